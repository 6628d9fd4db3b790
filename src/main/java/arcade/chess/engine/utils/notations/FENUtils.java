package arcade.chess.engine.utils.notations;

import arcade.chess.engine.common.Color;
import arcade.chess.engine.common.Piece;
import arcade.chess.engine.common.PieceType;
import arcade.chess.engine.common.Square;
import arcade.chess.engine.game.Game;
import arcade.chess.engine.game.board.Board;
import arcade.chess.engine.movegen.pieces.Pawn;
import arcade.chess.engine.movegen.utils.CheckUtils;

// FEN Visualizer: https://www.redhotpawn.com/chess/chess-fen-viewer.php
public class FENUtils {
    private record ParsedFEN(Board board, int halfMoveClock, int fullMoveNumber) {}

    public static Board getBoardFrom(String FEN) {
        return parse(FEN).board();
    }

    public static Game getGameFrom(String FEN) {
        ParsedFEN parsed = parse(FEN);
        return new Game(parsed.board(), parsed.halfMoveClock(), parsed.fullMoveNumber());
    }

    // https://en.wikipedia.org/wiki/Forsyth%E2%80%93Edwards_Notation
    // The clock fields may be left out, they then default to 0 and 1
    private static ParsedFEN parse(String FEN) {
        if(FEN == null) {
            throw new InvalidFenException("FEN record is null");
        }
        String[] fenFields = FEN.trim().split("\\s+");

        if(fenFields.length < 4 || fenFields.length > 6) {
            throw new InvalidFenException("Invalid FEN record, expected 4 to 6 fields: '" + FEN + "'");
        }

        Board board = new Board();
        injectPiecePlacement(board, fenFields[0]);
        injectCurrentTurn(board, fenFields[1]);
        injectCastlingRights(board, fenFields[2]);
        injectEnPassantSquare(board, fenFields[3]);
        int halfMoveClock = fenFields.length > 4 ? parseClock(fenFields[4], "half move clock") : 0;
        int fullMoveNumber = fenFields.length > 5 ? parseClock(fenFields[5], "full move number") : 1;

        checkKings(board);
        checkSideNotToMoveIsSafe(board);
        return new ParsedFEN(board, halfMoveClock, fullMoveNumber);
    }

    public static String getFENFromGame(Game game) {
        return getFENFromBoard(game.board(), game.halfMoveClock(), game.fullMoveNumber());
    }

    public static String getFENFromBoard(Board board, int halfMoveClock, int fullMoveNumber) {
        StringBuilder fen = new StringBuilder();
        injectPiecePlacement(board, fen);
        injectCurrentTurn(board, fen);
        injectCastlingRights(board, fen);
        injectEnPassantSquare(board, fen);
        fen.append(' ').append(halfMoveClock);
        fen.append(' ').append(fullMoveNumber);
        return fen.toString();
    }

    private static void injectPiecePlacement(Board board, StringBuilder fen) {
        for(int row = 0; row < 8; row++) {
            int emptySpaceCounter = 0;
            if(row != 0) {
                fen.append('/');
            }
            for(int col = 0; col < 8; col++) {
                Piece piece = board.getPiece(row, col);
                if(piece == null) {
                    emptySpaceCounter++;
                    continue;
                }
                if(emptySpaceCounter != 0) {
                    fen.append(emptySpaceCounter);
                    emptySpaceCounter = 0;
                }
                fen.append(piece.fenLetter());
            }

            if(emptySpaceCounter != 0) {
                fen.append(emptySpaceCounter);
            }
        }
    }

    private static void injectCurrentTurn(Board board, StringBuilder fen) {
        fen.append(' ').append(board.sideToMove() == Color.BLACK ? 'b' : 'w');
    }

    private static void injectCastlingRights(Board board, StringBuilder fen) {
        fen.append(' ');
        StringBuilder castlingRights = new StringBuilder();
        if(board.whiteCanCastleKingSide()) {
            castlingRights.append('K');
        }
        if(board.whiteCanCastleQueenSide()) {
            castlingRights.append('Q');
        }
        if(board.blackCanCastleKingSide()) {
            castlingRights.append('k');
        }
        if(board.blackCanCastleQueenSide()) {
            castlingRights.append('q');
        }

        if(castlingRights.isEmpty()) {
            fen.append('-');
        } else {
            fen.append(castlingRights);
        }
    }

    private static void injectEnPassantSquare(Board board, StringBuilder fen) {
        fen.append(' ');
        Square enPassantTarget = board.enPassantTarget();
        if(enPassantTarget != null) {
            fen.append(enPassantTarget.name());
        } else {
            fen.append('-');
        }
    }

    private static void injectPiecePlacement(Board board, String piecePlacement) {
        String[] piecePlacementRows = piecePlacement.split("/", -1);
        if(piecePlacementRows.length != 8) {
            throw new InvalidFenException("Piece placement should have 8 ranks: '" + piecePlacement + "'");
        }

        for(int row = 0; row < 8; row++) {
            int col = 0;
            for(char character : piecePlacementRows[row].toCharArray()) {
                if(character >= '1' && character <= '8') {
                    col += character - '0';
                    continue;
                }
                Piece piece = Piece.fromFenLetter(character);
                if(piece == null) {
                    throw new InvalidFenException("Unknown piece letter '" + character + "' in '" + piecePlacement + "'");
                }
                if(col > 7) {
                    throw new InvalidFenException("Rank " + (8 - row) + " is wider than 8 squares");
                }
                if(piece.type() == PieceType.PAWN && (row == 0 || row == 7)) {
                    throw new InvalidFenException("Pawn on the first or last rank in '" + piecePlacement + "'");
                }
                board.setPiece(Square.of(row, col), piece);
                col++;
            }
            if(col != 8) {
                throw new InvalidFenException("Rank " + (8 - row) + " does not cover 8 squares");
            }
        }
    }

    private static void injectCurrentTurn(Board board, String currentTurn) {
        switch (currentTurn) {
            case "w" -> board.setSideToMove(Color.WHITE);
            case "b" -> board.setSideToMove(Color.BLACK);
            default -> throw new InvalidFenException("Active color should be 'w' or 'b', got '" + currentTurn + "'");
        }
    }

    // Letters may come in any order, export writes them back as KQkq
    private static void injectCastlingRights(Board board, String castlingRights) {
        if("-".equals(castlingRights)) {
            return;
        }

        for(char character : castlingRights.toCharArray()) {
            if(castlingRights.indexOf(character) != castlingRights.lastIndexOf(character)) {
                throw new InvalidFenException("Repeated castling right '" + character + "' in '" + castlingRights + "'");
            }
            switch (character) {
                case 'K' -> board.setCanCastleKingSide(Color.WHITE, true);
                case 'Q' -> board.setCanCastleQueenSide(Color.WHITE, true);
                case 'k' -> board.setCanCastleKingSide(Color.BLACK, true);
                case 'q' -> board.setCanCastleQueenSide(Color.BLACK, true);
                default -> throw new InvalidFenException("Unknown castling right '" + character + "' in '" + castlingRights + "'");
            }
        }
    }

    // The target sits right behind a pawn of the side which just moved
    private static void injectEnPassantSquare(Board board, String enPassantSquare) {
        if("-".equals(enPassantSquare)) {
            board.setEnPassantTarget(null);
            return;
        }

        Square target = MoveIOUtils.getSquareFromName(enPassantSquare);
        Color pusher = board.sideToMove().getOppositeColor();
        int expectedRow = Pawn.startRow(pusher) + pusher.pawnDirection();
        if(target.row != expectedRow) {
            throw new InvalidFenException("En passant square " + enPassantSquare + " is not on the expected rank");
        }
        if(!board.isEmpty(target)) {
            throw new InvalidFenException("En passant square " + enPassantSquare + " is occupied");
        }
        board.setEnPassantTarget(target);
    }

    private static int parseClock(String value, String fieldName) {
        int clock;
        try {
            clock = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new InvalidFenException("Invalid " + fieldName + " '" + value + "'", e);
        }
        if(clock < 0) {
            throw new InvalidFenException("Negative " + fieldName + " '" + value + "'");
        }
        return clock;
    }

    private static void checkKings(Board board) {
        for(Color color : Color.values()) {
            int kings = board.countPieces(PieceType.KING, color);
            if(kings != 1) {
                throw new InvalidFenException("Expected exactly one " + color.displayName() + " king, found " + kings);
            }
        }
    }

    // The side which just moved cannot have left its king in check
    private static void checkSideNotToMoveIsSafe(Board board) {
        Color justMoved = board.sideToMove().getOppositeColor();
        if(CheckUtils.isInCheck(board, justMoved)) {
            throw new InvalidFenException("The " + justMoved.displayName() + " king is in check while "
                    + board.sideToMove().displayName() + " is to move");
        }
    }
}
