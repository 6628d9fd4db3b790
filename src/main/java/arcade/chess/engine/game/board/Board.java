package arcade.chess.engine.game.board;

import arcade.chess.engine.common.Color;
import arcade.chess.engine.common.Piece;
import arcade.chess.engine.common.PieceType;
import arcade.chess.engine.common.Square;
import arcade.chess.engine.movegen.Move;

import java.util.Arrays;

/**
 * 8x8 position plus the state move generation depends on: side to move, castling rights and
 * en passant target. Clocks, history and terminal flags live in {@link arcade.chess.engine.game.Game}.
 */
public class Board {
    // Rook corners, castling rights are lost as soon as something leaves or lands on them
    public static final Square WHITE_KING_SIDE_ROOK = Square.of(7, 7);
    public static final Square WHITE_QUEEN_SIDE_ROOK = Square.of(7, 0);
    public static final Square BLACK_KING_SIDE_ROOK = Square.of(0, 7);
    public static final Square BLACK_QUEEN_SIDE_ROOK = Square.of(0, 0);

    private final Piece[] pieceAt;

    private Color sideToMove = Color.WHITE;
    private boolean whiteCanCastleKingSide = false;
    private boolean whiteCanCastleQueenSide = false;
    private boolean blackCanCastleKingSide = false;
    private boolean blackCanCastleQueenSide = false;

    private Square enPassantTarget;

    public Board() {
        this.pieceAt = new Piece[64];
    }

    private Board(Board other) {
        this.pieceAt = other.pieceAt.clone();
        this.sideToMove = other.sideToMove;
        this.whiteCanCastleKingSide = other.whiteCanCastleKingSide;
        this.whiteCanCastleQueenSide = other.whiteCanCastleQueenSide;
        this.blackCanCastleKingSide = other.blackCanCastleKingSide;
        this.blackCanCastleQueenSide = other.blackCanCastleQueenSide;
        this.enPassantTarget = other.enPassantTarget;
    }

    public Board copy() {
        return new Board(this);
    }

    /**
     * @return the piece on the square, null for an empty square or a square off the board
     */
    public Piece getPiece(Square square) {
        if(square == null) {
            return null;
        }
        return pieceAt[square.index];
    }

    public Piece getPiece(int row, int col) {
        return getPiece(Square.of(row, col));
    }

    public boolean isEmpty(Square square) {
        return getPiece(square) == null;
    }

    public void setPiece(Square square, Piece piece) {
        pieceAt[square.index] = piece;
    }

    public Square findKing(Color color) {
        for(int i = 0; i < 64; i++) {
            Piece piece = pieceAt[i];
            if(piece != null && piece.is(PieceType.KING, color)) {
                return Square.of(i);
            }
        }
        return null;
    }

    public int countPieces(PieceType type, Color color) {
        int count = 0;
        for(Piece piece : pieceAt) {
            if(piece != null && piece.is(type, color)) {
                count++;
            }
        }
        return count;
    }

    // Plays a move produced by the move generator and returns what is needed to undo it.
    // The color moving is the color of the piece, which lets move generation probe either side.
    public MovePlayed playMove(Move move) {
        Square from = move.from();
        Square to = move.to();
        Piece piece = pieceAt[from.index];
        Color color = piece.color();

        Square pieceEatenSquare = move.enPassant() ? Square.of(from.row, to.col) : to;
        Piece pieceEaten = pieceAt[pieceEatenSquare.index];

        MovePlayed movePlayed = new MovePlayed(piece, move, pieceEaten, pieceEaten == null ? null : pieceEatenSquare,
                sideToMove, enPassantTarget,
                whiteCanCastleKingSide, whiteCanCastleQueenSide, blackCanCastleKingSide, blackCanCastleQueenSide);

        if(pieceEaten != null) {
            pieceAt[pieceEatenSquare.index] = null;
        }

        pieceAt[from.index] = null;
        pieceAt[to.index] = move.isPromotion() ? Piece.of(move.promotion(), color) : piece;

        // Castle moves
        if(move.castleKingSide()) {
            moveRook(color.homeRow(), 7, 5);
        } else if(move.castleQueenSide()) {
            moveRook(color.homeRow(), 0, 3);
        }

        // Removing castling rights when needed
        if(piece.type() == PieceType.KING) {
            setCanCastleKingSide(color, false);
            setCanCastleQueenSide(color, false);
        }
        revokeCastlingRightsOn(from);
        revokeCastlingRightsOn(to);

        // set enPassantSquare
        if(move.doublePush()) {
            enPassantTarget = Square.of((from.row + to.row) / 2, from.col);
        } else {
            enPassantTarget = null;
        }

        sideToMove = color.getOppositeColor();
        return movePlayed;
    }

    public void undoMove(MovePlayed movePlayed) {
        Move move = movePlayed.move();
        Square from = move.from();
        Square to = move.to();
        Color color = movePlayed.piece().color();

        if(move.castleKingSide()) {
            moveRook(color.homeRow(), 5, 7);
        } else if(move.castleQueenSide()) {
            moveRook(color.homeRow(), 3, 0);
        }

        pieceAt[to.index] = null;
        pieceAt[from.index] = movePlayed.piece();
        if(movePlayed.isCapture()) {
            pieceAt[movePlayed.pieceEatenSquare().index] = movePlayed.pieceEaten();
        }

        sideToMove = movePlayed.previousSideToMove();
        enPassantTarget = movePlayed.previousEnPassantTarget();
        whiteCanCastleKingSide = movePlayed.previousWhiteCanCastleKingSide();
        whiteCanCastleQueenSide = movePlayed.previousWhiteCanCastleQueenSide();
        blackCanCastleKingSide = movePlayed.previousBlackCanCastleKingSide();
        blackCanCastleQueenSide = movePlayed.previousBlackCanCastleQueenSide();
    }

    private void moveRook(int row, int fromCol, int toCol) {
        int fromIndex = row * 8 + fromCol;
        pieceAt[row * 8 + toCol] = pieceAt[fromIndex];
        pieceAt[fromIndex] = null;
    }

    private void revokeCastlingRightsOn(Square square) {
        if(square == WHITE_KING_SIDE_ROOK) {
            whiteCanCastleKingSide = false;
        } else if(square == WHITE_QUEEN_SIDE_ROOK) {
            whiteCanCastleQueenSide = false;
        } else if(square == BLACK_KING_SIDE_ROOK) {
            blackCanCastleKingSide = false;
        } else if(square == BLACK_QUEEN_SIDE_ROOK) {
            blackCanCastleQueenSide = false;
        }
    }

    public Color sideToMove() {
        return sideToMove;
    }

    public void setSideToMove(Color sideToMove) {
        this.sideToMove = sideToMove;
    }

    public Square enPassantTarget() {
        return enPassantTarget;
    }

    public void setEnPassantTarget(Square enPassantTarget) {
        this.enPassantTarget = enPassantTarget;
    }

    public boolean canCastleKingSide(Color color) {
        return color == Color.WHITE ? whiteCanCastleKingSide : blackCanCastleKingSide;
    }

    public boolean canCastleQueenSide(Color color) {
        return color == Color.WHITE ? whiteCanCastleQueenSide : blackCanCastleQueenSide;
    }

    public void setCanCastleKingSide(Color color, boolean canCastle) {
        if(color == Color.WHITE) {
            whiteCanCastleKingSide = canCastle;
        } else {
            blackCanCastleKingSide = canCastle;
        }
    }

    public void setCanCastleQueenSide(Color color, boolean canCastle) {
        if(color == Color.WHITE) {
            whiteCanCastleQueenSide = canCastle;
        } else {
            blackCanCastleQueenSide = canCastle;
        }
    }

    public boolean whiteCanCastleKingSide() {
        return whiteCanCastleKingSide;
    }

    public boolean whiteCanCastleQueenSide() {
        return whiteCanCastleQueenSide;
    }

    public boolean blackCanCastleKingSide() {
        return blackCanCastleKingSide;
    }

    public boolean blackCanCastleQueenSide() {
        return blackCanCastleQueenSide;
    }

    // Same pieces, same side to move, same rights and en passant target
    public boolean samePositionAs(Board other) {
        return Arrays.equals(pieceAt, other.pieceAt)
                && sideToMove == other.sideToMove
                && enPassantTarget == other.enPassantTarget
                && whiteCanCastleKingSide == other.whiteCanCastleKingSide
                && whiteCanCastleQueenSide == other.whiteCanCastleQueenSide
                && blackCanCastleKingSide == other.blackCanCastleKingSide
                && blackCanCastleQueenSide == other.blackCanCastleQueenSide;
    }

    /** Returns an ASCII diagram of the board (ranks 8..1). */
    public String toAscii() {
        StringBuilder sb = new StringBuilder(8 * (8 + 4));
        for(int row = 0; row < 8; row++) {
            sb.append(8 - row).append("  ");
            for(int col = 0; col < 8; col++) {
                Piece piece = pieceAt[row * 8 + col];
                sb.append(piece == null ? '.' : piece.fenLetter()).append(' ');
            }
            sb.append('\n');
        }
        sb.append("\n   a b c d e f g h");
        return sb.toString();
    }

    @Override
    public String toString() {
        return toAscii();
    }
}
