package arcade.chess.engine.movegen;

import arcade.chess.engine.common.Color;
import arcade.chess.engine.common.Piece;
import arcade.chess.engine.common.Square;
import arcade.chess.engine.game.board.Board;
import arcade.chess.engine.game.board.MovePlayed;
import arcade.chess.engine.movegen.pieces.Bishop;
import arcade.chess.engine.movegen.pieces.King;
import arcade.chess.engine.movegen.pieces.Knight;
import arcade.chess.engine.movegen.pieces.Pawn;
import arcade.chess.engine.movegen.pieces.Rook;
import arcade.chess.engine.movegen.utils.CheckUtils;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.List;

/**
 * Two-phase move generation: pseudo-legal moves per piece, then a legality filter which plays each
 * move on the board, looks for an attack on the mover's king and takes the move back.
 * <p>
 * Squares are visited in row-major order and each piece uses a fixed direction order, so the
 * resulting lists are deterministic.
 */
public class MoveGenerator {
    // According to literature, maximum number of legal moves in a given position is 218
    private static final int MOVE_LIST_CAPACITY = 218;

    public static List<Move> generatePseudoLegalMoves(Board board, Square from) {
        List<Move> moves = new ObjectArrayList<>();
        Piece piece = board.getPiece(from);
        if(piece != null) {
            addPseudoLegalMoves(board, from, piece, moves);
        }
        return moves;
    }

    /**
     * @return the legal moves of the piece on the square, empty for an empty square
     */
    public static List<Move> generateLegalMoves(Board board, Square from) {
        List<Move> moves = new ObjectArrayList<>();
        Piece piece = board.getPiece(from);
        if(piece != null) {
            addLegalMoves(board, from, piece, moves);
        }
        return moves;
    }

    public static List<Move> generateAllLegalMoves(Board board, Color color) {
        List<Move> moves = new ObjectArrayList<>(MOVE_LIST_CAPACITY);
        for(int i = 0; i < 64; i++) {
            Square square = Square.of(i);
            Piece piece = board.getPiece(square);
            if(piece != null && piece.color() == color) {
                addLegalMoves(board, square, piece, moves);
            }
        }
        return moves;
    }

    public static int countLegalMoves(Board board, Color color) {
        return generateAllLegalMoves(board, color).size();
    }

    // Stops at the first piece owning a legal move
    public static boolean hasLegalMoves(Board board, Color color) {
        List<Move> buffer = new ObjectArrayList<>();
        for(int i = 0; i < 64; i++) {
            Square square = Square.of(i);
            Piece piece = board.getPiece(square);
            if(piece != null && piece.color() == color) {
                buffer.clear();
                addLegalMoves(board, square, piece, buffer);
                if(!buffer.isEmpty()) {
                    return true;
                }
            }
        }
        return false;
    }

    private static void addLegalMoves(Board board, Square from, Piece piece, List<Move> moves) {
        List<Move> pseudoLegalMoves = new ObjectArrayList<>();
        addPseudoLegalMoves(board, from, piece, pseudoLegalMoves);
        for(Move move : pseudoLegalMoves) {
            if(!wouldKingBeInCheck(board, move, piece.color())) {
                moves.add(move);
            }
        }
    }

    public static boolean wouldKingBeInCheck(Board board, Move move, Color kingColor) {
        MovePlayed movePlayed = board.playMove(move);
        boolean inCheck = CheckUtils.isInCheck(board, kingColor);
        board.undoMove(movePlayed);
        return inCheck;
    }

    private static void addPseudoLegalMoves(Board board, Square from, Piece piece, List<Move> moves) {
        Color color = piece.color();
        switch (piece.type()) {
            case PAWN -> Pawn.generatePseudoLegalMoves(board, from, color, moves);
            case KNIGHT -> Knight.generatePseudoLegalMoves(board, from, color, moves);
            case BISHOP -> Bishop.generatePseudoLegalMoves(board, from, color, moves);
            case ROOK -> Rook.generatePseudoLegalMoves(board, from, color, moves);
            case QUEEN -> {
                Rook.generatePseudoLegalMoves(board, from, color, moves);
                Bishop.generatePseudoLegalMoves(board, from, color, moves);
            }
            case KING -> King.generatePseudoLegalMoves(board, from, color, moves);
            case NONE -> {
            }
        }
    }
}
