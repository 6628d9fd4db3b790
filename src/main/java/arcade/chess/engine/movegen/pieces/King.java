package arcade.chess.engine.movegen.pieces;

import arcade.chess.engine.common.Color;
import arcade.chess.engine.common.Piece;
import arcade.chess.engine.common.PieceType;
import arcade.chess.engine.common.Square;
import arcade.chess.engine.game.board.Board;
import arcade.chess.engine.movegen.Move;
import arcade.chess.engine.movegen.utils.CheckUtils;
import arcade.chess.engine.movegen.utils.SlidingMoveUtils;

import java.util.List;

public final class King {
    public static final int[][] OFFSETS = {{0, 1}, {0, -1}, {1, 0}, {-1, 0}, {1, 1}, {1, -1}, {-1, 1}, {-1, -1}};

    private static final int HOME_COL = 4;

    private King() {
    }

    public static void generatePseudoLegalMoves(Board board, Square from, Color color, List<Move> moves) {
        SlidingMoveUtils.generateStepMoves(board, from, color, OFFSETS, moves);
        generateCastlingMoves(board, from, color, moves);
    }

    // Castling is only offered when fully legal: the king may not be in check, pass through
    // or land on an attacked square, and every square between king and rook has to be empty
    private static void generateCastlingMoves(Board board, Square from, Color color, List<Move> moves) {
        boolean canKingSide = board.canCastleKingSide(color);
        boolean canQueenSide = board.canCastleQueenSide(color);
        if(!canKingSide && !canQueenSide) {
            return;
        }

        int row = color.homeRow();
        if(from.row != row || from.col != HOME_COL) {
            return;
        }

        Color opponent = color.getOppositeColor();
        if(CheckUtils.isSquareAttacked(board, from, opponent)) {
            return;
        }

        if(canKingSide && hasRook(board, row, 7, color)
                && board.isEmpty(Square.of(row, 5)) && board.isEmpty(Square.of(row, 6))
                && !CheckUtils.isSquareAttacked(board, Square.of(row, 5), opponent)
                && !CheckUtils.isSquareAttacked(board, Square.of(row, 6), opponent)) {
            moves.add(Move.castleKingSide(from, Square.of(row, 6)));
        }

        if(canQueenSide && hasRook(board, row, 0, color)
                && board.isEmpty(Square.of(row, 1)) && board.isEmpty(Square.of(row, 2)) && board.isEmpty(Square.of(row, 3))
                && !CheckUtils.isSquareAttacked(board, Square.of(row, 2), opponent)
                && !CheckUtils.isSquareAttacked(board, Square.of(row, 3), opponent)) {
            moves.add(Move.castleQueenSide(from, Square.of(row, 2)));
        }
    }

    private static boolean hasRook(Board board, int row, int col, Color color) {
        Piece piece = board.getPiece(row, col);
        return piece != null && piece.is(PieceType.ROOK, color);
    }
}
