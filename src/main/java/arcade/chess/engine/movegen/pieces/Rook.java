package arcade.chess.engine.movegen.pieces;

import arcade.chess.engine.common.Color;
import arcade.chess.engine.common.Square;
import arcade.chess.engine.game.board.Board;
import arcade.chess.engine.movegen.Move;
import arcade.chess.engine.movegen.utils.SlidingMoveUtils;

import java.util.List;

public final class Rook {
    public static final int[][] DIRECTIONS = {{0, 1}, {0, -1}, {1, 0}, {-1, 0}};

    private Rook() {
    }

    public static void generatePseudoLegalMoves(Board board, Square from, Color color, List<Move> moves) {
        SlidingMoveUtils.generateSlidingMoves(board, from, color, DIRECTIONS, moves);
    }
}
