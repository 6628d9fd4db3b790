package arcade.chess.engine.movegen.pieces;

import arcade.chess.engine.common.Color;
import arcade.chess.engine.common.Square;
import arcade.chess.engine.game.board.Board;
import arcade.chess.engine.movegen.Move;
import arcade.chess.engine.movegen.utils.SlidingMoveUtils;

import java.util.List;

public final class Knight {
    public static final int[][] OFFSETS = {{2, 1}, {2, -1}, {-2, 1}, {-2, -1}, {1, 2}, {1, -2}, {-1, 2}, {-1, -2}};

    private Knight() {
    }

    public static void generatePseudoLegalMoves(Board board, Square from, Color color, List<Move> moves) {
        SlidingMoveUtils.generateStepMoves(board, from, color, OFFSETS, moves);
    }
}
