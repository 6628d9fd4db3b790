package arcade.chess.engine.movegen.utils;

import arcade.chess.engine.common.Color;
import arcade.chess.engine.common.Piece;
import arcade.chess.engine.common.Square;
import arcade.chess.engine.game.board.Board;
import arcade.chess.engine.movegen.Move;

import java.util.List;

public final class SlidingMoveUtils {

    private SlidingMoveUtils() {
    }

    // Rays stop before an own piece and right after an enemy one
    public static void generateSlidingMoves(Board board, Square from, Color color, int[][] directions, List<Move> moves) {
        for(int[] direction : directions) {
            Square to = from.offset(direction[0], direction[1]);
            while(to != null) {
                Piece target = board.getPiece(to);
                if(target == null) {
                    moves.add(Move.of(from, to));
                } else {
                    if(target.color() != color) {
                        moves.add(Move.capture(from, to, target.type()));
                    }
                    break;
                }
                to = to.offset(direction[0], direction[1]);
            }
        }
    }

    // Knight and king style single steps
    public static void generateStepMoves(Board board, Square from, Color color, int[][] offsets, List<Move> moves) {
        for(int[] offset : offsets) {
            Square to = from.offset(offset[0], offset[1]);
            if(to == null) {
                continue;
            }
            Piece target = board.getPiece(to);
            if(target == null) {
                moves.add(Move.of(from, to));
            } else if(target.color() != color) {
                moves.add(Move.capture(from, to, target.type()));
            }
        }
    }
}
