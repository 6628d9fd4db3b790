package arcade.chess.engine.search;

import arcade.chess.engine.movegen.Move;
import arcade.chess.engine.search.evaluator.PieceValues;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.List;

/**
 * Captures first, most valuable victim first. The sort is stable: moves of equal score keep their
 * generation order, which keeps the root choice deterministic at equal scores.
 */
final class MoveOrdering {

    private MoveOrdering() {}

    static void sortByCaptureValue(List<Move> moves, IntArrayList scores) {
        final int n = moves.size();
        scores.clear();
        for (int i = 0; i < n; i++) {
            scores.add(scoreCapture(moves.get(i)));
        }

        // insertion sort by score desc, equal scores never swap
        for (int i = 1; i < n; i++) {
            Move m = moves.get(i);
            int s = scores.getInt(i), j = i - 1;
            while (j >= 0 && scores.getInt(j) < s) {
                moves.set(j + 1, moves.get(j));
                scores.set(j + 1, scores.getInt(j));
                j--;
            }
            moves.set(j + 1, m);
            scores.set(j + 1, s);
        }
    }

    // En passant counts as taking a pawn
    static int scoreCapture(Move move) {
        return PieceValues.value(move.captured());
    }
}
