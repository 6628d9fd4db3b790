package arcade.chess.engine.search;

import arcade.chess.engine.movegen.Move;

import java.util.List;
import java.util.Random;

public class RandomSearch {

    /**
     * @return a uniformly picked move, null when there is none
     */
    public static Move pickNextMove(List<Move> legalMoves, Random random) {
        if(legalMoves.isEmpty()) {
            return null;
        }
        return legalMoves.get(random.nextInt(legalMoves.size()));
    }
}
