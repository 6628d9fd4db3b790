package arcade.chess.engine.search;

import arcade.chess.engine.movegen.Move;

/**
 * @param move   best move found, null when the side to move has no legal move
 * @param random true when the move was picked at random instead of searched
 */
public record SearchResult(Move move, int score, int depth, long nodes, long timeMs, boolean random) {
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("SearchResult\n")
            .append("best move: ").append(move == null ? "(none)" : move).append("\n")
            .append("score: ").append(score).append("\n")
            .append("depth: ").append(depth).append("\n")
            .append("nodes: ").append(nodes).append("\n")
            .append("search time (ms): ").append(timeMs).append("\n")
            .append("random: ").append(random);
        return sb.toString();
    }

    public String toUCIInfo() {
        return "info"
                + " depth " + depth
                + " time " + timeMs
                + " score cp " + score
                + " nodes " + nodes
                + " pv " + (move == null ? "0000" : move.toString());
    }
}
