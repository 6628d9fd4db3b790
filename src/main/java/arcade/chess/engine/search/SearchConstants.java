package arcade.chess.engine.search;

public class SearchConstants {
    // Above any reachable score, mate scores included
    public static final int INF = 1_000_000;

    // Deepest tier is 4 plies, leave room for depth overrides
    public static final int MAX_PLY = 16;
}
