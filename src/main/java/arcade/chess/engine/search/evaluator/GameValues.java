package arcade.chess.engine.search.evaluator;

public final class GameValues {
    // Positive when black is mated, negative when white is
    public static final int CHECKMATE_VALUE = 100_000;
    public static final int DRAW_VALUE = 0;
    public static final int PAT_VALUE = DRAW_VALUE;
}
