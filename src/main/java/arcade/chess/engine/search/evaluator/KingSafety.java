package arcade.chess.engine.search.evaluator;

// Back rank king placement, from the king owner's point of view
public final class KingSafety {
    public static final int CASTLED           = +40; // king on g or c file
    public static final int KING_IN_CENTER    = -30; // king on d or e file

    public static final int[] CASTLED_COLS = {2, 6};
    public static final int CENTER_FIRST_COL = 3;
    public static final int CENTER_LAST_COL = 4;
}
