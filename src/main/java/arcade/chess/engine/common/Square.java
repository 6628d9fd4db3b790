package arcade.chess.engine.common;

/**
 * A board square. Row 0 is rank 8 and row 7 is rank 1, col 0 is file a.
 * Instances are cached so they can be compared by identity.
 */
public final class Square {
    private static final String FILES = "abcdefgh";
    private static final Square[] SQUARE_CACHE = new Square[64];
    static {
        for(int row = 0; row < 8; row++) {
            for(int col = 0; col < 8; col++) {
                SQUARE_CACHE[row * 8 + col] = new Square(row, col);
            }
        }
    }

    public static boolean isOnBoard(int row, int col) {
        return row >= 0 && row < 8 && col >= 0 && col < 8;
    }

    /**
     * @return the square, or null when the coordinates fall off the board
     */
    public static Square of(int row, int col) {
        if(!isOnBoard(row, col)) {
            return null;
        }
        return SQUARE_CACHE[row * 8 + col];
    }

    public static Square of(int index) {
        return SQUARE_CACHE[index];
    }

    public final int row;
    public final int col;
    public final int index;

    private Square(int row, int col) {
        this.row = row;
        this.col = col;
        this.index = row * 8 + col;
    }

    public Square offset(int rowDelta, int colDelta) {
        return Square.of(row + rowDelta, col + colDelta);
    }

    public char file() {
        return FILES.charAt(col);
    }

    public int rank() {
        return 8 - row;
    }

    public String name() {
        return "" + file() + rank();
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this;
    }

    @Override
    public int hashCode() {
        return index;
    }

    @Override
    public String toString() {
        return name();
    }
}
