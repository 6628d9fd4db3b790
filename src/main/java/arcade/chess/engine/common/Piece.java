package arcade.chess.engine.common;

/**
 * A colored chess piece. Instances are cached, use {@link #of(PieceType, Color)}.
 */
public record Piece(PieceType type, Color color) {
    private static final Piece[] CACHE = new Piece[PieceType.VALUES.length * 2];

    static {
        for(PieceType type : PieceType.VALUES) {
            if(type == PieceType.NONE) {
                continue;
            }
            for(Color color : Color.values()) {
                CACHE[cacheIndex(type, color)] = new Piece(type, color);
            }
        }
    }

    public Piece {
        if(type == null || type == PieceType.NONE || color == null) {
            throw new IllegalArgumentException("A piece needs a real type and a color");
        }
    }

    public static Piece of(PieceType type, Color color) {
        return CACHE[cacheIndex(type, color)];
    }

    private static int cacheIndex(PieceType type, Color color) {
        return type.ordinal() * 2 + color.ordinal();
    }

    public boolean is(PieceType pieceType, Color pieceColor) {
        return type == pieceType && color == pieceColor;
    }

    // FEN letter: uppercase for white, lowercase for black
    public char fenLetter() {
        return color == Color.WHITE ? type.letter : Character.toLowerCase(type.letter);
    }

    /**
     * @return the piece for a FEN letter, or null if the letter is not a piece letter
     */
    public static Piece fromFenLetter(char letter) {
        PieceType type = PieceType.fromLetter(letter);
        if(type == PieceType.NONE) {
            return null;
        }
        return of(type, Character.isUpperCase(letter) ? Color.WHITE : Color.BLACK);
    }

    @Override
    public String toString() {
        return String.valueOf(fenLetter());
    }
}
