package arcade.chess.engine.common;

public enum PieceType {
    PAWN('P'), KNIGHT('N'), BISHOP('B'), ROOK('R'), QUEEN('Q'), KING('K'), NONE(' ');

    public static final PieceType[] VALUES = PieceType.values();

    // Order in which promotion variants are generated
    public static final PieceType[] PROMOTIONS = {QUEEN, ROOK, BISHOP, KNIGHT};

    public final char letter;

    PieceType(char letter) {
        this.letter = letter;
    }

    public static PieceType fromLetter(char letter) {
        return switch (Character.toUpperCase(letter)) {
            case 'P' -> PAWN;
            case 'N' -> KNIGHT;
            case 'B' -> BISHOP;
            case 'R' -> ROOK;
            case 'Q' -> QUEEN;
            case 'K' -> KING;
            default -> NONE;
        };
    }
}
