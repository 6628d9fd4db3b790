package arcade.chess.engine.search.evaluator;

import arcade.chess.engine.common.PieceType;

public class PieceValues {
    // Centre control (cp per attacked square)
    public static final int CENTER_CONTROL = 8;
    public static final int EXTENDED_CENTER_CONTROL = 3;

    // Mobility weight (cp per legal move of difference)
    public static final int MOBILITY = 5;

    public static final int ROOK_VALUE = 500;
    public static final int BISHOP_VALUE = 330;
    public static final int KNIGHT_VALUE = 320;
    public static final int KING_VALUE = 20000;
    public static final int PAWN_VALUE = 100;
    public static final int QUEEN_VALUE = 900;

    // Tables are read as the board is printed: index 0 is a8 for white.
    // Black reads them through the row mirror, see mirrorV.

    // Pawn
    static final int[] P = {
            0,  0,  0,  0,  0,  0,  0,  0,
            50, 50, 50, 50, 50, 50, 50, 50,
            10, 10, 20, 30, 30, 20, 10, 10,
            5,  5, 10, 45, 45, 10,  5,  5,
            0,  0,  0, 40, 40,  0,  0,  0,
            5, -5,-10,  0,  0,-10, -5,  5,
            5, 10, 10,-25,-25, 10, 10,  5,
            0,  0,  0,  0,  0,  0,  0,  0
    };

    // Knight
    static final int[] N = {
            -50,-40,-30,-30,-30,-30,-40,-50,
            -40,-20,  0,  0,  0,  0,-20,-40,
            -30,  0, 10, 15, 15, 10,  0,-30,
            -30,  5, 15, 20, 20, 15,  5,-30,
            -30,  0, 15, 20, 20, 15,  0,-30,
            -30,  5, 10, 15, 15, 10,  5,-30,
            -40,-20,  0,  5,  5,  0,-20,-40,
            -50,-40,-30,-30,-30,-30,-40,-50
    };

    // Bishop
    static final int[] B = {
            -20,-10,-10,-10,-10,-10,-10,-20,
            -10,  0,  0,  0,  0,  0,  0,-10,
            -10,  0, 10, 10, 10, 10,  0,-10,
            -10,  5,  5, 10, 10,  5,  5,-10,
            -10,  0, 10, 10, 10, 10,  0,-10,
            -10, 10, 10, 10, 10, 10, 10,-10,
            -10,  5,  0,  0,  0,  0,  5,-10,
            -20,-10,-10,-10,-10,-10,-10,-20
    };

    // Rook
    static final int[] R = {
            0,  0,  0,  0,  0,  0,  0,  0,
            5, 10, 10, 10, 10, 10, 10,  5,
            -5,  0,  0,  0,  0,  0,  0, -5,
            -5,  0,  0,  0,  0,  0,  0, -5,
            -5,  0,  0,  0,  0,  0,  0, -5,
            -5,  0,  0,  0,  0,  0,  0, -5,
            -5,  0,  0,  0,  0,  0,  0, -5,
            0,  0,  0, 10, 10,  0,  0,  0
    };

    // Queen
    static final int[] Q = {
            -20,-10,-10, -5, -5,-10,-10,-20,
            -10,  0,  0,  0,  0,  0,  0,-10,
            -10,  0,  5,  5,  5,  5,  0,-10,
            -5,  0,  5,  5,  5,  5,  0, -5,
            0,  0,  5,  5,  5,  5,  0, -5,
            -10,  5,  5,  5,  5,  5,  0,-10,
            -10,  0,  5,  0,  0,  0,  0,-10,
            -20,-10,-10, -5, -5,-10,-10,-20
    };

    // King (middle game only)
    static final int[] K = {
            -30,-40,-40,-50,-50,-40,-40,-30,
            -30,-40,-40,-50,-50,-40,-40,-30,
            -30,-40,-40,-50,-50,-40,-40,-30,
            -30,-40,-40,-50,-50,-40,-40,-30,
            -20,-30,-30,-40,-40,-30,-30,-20,
            -10,-20,-20,-20,-20,-20,-20,-10,
            20, 20,  0,  0,  0,  0, 20, 20,
            20, 40, 10,  0,  0, 10, 40, 20
    };

    public static int value(PieceType pieceType) {
        return switch (pieceType) {
            case PAWN -> PAWN_VALUE;
            case KNIGHT -> KNIGHT_VALUE;
            case BISHOP -> BISHOP_VALUE;
            case ROOK -> ROOK_VALUE;
            case QUEEN -> QUEEN_VALUE;
            case KING -> KING_VALUE;
            case NONE -> 0;
        };
    }

    static int[] table(PieceType pieceType) {
        return switch (pieceType) {
            case PAWN -> P;
            case KNIGHT -> N;
            case BISHOP -> B;
            case ROOK -> R;
            case QUEEN -> Q;
            case KING -> K;
            case NONE -> throw new IllegalArgumentException("No table for an empty square");
        };
    }

    // Flip rows, keep files
    static int mirrorV(int index) {
        return index ^ 56;
    }

    public static int squareBonus(PieceType pieceType, boolean white, int index) {
        return table(pieceType)[white ? index : mirrorV(index)];
    }
}
