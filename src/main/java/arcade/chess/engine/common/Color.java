package arcade.chess.engine.common;

public enum Color {
    WHITE, BLACK;

    public Color getOppositeColor() {
        if(this == WHITE) {
            return BLACK;
        } else {
            return WHITE;
        }
    }

    // Row delta of a pawn push: white goes up the board (towards row 0)
    public int pawnDirection() {
        return this == WHITE ? -1 : 1;
    }

    // Row holding this color's king and rooks at game start
    public int homeRow() {
        return this == WHITE ? 7 : 0;
    }

    public String displayName() {
        return this == WHITE ? "white" : "black";
    }
}
