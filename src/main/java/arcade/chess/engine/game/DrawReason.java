package arcade.chess.engine.game;

public enum DrawReason {
    // 100 half moves without a pawn move or a capture
    FIFTY_MOVE("fifty-move");

    private final String label;

    DrawReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
