package arcade.chess.engine.game;

public enum Opponent {
    AI, HUMAN
}
