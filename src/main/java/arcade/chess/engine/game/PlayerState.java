package arcade.chess.engine.game;

// State of the game from the point of view of the side to move
public enum PlayerState {
    IN_PROGRESS, CHECKMATE, PAT, DRAW
}
