package arcade.chess.engine.utils.notations;

/**
 * Thrown when a position string or a square name cannot describe a structurally valid position.
 */
public class InvalidFenException extends IllegalArgumentException {
    public InvalidFenException(String message) {
        super(message);
    }

    public InvalidFenException(String message, Throwable cause) {
        super(message, cause);
    }
}
