package arcade.chess.engine.game;

import arcade.chess.engine.movegen.Move;

import java.util.List;

/**
 * Outcome of {@link Game#selectSquare}.
 *
 * @param legalMoves the moves of the selected piece, only filled for {@link Status#SELECTED}
 * @param move       the move played, or the promotion waiting for a piece choice
 */
public record SelectionResult(Status status, List<Move> legalMoves, Move move) {
    public enum Status {
        SELECTED, MOVED, PROMOTION_REQUIRED, DESELECTED
    }

    public static SelectionResult selected(List<Move> legalMoves) {
        return new SelectionResult(Status.SELECTED, List.copyOf(legalMoves), null);
    }

    public static SelectionResult moved(Move move) {
        return new SelectionResult(Status.MOVED, List.of(), move);
    }

    public static SelectionResult promotionRequired(Move move) {
        return new SelectionResult(Status.PROMOTION_REQUIRED, List.of(), move);
    }

    public static SelectionResult deselected() {
        return new SelectionResult(Status.DESELECTED, List.of(), null);
    }
}
