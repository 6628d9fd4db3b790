package arcade.chess.engine.game;

import arcade.chess.engine.common.Color;
import arcade.chess.engine.common.Piece;
import arcade.chess.engine.common.PieceType;
import arcade.chess.engine.movegen.Move;

/**
 * Callbacks fired synchronously from {@link Game#makeMove}, in this order: capture, promotion,
 * check or checkmate or stalemate, draw, move and finally turn change.
 * Every method defaults to doing nothing so listeners only override what they need.
 */
public interface GameListener {
    default void onCapture(Piece captured) {
    }

    /**
     * Reports a promotion that has already been played. Asking for the piece happens before the move,
     * through {@link SelectionResult.Status#PROMOTION_REQUIRED}.
     */
    default void onPromotion(Move move, PieceType promotion) {
    }

    default void onCheck(Color colorInCheck) {
    }

    default void onCheckmate(Color winner) {
    }

    default void onStalemate() {
    }

    default void onDraw(DrawReason reason) {
    }

    default void onMove(Move move) {
    }

    default void onTurnChange(Color sideToMove) {
    }
}
