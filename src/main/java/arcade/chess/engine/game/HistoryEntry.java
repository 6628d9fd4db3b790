package arcade.chess.engine.game;

import arcade.chess.engine.common.Color;
import arcade.chess.engine.common.PieceType;
import arcade.chess.engine.common.Square;
import arcade.chess.engine.movegen.Move;

/**
 * One line of the move history.
 *
 * @param move      the move as played, carrying the promotion actually chosen
 * @param promotion the piece a pawn turned into, NONE otherwise
 */
public record HistoryEntry(String notation, Color color, Square from, Square to, Move move, PieceType promotion) {
    @Override
    public String toString() {
        return notation;
    }
}
