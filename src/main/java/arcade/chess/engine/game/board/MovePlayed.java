package arcade.chess.engine.game.board;

import arcade.chess.engine.common.Color;
import arcade.chess.engine.common.Piece;
import arcade.chess.engine.common.Square;
import arcade.chess.engine.movegen.Move;

/**
 * Everything {@link Board#undoMove(MovePlayed)} needs to restore the position a move was played from.
 *
 * @param pieceEaten       the captured piece, null when nothing was taken
 * @param pieceEatenSquare where the captured piece stood (differs from the destination for en passant)
 */
public record MovePlayed(Piece piece, Move move, Piece pieceEaten, Square pieceEatenSquare,
                         Color previousSideToMove, Square previousEnPassantTarget,
                         boolean previousWhiteCanCastleKingSide, boolean previousWhiteCanCastleQueenSide,
                         boolean previousBlackCanCastleKingSide, boolean previousBlackCanCastleQueenSide) {

    public boolean isCapture() {
        return pieceEaten != null;
    }
}
