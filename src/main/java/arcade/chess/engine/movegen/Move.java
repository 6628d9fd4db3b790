package arcade.chess.engine.movegen;

import arcade.chess.engine.common.PieceType;
import arcade.chess.engine.common.Square;
import arcade.chess.engine.utils.notations.MoveIOUtils;

/**
 * A move as produced by the {@link MoveGenerator}. Legality is established at generation time,
 * a Move is never re-validated when it gets played.
 *
 * @param captured  type of the piece taken, {@link PieceType#PAWN} for en passant, NONE otherwise
 * @param promotion piece the pawn turns into, NONE when not a promotion
 */
public record Move(Square from, Square to, PieceType captured, PieceType promotion,
                   boolean doublePush, boolean enPassant, boolean castleKingSide, boolean castleQueenSide) {

    public static Move of(Square from, Square to) {
        return new Move(from, to, PieceType.NONE, PieceType.NONE, false, false, false, false);
    }

    public static Move capture(Square from, Square to, PieceType captured) {
        return new Move(from, to, captured, PieceType.NONE, false, false, false, false);
    }

    public static Move promote(Square from, Square to, PieceType captured, PieceType promotion) {
        return new Move(from, to, captured, promotion, false, false, false, false);
    }

    public static Move doublePush(Square from, Square to) {
        return new Move(from, to, PieceType.NONE, PieceType.NONE, true, false, false, false);
    }

    public static Move enPassant(Square from, Square to) {
        return new Move(from, to, PieceType.PAWN, PieceType.NONE, false, true, false, false);
    }

    public static Move castleKingSide(Square from, Square to) {
        return new Move(from, to, PieceType.NONE, PieceType.NONE, false, false, true, false);
    }

    public static Move castleQueenSide(Square from, Square to) {
        return new Move(from, to, PieceType.NONE, PieceType.NONE, false, false, false, true);
    }

    public boolean isCapture() {
        return captured != PieceType.NONE;
    }

    public boolean isPromotion() {
        return promotion != PieceType.NONE;
    }

    public boolean isCastle() {
        return castleKingSide || castleQueenSide;
    }

    public Move withPromotion(PieceType promotionPiece) {
        if(!isPromotion() || promotionPiece == promotion) {
            return this;
        }
        return new Move(from, to, captured, promotionPiece, doublePush, enPassant, castleKingSide, castleQueenSide);
    }

    @Override
    public String toString() {
        return MoveIOUtils.writeCoordinateNotation(this);
    }
}
