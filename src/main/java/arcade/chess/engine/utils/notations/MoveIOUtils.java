package arcade.chess.engine.utils.notations;

import arcade.chess.engine.common.Piece;
import arcade.chess.engine.common.PieceType;
import arcade.chess.engine.common.Square;
import arcade.chess.engine.movegen.Move;

public class MoveIOUtils {
    private static final String FILES = "abcdefgh";

    /**
     * History notation: castling as O-O / O-O-O, piece letter (none for pawns), origin file for pawn
     * captures, x for captures, destination and =Q style promotion suffix.
     * Two identical pieces able to reach the same square are not disambiguated, and there is no check suffix.
     *
     * @param captured  the piece taken by the move, null when nothing was taken
     * @param promotion the piece the pawn turned into, NONE when not a promotion
     */
    public static String writeAlgebraicNotation(Move move, Piece piece, Piece captured, PieceType promotion) {
        if(move.castleKingSide()) {
            return "O-O";
        }
        if(move.castleQueenSide()) {
            return "O-O-O";
        }

        StringBuilder notation = new StringBuilder();
        boolean isPawn = piece.type() == PieceType.PAWN;
        if(!isPawn) {
            notation.append(piece.type().letter);
        }

        if(captured != null) {
            if(isPawn) {
                notation.append(move.from().file());
            }
            notation.append('x');
        }

        notation.append(move.to().name());

        if(promotion != PieceType.NONE) {
            notation.append('=').append(promotion.letter);
        }
        return notation.toString();
    }

    // Long coordinate form, e.g. e2e4 or e7e8q
    public static String writeCoordinateNotation(Move move) {
        String promotedPiece = move.isPromotion() ? String.valueOf(Character.toLowerCase(move.promotion().letter)) : "";
        return move.from().name() + move.to().name() + promotedPiece;
    }

    public static Square getSquareFromName(String square) {
        if(square == null || square.length() != 2) {
            throw new InvalidFenException("square should be format 'a1', got '" + square + "'");
        }

        int col = FILES.indexOf(square.charAt(0));
        if(col == -1) {
            throw new InvalidFenException("square letter should be in [a-h], got '" + square + "'");
        }

        char rankChar = square.charAt(1);
        if(rankChar < '1' || rankChar > '8') {
            throw new InvalidFenException("square digit should be in [1-8], got '" + square + "'");
        }
        int rank = rankChar - '0';

        return Square.of(8 - rank, col);
    }

    public static PieceType getPromotionFromLetter(char letter) {
        return switch (letter) {
            case 'n', 'N' -> PieceType.KNIGHT;
            case 'q', 'Q' -> PieceType.QUEEN;
            case 'r', 'R' -> PieceType.ROOK;
            case 'b', 'B' -> PieceType.BISHOP;
            default -> throw new IllegalArgumentException("Unknown promotion letter " + letter);
        };
    }
}
