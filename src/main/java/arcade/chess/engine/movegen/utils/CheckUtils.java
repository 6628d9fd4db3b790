package arcade.chess.engine.movegen.utils;

import arcade.chess.engine.common.Color;
import arcade.chess.engine.common.Piece;
import arcade.chess.engine.common.PieceType;
import arcade.chess.engine.common.Square;
import arcade.chess.engine.game.board.Board;
import arcade.chess.engine.movegen.pieces.Bishop;
import arcade.chess.engine.movegen.pieces.King;
import arcade.chess.engine.movegen.pieces.Knight;
import arcade.chess.engine.movegen.pieces.Rook;

public final class CheckUtils {

    private CheckUtils() {
    }

    /**
     * Tells whether any piece of {@code byColor} attacks the square. A null (off-board) square is never attacked.
     */
    public static boolean isSquareAttacked(Board board, Square square, Color byColor) {
        if(square == null) {
            return false;
        }
        int row = square.row;
        int col = square.col;

        // Pawns attack towards their push direction, so the attacker stands one row behind
        int pawnRow = row - byColor.pawnDirection();
        if(isPiece(board, pawnRow, col - 1, PieceType.PAWN, byColor)
                || isPiece(board, pawnRow, col + 1, PieceType.PAWN, byColor)) {
            return true;
        }

        for(int[] offset : Knight.OFFSETS) {
            if(isPiece(board, row + offset[0], col + offset[1], PieceType.KNIGHT, byColor)) {
                return true;
            }
        }

        for(int[] offset : King.OFFSETS) {
            if(isPiece(board, row + offset[0], col + offset[1], PieceType.KING, byColor)) {
                return true;
            }
        }

        if(isAttackedAlong(board, square, Rook.DIRECTIONS, PieceType.ROOK, byColor)) {
            return true;
        }

        return isAttackedAlong(board, square, Bishop.DIRECTIONS, PieceType.BISHOP, byColor);
    }

    public static boolean isInCheck(Board board, Color color) {
        Square kingSquare = board.findKing(color);
        if(kingSquare == null) {
            return false;
        }
        return isSquareAttacked(board, kingSquare, color.getOppositeColor());
    }

    // Walks each ray up to the first blocker, which attacks if it is the slider or a queen
    private static boolean isAttackedAlong(Board board, Square square, int[][] directions, PieceType slider, Color byColor) {
        for(int[] direction : directions) {
            int row = square.row + direction[0];
            int col = square.col + direction[1];
            while(Square.isOnBoard(row, col)) {
                Piece piece = board.getPiece(row, col);
                if(piece != null) {
                    if(piece.color() == byColor && (piece.type() == slider || piece.type() == PieceType.QUEEN)) {
                        return true;
                    }
                    break;
                }
                row += direction[0];
                col += direction[1];
            }
        }
        return false;
    }

    private static boolean isPiece(Board board, int row, int col, PieceType type, Color color) {
        Piece piece = board.getPiece(row, col);
        return piece != null && piece.is(type, color);
    }
}
