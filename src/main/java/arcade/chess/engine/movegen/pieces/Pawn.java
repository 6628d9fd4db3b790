package arcade.chess.engine.movegen.pieces;

import arcade.chess.engine.common.Color;
import arcade.chess.engine.common.Piece;
import arcade.chess.engine.common.PieceType;
import arcade.chess.engine.common.Square;
import arcade.chess.engine.game.board.Board;
import arcade.chess.engine.movegen.Move;

import java.util.List;

public final class Pawn {
    private static final int[] CAPTURE_COLS = {-1, 1};

    private Pawn() {
    }

    public static int startRow(Color color) {
        return color == Color.WHITE ? 6 : 1;
    }

    public static int promotionRow(Color color) {
        return color == Color.WHITE ? 0 : 7;
    }

    public static void generatePseudoLegalMoves(Board board, Square from, Color color, List<Move> moves) {
        int direction = color.pawnDirection();

        Square oneForward = from.offset(direction, 0);
        if(oneForward == null) {
            return;
        }

        // Forward pushes
        if(board.isEmpty(oneForward)) {
            addPawnMove(from, oneForward, PieceType.NONE, color, moves);

            if(from.row == startRow(color)) {
                Square twoForward = from.offset(2 * direction, 0);
                if(board.isEmpty(twoForward)) {
                    moves.add(Move.doublePush(from, twoForward));
                }
            }
        }

        // Captures, en passant only belongs to the side to move
        Square enPassantTarget = board.sideToMove() == color ? board.enPassantTarget() : null;
        for(int colDelta : CAPTURE_COLS) {
            Square to = from.offset(direction, colDelta);
            if(to == null) {
                continue;
            }
            Piece target = board.getPiece(to);
            if(target != null && target.color() != color) {
                addPawnMove(from, to, target.type(), color, moves);
            }
            if(to == enPassantTarget) {
                moves.add(Move.enPassant(from, to));
            }
        }
    }

    // Landing on the last row expands into one move per promotion piece
    private static void addPawnMove(Square from, Square to, PieceType captured, Color color, List<Move> moves) {
        if(to.row == promotionRow(color)) {
            for(PieceType promotion : PieceType.PROMOTIONS) {
                moves.add(Move.promote(from, to, captured, promotion));
            }
        } else if(captured != PieceType.NONE) {
            moves.add(Move.capture(from, to, captured));
        } else {
            moves.add(Move.of(from, to));
        }
    }
}
