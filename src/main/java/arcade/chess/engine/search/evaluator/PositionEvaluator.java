package arcade.chess.engine.search.evaluator;

import arcade.chess.engine.common.Color;
import arcade.chess.engine.common.Piece;
import arcade.chess.engine.common.Square;
import arcade.chess.engine.game.board.Board;
import arcade.chess.engine.movegen.MoveGenerator;
import arcade.chess.engine.movegen.utils.CheckUtils;

import static arcade.chess.engine.search.evaluator.PieceValues.*;

/**
 * Static evaluation in centipawns, always from white's point of view: positive favours white.
 * Material plus piece-square tables, centre control, back rank king placement and mobility.
 */
public class PositionEvaluator {
    private static final Square[] CENTER = {
            Square.of(3, 3), Square.of(3, 4), Square.of(4, 3), Square.of(4, 4)
    };
    private static final Square[] EXTENDED_CENTER = {
            Square.of(2, 2), Square.of(2, 3), Square.of(2, 4), Square.of(2, 5),
            Square.of(3, 2), Square.of(3, 5),
            Square.of(4, 2), Square.of(4, 5),
            Square.of(5, 2), Square.of(5, 3), Square.of(5, 4), Square.of(5, 5)
    };

    public static int evaluate(Board board) {
        return evaluateMaterialAndSquares(board)
                + evaluateCenterControl(board)
                + evaluateKingSafety(board, Color.WHITE) - evaluateKingSafety(board, Color.BLACK)
                + evaluateMobility(board);
    }

    static int evaluateMaterialAndSquares(Board board) {
        int score = 0;
        for(int i = 0; i < 64; i++) {
            Piece piece = board.getPiece(Square.of(i));
            if(piece == null) {
                continue;
            }
            boolean white = piece.color() == Color.WHITE;
            int pieceScore = value(piece.type()) + squareBonus(piece.type(), white, i);
            score += white ? pieceScore : -pieceScore;
        }
        return score;
    }

    static int evaluateCenterControl(Board board) {
        return controlOf(board, CENTER, CENTER_CONTROL) + controlOf(board, EXTENDED_CENTER, EXTENDED_CENTER_CONTROL);
    }

    private static int controlOf(Board board, Square[] squares, int bonus) {
        int score = 0;
        for(Square square : squares) {
            if(CheckUtils.isSquareAttacked(board, square, Color.WHITE)) {
                score += bonus;
            }
            if(CheckUtils.isSquareAttacked(board, square, Color.BLACK)) {
                score -= bonus;
            }
        }
        return score;
    }

    // From the king owner's point of view
    static int evaluateKingSafety(Board board, Color color) {
        Square king = board.findKing(color);
        if(king == null || king.row != color.homeRow()) {
            return 0;
        }
        int score = 0;
        for(int castledCol : KingSafety.CASTLED_COLS) {
            if(king.col == castledCol) {
                score += KingSafety.CASTLED;
            }
        }
        if(king.col >= KingSafety.CENTER_FIRST_COL && king.col <= KingSafety.CENTER_LAST_COL) {
            score += KingSafety.KING_IN_CENTER;
        }
        return score;
    }

    static int evaluateMobility(Board board) {
        int whiteMoves = MoveGenerator.countLegalMoves(board, Color.WHITE);
        int blackMoves = MoveGenerator.countLegalMoves(board, Color.BLACK);
        return (whiteMoves - blackMoves) * MOBILITY;
    }
}
