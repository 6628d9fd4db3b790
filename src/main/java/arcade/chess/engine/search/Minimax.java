package arcade.chess.engine.search;

import arcade.chess.engine.common.Color;
import arcade.chess.engine.game.board.Board;
import arcade.chess.engine.movegen.Move;
import arcade.chess.engine.movegen.MoveGenerator;
import arcade.chess.engine.movegen.utils.CheckUtils;
import arcade.chess.engine.search.evaluator.GameValues;
import arcade.chess.engine.search.evaluator.PositionEvaluator;

import java.util.List;

import static arcade.chess.engine.search.SearchConstants.INF;

/**
 * Fixed depth minimax with alpha-beta pruning. Scores are from white's point of view, white maximises.
 * Every child is searched on its own copy of the board.
 */
final class Minimax {

    private Minimax() {}

    static int search(Board board, SearchContext ctx, int depth, int ply, int alpha, int beta) {
        ctx.nodes++;
        final Color sideToMove = board.sideToMove();
        final boolean maximizing = sideToMove == Color.WHITE;

        // Mate and stalemate are scored before the depth is looked at
        List<Move> moves = MoveGenerator.generateAllLegalMoves(board, sideToMove);
        if (moves.isEmpty()) {
            if (CheckUtils.isInCheck(board, sideToMove)) {
                return maximizing ? -GameValues.CHECKMATE_VALUE : GameValues.CHECKMATE_VALUE;
            }
            return GameValues.PAT_VALUE;
        }

        if (depth == 0) {
            return PositionEvaluator.evaluate(board);
        }

        MoveOrdering.sortByCaptureValue(moves, ctx.scoreBuf[ply]);

        if (maximizing) {
            int maxEval = -INF;
            for (Move move : moves) {
                Board child = board.copy();
                child.playMove(move);
                int eval = search(child, ctx, depth - 1, ply + 1, alpha, beta);
                maxEval = Math.max(maxEval, eval);
                alpha = Math.max(alpha, eval);
                if (beta <= alpha) break;
            }
            return maxEval;
        } else {
            int minEval = INF;
            for (Move move : moves) {
                Board child = board.copy();
                child.playMove(move);
                int eval = search(child, ctx, depth - 1, ply + 1, alpha, beta);
                minEval = Math.min(minEval, eval);
                beta = Math.min(beta, eval);
                if (beta <= alpha) break;
            }
            return minEval;
        }
    }
}
