package arcade.chess.engine.search;

import arcade.chess.engine.common.Color;
import arcade.chess.engine.game.board.Board;
import arcade.chess.engine.movegen.Move;
import arcade.chess.engine.movegen.MoveGenerator;
import arcade.chess.engine.movegen.utils.CheckUtils;
import arcade.chess.engine.search.evaluator.GameValues;

import java.util.List;
import java.util.function.Consumer;

import static arcade.chess.engine.search.SearchConstants.INF;

final class RootSearch {

    // The board is owned by the search, callers hand over a copy
    static SearchResult search(Board board, SearchContext ctx, Consumer<String> out) {
        final long start = System.currentTimeMillis();
        final int depth = ctx.cfg.depth;
        ctx.newSearch();
        out.accept("info string Searching at depth " + depth + " for " + board.sideToMove().displayName());

        final Color sideToMove = board.sideToMove();
        final boolean maximizing = sideToMove == Color.WHITE;
        final List<Move> moves = MoveGenerator.generateAllLegalMoves(board, sideToMove);

        if (moves.isEmpty()) {
            int score = CheckUtils.isInCheck(board, sideToMove)
                    ? (maximizing ? -GameValues.CHECKMATE_VALUE : GameValues.CHECKMATE_VALUE)
                    : GameValues.PAT_VALUE;
            SearchResult sr = new SearchResult(null, score, 0, 0, System.currentTimeMillis() - start, false);
            out.accept(sr.toUCIInfo());
            return sr;
        }

        if (ctx.cfg.randomMoveProbability > 0 && ctx.random.nextDouble() < ctx.cfg.randomMoveProbability) {
            Move randomMove = RandomSearch.pickNextMove(moves, ctx.random);
            out.accept("info string Playing a random move");
            SearchResult sr = new SearchResult(randomMove, 0, 0, 0, System.currentTimeMillis() - start, true);
            out.accept(sr.toUCIInfo());
            return sr;
        }

        MoveOrdering.sortByCaptureValue(moves, ctx.scoreBuf[0]);

        Move bestMove = moves.get(0);
        int bestScore = maximizing ? -INF : INF;
        int alpha = -INF, beta = INF;

        // Strict comparisons, the first move reaching the best score is kept
        for (Move move : moves) {
            Board child = board.copy();
            child.playMove(move);
            int score = Minimax.search(child, ctx, depth - 1, 1, alpha, beta);

            if (maximizing) {
                if (score > bestScore) {
                    bestScore = score;
                    bestMove = move;
                }
                alpha = Math.max(alpha, bestScore);
            } else {
                if (score < bestScore) {
                    bestScore = score;
                    bestMove = move;
                }
                beta = Math.min(beta, bestScore);
            }
        }

        SearchResult sr = new SearchResult(bestMove, bestScore, depth, ctx.nodes, System.currentTimeMillis() - start, false);
        out.accept(sr.toUCIInfo());
        return sr;
    }
}
