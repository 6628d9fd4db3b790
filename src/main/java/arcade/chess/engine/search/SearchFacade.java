package arcade.chess.engine.search;

import arcade.chess.engine.common.Color;
import arcade.chess.engine.game.Game;
import arcade.chess.engine.game.board.Board;
import arcade.chess.engine.movegen.Move;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Entry point of the computer opponent. Searches run synchronously to completion on a private copy
 * of the board, the caller's board and game are never touched.
 */
public final class SearchFacade {
    private static final Consumer<String> NO_OUTPUT = line -> {};

    private SearchContext ctx;

    public SearchFacade() {
        this(new SearchConfig.Builder().build());
    }

    public SearchFacade(SearchConfig cfg) {
        this.ctx = new SearchContext(cfg);
    }

    /**
     * @return the move to play, empty when {@code sideToMove} is mated or stalemated
     */
    public Optional<Move> selectMove(Board board, Color sideToMove) {
        return Optional.ofNullable(search(board, sideToMove, NO_OUTPUT).move());
    }

    public Optional<Move> selectMove(Game game) {
        return selectMove(game.board(), game.sideToMove());
    }

    /**
     * Same as {@link #selectMove(Board, Color)}, reporting progress as UCI style {@code info} lines to {@code out}.
     */
    public SearchResult search(Board board, Color sideToMove, Consumer<String> out) {
        Board root = board.copy();
        if (root.sideToMove() != sideToMove) {
            // the en passant target belongs to the other side
            root.setSideToMove(sideToMove);
            root.setEnPassantTarget(null);
        }
        return RootSearch.search(root, ctx, out);
    }

    public SearchConfig config() {
        return ctx.cfg;
    }

    public Difficulty getDifficulty() {
        return ctx.cfg.difficulty;
    }

    // Depth and random move overrides are dropped, the seed is kept
    public void setDifficulty(Difficulty difficulty) {
        SearchConfig.Builder builder = new SearchConfig.Builder().difficulty(difficulty);
        if (ctx.cfg.randomSeed != null) {
            builder.randomSeed(ctx.cfg.randomSeed);
        }
        this.ctx = new SearchContext(builder.build());
    }

    /**
     * Switches tier by name, {@code easy}, {@code medium} or {@code hard}. Unknown names leave the tier unchanged.
     *
     * @return true when the tier was changed
     */
    public boolean setDifficulty(String name) {
        Optional<Difficulty> difficulty = Difficulty.fromName(name);
        difficulty.ifPresent(this::setDifficulty);
        return difficulty.isPresent();
    }
}
