package arcade.chess.engine.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.Random;

public final class SearchContext {
    // Capture scores per ply, reused between nodes of the same ply
    public final IntArrayList[] scoreBuf = new IntArrayList[SearchConstants.MAX_PLY + 1];

    public final Random random;

    // Counters
    public long nodes;

    // Config
    public final SearchConfig cfg;

    public SearchContext(SearchConfig cfg) {
        this.cfg = cfg;
        this.random = cfg.randomSeed != null ? new Random(cfg.randomSeed) : new Random();
        for (int p = 0; p < scoreBuf.length; p++) {
            scoreBuf[p] = new IntArrayList();
        }
    }

    public void newSearch() {
        nodes = 0;
        for (IntArrayList scores : scoreBuf) {
            scores.clear();
        }
    }
}
