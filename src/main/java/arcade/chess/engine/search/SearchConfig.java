package arcade.chess.engine.search;

public final class SearchConfig {

    public final Difficulty difficulty;

    // Plies searched from the root
    public final int depth;

    // Chance of skipping the search for a uniformly random legal move
    public final double randomMoveProbability;

    // null for an unseeded random source
    public final Long randomSeed;

    private SearchConfig(Builder b) {
        difficulty = b.difficulty;
        depth = b.depth > 0 ? b.depth : b.difficulty.depth;
        randomMoveProbability = b.randomMoveProbability >= 0 ? b.randomMoveProbability : b.difficulty.randomMoveProbability;
        randomSeed = b.randomSeed;
    }

    @Override
    public String toString() {
        return "SearchConfig[difficulty=" + difficulty.displayName() + ", depth=" + depth
                + ", randomMoveProbability=" + randomMoveProbability + ", randomSeed=" + randomSeed + "]";
    }

    public static class Builder {
        private Difficulty difficulty = Difficulty.MEDIUM;

        // Overrides, unset values fall back on the difficulty tier
        private int depth = -1;
        private double randomMoveProbability = -1;

        private Long randomSeed = null;

        public Builder difficulty(Difficulty v){difficulty=v;return this;}
        public Builder depth(int v){
            if(v < 1 || v > SearchConstants.MAX_PLY) {
                throw new IllegalArgumentException("depth should be in [1-" + SearchConstants.MAX_PLY + "], got " + v);
            }
            depth=v;return this;
        }
        public Builder randomMoveProbability(double v){
            if(v < 0 || v > 1) {
                throw new IllegalArgumentException("randomMoveProbability should be in [0-1], got " + v);
            }
            randomMoveProbability=v;return this;
        }
        public Builder randomSeed(long v){randomSeed=v;return this;}

        public SearchConfig build(){return new SearchConfig(this);}
    }
}
