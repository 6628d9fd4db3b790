package arcade.chess.engine.search;

import java.util.Locale;
import java.util.Optional;

public enum Difficulty {
    // Plays a uniformly random legal move 30% of the time
    EASY(2, 0.3),
    MEDIUM(3, 0),
    HARD(4, 0);

    public final int depth;
    public final double randomMoveProbability;

    Difficulty(int depth, double randomMoveProbability) {
        this.depth = depth;
        this.randomMoveProbability = randomMoveProbability;
    }

    /**
     * @return the tier named {@code easy}, {@code medium} or {@code hard} (any case), empty for anything else
     */
    public static Optional<Difficulty> fromName(String name) {
        if(name == null) {
            return Optional.empty();
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "easy" -> Optional.of(EASY);
            case "medium" -> Optional.of(MEDIUM);
            case "hard" -> Optional.of(HARD);
            default -> Optional.empty();
        };
    }

    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
