package arcade.chess.engine.movegen.perft;

import arcade.chess.engine.game.board.utils.BoardGenerator;

import java.util.Map;
import java.util.TreeMap;

// Based on https://www.chessprogramming.org/Perft_Results
// Depths are kept small, the mailbox generator is not built for deep perft runs
public class PerftTestSet {
    public static final Map<String, Map<Integer, Long>> PERFT_TEST_FEN_MAP = new TreeMap<>();
    private static final String FEN_POSITION_2 = "r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q1p/PPPBBPPP/R3K2R w KQkq - 0 1";
    private static final String FEN_POSITION_3 = "8/2p5/3p4/KP5r/1R3p1k/8/4P1P1/8 w - - 0 1";
    private static final String FEN_POSITION_4 = "r3k2r/Pppp1ppp/1b3nbN/nP6/BBP1P3/q4N2/Pp1P2PP/R2Q1RK1 w kq - 0 1";
    private static final String FEN_POSITION_4_MIRROR = "r2q1rk1/pP1p2pp/Q4n2/bbp1p3/Np6/1B3NBn/pPPP1PPP/R3K2R b KQ - 0 1";
    private static final String FEN_POSITION_5 = "rnbq1k1r/pp1Pbppp/2p5/8/2B5/8/PPP1NnPP/RNBQK2R w KQ - 1 8";
    private static final String FEN_POSITION_6 = "r4rk1/1pp1qppp/p1np1n2/2b1p1B1/2B1P1b1/P1NP1N2/1PP1QPPP/R4RK1 w - - 0 10";

    public static final Map<String, String> FEN_TEST_NAMES = Map.of(
            BoardGenerator.STANDARD_GAME, "Standard board",
            FEN_POSITION_2, "Position 2",
            FEN_POSITION_3, "Position 3",
            FEN_POSITION_4, "Position 4",
            FEN_POSITION_4_MIRROR, "Position 4 - Mirror",
            FEN_POSITION_5, "Position 5",
            FEN_POSITION_6, "Position 6"
    );

    static {
        PERFT_TEST_FEN_MAP.put(BoardGenerator.STANDARD_GAME, new TreeMap<>(Map.of(1, 20L, 2, 400L, 3, 8_902L)));
        PERFT_TEST_FEN_MAP.put(FEN_POSITION_2, new TreeMap<>(Map.of(1, 48L, 2, 2_039L)));
        PERFT_TEST_FEN_MAP.put(FEN_POSITION_3, new TreeMap<>(Map.of(1, 14L, 2, 191L, 3, 2_812L)));
        PERFT_TEST_FEN_MAP.put(FEN_POSITION_4, new TreeMap<>(Map.of(1, 6L, 2, 264L, 3, 9_467L)));
        PERFT_TEST_FEN_MAP.put(FEN_POSITION_4_MIRROR, new TreeMap<>(Map.of(1, 6L, 2, 264L, 3, 9_467L)));
        PERFT_TEST_FEN_MAP.put(FEN_POSITION_5, new TreeMap<>(Map.of(1, 44L, 2, 1_486L)));
        PERFT_TEST_FEN_MAP.put(FEN_POSITION_6, new TreeMap<>(Map.of(1, 46L, 2, 2_079L)));
    }
}
