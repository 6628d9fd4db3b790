package arcade.chess.engine.movegen.perft;

import arcade.chess.engine.game.board.Board;
import arcade.chess.engine.game.board.MovePlayed;
import arcade.chess.engine.movegen.Move;
import arcade.chess.engine.movegen.MoveGenerator;
import arcade.chess.engine.utils.notations.FENUtils;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

// https://www.chessprogramming.org/Perft_Results
public class PerftTest {

    public static Stream<Arguments> getPerftTestSet() {
        List<Arguments> argumentsList = new ArrayList<>();
        PerftTestSet.PERFT_TEST_FEN_MAP.forEach((fen, results) -> argumentsList.add(Arguments.of(PerftTestSet.FEN_TEST_NAMES.get(fen), fen, results)));

        return argumentsList.stream();
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("getPerftTestSet")
    public void runPerftTest(String testName, String fen, Map<Integer, Long> expectedResults) {
        for(Map.Entry<Integer, Long> expectedResult : expectedResults.entrySet()) {
            // Given
            Board board = FENUtils.getBoardFrom(fen);
            String fenBefore = FENUtils.getFENFromBoard(board, 0, 1);

            // When
            long nodes = runPerft(board, expectedResult.getKey());

            // Then
            assertEquals(expectedResult.getValue(), nodes, testName + " at depth " + expectedResult.getKey());
            // Play and undo must leave the board exactly as it was
            assertEquals(fenBefore, FENUtils.getFENFromBoard(board, 0, 1));
        }
    }

    private static long runPerft(Board board, int depth) {
        List<Move> moves = MoveGenerator.generateAllLegalMoves(board, board.sideToMove());
        if(depth == 1) {
            return moves.size();
        }

        long nodes = 0;
        for(Move move : moves) {
            Board before = board.copy();
            MovePlayed movePlayed = board.playMove(move);
            nodes += runPerft(board, depth - 1);
            board.undoMove(movePlayed);
            assertTrue(board.samePositionAs(before), "undo of " + move + " did not restore the position");
        }
        return nodes;
    }
}
