package arcade.chess.engine.movegen.utils;

import arcade.chess.engine.common.Color;
import arcade.chess.engine.common.Square;
import arcade.chess.engine.game.board.Board;
import arcade.chess.engine.utils.notations.FENUtils;
import arcade.chess.engine.utils.notations.MoveIOUtils;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CheckUtilsTest {

    private static Square square(String name) {
        return MoveIOUtils.getSquareFromName(name);
    }

    @Test
    public void offBoardSquare_shouldNeverBeAttacked() {
        Board board = FENUtils.getBoardFrom("4k3/8/8/8/8/8/8/Q3K3 w - - 0 1");

        assertFalse(CheckUtils.isSquareAttacked(board, Square.of(8, 0), Color.WHITE));
        assertFalse(CheckUtils.isSquareAttacked(board, null, Color.WHITE));
    }

    @Test
    public void pawns_shouldAttackTowardsTheirPushDirection() {
        // Given
        Board board = FENUtils.getBoardFrom("4k3/8/8/3p4/8/8/4P3/4K3 w - - 0 1");

        // Then
        assertTrue(CheckUtils.isSquareAttacked(board, square("d3"), Color.WHITE));
        assertTrue(CheckUtils.isSquareAttacked(board, square("f3"), Color.WHITE));
        assertFalse(CheckUtils.isSquareAttacked(board, square("e3"), Color.WHITE));
        assertFalse(CheckUtils.isSquareAttacked(board, square("e4"), Color.WHITE));

        assertTrue(CheckUtils.isSquareAttacked(board, square("c4"), Color.BLACK));
        assertTrue(CheckUtils.isSquareAttacked(board, square("e4"), Color.BLACK));
        assertFalse(CheckUtils.isSquareAttacked(board, square("c6"), Color.BLACK));
    }

    @Test
    public void sliders_shouldStopAtTheFirstBlocker() {
        // Given
        Board board = FENUtils.getBoardFrom("4k3/8/8/8/8/8/8/R1n4K w - - 0 1");

        // Then
        assertTrue(CheckUtils.isSquareAttacked(board, square("b1"), Color.WHITE));
        assertTrue(CheckUtils.isSquareAttacked(board, square("c1"), Color.WHITE));
        assertFalse(CheckUtils.isSquareAttacked(board, square("d1"), Color.WHITE));
        assertTrue(CheckUtils.isSquareAttacked(board, square("a8"), Color.WHITE));
    }

    @Test
    public void queen_shouldAttackOnLinesAndDiagonals() {
        // Given
        Board board = FENUtils.getBoardFrom("4k3/8/8/3q4/8/8/8/K7 w - - 0 1");

        // Then
        assertTrue(CheckUtils.isSquareAttacked(board, square("d1"), Color.BLACK));
        assertTrue(CheckUtils.isSquareAttacked(board, square("h1"), Color.BLACK));
        assertTrue(CheckUtils.isSquareAttacked(board, square("a8"), Color.BLACK));
        assertFalse(CheckUtils.isSquareAttacked(board, square("e3"), Color.BLACK));
        assertFalse(CheckUtils.isInCheck(board, Color.WHITE));
    }

    @Test
    public void knightAndKing_shouldAttackTheirOffsets() {
        // Given
        Board board = FENUtils.getBoardFrom("4k3/8/8/8/8/8/8/1N2K3 w - - 0 1");

        // Then
        assertTrue(CheckUtils.isSquareAttacked(board, square("c3"), Color.WHITE));
        assertTrue(CheckUtils.isSquareAttacked(board, square("d2"), Color.WHITE));
        assertTrue(CheckUtils.isSquareAttacked(board, square("f2"), Color.WHITE));
        assertFalse(CheckUtils.isSquareAttacked(board, square("b3"), Color.WHITE));
        assertFalse(CheckUtils.isInCheck(board, Color.BLACK));
    }
}
