package arcade.chess.engine.utils.notations;

import arcade.chess.engine.common.Color;
import arcade.chess.engine.game.Game;
import arcade.chess.engine.game.board.Board;
import arcade.chess.engine.game.board.utils.BoardGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FENUtilsTest {

    @ParameterizedTest
    @ValueSource(strings = {
            BoardGenerator.STANDARD_GAME,
            "rnbqkbnr/pppppppp/8/8/4P3/8/PPPP1PPP/RNBQKBNR b KQkq e3 0 1",
            "r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q1p/PPPBBPPP/R3K2R w KQkq - 0 1",
            "rnbq1k1r/pp1Pbppp/2p5/8/2B5/8/PPP1NnPP/RNBQK2R w KQ - 1 8",
            "8/2p5/3p4/KP5r/1R3p1k/8/4P1P1/8 w - - 0 1",
            "r4rk1/1pp1qppp/p1np1n2/2b1p1B1/2B1P1b1/P1NP1N2/1PP1QPPP/R4RK1 w - - 0 10",
            "7k/8/8/8/8/8/8/R6K w - - 99 80",
            "8/8/8/KPp4r/8/8/8/7k w - c6 0 2",
    })
    public void export_shouldReproduceTheImportedRecord(String fen) {
        // When
        Game game = FENUtils.getGameFrom(fen);

        // Then
        assertEquals(fen, FENUtils.getFENFromGame(game));
        assertEquals(fen, game.exportFEN());
    }

    @Test
    public void import_shouldReadEveryField() {
        // When
        Board board = FENUtils.getBoardFrom("rnbqkbnr/pppp1ppp/8/4p3/4P3/8/PPPP1PPP/RNBQKBNR w Kq e6 3 12");
        Game game = FENUtils.getGameFrom("rnbqkbnr/pppp1ppp/8/4p3/4P3/8/PPPP1PPP/RNBQKBNR w Kq e6 3 12");

        // Then
        assertEquals(Color.WHITE, board.sideToMove());
        assertTrue(board.canCastleKingSide(Color.WHITE));
        assertFalse(board.canCastleQueenSide(Color.WHITE));
        assertFalse(board.canCastleKingSide(Color.BLACK));
        assertTrue(board.canCastleQueenSide(Color.BLACK));
        assertEquals("e6", board.enPassantTarget().name());
        assertEquals("p", board.getPiece(MoveIOUtils.getSquareFromName("e5")).toString());
        assertEquals(3, game.halfMoveClock());
        assertEquals(12, game.fullMoveNumber());
    }

    @Test
    public void missingClocks_shouldDefaultToZeroAndOne() {
        // When
        Game game = FENUtils.getGameFrom("4k3/8/8/8/8/8/8/4K3 b - -");

        // Then
        assertEquals(0, game.halfMoveClock());
        assertEquals(1, game.fullMoveNumber());
        assertEquals(Color.BLACK, game.sideToMove());
        assertNull(game.board().enPassantTarget());
        assertEquals("4k3/8/8/8/8/8/8/4K3 b - - 0 1", game.exportFEN());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1 extra",
            // 7 ranks
            "rnbqkbnr/pppppppp/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1",
            // 9 squares on the last rank
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNRR w KQkq - 0 1",
            // 7 squares on the first rank
            "rnbqkbn/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNX w KQkq - 0 1",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR x KQkq - 0 1",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQxq - 0 1",
            // repeated castling right
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KKq - 0 1",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq e9 0 1",
            // en passant square on the wrong rank for the side to move
            "rnbqkbnr/pppppppp/8/8/4P3/8/PPPP1PPP/RNBQKBNR b KQkq e6 0 1",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - x 1",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - -1 1",
            // no black king, then two white kings
            "rnbqqbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBKKBNR w KQkq - 0 1",
            // pawn on the last rank
            "Pnbqkbnr/pppppppp/8/8/8/8/1PPPPPPP/RNBQKBNR w KQkq - 0 1",
            // black, who just moved, is left in check: white could take the king
            "4k3/8/8/8/8/8/4Q3/4K3 w - - 0 1",
            "4k3/4r3/8/8/8/8/8/4K3 b - - 0 1",
    })
    public void malformedRecord_shouldBeRejected(String fen) {
        assertThrows(InvalidFenException.class, () -> FENUtils.getBoardFrom(fen));
    }

    @Test
    public void castlingRights_shouldBeExportedInStandardOrder() {
        // When
        Game game = FENUtils.getGameFrom("rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w qkQK - 0 1");

        // Then
        assertEquals(BoardGenerator.STANDARD_GAME, game.exportFEN());
    }

    @Test
    public void sideToMoveInCheck_shouldBeAccepted() {
        // When
        Game game = FENUtils.getGameFrom("4k3/8/8/8/8/8/4q3/4K3 w - - 0 1");

        // Then
        assertTrue(game.isCheck());
        assertEquals(1, game.getAllLegalMoves(Color.WHITE).size());
    }

    @Test
    public void invalidFenException_shouldBeAnIllegalArgumentException() {
        assertThrows(IllegalArgumentException.class, () -> FENUtils.getGameFrom(null));
    }
}
