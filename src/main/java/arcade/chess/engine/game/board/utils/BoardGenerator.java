package arcade.chess.engine.game.board.utils;

import arcade.chess.engine.common.Color;
import arcade.chess.engine.game.Game;
import arcade.chess.engine.game.Opponent;
import arcade.chess.engine.utils.notations.FENUtils;

public class BoardGenerator {
    public static final String STANDARD_GAME = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";

    public static Game newStandardGame() {
        return FENUtils.getGameFrom(STANDARD_GAME);
    }

    public static Game newStandardGame(Opponent opponent, Color playerColor) {
        Game game = newStandardGame();
        game.setOpponent(opponent);
        game.setPlayerColor(playerColor);
        return game;
    }

    public static Game from(String FEN) {
        return FENUtils.getGameFrom(FEN);
    }
}
