package gotham.chess.engine.game.board.utils;

import gotham.chess.engine.game.Game;
import gotham.chess.engine.utils.notations.FENUtils;

public final class BoardGenerator {
    public static final String STANDARD_GAME = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";

    public static Game newStandardGameBoard() {
        return FENUtils.getBoardFrom(STANDARD_GAME);
    }

    public static Game from(String FEN) {
        return FENUtils.getBoardFrom(FEN);
    }

    private BoardGenerator() {}
}
