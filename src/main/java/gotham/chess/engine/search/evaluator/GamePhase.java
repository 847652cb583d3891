package gotham.chess.engine.search.evaluator;

import gotham.chess.engine.game.Game;
import gotham.chess.engine.game.board.Board;
import gotham.chess.engine.utils.BitUtils;

public enum GamePhase {
    OPENING,
    MIDDLE_GAME,
    ENDGAME;

    // First ten moves of each side
    static final int OPENING_PLIES = 20;
    static final int OPENING_MIN_PIECES = 28;
    static final int ENDGAME_MAX_PIECES = 10;
    static final int ENDGAME_MAX_MAJORS = 2;

    public static GamePhase of(Game game) {
        final Board board = game.board();
        final int pieces = BitUtils.bitCount(board.gameBB);
        if(game.pliesPlayed() < OPENING_PLIES || pieces >= OPENING_MIN_PIECES) {
            return OPENING;
        }
        final int majors = BitUtils.bitCount(board.rookBB | board.queenBB);
        if(pieces <= ENDGAME_MAX_PIECES || majors <= ENDGAME_MAX_MAJORS) {
            return ENDGAME;
        }
        return MIDDLE_GAME;
    }

    public boolean isEndgame() {
        return this == ENDGAME;
    }
}
