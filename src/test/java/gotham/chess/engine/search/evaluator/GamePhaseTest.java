package gotham.chess.engine.search.evaluator;

import gotham.chess.engine.game.board.utils.BoardGenerator;
import gotham.chess.engine.utils.notations.FENUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GamePhaseTest {

    @Test
    public void gamePhaseShouldBeOpeningAtTheStart() {
        assertEquals(GamePhase.OPENING, GamePhase.of(BoardGenerator.newStandardGameBoard()));
        assertEquals(GamePhase.OPENING, GamePhase.of(FENUtils.getBoardFrom("rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 40")),
                "Every piece still on the board");
        assertEquals(GamePhase.OPENING, GamePhase.of(FENUtils.getBoardFrom("r2qk2r/ppp2ppp/2n5/8/8/2N5/PPP2PPP/R2QK2R w KQkq - 0 1")),
                "Fewer than ten moves each");
    }

    @Test
    public void gamePhaseShouldBeMiddleGame() {
        assertEquals(GamePhase.MIDDLE_GAME, GamePhase.of(FENUtils.getBoardFrom("r2qk2r/ppp2ppp/2n5/8/8/2N5/PPP2PPP/R2QK2R w KQkq - 0 15")));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "4k3/8/8/8/8/8/8/4K2R w - - 0 40",
            "4k3/pppp4/8/8/8/8/PPPP4/R3K3 w - - 0 40",
            "1r2k3/pppppppp/8/8/8/8/PPPPPPPP/1R2K3 w - - 0 40"
    })
    public void gamePhaseShouldBeEndgame(String fen) {
        GamePhase phase = GamePhase.of(FENUtils.getBoardFrom(fen));
        assertEquals(GamePhase.ENDGAME, phase);
        assertTrue(phase.isEndgame());
    }
}
