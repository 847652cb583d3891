package gotham.chess.engine.search.evaluator;

import gotham.chess.engine.game.Game;
import gotham.chess.engine.search.tactics.MotifKind;
import gotham.chess.engine.search.tactics.MotifRecognizer;
import gotham.chess.engine.utils.notations.FENUtils;
import gotham.chess.engine.utils.notations.MoveIOUtils;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class TacticalWeightsTest {

    @Test
    public void scaledMotifsAreCapped() {
        assertEquals(400, TacticalWeights.weigh(MotifKind.FORK, 500));
        assertEquals(600, TacticalWeights.weigh(MotifKind.FORK, 1000));
        assertEquals(500, TacticalWeights.weigh(MotifKind.SKEWER, 810));
        assertEquals(250, TacticalWeights.weigh(MotifKind.SACRIFICE, 10_000));
    }

    @Test
    public void flatMotifsIgnoreTheMagnitude() {
        assertEquals(TacticalWeights.MATE_IN_ONE, TacticalWeights.weigh(MotifKind.MATE_IN_ONE, MotifRecognizer.MATE_IN_ONE_VALUE));
        assertEquals(TacticalWeights.BACK_RANK, TacticalWeights.weigh(MotifKind.BACK_RANK, 1));
        assertEquals(TacticalWeights.EN_PASSANT, TacticalWeights.weigh(MotifKind.EN_PASSANT, MotifRecognizer.EN_PASSANT_VALUE));
    }

    @Test
    public void absentMotifWeighsNothing() {
        for(MotifKind kind : MotifKind.values()) {
            assertEquals(0, TacticalWeights.weigh(kind, 0), kind.name());
        }
    }

    @Test
    public void signalsAreWeighedMotifByMotif() {
        Game game = FENUtils.getBoardFrom("6k1/5ppp/8/8/8/8/5PPP/R5K1 w - - 0 1");
        int mate = MoveIOUtils.readMove(game, "a1a8");
        assertEquals(TacticalWeights.MATE_IN_ONE, TacticalWeights.weigh(new MotifRecognizer().analyze(game, mate)));
    }
}
