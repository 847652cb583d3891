package gotham.chess.engine.search;

import gotham.chess.engine.game.Game;
import gotham.chess.engine.search.tactics.MotifRecognizer;
import gotham.chess.engine.utils.notations.FENUtils;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class AdaptiveDepthTest {
    private final MotifRecognizer recognizer = new MotifRecognizer();

    @Test
    public void quietPositionUsesTheBaseDepth() {
        SearchConfig cfg = SearchConfig.defaults();
        Game game = FENUtils.getBoardFrom("4k3/8/8/8/8/8/8/4K3 w - - 0 1");
        assertEquals(cfg.baseDepth, AdaptiveDepth.compute(game, cfg, recognizer));
    }

    @Test
    public void forcingPositionGetsTheBonus() {
        SearchConfig cfg = SearchConfig.defaults();
        Game game = FENUtils.getBoardFrom("4k3/8/8/nnnnnnnn/PPPPPPPP/8/8/4K3 w - - 0 30");
        assertEquals(cfg.baseDepth + 1, AdaptiveDepth.compute(game, cfg, recognizer));
    }

    @Test
    public void bonusNeverExceedsItsCap() {
        // Fourteen captures, each one a motif as well
        Game game = FENUtils.getBoardFrom("4k3/8/8/nnnnnnnn/PPPPPPPP/8/8/4K3 w - - 0 30");
        SearchConfig noBonus = new SearchConfig.Builder().maxDepthBonus(0).build();
        assertEquals(noBonus.baseDepth, AdaptiveDepth.compute(game, noBonus, recognizer));

        SearchConfig off = new SearchConfig.Builder().adaptiveDepth(false).build();
        assertEquals(off.baseDepth, AdaptiveDepth.compute(game, off, recognizer));
    }
}
