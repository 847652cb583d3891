package gotham.chess.engine.search;

import gotham.chess.engine.game.Game;
import gotham.chess.engine.search.tactics.MotifRecognizer;
import gotham.chess.engine.search.tactics.MotifSignals;

/**
 * Picks the main search depth: the base depth, plus a small bonus in tactically dense positions. The bonus never
 * exceeds {@link SearchConfig#maxDepthBonus}.
 */
final class AdaptiveDepth {

    static int compute(Game g, SearchConfig cfg, MotifRecognizer recognizer) {
        if (!cfg.adaptiveDepth) return cfg.baseDepth;

        final int[] moves = g.getLegalMoves();
        final int scanned = Math.min(moves.length, cfg.tacticalScanMoves);
        int motifMoves = 0;
        int highValueMoves = 0;
        for (int i = 0; i < scanned; i++) {
            MotifSignals signals = recognizer.analyze(g, moves[i]);
            if (!signals.isEmpty()) motifMoves++;
            if (signals.total() >= cfg.highValueMotif) highValueMoves++;
        }

        int forcing = 0;
        for (int move : moves) {
            if (g.isCapture(move) || g.givesCheck(move)) forcing++;
        }

        int bonus = 0;
        if (motifMoves >= cfg.motifMovesThreshold) bonus++;
        if (highValueMoves >= cfg.highValueMovesThreshold) bonus++;
        if (forcing >= cfg.forcingMovesThreshold) bonus++;
        return cfg.baseDepth + Math.min(bonus, cfg.maxDepthBonus);
    }

    private AdaptiveDepth() {}
}
