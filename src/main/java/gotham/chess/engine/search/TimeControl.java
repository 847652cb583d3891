package gotham.chess.engine.search;

import java.util.concurrent.atomic.AtomicBoolean;

final class TimeControl {
    /** Budget in nanoseconds: the default when none is given, never above the hard cap. */
    static long computeBudgetNs(long budgetMs, SearchConfig cfg) {
        if (budgetMs <= 0) return Math.min(cfg.defaultTimeNs, cfg.maxHardCapNs);
        // Clamp in milliseconds first: "infinite" budgets must not overflow
        return Math.min(budgetMs, cfg.maxHardCapNs / 1_000_000L) * 1_000_000L;
    }

    static boolean aborted(AtomicBoolean stop, long startNs, long budgetNs) {
        return stop.get() || System.nanoTime() - startNs >= budgetNs;
    }

    private TimeControl() {}
}
