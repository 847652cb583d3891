package gotham.chess.engine.search;

import gotham.chess.engine.search.evaluator.PositionEvaluator;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-search scratch state: buffers, counters and the time box. One context per search, never shared between
 * threads.
 */
public final class SearchContext {
    // Buffers per ply (quiescence plies come after the main search plies)
    public final int[][] moveBuf = new int[SearchConstants.MAX_PLY][SearchConstants.MAX_MOVES];

    // Triangular principal variation
    public final int[][] pv = new int[SearchConstants.MAX_PLY][SearchConstants.MAX_PLY];
    public final int[] pvLen = new int[SearchConstants.MAX_PLY];

    // Counters
    public long nodes, qNodes;
    public int currentDepth;

    // Time box
    public final AtomicBoolean stop;
    public final long startNs;
    public final long budgetNs;
    public boolean timedOut;

    // Config
    public final SearchConfig cfg;
    public final PositionEvaluator evaluator;
    public final MoveOrderer orderer;

    public SearchContext(SearchConfig cfg, PositionEvaluator evaluator, AtomicBoolean stop, long startNs, long budgetNs) {
        this.cfg = cfg;
        this.evaluator = evaluator;
        this.orderer = new MoveOrderer(evaluator.recognizer(), cfg);
        this.stop = stop;
        this.startNs = startNs;
        this.budgetNs = budgetNs;
    }

    /** Polls the stop flag and the clock; once over budget the context stays timed out. */
    public boolean checkTime() {
        if (!timedOut && TimeControl.aborted(stop, startNs, budgetNs)) {
            timedOut = true;
        }
        return timedOut;
    }

    public long elapsedMs() {
        return (System.nanoTime() - startNs) / 1_000_000L;
    }

    void clearPv(int ply) {
        if (ply < SearchConstants.MAX_PLY) pvLen[ply] = 0;
    }

    void updatePv(int ply, int move) {
        if (ply >= SearchConstants.MAX_PLY) return;
        pv[ply][0] = move;
        int childLen = (ply + 1 < SearchConstants.MAX_PLY) ? pvLen[ply + 1] : 0;
        int len = Math.min(childLen, SearchConstants.MAX_PLY - 1);
        if (len > 0) System.arraycopy(pv[ply + 1], 0, pv[ply], 1, len);
        pvLen[ply] = len + 1;
    }

    int[] rootPv() {
        return java.util.Arrays.copyOf(pv[0], pvLen[0]);
    }

    public String toUCIInfo(int depth) {
        return String.format("info string diag depth %d nodes %d qnodes %d timedout %b",
                depth, nodes, qNodes, timedOut);
    }
}
