package gotham.chess.engine.search;

import gotham.chess.engine.game.Game;
import gotham.chess.engine.movegen.Move;
import gotham.chess.engine.search.evaluator.GameValues;

import java.util.function.Consumer;

final class IterativeDeepening {

    /**
     * Deepens from 1 to {@code maxDepth} (or searches {@code maxDepth} directly when deepening is off) and returns
     * the last completed iteration.
     */
    static SearchResult run(Game game, SearchContext ctx, int maxDepth, Consumer<String> out) {
        final int firstDepth = ctx.cfg.iterativeDeepening ? 1 : maxDepth;

        SearchResult last = null;
        AlphaBetaSearch.RootResult partial = null;
        int bestMove = Move.NONE;

        for (ctx.currentDepth = firstDepth; ctx.currentDepth <= maxDepth; ctx.currentDepth++) {
            if (ctx.checkTime()) break;

            AlphaBetaSearch.RootResult r = AlphaBetaSearch.searchRoot(game, ctx, ctx.currentDepth, bestMove);
            if (!r.complete()) {
                if (r.move() != Move.NONE) partial = r;
                break;
            }
            bestMove = r.move();
            last = result(ctx, r, ctx.currentDepth, ctx.rootPv(), false);
            out.accept(last.toUCIInfo());
            if (ctx.cfg.stopOnMate && GameValues.isMateScore(r.score())) break;
        }

        if (last != null) {
            return ctx.timedOut ? withTimedOut(last) : last;
        }
        out.accept("info string time out before the first iteration completed");
        if (partial != null) {
            return result(ctx, partial, ctx.currentDepth, new int[] { partial.move() }, true);
        }
        // Fallback: first legal move
        int[] buf = ctx.moveBuf[0];
        int n = game.getLegalMoves(buf);
        int mv = (n > 0) ? buf[0] : Move.NONE;
        return new SearchResult(mv, ctx.evaluator.evaluate(game), 0, ctx.nodes, ctx.qNodes, ctx.elapsedMs(), 0,
                mv == Move.NONE ? new int[0] : new int[] { mv }, true, false);
    }

    private static SearchResult result(SearchContext ctx, AlphaBetaSearch.RootResult r, int depth, int[] pv, boolean timedOut) {
        long timeMs = ctx.elapsedMs();
        long nps = timeMs > 0 ? ctx.nodes * 1000L / timeMs : ctx.nodes;
        return new SearchResult(r.move(), r.score(), depth, ctx.nodes, ctx.qNodes, timeMs, nps, pv, timedOut, false);
    }

    private static SearchResult withTimedOut(SearchResult r) {
        return new SearchResult(r.move(), r.score(), r.depth(), r.nodes(), r.qNodes(), r.timeMs(), r.nps(),
                r.principalVariation(), true, false);
    }

    private IterativeDeepening() {}
}
