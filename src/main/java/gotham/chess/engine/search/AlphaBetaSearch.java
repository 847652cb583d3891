package gotham.chess.engine.search;

import gotham.chess.engine.game.Game;
import gotham.chess.engine.movegen.Move;
import gotham.chess.engine.search.evaluator.GameValues;
import gotham.chess.engine.utils.ColorUtils;

import static gotham.chess.engine.search.SearchConstants.INF;

/**
 * Depth-limited minimax with alpha-beta pruning over White-positive scores: White nodes maximise, Black nodes
 * minimise. Every frame undoes what it played before returning, time-outs included.
 */
final class AlphaBetaSearch {

    record RootResult(int move, int score, boolean complete) {}

    /**
     * Searches every root move to {@code depth}. When time runs out the result only accounts for the root moves whose
     * subtree was fully searched and is flagged incomplete.
     */
    static RootResult searchRoot(Game g, SearchContext ctx, int depth, int previousBest) {
        ctx.nodes++;
        ctx.clearPv(0);
        final int[] moves = ctx.moveBuf[0];
        final int n = g.getLegalMoves(moves);
        ctx.orderer.order(g, moves, n);
        MoveOrderer.moveToFront(previousBest, moves, n);

        final boolean maximizing = ColorUtils.isWhite(g.currentPlayer);
        final boolean pruning = ctx.cfg.alphaBetaPruning;
        int alpha = -INF, beta = INF;
        int best = maximizing ? -INF : INF;
        int bestMove = Move.NONE;

        for (int i = 0; i < n; i++) {
            if (ctx.checkTime()) break;
            final int move = moves[i];
            final long changes = g.playMove(move);
            final int score = search(g, ctx, depth - 1, pruning ? alpha : -INF, pruning ? beta : INF, 1);
            g.undoMove(changes);
            if (ctx.timedOut) break;

            if (maximizing ? score > best : score < best) {
                best = score;
                bestMove = move;
                ctx.updatePv(0, move);
            }
            if (maximizing) { if (score > alpha) alpha = score; }
            else            { if (score < beta) beta = score; }
        }
        return new RootResult(bestMove, best, !ctx.timedOut);
    }

    static int search(Game g, SearchContext ctx, int depth, int alpha, int beta, int ply) {
        ctx.nodes++;
        ctx.clearPv(ply);
        if (ctx.checkTime()) return ctx.evaluator.evaluate(g);

        final int[] moves = ctx.moveBuf[ply];
        final int n = g.getLegalMoves(moves);
        if (n == 0) {
            return g.inCheck() ? matedScore(g, ply) : GameValues.PAT_VALUE;
        }
        if (g.isADraw()) return GameValues.DRAW_VALUE;

        if (depth <= 0 || ply >= SearchConstants.MAX_PLY - 1) {
            return ctx.cfg.useQuiescence
                    ? QuiescenceSearch.search(g, ctx, alpha, beta, ply, 0)
                    : ctx.evaluator.evaluate(g);
        }

        ctx.orderer.order(g, moves, n);
        final boolean maximizing = ColorUtils.isWhite(g.currentPlayer);
        final boolean pruning = ctx.cfg.alphaBetaPruning;
        int best = maximizing ? -INF : INF;
        boolean searched = false;

        for (int i = 0; i < n; i++) {
            if (ctx.checkTime()) break;
            final int move = moves[i];
            final long changes = g.playMove(move);
            final int score = search(g, ctx, depth - 1, pruning ? alpha : -INF, pruning ? beta : INF, ply + 1);
            g.undoMove(changes);
            searched = true;

            if (maximizing ? score > best : score < best) {
                best = score;
                ctx.updatePv(ply, move);
            }
            if (!pruning) continue;
            if (maximizing) { if (score > alpha) alpha = score; }
            else            { if (score < beta) beta = score; }
            if (alpha >= beta) break;
        }
        // Out of time before any child: fall back on the static view of this node
        return searched ? best : ctx.evaluator.evaluate(g);
    }

    /** Score of the side to move being checkmated; nearer mates weigh more. */
    static int matedScore(Game g, int ply) {
        int mate = GameValues.CHECKMATE_VALUE - ply;
        return ColorUtils.isWhite(g.currentPlayer) ? -mate : mate;
    }

    private AlphaBetaSearch() {}
}
