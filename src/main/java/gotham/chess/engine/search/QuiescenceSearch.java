package gotham.chess.engine.search;

import gotham.chess.engine.game.Game;
import gotham.chess.engine.movegen.Move;
import gotham.chess.engine.search.evaluator.GameValues;
import gotham.chess.engine.search.evaluator.PieceValues;
import gotham.chess.engine.utils.ColorUtils;
import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Horizon extension that only plays noisy moves. Scores are White-positive: White maximises, Black minimises.
 * The static evaluation is a floor for White and a ceiling for Black, so the result is never worse for the side
 * to move than standing pat.
 */
final class QuiescenceSearch {

    static int search(Game g, SearchContext ctx, int alpha, int beta, int ply, int qDepth) {
        ctx.nodes++; ctx.qNodes++;
        if (ctx.checkTime() || qDepth > ctx.cfg.quiescenceDepth || ply >= SearchConstants.MAX_PLY - 1) {
            return ctx.evaluator.evaluate(g);
        }

        final int[] moves = ctx.moveBuf[ply];
        final int n = g.getLegalMoves(moves);
        if (n == 0) {
            return g.inCheck() ? AlphaBetaSearch.matedScore(g, ply) : GameValues.PAT_VALUE;
        }

        final boolean maximizing = ColorUtils.isWhite(g.currentPlayer);
        final int standPat = ctx.evaluator.evaluate(g);
        if (maximizing) {
            if (standPat >= beta) return standPat;
            if (standPat > alpha) alpha = standPat;
        } else {
            if (standPat <= alpha) return standPat;
            if (standPat < beta) beta = standPat;
        }

        final IntArrayList noisy = noisyMoves(g, ctx, moves, n);
        int best = standPat;
        for (int i = 0; i < noisy.size(); i++) {
            if (ctx.checkTime()) break;
            final int move = noisy.getInt(i);
            final long changes = g.playMove(move);
            final int score = search(g, ctx, alpha, beta, ply + 1, qDepth + 1);
            g.undoMove(changes);

            if (maximizing) {
                if (score > best) best = score;
                if (score > alpha) alpha = score;
            } else {
                if (score < best) best = score;
                if (score < beta) beta = score;
            }
            if (ctx.cfg.alphaBetaPruning && alpha >= beta) break;
        }
        return best;
    }

    /**
     * Non-losing captures, safe checks, promotions and strong motifs, at most {@code noisyCap} of them, in
     * {@link MoveOrderer} order. A capture is only kept when it wins at least as much as the capturing piece is
     * worth or takes a piece worth {@code captureThreshold} or more.
     */
    static IntArrayList noisyMoves(Game g, SearchContext ctx, int[] moves, int n) {
        final SearchConfig cfg = ctx.cfg;
        final IntArrayList noisy = new IntArrayList();
        final IntArrayList values = new IntArrayList();
        final IntArrayList motifTotals = new IntArrayList();
        for (int i = 0; i < n; i++) {
            final int move = moves[i];
            if (MoveOrderer.isCapture(g, move)) {
                final int captured = PieceValues.pieceTypeToValue(g.pieceAt(Move.getEndPosition(move)));
                final int moving = PieceValues.pieceTypeToValue(Move.getPieceType(move));
                if (captured >= moving || captured >= cfg.captureThreshold) {
                    noisy.add(move);
                    values.add(captured);
                    motifTotals.add(ctx.evaluator.recognizer().analyze(g, move).total());
                }
                continue;
            }
            final int motifs = ctx.evaluator.recognizer().analyze(g, move).total();
            if (isSafeCheck(g, move) || Move.isPromotion(move) || motifs >= cfg.motifThreshold) {
                noisy.add(move);
                values.add(motifs);
                motifTotals.add(motifs);
            }
        }

        int size = noisy.size();
        final int[] index = new int[size];
        for (int i = 0; i < size; i++) index[i] = i;
        if (size > cfg.noisyCap) {
            MoveOrderer.sortDescending(index, values.toIntArray(), size);
            size = cfg.noisyCap;
        }
        // Motif totals computed above are reused for ordering
        final int[] ordered = new int[size];
        final int[] scores = new int[size];
        for (int i = 0; i < size; i++) {
            ordered[i] = noisy.getInt(index[i]);
            scores[i] = ctx.orderer.score(g, ordered[i], motifTotals.getInt(index[i]));
        }
        MoveOrderer.sortDescending(ordered, scores, size);
        return IntArrayList.wrap(ordered);
    }

    // The checking piece cannot be taken right away
    static boolean isSafeCheck(Game g, int move) {
        final int mover = g.currentPlayer;
        final long changes = g.playMove(move);
        final boolean safe = g.inCheck() && !g.isSquareAttacked(Move.getEndPosition(move), ColorUtils.switchColor(mover));
        g.undoMove(changes);
        return safe;
    }

    private QuiescenceSearch() {}
}
