package gotham.chess.engine.search;

import gotham.chess.engine.book.NoOpeningBook;
import gotham.chess.engine.book.OpeningBook;
import gotham.chess.engine.book.StaticOpeningBook;
import gotham.chess.engine.game.Game;
import gotham.chess.engine.search.evaluator.PositionAnalysis;
import gotham.chess.engine.search.evaluator.PositionEvaluator;
import gotham.chess.engine.utils.notations.FENUtils;
import gotham.chess.engine.utils.notations.MoveIOUtils;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Entry point of the engine: book lookup, adaptive depth and time-boxed iterative alpha-beta search.
 * <p>
 * The game passed in is used as the search's working position and is always handed back in the state it was
 * received. An engine instance holds no state between searches but is not meant for concurrent use.
 */
public final class SearchEngine {
    private static final Consumer<String> NO_OUTPUT = line -> {};

    private final SearchConfig cfg;
    private final PositionEvaluator evaluator;
    private final OpeningBook book;

    public SearchEngine() {
        this(SearchConfig.defaults());
    }

    public SearchEngine(SearchConfig cfg) {
        this(cfg, cfg.useBook ? StaticOpeningBook.fromClasspath() : NoOpeningBook.INSTANCE);
    }

    public SearchEngine(SearchConfig cfg, OpeningBook book) {
        this.cfg = cfg;
        this.evaluator = new PositionEvaluator(cfg.evaluation);
        this.book = book;
    }

    public SearchConfig config() {
        return cfg;
    }

    /** White-positive static evaluation. */
    public int evaluate(Game game) {
        return evaluator.evaluate(game);
    }

    public PositionAnalysis analyze(Game game) {
        return evaluator.analyze(game);
    }

    /** Search depth {@link #search} would use on this position. */
    public int adaptiveDepth(Game game) {
        return AdaptiveDepth.compute(game, cfg, evaluator.recognizer());
    }

    public SearchResult search(Game game, long budgetMs) {
        return search(game, budgetMs, new AtomicBoolean(false), NO_OUTPUT);
    }

    /**
     * @param budgetMs time budget, the configured default when {@code <= 0}
     * @param stop     cooperative stop flag, polled together with the clock
     * @param out      receives UCI-style {@code info} lines
     * @return the best move found, {@code Move.NONE} when there is no legal move or the position is invalid
     */
    public SearchResult search(Game game, long budgetMs, AtomicBoolean stop, Consumer<String> out) {
        final long startNs = System.nanoTime();
        final long budgetNs = TimeControl.computeBudgetNs(budgetMs, cfg);

        if (!game.hasBothKings()) {
            out.accept("info string invalid position: missing king");
            return SearchResult.noMove(0);
        }
        if (game.getLegalMovesCount() == 0) {
            return SearchResult.noMove(evaluator.evaluate(game));
        }

        if (cfg.useBook && book.isLoaded()) {
            Optional<Integer> bookMove = book.pickMove(game, cfg.bookPolicy, cfg.bookSeed);
            if (bookMove.isPresent()) {
                int move = bookMove.get();
                out.accept("info string book move " + MoveIOUtils.writeAlgebraicNotation(move));
                return SearchResult.book(move, evaluator.evaluate(game));
            }
        }

        SearchContext ctx = new SearchContext(cfg, evaluator, stop, startNs, budgetNs);
        int depth = AdaptiveDepth.compute(game, cfg, evaluator.recognizer());
        out.accept("info string adaptive depth " + depth);
        return run(game, ctx, depth, out);
    }

    /** Fixed-depth search: no book, no adaptive depth. */
    public SearchResult searchAtDepth(Game game, int depth, long budgetMs) {
        return searchAtDepth(game, depth, budgetMs, NO_OUTPUT);
    }

    public SearchResult searchAtDepth(Game game, int depth, long budgetMs, Consumer<String> out) {
        if (depth < 1) throw new IllegalArgumentException("depth must be >= 1: " + depth);
        final long startNs = System.nanoTime();
        if (!game.hasBothKings()) {
            out.accept("info string invalid position: missing king");
            return SearchResult.noMove(0);
        }
        if (game.getLegalMovesCount() == 0) {
            return SearchResult.noMove(evaluator.evaluate(game));
        }
        SearchContext ctx = new SearchContext(cfg, evaluator, new AtomicBoolean(false), startNs,
                TimeControl.computeBudgetNs(budgetMs, cfg));
        return run(game, ctx, depth, out);
    }

    private SearchResult run(Game game, SearchContext ctx, int depth, Consumer<String> out) {
        final String fenBefore = cfg.debug ? FENUtils.getFENFromBoard(game) : null;
        SearchResult sr = IterativeDeepening.run(game, ctx, depth, out);
        if (sr.timedOut()) {
            out.accept("info string search timed out at depth " + ctx.currentDepth);
        }
        if (cfg.debug) {
            out.accept(ctx.toUCIInfo(sr.depth()));
            verify(game, sr, fenBefore);
        }
        return sr;
    }

    private static void verify(Game game, SearchResult sr, String fenBefore) {
        String fenAfter = FENUtils.getFENFromBoard(game);
        if (!fenAfter.equals(fenBefore)) {
            throw new IllegalStateException("Position not restored after search: " + fenBefore + " vs " + fenAfter);
        }
        // Verify bestMove legality in the current position
        int mv = sr.move();
        if (mv != 0) {
            boolean legal = false;
            for (int m : game.getLegalMoves()) {
                if (m == mv) { legal = true; break; }
            }
            if (!legal) {
                throw new IllegalStateException("Illegal bestMove: " + MoveIOUtils.writeAlgebraicNotation(mv));
            }
            // PV head must match bestMove when present
            int[] pv = sr.principalVariation();
            if (pv != null && pv.length > 0 && pv[0] != mv) {
                throw new IllegalStateException("BestMove/PV mismatch: " + mv + " vs " + pv[0]);
            }
        }
    }
}
