package gotham.chess.engine.search;

import gotham.chess.engine.book.BookPolicy;
import gotham.chess.engine.search.evaluator.EvaluationConfig;

public final class SearchConfig {

    public final boolean debug;

    // Depth
    public final int baseDepth;
    public final boolean adaptiveDepth;
    public final int maxDepthBonus;

    // Tactical density (adaptive depth)
    public final int tacticalScanMoves;      // first legal moves inspected for motifs
    public final int motifMovesThreshold;    // moves carrying a motif
    public final int highValueMotif;         // motif total counted as high value
    public final int highValueMovesThreshold;
    public final int forcingMovesThreshold;  // captures + checks over all legal moves

    // Quiescence
    public final boolean useQuiescence;
    public final int quiescenceDepth;        // levels 0..quiescenceDepth expand moves
    public final int noisyCap;
    public final int captureThreshold;       // captures of at least this value are never losing enough to skip
    public final int motifThreshold;

    // Main search
    public final boolean alphaBetaPruning;
    public final boolean iterativeDeepening;
    public final boolean stopOnMate;

    // Opening book
    public final boolean useBook;
    public final BookPolicy bookPolicy;
    public final long bookSeed;

    // Move ordering
    public final int captureMultiplier;
    public final int checkBonus;
    public final int promotionBonus;
    public final int castleBonus;

    // Safety nets
    public final long defaultTimeNs;
    public final long maxHardCapNs;

    public final EvaluationConfig evaluation;

    private SearchConfig(Builder b) {
        debug = b.debug;

        baseDepth = b.baseDepth;
        adaptiveDepth = b.adaptiveDepth;
        maxDepthBonus = b.maxDepthBonus;

        tacticalScanMoves = b.tacticalScanMoves;
        motifMovesThreshold = b.motifMovesThreshold;
        highValueMotif = b.highValueMotif;
        highValueMovesThreshold = b.highValueMovesThreshold;
        forcingMovesThreshold = b.forcingMovesThreshold;

        useQuiescence = b.useQuiescence;
        quiescenceDepth = b.quiescenceDepth;
        noisyCap = b.noisyCap;
        captureThreshold = b.captureThreshold;
        motifThreshold = b.motifThreshold;

        alphaBetaPruning = b.alphaBetaPruning;
        iterativeDeepening = b.iterativeDeepening;
        stopOnMate = b.stopOnMate;

        useBook = b.useBook;
        bookPolicy = b.bookPolicy;
        bookSeed = b.bookSeed;

        captureMultiplier = b.captureMultiplier;
        checkBonus = b.checkBonus;
        promotionBonus = b.promotionBonus;
        castleBonus = b.castleBonus;

        defaultTimeNs = b.defaultTimeNs;
        maxHardCapNs = b.maxHardCapNs;

        evaluation = b.evaluation;
    }

    /** Deepest main-search depth this configuration can reach. */
    public int maxDepth() {
        return baseDepth + (adaptiveDepth ? maxDepthBonus : 0);
    }

    public static SearchConfig defaults() {
        return new Builder().build();
    }

    public static class Builder {
        private boolean debug = false;

        private int baseDepth = 4;
        private boolean adaptiveDepth = true;
        private int maxDepthBonus = 1;

        private int tacticalScanMoves = 15;
        private int motifMovesThreshold = 4;
        private int highValueMotif = 500;
        private int highValueMovesThreshold = 2;
        private int forcingMovesThreshold = 12;

        private boolean useQuiescence = true;
        private int quiescenceDepth = 3;
        private int noisyCap = 8;
        private int captureThreshold = 300;
        private int motifThreshold = 200;

        private boolean alphaBetaPruning = true;
        private boolean iterativeDeepening = true;
        private boolean stopOnMate = true;

        private boolean useBook = true;
        private BookPolicy bookPolicy = BookPolicy.defaults();
        private long bookSeed = 0L;

        private int captureMultiplier = 10;
        private int checkBonus = 50;
        private int promotionBonus = 100;
        private int castleBonus = 30;

        private long defaultTimeNs = java.time.Duration.ofSeconds(1).toNanos();
        private long maxHardCapNs = java.time.Duration.ofSeconds(120).toNanos();

        private EvaluationConfig evaluation = EvaluationConfig.defaults();

        public Builder debug(boolean v){debug=v;return this;}

        public Builder baseDepth(int v){baseDepth=v;return this;}
        public Builder adaptiveDepth(boolean v){adaptiveDepth=v;return this;}
        public Builder maxDepthBonus(int v){maxDepthBonus=v;return this;}

        public Builder tacticalScanMoves(int v){tacticalScanMoves=v;return this;}
        public Builder motifMovesThreshold(int v){motifMovesThreshold=v;return this;}
        public Builder highValueMotif(int v){highValueMotif=v;return this;}
        public Builder highValueMovesThreshold(int v){highValueMovesThreshold=v;return this;}
        public Builder forcingMovesThreshold(int v){forcingMovesThreshold=v;return this;}

        public Builder useQuiescence(boolean v){useQuiescence=v;return this;}
        public Builder quiescenceDepth(int v){quiescenceDepth=v;return this;}
        public Builder noisyCap(int v){noisyCap=v;return this;}
        public Builder captureThreshold(int v){captureThreshold=v;return this;}
        public Builder motifThreshold(int v){motifThreshold=v;return this;}

        public Builder alphaBetaPruning(boolean v){alphaBetaPruning=v;return this;}
        public Builder iterativeDeepening(boolean v){iterativeDeepening=v;return this;}
        public Builder stopOnMate(boolean v){stopOnMate=v;return this;}

        public Builder useBook(boolean v){useBook=v;return this;}
        public Builder bookPolicy(BookPolicy v){bookPolicy=v;return this;}
        public Builder bookSeed(long v){bookSeed=v;return this;}

        public Builder captureMultiplier(int v){captureMultiplier=v;return this;}
        public Builder checkBonus(int v){checkBonus=v;return this;}
        public Builder promotionBonus(int v){promotionBonus=v;return this;}
        public Builder castleBonus(int v){castleBonus=v;return this;}

        public Builder defaultTimeNs(long v){defaultTimeNs=v;return this;}
        public Builder maxHardCapNs(long v){maxHardCapNs=v;return this;}

        public Builder evaluation(EvaluationConfig v){evaluation=v;return this;}

        public SearchConfig build(){
            requireNonNegative("baseDepth", baseDepth);
            requireNonNegative("maxDepthBonus", maxDepthBonus);
            requireNonNegative("tacticalScanMoves", tacticalScanMoves);
            requireNonNegative("quiescenceDepth", quiescenceDepth);
            requireNonNegative("noisyCap", noisyCap);
            if (defaultTimeNs <= 0) throw new IllegalArgumentException("defaultTimeNs must be > 0: " + defaultTimeNs);
            if (maxHardCapNs <= 0) throw new IllegalArgumentException("maxHardCapNs must be > 0: " + maxHardCapNs);
            if (bookPolicy == null) throw new IllegalArgumentException("bookPolicy is required");
            if (evaluation == null) throw new IllegalArgumentException("evaluation is required");
            // Main plies + quiescence plies + the root must fit the per-ply buffers
            int plies = baseDepth + maxDepthBonus + quiescenceDepth + 2;
            if (plies >= SearchConstants.MAX_PLY) {
                throw new IllegalArgumentException("Search too deep for " + SearchConstants.MAX_PLY + " plies: " + plies);
            }
            return new SearchConfig(this);
        }

        private static void requireNonNegative(String name, int value) {
            if (value < 0) throw new IllegalArgumentException(name + " must be >= 0: " + value);
        }
    }
}
