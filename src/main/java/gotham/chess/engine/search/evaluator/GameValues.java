package gotham.chess.engine.search.evaluator;

public final class GameValues {
    public static final int CHECKMATE_VALUE = 29000;
    public static final int DRAW_VALUE = 0;
    public static final int PAT_VALUE = DRAW_VALUE;

    // Scores at or beyond this magnitude are mates
    public static final int MATE_SENTINEL = 9000;
    public static final int MAX_STATIC_SCORE = MATE_SENTINEL - 1;

    public static boolean isMateScore(int score) {
        return Math.abs(score) >= MATE_SENTINEL;
    }

    public static int clampStatic(int score) {
        return Math.max(-MAX_STATIC_SCORE, Math.min(MAX_STATIC_SCORE, score));
    }

    private GameValues() {}
}
