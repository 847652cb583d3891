package gotham.chess.engine.search;

import gotham.chess.engine.game.Game;
import gotham.chess.engine.movegen.Move;
import gotham.chess.engine.search.evaluator.PieceValues;
import gotham.chess.engine.search.tactics.MotifRecognizer;
import gotham.chess.engine.utils.PieceUtils;

/**
 * Ranks moves so that alpha-beta sees the most promising ones first. A move's priority is its motif total, plus
 * ten times the pawn value of the piece on its destination square, plus fixed check, promotion and castle bonuses.
 * <p>
 * Sorting is stable: equal priorities keep the generator's order.
 */
public final class MoveOrderer {
    private final MotifRecognizer recognizer;
    private final SearchConfig cfg;

    public MoveOrderer(MotifRecognizer recognizer, SearchConfig cfg) {
        this.recognizer = recognizer;
        this.cfg = cfg;
    }

    public int score(Game game, int move) {
        return score(game, move, recognizer.analyze(game, move).total());
    }

    /** Same as {@link #score(Game, int)} for a move whose motif total is already known. */
    int score(Game game, int move, int motifTotal) {
        int score = motifTotal;
        if (!Move.isCastle(move)) {
            byte captured = game.pieceAt(Move.getEndPosition(move));
            score += cfg.captureMultiplier * PieceValues.pieceTypeToUnits(captured);
        }
        if (game.givesCheck(move)) score += cfg.checkBonus;
        if (Move.isPromotion(move)) score += cfg.promotionBonus;
        if (Move.isCastle(move)) score += cfg.castleBonus;
        return score;
    }

    /** Sorts the first {@code n} moves in place, best first. */
    public void order(Game game, int[] moves, int n) {
        if (n <= 1) return;
        int[] scores = new int[n];
        for (int i = 0; i < n; i++) scores[i] = score(game, moves[i]);
        sortDescending(moves, scores, n);
    }

    /** Sorted copy of {@code moves}, best first. */
    public int[] order(Game game, int[] moves) {
        int[] sorted = moves.clone();
        order(game, sorted, sorted.length);
        return sorted;
    }

    // insertion sort by score desc, stable
    static void sortDescending(int[] moves, int[] scores, int n) {
        for (int i = 1; i < n; i++) {
            int m = moves[i], s = scores[i], j = i - 1;
            while (j >= 0 && scores[j] < s) {
                moves[j + 1] = moves[j];
                scores[j + 1] = scores[j];
                j--;
            }
            moves[j + 1] = m;
            scores[j + 1] = s;
        }
    }

    /** Moves {@code move} to index 0 keeping the relative order of the others; no-op when absent. */
    static void moveToFront(int move, int[] moves, int n) {
        if (move == Move.NONE) return;
        for (int i = 0; i < n; i++) {
            if (moves[i] == move) {
                System.arraycopy(moves, 0, moves, 1, i);
                moves[0] = move;
                return;
            }
        }
    }

    static boolean isCapture(Game game, int move) {
        return !Move.isCastle(move) && game.pieceAt(Move.getEndPosition(move)) != PieceUtils.NONE;
    }
}
