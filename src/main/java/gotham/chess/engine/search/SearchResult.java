package gotham.chess.engine.search;

import gotham.chess.engine.movegen.Move;
import gotham.chess.engine.utils.notations.MoveIOUtils;

/**
 * Outcome of a search. {@code move} is {@link Move#NONE} when there is nothing to play; {@code score} is
 * White-positive.
 */
public record SearchResult(int move, int score, int depth, long nodes, long qNodes, long timeMs, long nps,
                           int[] principalVariation, boolean timedOut, boolean fromBook) {

    static SearchResult noMove(int score) {
        return new SearchResult(Move.NONE, score, 0, 0, 0, 0, 0, new int[0], false, false);
    }

    static SearchResult book(int move, int score) {
        return new SearchResult(move, score, 0, 0, 0, 0, 0, new int[] { move }, false, true);
    }

    public boolean hasMove() {
        return move != Move.NONE;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("SearchResult\n")
            .append("best move: ").append(MoveIOUtils.writeAlgebraicNotation(move)).append("\n")
            .append("score: ").append(score).append("\n")
            .append("depth: ").append(depth).append(fromBook ? " (book)" : "").append(timedOut ? " (timed out)" : "").append("\n")
            .append("search time (ms): ").append(timeMs).append("\n")
            .append("nodes/sec: ").append(nps).append("\n")
            .append("PV: ");
        for(int move :  principalVariation) {
            sb.append(MoveIOUtils.writeAlgebraicNotation(move)).append(" ");
        }
        return sb.toString();
    }

    public String toUCIInfo() {
        StringBuilder sb = new StringBuilder("info")
            .append(" depth ").append(depth)
                .append(" time ").append(timeMs)
                .append(" score cp ").append(score)
                .append(" nps ").append(nps)
                .append(" nodes ").append(nodes)
                .append(" pv ");

        for(int move :  principalVariation) {
            sb.append(MoveIOUtils.writeAlgebraicNotation(move)).append(" ");
        }

        return sb.toString();
    }
}
