package gotham.chess.engine.search.evaluator;

import gotham.chess.engine.search.tactics.MateType;
import gotham.chess.engine.utils.notations.MoveIOUtils;

/**
 * Breakdown of a static evaluation, White-positive like the evaluation itself. Per-side values are raw
 * (unweighted) scores of that side.
 */
public record PositionAnalysis(GamePhase phase,
                               int materialBalance,
                               int whiteKingSafety, int blackKingSafety,
                               int whiteDevelopment, int blackDevelopment,
                               int whiteCenterControl, int blackCenterControl,
                               int whiteTactics, int blackTactics,
                               int evaluation,
                               int[] matingMoves,
                               MateType bestMateType) {

    public boolean hasMateInOne() {
        return matingMoves.length > 0;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("PositionAnalysis\n")
            .append("phase: ").append(phase).append("\n")
            .append("material (pawns): ").append(materialBalance).append("\n")
            .append("king safety: ").append(whiteKingSafety).append(" / ").append(blackKingSafety).append("\n")
            .append("development: ").append(whiteDevelopment).append(" / ").append(blackDevelopment).append("\n")
            .append("center: ").append(whiteCenterControl).append(" / ").append(blackCenterControl).append("\n")
            .append("tactics: ").append(whiteTactics).append(" / ").append(blackTactics).append("\n")
            .append("evaluation: ").append(evaluation).append("\n")
            .append("mates: ");
        for(int move : matingMoves) {
            sb.append(MoveIOUtils.writeAlgebraicNotation(move)).append(" ");
        }
        sb.append("(").append(bestMateType).append(")");
        return sb.toString();
    }
}
