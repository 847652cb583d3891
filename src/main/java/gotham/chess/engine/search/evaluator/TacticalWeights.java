package gotham.chess.engine.search.evaluator;

import gotham.chess.engine.search.tactics.MotifKind;
import gotham.chess.engine.search.tactics.MotifSignals;

/**
 * Turns recognizer magnitudes into evaluation points. Mates are flat bonuses, the other motifs are scaled and
 * capped so that no single motif outweighs a piece.
 */
public final class TacticalWeights {
    public static final int MATE_IN_ONE = 5000;
    public static final int MATE_IN_TWO = 2500;
    public static final int BACK_RANK = 800;
    public static final int EN_PASSANT = 120;

    public static int weigh(MotifKind kind, int magnitude) {
        if(magnitude <= 0) {
            return 0;
        }
        return switch (kind) {
            case MATE_IN_ONE -> MATE_IN_ONE;
            case MATE_IN_TWO -> MATE_IN_TWO;
            case BACK_RANK -> BACK_RANK;
            case FORK -> scaled(magnitude, 0.8, 600);
            case SKEWER -> scaled(magnitude, 0.9, 500);
            case PIN -> scaled(magnitude, 0.7, 400);
            case DISCOVERED_ATTACK -> scaled(magnitude, 0.6, 350);
            case DEFLECTION -> scaled(magnitude, 0.5, 300);
            case SACRIFICE -> scaled(magnitude, 0.4, 250);
            case EN_PASSANT -> EN_PASSANT;
        };
    }

    public static int weigh(MotifSignals signals) {
        int total = 0;
        for(MotifKind kind : MotifKind.values()) {
            total += weigh(kind, signals.get(kind));
        }
        return total;
    }

    private static int scaled(int magnitude, double factor, int cap) {
        return (int) Math.min(magnitude * factor, cap);
    }

    private TacticalWeights() {}
}
