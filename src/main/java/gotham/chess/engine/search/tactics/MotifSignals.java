package gotham.chess.engine.search.tactics;

import java.util.EnumMap;
import java.util.Map;

/**
 * Motif magnitudes found for one move. Produced by {@link MotifRecognizer} and consumed right away by
 * ordering, evaluation or quiescence filtering.
 */
public final class MotifSignals {
    private static final MotifKind[] KINDS = MotifKind.values();

    private final int[] magnitudes = new int[KINDS.length];
    private int total;
    private int count;

    MotifSignals() {}

    static MotifSignals of(MotifKind kind, int magnitude) {
        MotifSignals signals = new MotifSignals();
        signals.put(kind, magnitude);
        return signals;
    }

    // Zero or negative magnitudes mean "not found"
    void put(MotifKind kind, int magnitude) {
        if (magnitude <= 0) {
            return;
        }
        int previous = magnitudes[kind.ordinal()];
        if (previous == 0) {
            count++;
        }
        magnitudes[kind.ordinal()] = magnitude;
        total += magnitude - previous;
    }

    public int get(MotifKind kind) {
        return magnitudes[kind.ordinal()];
    }

    public boolean has(MotifKind kind) {
        return magnitudes[kind.ordinal()] > 0;
    }

    /** Sum of all magnitudes. */
    public int total() {
        return total;
    }

    public int count() {
        return count;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    public Map<MotifKind, Integer> asMap() {
        Map<MotifKind, Integer> map = new EnumMap<>(MotifKind.class);
        for (MotifKind kind : KINDS) {
            if (has(kind)) {
                map.put(kind, get(kind));
            }
        }
        return map;
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
