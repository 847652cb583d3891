package gotham.chess.engine.search.evaluator;

public final class EvaluationConfig {

    // Tactical term on/off, the only difference between the "basic" and the "tactical" engine
    public final boolean tacticalWeighting;
    public final int tacticalPrefix;        // legal moves inspected per side
    public final int tacticalTopK;          // best moves kept per side
    public final boolean nullMoveThreats;   // estimate the threats of the side not to move by passing
    public final boolean detectMateInTwo;   // expensive, checking moves only

    private EvaluationConfig(Builder b) {
        tacticalWeighting = b.tacticalWeighting;
        tacticalPrefix = b.tacticalPrefix;
        tacticalTopK = b.tacticalTopK;
        nullMoveThreats = b.nullMoveThreats;
        detectMateInTwo = b.detectMateInTwo;
    }

    public static EvaluationConfig defaults() {
        return new Builder().build();
    }

    public static class Builder {
        private boolean tacticalWeighting = true;
        private int tacticalPrefix = 15;
        private int tacticalTopK = 3;
        private boolean nullMoveThreats = true;
        private boolean detectMateInTwo = false;

        public Builder tacticalWeighting(boolean v){tacticalWeighting=v;return this;}
        public Builder tacticalPrefix(int v){tacticalPrefix=v;return this;}
        public Builder tacticalTopK(int v){tacticalTopK=v;return this;}
        public Builder nullMoveThreats(boolean v){nullMoveThreats=v;return this;}
        public Builder detectMateInTwo(boolean v){detectMateInTwo=v;return this;}

        public EvaluationConfig build(){
            if (tacticalPrefix < 0) throw new IllegalArgumentException("tacticalPrefix must be >= 0: " + tacticalPrefix);
            if (tacticalTopK < 0) throw new IllegalArgumentException("tacticalTopK must be >= 0: " + tacticalTopK);
            return new EvaluationConfig(this);
        }
    }
}
