package gotham.chess.engine.search.tactics;

public enum MateType {
    NONE,
    BACK_RANK,
    SMOTHERED,
    ARABIAN,
    STANDARD
}
