package gotham.chess.engine.search.tactics;

/**
 * Tactical patterns the recognizer reports, declared from the most to the least decisive.
 */
public enum MotifKind {
    MATE_IN_ONE,
    MATE_IN_TWO,
    BACK_RANK,
    FORK,
    SKEWER,
    PIN,
    DISCOVERED_ATTACK,
    DEFLECTION,
    SACRIFICE,
    EN_PASSANT
}
