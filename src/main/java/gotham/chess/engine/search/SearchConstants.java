package gotham.chess.engine.search;

import gotham.chess.engine.movegen.MoveGenerator;

public class SearchConstants {
    public static final int INF     =  30000;

    // Nominal ply bound for principal variation & per-ply buffers
    public static final int MAX_PLY = 64;

    public static final int MAX_MOVES = MoveGenerator.MAX_MOVES;
}
