package gotham.chess.engine.search.evaluator;

import gotham.chess.engine.utils.PieceUtils;

/**
 * Piece values and piece-square tables.
 * <p>
 * Tables are indexed by square from White's point of view, index 0 being a1 and index 63 h8.
 * Black pieces read them through {@link #mirrorV(int)}.
 */
public final class PieceValues {
    // Mobility weights (per reachable square)
    static final class Mobility {
        static final int PAWN = 5;
        static final int KNIGHT = 4;
        static final int BISHOP = 3;
        static final int ROOK = 3;
        static final int QUEEN = 2;
        static final int KING = 0;
        static final int CENTER_BONUS = 5;
        static final int EXTENDED_CENTER_BONUS = 2;

        private Mobility() {}
    }

    public static final int ROOK_VALUE = 500;
    public static final int BISHOP_VALUE = 330;
    public static final int KNIGHT_VALUE = 320;
    public static final int KING_VALUE = 0;
    public static final int PAWN_VALUE = 100;
    public static final int QUEEN_VALUE = 900;

    // Ranks pieces for "which one is worth more" questions, the king above everything
    private static final int ROYAL_RANK = 100_000;

    // Centipawn values (cheap access)
    public static final int[] VAL = {
            0,
            PieceValues.PAWN_VALUE,
            PieceValues.KNIGHT_VALUE,
            PieceValues.BISHOP_VALUE,
            PieceValues.ROOK_VALUE,
            PieceValues.QUEEN_VALUE,
            PieceValues.KING_VALUE
    };

    // Material in pawn units
    public static final int[] UNITS = {0, 1, 3, 3, 5, 9, 0};

    static final int[] PAWN_TABLE = {
            0,  0,  0,  0,  0,  0,  0,  0,
            5, 10, 10,-20,-20, 10, 10,  5,
            5, -5,-10,  0,  0,-10, -5,  5,
            0,  0,  0, 20, 20,  0,  0,  0,
            5,  5, 10, 25, 25, 10,  5,  5,
            10, 10, 20, 30, 30, 20, 10, 10,
            50, 50, 50, 50, 50, 50, 50, 50,
            0,  0,  0,  0,  0,  0,  0,  0
    };

    static final int[] KNIGHT_TABLE = {
            -50,-40,-30,-30,-30,-30,-40,-50,
            -40,-20,  0,  5,  5,  0,-20,-40,
            -30,  5, 10, 15, 15, 10,  5,-30,
            -30,  0, 15, 20, 20, 15,  0,-30,
            -30,  5, 15, 20, 20, 15,  5,-30,
            -30,  0, 10, 15, 15, 10,  0,-30,
            -40,-20,  0,  0,  0,  0,-20,-40,
            -50,-40,-30,-30,-30,-30,-40,-50
    };

    static final int[] BISHOP_TABLE = {
            -20,-10,-10,-10,-10,-10,-10,-20,
            -10,  5,  0,  0,  0,  0,  5,-10,
            -10, 10, 10, 10, 10, 10, 10,-10,
            -10,  0, 10, 10, 10, 10,  0,-10,
            -10,  5,  5, 10, 10,  5,  5,-10,
            -10,  0,  5, 10, 10,  5,  0,-10,
            -10,  0,  0,  0,  0,  0,  0,-10,
            -20,-10,-10,-10,-10,-10,-10,-20
    };

    static final int[] ROOK_TABLE = {
            0,  0,  0,  5,  5,  0,  0,  0,
            -5,  0,  0,  0,  0,  0,  0, -5,
            -5,  0,  0,  0,  0,  0,  0, -5,
            -5,  0,  0,  0,  0,  0,  0, -5,
            -5,  0,  0,  0,  0,  0,  0, -5,
            -5,  0,  0,  0,  0,  0,  0, -5,
            5, 10, 10, 10, 10, 10, 10,  5,
            0,  0,  0,  0,  0,  0,  0,  0
    };

    // Very mild central preference
    static final int[] QUEEN_TABLE = {
            -20,-10,-10, -5, -5,-10,-10,-20,
            -10,  0,  5,  0,  0,  0,  0,-10,
            -10,  5,  5,  5,  5,  5,  0,-10,
            0,  0,  5,  5,  5,  5,  0, -5,
            -5,  0,  5,  5,  5,  5,  0, -5,
            -10,  0,  5,  5,  5,  5,  0,-10,
            -10,  0,  0,  0,  0,  0,  0,-10,
            -20,-10,-10, -5, -5,-10,-10,-20
    };

    // Safer in the corner
    static final int[] KING_MIDDLE_GAME_TABLE = {
            20, 30, 10,  0,  0, 10, 30, 20,
            20, 20,  0,  0,  0,  0, 20, 20,
            -10,-20,-20,-20,-20,-20,-20,-10,
            -20,-30,-30,-40,-40,-30,-30,-20,
            -30,-40,-40,-50,-50,-40,-40,-30,
            -30,-40,-40,-50,-50,-40,-40,-30,
            -30,-40,-40,-50,-50,-40,-40,-30,
            -30,-40,-40,-50,-50,-40,-40,-30
    };

    // Centralization
    static final int[] KING_ENDGAME_TABLE = {
            -50,-30,-30,-30,-30,-30,-30,-50,
            -30,-30,  0,  0,  0,  0,-30,-30,
            -30,-10, 20, 30, 30, 20,-10,-30,
            -30,-10, 30, 40, 40, 30,-10,-30,
            -30,-10, 30, 40, 40, 30,-10,-30,
            -30,-10, 20, 30, 30, 20,-10,-30,
            -30,-20,-10,  0,  0,-10,-20,-30,
            -50,-40,-30,-20,-20,-30,-40,-50
    };

    public static int pieceTypeToValue(int pieceType) {
        return switch (pieceType) {
            case PieceUtils.PAWN -> PAWN_VALUE;
            case PieceUtils.BISHOP -> BISHOP_VALUE;
            case PieceUtils.ROOK -> ROOK_VALUE;
            case PieceUtils.QUEEN -> QUEEN_VALUE;
            case PieceUtils.KING -> KING_VALUE;
            case PieceUtils.KNIGHT -> KNIGHT_VALUE;
            default -> 0;
        };
    }

    public static int pieceTypeToUnits(int pieceType) {
        return pieceType >= 0 && pieceType < UNITS.length ? UNITS[pieceType] : 0;
    }

    /** Same as the centipawn value except that the king outranks every other piece. */
    public static int importance(int pieceType) {
        return pieceType == PieceUtils.KING ? ROYAL_RANK : pieceTypeToValue(pieceType);
    }

    /** Piece-square bonus for a piece of the given colour; the endgame king table only applies when asked. */
    public static int squareBonus(int pieceType, int square, boolean white, boolean endgame) {
        int index = white ? square : mirrorV(square);
        return switch (pieceType) {
            case PieceUtils.PAWN -> PAWN_TABLE[index];
            case PieceUtils.KNIGHT -> KNIGHT_TABLE[index];
            case PieceUtils.BISHOP -> BISHOP_TABLE[index];
            case PieceUtils.ROOK -> ROOK_TABLE[index];
            case PieceUtils.QUEEN -> QUEEN_TABLE[index];
            case PieceUtils.KING -> endgame ? KING_ENDGAME_TABLE[index] : KING_MIDDLE_GAME_TABLE[index];
            default -> 0;
        };
    }

    static int mobilityWeight(int pieceType) {
        return switch (pieceType) {
            case PieceUtils.PAWN -> Mobility.PAWN;
            case PieceUtils.KNIGHT -> Mobility.KNIGHT;
            case PieceUtils.BISHOP -> Mobility.BISHOP;
            case PieceUtils.ROOK -> Mobility.ROOK;
            case PieceUtils.QUEEN -> Mobility.QUEEN;
            default -> Mobility.KING;
        };
    }

    public static int mirrorV(int sq) { return sq ^ 56; } // flip vertically

    private PieceValues() {}
}
