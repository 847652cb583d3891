package gotham.chess.engine.movegen.pieces;

import gotham.chess.engine.movegen.utils.BitBoardUtils;
import gotham.chess.engine.utils.BitUtils;
import gotham.chess.engine.utils.ColorUtils;

public final class Pawn {
    public static final long[] BLACK_PAWN_ATTACKING_MOVES_BB = new long[64];
    public static final long[] WHITE_PAWN_ATTACKING_MOVES_BB = new long[64];

    static {
        generatePawnAttackingMovesLookUp();
    }

    public static long getAttackBB(int pawnPosition, int color) {
        return ColorUtils.isWhite(color)
                ? WHITE_PAWN_ATTACKING_MOVES_BB[pawnPosition]
                : BLACK_PAWN_ATTACKING_MOVES_BB[pawnPosition];
    }

    // Batch generation
    public static long getAttackBB(long pawnBB, int color) {
        return ColorUtils.isWhite(color)
                ? BitBoardUtils.shift(pawnBB, BitBoardUtils.Direction.NORTHEAST) | BitBoardUtils.shift(pawnBB, BitBoardUtils.Direction.NORTHWEST)
                : BitBoardUtils.shift(pawnBB, BitBoardUtils.Direction.SOUTHEAST) | BitBoardUtils.shift(pawnBB, BitBoardUtils.Direction.SOUTHWEST);
    }

    /** Single and double pushes onto empty squares. */
    public static long getPushesBB(int pawnPosition, int color, long occupiedSquaresBB) {
        long pawnBB = BitUtils.getPositionIndexBitMask(pawnPosition);
        BitBoardUtils.Direction forward = ColorUtils.isWhite(color) ? BitBoardUtils.Direction.NORTH : BitBoardUtils.Direction.SOUTH;
        long single = BitBoardUtils.shift(pawnBB, forward) & ~occupiedSquaresBB;
        if (single == 0) {
            return 0;
        }
        int startRank = ColorUtils.isWhite(color) ? 1 : 6;
        if (BitUtils.rankOf(pawnPosition) != startRank) {
            return single;
        }
        long twice = BitBoardUtils.shift(single, forward) & ~occupiedSquaresBB;
        return single | twice;
    }

    public static boolean isPromotionRank(int positionIndex, int color) {
        return BitUtils.rankOf(positionIndex) == (ColorUtils.isWhite(color) ? 7 : 0);
    }

    private static void generatePawnAttackingMovesLookUp() {
        for (int i = 0; i < 64; i++) {
            long pawnBB = BitUtils.getPositionIndexBitMask(i);
            WHITE_PAWN_ATTACKING_MOVES_BB[i] = getAttackBB(pawnBB, ColorUtils.WHITE);
            BLACK_PAWN_ATTACKING_MOVES_BB[i] = getAttackBB(pawnBB, ColorUtils.BLACK);
        }
    }

    private Pawn() {}
}
