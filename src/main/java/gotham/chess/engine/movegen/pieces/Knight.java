package gotham.chess.engine.movegen.pieces;

import gotham.chess.engine.utils.BitUtils;

public final class Knight {
    public static final long[] KNIGHT_MOVES_BB = new long[64];

    private static final int[][] JUMPS = {
            {1, 2}, {2, 1}, {2, -1}, {1, -2}, {-1, -2}, {-2, -1}, {-2, 1}, {-1, 2}
    };

    static {
        generateKnightMovesBB();
    }

    public static long getLegalMovesBB(int positionIndex, long friendlyOccupiedSquareBB) {
        return KNIGHT_MOVES_BB[positionIndex] & ~friendlyOccupiedSquareBB;
    }

    public static long getAttackBB(int positionIndex) {
        return KNIGHT_MOVES_BB[positionIndex];
    }

    private static void generateKnightMovesBB() {
        for (int i = 0; i < 64; i++) {
            int file = BitUtils.fileOf(i);
            int rank = BitUtils.rankOf(i);
            long movesBB = 0;
            for (int[] jump : JUMPS) {
                int f = file + jump[0];
                int r = rank + jump[1];
                if (BitUtils.isOnBoard(f, r)) {
                    movesBB |= BitUtils.getPositionIndexBitMask(BitUtils.square(f, r));
                }
            }
            KNIGHT_MOVES_BB[i] = movesBB;
        }
    }

    private Knight() {}
}
