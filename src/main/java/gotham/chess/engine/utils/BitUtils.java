package gotham.chess.engine.utils;

public final class BitUtils {

    /**
     * Returns the index of the first (<i>rightmost</i>) bit set to 1 in the bitboard provided in input. The bit is the
     * Least Significant 1-bit (LS1B).
     *
     * @param bb the bitboard for which the LS1B is to be returned
     * @return the index of the first bit set to 1, or 64 for an empty bitboard
     */
    public static int bitScanForward(long bb) {
        return Long.numberOfTrailingZeros(bb);
    }

    public static long getPositionIndexBitMask(int positionIndex) {
        return 1L << positionIndex;
    }

    public static int bitCount(long bb) {
        return Long.bitCount(bb);
    }

    public static boolean isSet(long bb, int positionIndex) {
        return ((bb >>> positionIndex) & 1L) != 0;
    }

    // Squares: a1 = 0, h1 = 7, a8 = 56
    public static int fileOf(int positionIndex) {
        return positionIndex & 7;
    }

    public static int rankOf(int positionIndex) {
        return positionIndex >>> 3;
    }

    public static int square(int file, int rank) {
        return rank * 8 + file;
    }

    public static boolean isOnBoard(int file, int rank) {
        return file >= 0 && file < 8 && rank >= 0 && rank < 8;
    }

    private BitUtils() {}
}
