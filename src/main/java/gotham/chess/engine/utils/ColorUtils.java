package gotham.chess.engine.utils;

public final class ColorUtils {
    public static final int BLACK = -1;
    public static final int WHITE = 1;

    public static int switchColor(int color) {
        return ~color + 1;
    }

    public static boolean isBlack(int color) {
        return color == BLACK;
    }

    public static boolean isWhite(int color) {
        return color == WHITE;
    }

    /** Rank index (0..7) the pieces of this colour start on. */
    public static int homeRank(int color) {
        return isWhite(color) ? 0 : 7;
    }

    /** +1 when this colour's pawns move up the board, -1 otherwise. */
    public static int forward(int color) {
        return isWhite(color) ? 1 : -1;
    }

    public static String name(int color) {
        return isWhite(color) ? "white" : "black";
    }

    private ColorUtils() {}
}
