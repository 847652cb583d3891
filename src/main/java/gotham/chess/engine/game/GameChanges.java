package gotham.chess.engine.game;

/**
 * Everything {@link Game#undoMove(long)} needs to restore a position, packed in a long:
 * <pre>
 *  bits 0-3   castling rights before the move (K, Q, k, q)
 *  bits 4-27  half move clock before the move
 *  bits 28-   {@link gotham.chess.engine.game.board.MovePlayed} token
 * </pre>
 */
public final class GameChanges {
    private static final long PREVIOUS_WHITE_CAN_CASTLE_KING_SIDE_MASK = 0b1;
    private static final long PREVIOUS_WHITE_CAN_CASTLE_QUEEN_SIDE_MASK = 0b10;
    private static final long PREVIOUS_BLACK_CAN_CASTLE_KING_SIDE_MASK = 0b100;
    private static final long PREVIOUS_BLACK_CAN_CASTLE_QUEEN_SIDE_MASK = 0b1000;
    private static final long PREVIOUS_HALF_MOVE_CLOCK_MASK = 0xFFFFFF0L;
    public static final int MAX_HALF_MOVE_CLOCK = 0xFFFFFF;

    public static long asBytes(int movePlayed, int previousHalfMoveClock, boolean previousWhiteCanCastleKingSide,
                               boolean previousWhiteCanCastleQueenSide, boolean previousBlackCanCastleKingSide,
                               boolean previousBlackCanCastleQueenSide) {
        return ((long) movePlayed << 28)
                | (((long) previousHalfMoveClock << 4) & PREVIOUS_HALF_MOVE_CLOCK_MASK)
                | ((previousBlackCanCastleQueenSide ? 1L : 0L) << 3)
                | ((previousBlackCanCastleKingSide ? 1L : 0L) << 2)
                | ((previousWhiteCanCastleQueenSide ? 1L : 0L) << 1)
                | (previousWhiteCanCastleKingSide ? 1L : 0L);
    }

    public static boolean getPreviousWhiteCanCastleKingSide(long bytes) {
        return (bytes & PREVIOUS_WHITE_CAN_CASTLE_KING_SIDE_MASK) != 0;
    }
    public static boolean getPreviousWhiteCanCastleQueenSide(long bytes) {
        return (bytes & PREVIOUS_WHITE_CAN_CASTLE_QUEEN_SIDE_MASK) != 0;
    }
    public static boolean getPreviousBlackCanCastleKingSide(long bytes) {
        return (bytes & PREVIOUS_BLACK_CAN_CASTLE_KING_SIDE_MASK) != 0;
    }
    public static boolean getPreviousBlackCanCastleQueenSide(long bytes) {
        return (bytes & PREVIOUS_BLACK_CAN_CASTLE_QUEEN_SIDE_MASK) != 0;
    }

    public static int getPreviousHalfMoveClock(long bytes) {
        return (int) ((bytes & PREVIOUS_HALF_MOVE_CLOCK_MASK) >>> 4);
    }

    public static int getMovePlayed(long bytes) {
        return (int) (bytes >>> 28);
    }

    private GameChanges() {}
}
