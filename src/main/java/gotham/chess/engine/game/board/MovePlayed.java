package gotham.chess.engine.game.board;

/**
 * Undo information of a single board move packed in an int:
 * the move itself, the piece eaten (if any) and the en passant square before the move.
 */
public final class MovePlayed {
    private static final int MOVE_MASK = ~0b1111111111;
    private static final int PIECE_EATEN_MASK = 0b1110000000;
    private static final int PREVIOUS_EN_PASSANT_MASK = 0b1111111;

    public static int asBytes(int move, byte pieceEaten, int previousEnPassantIndex) {
        return (move << 10) | (pieceEaten << 7) | (previousEnPassantIndex + 1);
    }

    public static int getMove(int bytes) {
        return (bytes & MOVE_MASK) >>> 10;
    }

    public static byte getPieceEaten(int bytes) {
        return (byte) ((bytes & PIECE_EATEN_MASK) >>> 7);
    }

    public static int getPreviousEnPassantIndex(int bytes) {
        return (bytes & PREVIOUS_EN_PASSANT_MASK) - 1;
    }

    private MovePlayed() {}
}
