package gotham.chess.engine.movegen;

import gotham.chess.engine.utils.PieceUtils;
import gotham.chess.engine.utils.notations.MoveIOUtils;

/**
 * Moves are packed into a single int so move lists stay allocation-free:
 * <pre>
 *  bits  0-5   end square
 *  bits  6-11  start square
 *  bits 12-14  moving piece type
 *  bits 15-16  flags (01 en passant, 10 castle king side, 11 castle queen side)
 *  bits 17-19  promotion piece type
 * </pre>
 * A legal move always carries a piece type, so {@link #NONE} (0) never collides with one.
 */
public final class Move {
    public static final int NONE = 0;

    private static final int FLAGS_MASK = 0b11 << 15;
    private static final int EN_PASSANT_FLAG = 0b01 << 15;
    private static final int CASTLE_KING_SIDE_FLAG = 0b10 << 15;
    private static final int CASTLE_QUEEN_SIDE_FLAG = 0b11 << 15;

    public static final int CASTLE_KING_SIDE_WHITE_MOVE = Move.asBytes(4, 6, PieceUtils.KING) | CASTLE_KING_SIDE_FLAG;
    public static final int CASTLE_QUEEN_SIDE_WHITE_MOVE = Move.asBytes(4, 2, PieceUtils.KING) | CASTLE_QUEEN_SIDE_FLAG;
    public static final int CASTLE_KING_SIDE_BLACK_MOVE = Move.asBytes(60, 62, PieceUtils.KING) | CASTLE_KING_SIDE_FLAG;
    public static final int CASTLE_QUEEN_SIDE_BLACK_MOVE = Move.asBytes(60, 58, PieceUtils.KING) | CASTLE_QUEEN_SIDE_FLAG;

    public static int asBytes(final int startPosition, final int endPosition,
                              final byte pieceType, final byte promotion) {
        return (promotion << 17) | asBytes(startPosition, endPosition, pieceType);
    }

    public static int asBytes(final int startPosition, final int endPosition, final byte pieceType) {
        return (pieceType << 12) | (startPosition << 6) | endPosition;
    }

    public static int asBytesEnPassant(final int startPosition, final int endPosition) {
        return asBytes(startPosition, endPosition, PieceUtils.PAWN) | EN_PASSANT_FLAG;
    }

    public static int getStartPosition(final int bytes) {
        return (bytes & 0b111111000000) >> 6;
    }

    public static int getEndPosition(final int bytes) {
        return bytes & 0b111111;
    }

    public static byte getPromotion(final int bytes) {
        return (byte) ((bytes & 0b11100000000000000000) >> 17);
    }

    public static byte getPieceType(final int bytes) {
        return (byte) ((bytes & 0b111000000000000) >> 12);
    }

    public static boolean isPromotion(final int bytes) {
        return getPromotion(bytes) != PieceUtils.NONE;
    }

    public static boolean isCastleKingSide(final int bytes) {
        return (bytes & FLAGS_MASK) == CASTLE_KING_SIDE_FLAG;
    }

    public static boolean isCastleQueenSide(final int bytes) {
        return (bytes & FLAGS_MASK) == CASTLE_QUEEN_SIDE_FLAG;
    }

    public static boolean isCastle(final int bytes) {
        int flags = bytes & FLAGS_MASK;
        return flags == CASTLE_KING_SIDE_FLAG || flags == CASTLE_QUEEN_SIDE_FLAG;
    }

    public static boolean isEnPassant(final int bytes) {
        return (bytes & FLAGS_MASK) == EN_PASSANT_FLAG;
    }

    public static String toString(final int bytes) {
        return MoveIOUtils.writeAlgebraicNotation(bytes);
    }

    private Move() {}
}
