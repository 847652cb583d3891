package gotham.chess.engine.movegen;

import gotham.chess.engine.utils.PieceUtils;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MoveTest {

    @Test
    public void promotionKeepsTheOtherFields() {
        int move = Move.asBytes(52, 60, PieceUtils.PAWN, PieceUtils.KNIGHT);
        assertEquals(52, Move.getStartPosition(move));
        assertEquals(60, Move.getEndPosition(move));
        assertEquals(PieceUtils.PAWN, Move.getPieceType(move));
        assertEquals(PieceUtils.KNIGHT, Move.getPromotion(move));
        assertTrue(Move.isPromotion(move));
        assertFalse(Move.isCastle(move));
    }

    @Test
    public void castleFlagsAreExclusive() {
        assertTrue(Move.isCastleKingSide(Move.CASTLE_KING_SIDE_WHITE_MOVE));
        assertFalse(Move.isCastleQueenSide(Move.CASTLE_KING_SIDE_WHITE_MOVE));
        assertTrue(Move.isCastleQueenSide(Move.CASTLE_QUEEN_SIDE_BLACK_MOVE));
        assertFalse(Move.isEnPassant(Move.CASTLE_QUEEN_SIDE_BLACK_MOVE));
        assertEquals(60, Move.getStartPosition(Move.CASTLE_KING_SIDE_BLACK_MOVE));
        assertEquals(62, Move.getEndPosition(Move.CASTLE_KING_SIDE_BLACK_MOVE));
    }

    @Test
    public void enPassantIsAPawnMove() {
        int move = Move.asBytesEnPassant(36, 43);
        assertTrue(Move.isEnPassant(move));
        assertFalse(Move.isCastle(move));
        assertEquals(PieceUtils.PAWN, Move.getPieceType(move));
        assertEquals("e5d6", Move.toString(move));
    }

    @Test
    public void noneIsNeverALegalMove() {
        assertEquals(PieceUtils.NONE, Move.getPieceType(Move.NONE));
        assertEquals("0000", Move.toString(Move.NONE));
    }
}
