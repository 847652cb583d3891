package gotham.chess.engine.utils.notations;

import gotham.chess.engine.game.Game;
import gotham.chess.engine.game.board.utils.BoardGenerator;
import gotham.chess.engine.utils.ColorUtils;
import gotham.chess.engine.utils.PieceUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FENUtilsTest {

    @ParameterizedTest
    @ValueSource(strings = {
            BoardGenerator.STANDARD_GAME,
            "r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q1p/PPPBBPPP/R3K2R w KQkq - 0 1",
            "rnbqkbnr/pppp1ppp/8/4p3/4P3/8/PPPP1PPP/RNBQKBNR w KQkq e6 0 2",
            "8/8/8/8/8/5k2/5q2/5K2 w - - 12 61"
    })
    public void fenShouldRoundTrip(String fen) {
        assertEquals(fen, FENUtils.getFENFromBoard(FENUtils.getBoardFrom(fen)));
    }

    @Test
    public void fenFieldsAreRead() {
        Game game = FENUtils.getBoardFrom("r3k3/8/8/8/8/8/8/4K2R b Kq - 7 30");
        assertEquals(ColorUtils.BLACK, game.currentPlayer);
        assertTrue(game.whiteCanCastleKingSide);
        assertFalse(game.whiteCanCastleQueenSide);
        assertFalse(game.blackCanCastleKingSide);
        assertTrue(game.blackCanCastleQueenSide);
        assertEquals(7, game.halfMoveClock);
        assertEquals(30, game.fullMoveClock);
        assertEquals(PieceUtils.ROOK, game.pieceAt(MoveIOUtils.getPositionFromSquare("a8")));
        assertEquals(ColorUtils.BLACK, game.colorAt(MoveIOUtils.getPositionFromSquare("a8")));
    }

    @Test
    public void clocksAreOptional() {
        Game game = FENUtils.getBoardFrom("4k3/8/8/8/8/8/8/4K3 w - -");
        assertEquals(0, game.halfMoveClock);
        assertEquals(1, game.fullMoveClock);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "8/8/8/8/8/8/8/8 w",
            "8/8/8/8/8/8/8 w - - 0 1",
            "9/8/8/8/8/8/8/8 w - - 0 1",
            "4k3/8/8/8/8/8/8/4X3 w - - 0 1",
            "4k3/8/8/8/8/8/8/4K3 x - - 0 1",
            "4k3/8/8/8/8/8/8/4K3 w KX - 0 1",
            "4k3/8/8/8/8/8/8/4K3 w - z9 0 1",
            "4k3/8/8/8/8/8/8/4K3 w - - -1 1",
            "4k3/8/8/8/8/8/8/4K3 w - - a 1",
            "4k3/8/8/8/8/8/8/4K3 w - - 99999999 1"
    })
    public void invalidFenIsRejected(String fen) {
        assertThrows(IllegalArgumentException.class, () -> FENUtils.getBoardFrom(fen));
    }

    @Test
    public void positionKeyIgnoresClocksAndEnPassant() {
        Game game = FENUtils.getBoardFrom("rnbqkbnr/pppp1ppp/8/4p3/4P3/8/PPPP1PPP/RNBQKBNR w KQkq e6 0 2");
        assertEquals("rnbqkbnr/pppp1ppp/8/4p3/4P3/8/PPPP1PPP/RNBQKBNR w KQkq", FENUtils.positionKey(game));
    }

    @Test
    public void movesAreWrittenInLongAlgebraic() {
        Game game = FENUtils.getBoardFrom("4k3/P7/8/8/8/8/8/4K3 w - - 0 1");
        assertEquals("a7a8n", MoveIOUtils.writeAlgebraicNotation(MoveIOUtils.readMove(game, "a7a8n")));
        assertEquals("0000", MoveIOUtils.writeAlgebraicNotation(0));
        assertThrows(IllegalArgumentException.class, () -> MoveIOUtils.readMove(game, "a7a8"));
        assertThrows(IllegalArgumentException.class, () -> MoveIOUtils.readMove(game, "i1a1"));
    }
}
