package gotham.chess.engine.game;

import gotham.chess.engine.game.board.utils.BoardGenerator;
import gotham.chess.engine.utils.ColorUtils;
import gotham.chess.engine.utils.notations.FENUtils;
import gotham.chess.engine.utils.notations.MoveIOUtils;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GameTest {

    @Test
    public void gameShouldDetect_checkmate() {
        Game game = FENUtils.getBoardFrom("6k1/5ppp/8/8/8/8/5PPP/R5K1 w - - 0 1");
        int move = MoveIOUtils.readMove(game, "a1a8");
        assertTrue(game.givesCheck(move));

        game.playMove(move);
        assertTrue(game.isCheckmate());
        assertEquals(PlayerState.CHECKMATE, game.getPlayerState());
    }

    @Test
    public void gameShouldDetect_stalemate() {
        Game game = FENUtils.getBoardFrom("7k/5Q2/6K1/8/8/8/8/8 b - - 0 1");
        assertTrue(game.isStalemate());
        assertFalse(game.isCheckmate());
        assertEquals(PlayerState.PAT, game.getPlayerState());
    }

    @Test
    public void gameShouldDetect_insufficientMaterial() {
        assertTrue(FENUtils.getBoardFrom("4k3/8/8/8/8/8/8/4K1N1 w - - 0 1").isInsufficientMaterial());
        assertTrue(FENUtils.getBoardFrom("4kb2/8/8/8/8/8/8/2B1K3 w - - 0 1").isInsufficientMaterial(), "Bishops on the same colour");
        assertFalse(FENUtils.getBoardFrom("4k3/8/8/8/8/8/8/2B1KB2 w - - 0 1").isInsufficientMaterial(), "Bishops on both colours");
        assertFalse(FENUtils.getBoardFrom("4k3/8/8/8/8/8/4P3/4K3 w - - 0 1").isInsufficientMaterial());
    }

    @Test
    public void gameShouldDetect_drawByFiftyMoves() {
        Game game = FENUtils.getBoardFrom("4k3/8/8/8/8/8/8/R3K3 w - - 100 80");
        assertTrue(game.isADraw());
        assertEquals(PlayerState.DRAW, game.getPlayerState());
    }

    @Test
    public void nullMoveOnlyChangesTheTurn() {
        Game game = FENUtils.getBoardFrom("4k3/8/8/3pP3/8/8/8/4K3 w - d6 0 2");
        String before = FENUtils.getFENFromBoard(game);
        assertTrue(game.canPlayNullMove());

        long changes = game.playNullMove();
        assertEquals(ColorUtils.BLACK, game.currentPlayer);
        assertEquals(-1, game.board().enPassantIndex);

        game.undoNullMove(changes);
        assertEquals(before, FENUtils.getFENFromBoard(game));
    }

    @Test
    public void nullMoveIsRefusedInCheckOrWithoutKing() {
        assertFalse(FENUtils.getBoardFrom("4k3/8/8/8/8/8/8/r3K3 w - - 0 1").canPlayNullMove());
        assertFalse(FENUtils.getBoardFrom("8/8/8/8/8/8/8/4K3 w - - 0 1").canPlayNullMove());
    }

    @Test
    public void copyIsIndependent() {
        Game game = BoardGenerator.newStandardGameBoard();
        Game copy = game.copy();
        copy.playMoves("e2e4 e7e5");
        assertEquals(BoardGenerator.STANDARD_GAME, FENUtils.getFENFromBoard(game));
        assertNotEquals(FENUtils.getFENFromBoard(game), FENUtils.getFENFromBoard(copy));
    }

    @Test
    public void playMovesRejectsIllegalMoves() {
        Game game = BoardGenerator.newStandardGameBoard();
        assertThrows(IllegalArgumentException.class, () -> game.playMoves("e2e5"));
        assertThrows(IllegalArgumentException.class, () -> game.playMoves(List.of("e2")));
    }

    @Test
    public void undoRestoresLargeHalfMoveClock() {
        String fen = "4k3/8/8/8/8/8/8/R3K3 w Q - 300 200";
        Game game = FENUtils.getBoardFrom(fen);
        for (int move : game.getLegalMoves()) {
            long changes = game.playMove(move);
            game.undoMove(changes);
            assertEquals(fen, FENUtils.getFENFromBoard(game), "After " + MoveIOUtils.writeAlgebraicNotation(move));
        }
        long changes = game.playNullMove();
        assertEquals(301, game.halfMoveClock);
        game.undoNullMove(changes);
        assertEquals(fen, FENUtils.getFENFromBoard(game));
    }

    @Test
    public void undoRestoresClocksAndCastlingRights() {
        Game game = FENUtils.getBoardFrom("r3k2r/8/8/8/8/8/8/R3K2R b KQkq - 7 12");
        String before = FENUtils.getFENFromBoard(game);
        List<Long> changes = game.playMoves("a8a1 e1e2");
        assertEquals("4k2r/8/8/8/8/8/4K3/r6R b k - 1 13", FENUtils.getFENFromBoard(game));

        game.undoMove(changes.get(1));
        game.undoMove(changes.get(0));
        assertEquals(before, FENUtils.getFENFromBoard(game));
    }

    @Test
    public void missingKingIsNeverInCheck() {
        Game game = FENUtils.getBoardFrom("8/8/8/8/8/8/8/r3K3 b - - 0 1");
        assertFalse(game.inCheck());
        assertEquals(-1, game.kingSquare(ColorUtils.BLACK));
        assertFalse(game.hasBothKings());
    }
}
