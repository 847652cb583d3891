package gotham.chess.engine.search.tactics;

import gotham.chess.engine.game.Game;
import gotham.chess.engine.search.evaluator.PieceValues;
import gotham.chess.engine.utils.notations.FENUtils;
import gotham.chess.engine.utils.notations.MoveIOUtils;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MotifRecognizerTest {
    private final MotifRecognizer recognizer = new MotifRecognizer();

    private MotifSignals analyze(String fen, String move) {
        Game game = FENUtils.getBoardFrom(fen);
        return recognizer.analyze(game, MoveIOUtils.readMove(game, move));
    }

    @Test
    public void noForkWithoutASecondTarget() {
        Game game = FENUtils.getBoardFrom("4k3/8/8/3N4/8/8/8/4K3 w - - 0 1");
        for(int move : game.getLegalMoves()) {
            assertEquals(0, recognizer.analyze(game, move).get(MotifKind.FORK), MoveIOUtils.writeAlgebraicNotation(move));
        }
    }

    @Test
    public void royalForkDoublesTheHaul() {
        Game game = FENUtils.getBoardFrom("r3k3/8/8/3N4/8/8/8/4K3 w - - 0 1");
        for(int move : game.getLegalMoves()) {
            int fork = recognizer.analyze(game, move).get(MotifKind.FORK);
            if("d5c7".equals(MoveIOUtils.writeAlgebraicNotation(move))) {
                assertEquals(1000, fork, "Rook and king forked from c7");
            } else {
                assertEquals(0, fork, MoveIOUtils.writeAlgebraicNotation(move));
            }
        }
    }

    @Test
    public void forkOfTwoRooks() {
        MotifSignals signals = analyze("r3r1k1/8/8/3N4/8/8/8/5K2 w - - 0 1", "d5c7");
        assertEquals((int) (2 * PieceValues.ROOK_VALUE * MotifRecognizer.FORK_FACTOR), signals.get(MotifKind.FORK));
    }

    @Test
    public void mateInOneIsTheOnlyMotifReported() {
        MotifSignals signals = analyze("6k1/5ppp/8/8/8/8/5PPP/R5K1 w - - 0 1", "a1a8");
        assertEquals(1, signals.count());
        assertEquals(MotifRecognizer.MATE_IN_ONE_VALUE, signals.get(MotifKind.MATE_IN_ONE));
        assertEquals(MotifRecognizer.MATE_IN_ONE_VALUE, signals.total());
    }

    @Test
    public void backRankWeaknessIsFlaggedForQuietMoves() {
        MotifSignals signals = analyze("6k1/5ppp/8/8/8/8/8/R3K3 w - - 0 1", "e1d1");
        assertEquals(MotifRecognizer.BACK_RANK_VALUE, signals.get(MotifKind.BACK_RANK));
        assertEquals(MotifRecognizer.BACK_RANK_VALUE, signals.total());
    }

    @Test
    public void bishopPinsKnightToKing() {
        MotifSignals signals = analyze("4k3/8/2n5/8/8/8/8/4KB2 w - - 0 1", "f1b5");
        assertEquals((int) (PieceValues.KNIGHT_VALUE * MotifRecognizer.PIN_FACTOR), signals.get(MotifKind.PIN));
        assertFalse(signals.has(MotifKind.SKEWER));
        assertFalse(signals.has(MotifKind.FORK));
    }

    @Test
    public void rookSkewersKingAndQueen() {
        MotifSignals signals = analyze("q7/8/8/8/k7/8/8/1R2K3 w - - 0 1", "b1a1");
        assertEquals((int) (PieceValues.QUEEN_VALUE * MotifRecognizer.SKEWER_FACTOR), signals.get(MotifKind.SKEWER));
        assertFalse(signals.has(MotifKind.PIN));
    }

    @Test
    public void knightMoveUncoversTheRook() {
        MotifSignals signals = analyze("q3k3/8/8/8/N7/8/8/R3K3 w - - 0 1", "a4c3");
        assertEquals((int) (PieceValues.QUEEN_VALUE * MotifRecognizer.DISCOVERED_FACTOR), signals.get(MotifKind.DISCOVERED_ATTACK));
        assertEquals(signals.get(MotifKind.DISCOVERED_ATTACK), signals.total());
    }

    @Test
    public void plainCaptureIsADeflection() {
        MotifSignals signals = analyze("4k3/8/8/3p4/4P3/8/8/4K3 w - - 0 1", "e4d5");
        assertEquals((int) (PieceValues.PAWN_VALUE * MotifRecognizer.DEFLECTION_FACTOR), signals.get(MotifKind.DEFLECTION));
        assertFalse(signals.has(MotifKind.SACRIFICE), "Pawn takes pawn gives nothing away");
    }

    @Test
    public void queenGivenForCheckIsASacrifice() {
        MotifSignals signals = analyze("4k3/5p2/8/8/8/8/8/4KQ2 w - - 0 1", "f1f7");
        assertEquals(400, signals.get(MotifKind.SACRIFICE));
        assertEquals((int) (PieceValues.PAWN_VALUE * MotifRecognizer.DEFLECTION_FACTOR), signals.get(MotifKind.DEFLECTION));
        assertFalse(signals.has(MotifKind.MATE_IN_ONE), "The king can take back");
    }

    @Test
    public void enPassantIsNotADeflection() {
        MotifSignals signals = analyze("4k3/8/8/3pP3/8/8/8/4K3 w - d6 0 2", "e5d6");
        assertEquals(MotifRecognizer.EN_PASSANT_VALUE, signals.get(MotifKind.EN_PASSANT));
        assertFalse(signals.has(MotifKind.DEFLECTION));
    }

    @Test
    public void mateInTwoOnlyWhenEnabled() {
        String fen = "8/7k/R7/1R6/8/8/8/4K3 w - - 0 1";
        Game game = FENUtils.getBoardFrom(fen);
        int move = MoveIOUtils.readMove(game, "b5b7");

        assertFalse(recognizer.analyze(game, move).has(MotifKind.MATE_IN_TWO));
        assertEquals(MotifRecognizer.MATE_IN_TWO_VALUE, new MotifRecognizer(true).analyze(game, move).get(MotifKind.MATE_IN_TWO));
    }

    @Test
    public void analyzeLeavesTheGameUntouched() {
        String fen = "r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q1p/PPPBBPPP/R3K2R w KQkq - 0 1";
        Game game = FENUtils.getBoardFrom(fen);
        MotifRecognizer withMateInTwo = new MotifRecognizer(true);
        for(int move : game.getLegalMoves()) {
            MotifSignals signals = withMateInTwo.analyze(game, move);
            assertTrue(signals.total() >= 0);
        }
        assertEquals(fen, FENUtils.getFENFromBoard(game));
    }

    @Test
    public void promotionIsAnalyzedWithThePromotedPiece() {
        String fen = "4k2r/P7/8/8/8/8/8/4K3 w - - 0 1";
        assertEquals((int) (PieceValues.ROOK_VALUE * MotifRecognizer.SKEWER_FACTOR), analyze(fen, "a7a8q").get(MotifKind.SKEWER));
        assertFalse(analyze(fen, "a7a8n").has(MotifKind.SKEWER));
    }
}
