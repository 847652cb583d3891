package gotham.chess.engine.search.evaluator;

import gotham.chess.engine.game.Game;
import gotham.chess.engine.game.board.utils.BoardGenerator;
import gotham.chess.engine.search.tactics.MateType;
import gotham.chess.engine.utils.ColorUtils;
import gotham.chess.engine.utils.notations.FENUtils;
import gotham.chess.engine.utils.notations.MoveIOUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PositionEvaluatorTest {
    // Equal totals may keep different moves once the board is flipped
    private static final int TACTICAL_TOLERANCE = 100;

    private final PositionEvaluator evaluator = new PositionEvaluator();

    // Flips the board vertically and swaps the colours of every piece and right
    private static String mirror(String fen) {
        String[] fields = fen.split(" ");
        String[] ranks = fields[0].split("/");
        StringBuilder placement = new StringBuilder();
        for(int i = ranks.length - 1; i >= 0; i--) {
            placement.append(swapCase(ranks[i]));
            if(i > 0) {
                placement.append('/');
            }
        }
        String side = "w".equals(fields[1]) ? "b" : "w";
        String castling = "-";
        if(!"-".equals(fields[2])) {
            StringBuilder rights = new StringBuilder();
            for(char right : "KQkq".toCharArray()) {
                if(fields[2].indexOf(Character.isUpperCase(right) ? Character.toLowerCase(right) : Character.toUpperCase(right)) >= 0) {
                    rights.append(right);
                }
            }
            castling = rights.toString();
        }
        String enPassant = "-".equals(fields[3]) ? "-" : fields[3].charAt(0) + (fields[3].charAt(1) == '3' ? "6" : "3");
        return placement + " " + side + " " + castling + " " + enPassant + " " + fields[4] + " " + fields[5];
    }

    private static String swapCase(String rank) {
        StringBuilder swapped = new StringBuilder();
        for(char c : rank.toCharArray()) {
            swapped.append(Character.isUpperCase(c) ? Character.toLowerCase(c) : Character.toUpperCase(c));
        }
        return swapped.toString();
    }

    @Test
    public void checkmateScoresFromWhitePointOfView() {
        assertEquals(GameValues.CHECKMATE_VALUE, evaluator.evaluate(FENUtils.getBoardFrom("R5k1/5ppp/8/8/8/8/5PPP/6K1 b - - 1 1")));
        assertEquals(-GameValues.CHECKMATE_VALUE, evaluator.evaluate(FENUtils.getBoardFrom("8/8/8/8/8/5k2/5q2/5K2 w - - 0 1")));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "7k/5Q2/6K1/8/8/8/8/8 b - - 0 1",          // stalemate
            "4k3/8/8/8/8/8/8/4K1N1 w - - 0 1",         // insufficient material
            "4k3/8/8/8/8/8/8/R3K3 w - - 100 80",       // fifty moves
            "8/8/8/8/8/8/8/4K3 w - - 0 1",             // missing king
            "8/8/8/8/8/8/8/8 w - - 0 1"
    })
    public void drawnOrInvalidPositionsScoreZero(String fen) {
        assertEquals(GameValues.DRAW_VALUE, evaluator.evaluate(FENUtils.getBoardFrom(fen)));
    }

    @Test
    public void staticScoreStaysBelowTheMateSentinel() {
        int score = evaluator.evaluate(FENUtils.getBoardFrom("k7/8/8/8/8/8/1QQQQ3/K7 w - - 0 30"));
        assertTrue(score > 0);
        assertTrue(score <= GameValues.MAX_STATIC_SCORE);
        assertTrue(!GameValues.isMateScore(score));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "6k1/5ppp/8/8/8/8/5PPP/6K1 w - - 0 30",
            "4k3/3p4/8/8/8/8/4P3/4K3 w - - 0 30",
            "4k3/8/8/8/8/2n5/4P3/4K3 w - - 0 30",
            "4k3/8/8/3p4/4P3/8/8/4K3 b - - 0 30"
    })
    public void mirroredPositionsScoreOpposite(String fen) {
        int score = evaluator.evaluate(FENUtils.getBoardFrom(fen));
        int mirrored = evaluator.evaluate(FENUtils.getBoardFrom(mirror(fen)));
        assertTrue(Math.abs(score + mirrored) <= TACTICAL_TOLERANCE, score + " vs " + mirrored + " for " + fen);
    }

    @Test
    public void mirroredPositionsScoreExactlyOppositeWithoutTactics() {
        PositionEvaluator basic = new PositionEvaluator(new EvaluationConfig.Builder().tacticalWeighting(false).build());
        String fen = "r2qk2r/ppp2ppp/2n5/3p4/3P4/2N2N2/PPP2PPP/R2QK2R w KQkq - 0 15";
        assertEquals(-basic.evaluate(FENUtils.getBoardFrom(fen)), basic.evaluate(FENUtils.getBoardFrom(mirror(fen))));
    }

    @Test
    public void evaluateLeavesTheGameUntouched() {
        String fen = "r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q1p/PPPBBPPP/R3K2R w KQkq - 0 1";
        Game game = FENUtils.getBoardFrom(fen);
        evaluator.evaluate(game);
        evaluator.analyze(game);
        assertEquals(fen, FENUtils.getFENFromBoard(game));
    }

    @Test
    public void royalForkCountsForWhite() {
        Game game = FENUtils.getBoardFrom("r3k3/8/8/3N4/8/8/8/4K3 w - - 0 30");
        assertTrue(evaluator.tactics(game, ColorUtils.WHITE) >= 600);

        PositionEvaluator basic = new PositionEvaluator(new EvaluationConfig.Builder().tacticalWeighting(false).build());
        assertEquals(0, basic.analyze(game).whiteTactics());
    }

    @Test
    public void sideNotToMoveIsEstimatedByPassing() {
        Game game = FENUtils.getBoardFrom("r3k3/8/8/3N4/8/8/8/4K3 b - - 0 30");
        assertTrue(evaluator.tactics(game, ColorUtils.WHITE) >= 600);

        PositionEvaluator noThreats = new PositionEvaluator(new EvaluationConfig.Builder().nullMoveThreats(false).build());
        assertEquals(0, noThreats.tactics(game, ColorUtils.WHITE));

        Game inCheck = FENUtils.getBoardFrom("4k3/8/8/8/8/8/8/r3K3 w - - 0 30");
        assertEquals(0, evaluator.tactics(inCheck, ColorUtils.BLACK), "White cannot pass while in check");
    }

    @Test
    public void analyzeReportsTheMateInOne() {
        Game game = FENUtils.getBoardFrom("6k1/5ppp/8/8/8/8/5PPP/R5K1 w - - 0 1");
        PositionAnalysis analysis = evaluator.analyze(game);
        assertTrue(analysis.hasMateInOne());
        assertArrayEquals(new int[] {MoveIOUtils.readMove(game, "a1a8")}, analysis.matingMoves());
        assertEquals(MateType.BACK_RANK, analysis.bestMateType());
        assertEquals(5, analysis.materialBalance());
        assertTrue(analysis.evaluation() > 0);
        assertTrue(analysis.toString().contains("a1a8"));
    }

    @Test
    public void startingPositionIsBalanced() {
        PositionAnalysis analysis = evaluator.analyze(BoardGenerator.newStandardGameBoard());
        assertEquals(GamePhase.OPENING, analysis.phase());
        assertEquals(0, analysis.materialBalance());
        assertEquals(analysis.whiteDevelopment(), analysis.blackDevelopment());
        assertEquals(analysis.whiteCenterControl(), analysis.blackCenterControl());
        assertEquals(MateType.NONE, analysis.bestMateType());
    }

    @Test
    public void developmentRewardsMinorPiecesOffTheBackRank() {
        Game game = FENUtils.getBoardFrom("rnbqkbnr/pppppppp/8/8/8/5N2/PPPPPPPP/RNBQKB1R b KQkq - 1 1");
        assertEquals(1, PositionEvaluator.development(game, ColorUtils.WHITE));
        assertEquals(0, PositionEvaluator.development(game, ColorUtils.BLACK));
    }

    @Test
    public void invalidConfigurationIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new EvaluationConfig.Builder().tacticalPrefix(-1).build());
        assertThrows(IllegalArgumentException.class, () -> new EvaluationConfig.Builder().tacticalTopK(-1).build());
    }
}
