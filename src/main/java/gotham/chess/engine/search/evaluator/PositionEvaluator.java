package gotham.chess.engine.search.evaluator;

import gotham.chess.engine.game.Game;
import gotham.chess.engine.game.board.Board;
import gotham.chess.engine.movegen.MoveGenerator;
import gotham.chess.engine.movegen.pieces.Pawn;
import gotham.chess.engine.search.tactics.MateDetector;
import gotham.chess.engine.search.tactics.MateType;
import gotham.chess.engine.search.tactics.MotifRecognizer;
import gotham.chess.engine.search.tactics.MotifSignals;
import gotham.chess.engine.utils.BitUtils;
import gotham.chess.engine.utils.ColorUtils;
import gotham.chess.engine.utils.PieceUtils;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;

import static gotham.chess.engine.search.evaluator.PieceValues.*;

/**
 * Static evaluation, always from White's point of view: positive scores favour White whoever is to move.
 * <p>
 * The game handed in is never modified; tactical probing runs on scratch copies.
 */
public class PositionEvaluator {
    static final int KING_SAFETY_WEIGHT = KingSafety.SAFE_KING_BONUS;
    static final int DEVELOPMENT_WEIGHT = 10;
    static final int CENTER_WEIGHT = 5;
    static final int ACTIVITY_WEIGHT = 2;

    // Queen moves before this ply count as early development
    static final int EARLY_QUEEN_PLIES = 10;

    static final int[] CENTER_SQUARES = {27, 28, 35, 36}; // d4 e4 d5 e5
    static final long EXTENDED_CENTER_BB = squares(18, 26, 34, 42, 19, 43, 20, 44, 21, 29, 37, 45); // c3-c6 d3 d6 e3 e6 f3-f6

    private final EvaluationConfig config;
    private final MotifRecognizer recognizer;

    public PositionEvaluator() {
        this(EvaluationConfig.defaults());
    }

    public PositionEvaluator(EvaluationConfig config) {
        this.config = config;
        this.recognizer = new MotifRecognizer(config.detectMateInTwo);
    }

    public EvaluationConfig config() {
        return config;
    }

    public MotifRecognizer recognizer() {
        return recognizer;
    }

    public int evaluate(Game game) {
        if(!game.hasBothKings()) {
            return GameValues.DRAW_VALUE;
        }
        if(game.getLegalMovesCount() == 0) {
            if(game.inCheck()) {
                return ColorUtils.isWhite(game.currentPlayer) ? -GameValues.CHECKMATE_VALUE : GameValues.CHECKMATE_VALUE;
            }
            return GameValues.PAT_VALUE;
        }
        if(game.isADraw()) {
            return GameValues.DRAW_VALUE;
        }

        final GamePhase phase = GamePhase.of(game);
        int score = material(game, phase)
                + kingSafety(game, phase)
                + (development(game, ColorUtils.WHITE) - development(game, ColorUtils.BLACK)) * DEVELOPMENT_WEIGHT
                + (centerControl(game, ColorUtils.WHITE) - centerControl(game, ColorUtils.BLACK)) * CENTER_WEIGHT;
        if(config.tacticalWeighting) {
            score += tactics(game, ColorUtils.WHITE) - tactics(game, ColorUtils.BLACK);
        }
        return GameValues.clampStatic(score);
    }

    /** Component breakdown of {@link #evaluate(Game)}, plus the immediate mates of the side to move. */
    public PositionAnalysis analyze(Game game) {
        final GamePhase phase = GamePhase.of(game);
        final boolean tactical = config.tacticalWeighting && game.hasBothKings();
        final IntArrayList mates = game.hasBothKings() ? MateDetector.findMateInOne(game) : new IntArrayList();

        MateType mateType = MateType.NONE;
        if(!mates.isEmpty()) {
            mateType = MateType.STANDARD;
            Game scratch = game.copy();
            for(int move : mates) {
                long changes = scratch.playMove(move);
                MateType type = MateDetector.classify(scratch);
                scratch.undoMove(changes);
                if(type != MateType.STANDARD) {
                    mateType = type;
                    break;
                }
            }
        }

        return new PositionAnalysis(phase,
                materialBalance(game),
                KingSafety.score(game, ColorUtils.WHITE), KingSafety.score(game, ColorUtils.BLACK),
                development(game, ColorUtils.WHITE), development(game, ColorUtils.BLACK),
                centerControl(game, ColorUtils.WHITE), centerControl(game, ColorUtils.BLACK),
                tactical ? tactics(game, ColorUtils.WHITE) : 0, tactical ? tactics(game, ColorUtils.BLACK) : 0,
                evaluate(game),
                mates.toIntArray(),
                mateType);
    }

    /** Pawn-unit material difference, White minus Black. */
    public static int materialBalance(Game game) {
        final Board board = game.board();
        int balance = 0;
        long piecesBB = board.gameBB;
        while(piecesBB != 0) {
            final int square = BitUtils.bitScanForward(piecesBB);
            piecesBB &= piecesBB - 1;
            balance += pieceTypeToUnits(board.getPieceTypeAt(square)) * board.getColorAt(square);
        }
        return balance;
    }

    // Base value, square table and activity of every piece on the board
    static int material(Game game, GamePhase phase) {
        final Board board = game.board();
        final boolean endgame = phase.isEndgame();
        int score = 0;
        long piecesBB = board.gameBB;
        while(piecesBB != 0) {
            final int square = BitUtils.bitScanForward(piecesBB);
            piecesBB &= piecesBB - 1;
            final byte pieceType = board.getPieceTypeAt(square);
            final int color = board.getColorAt(square);
            final int value = pieceTypeToUnits(pieceType) * 100
                    + squareBonus(pieceType, square, ColorUtils.isWhite(color), endgame)
                    + activity(board, square, pieceType, color) * ACTIVITY_WEIGHT;
            score += value * color;
        }
        return score;
    }

    /** Reachable squares weighted per piece type, plus a bonus for standing near the centre. */
    static int activity(Board board, int square, byte pieceType, int color) {
        final long ownBB = board.colorBB(color);
        long destinationsBB;
        if(pieceType == PieceUtils.PAWN) {
            destinationsBB = Pawn.getPushesBB(square, color, board.gameBB)
                    | (Pawn.getAttackBB(square, color) & board.colorBB(ColorUtils.switchColor(color)));
        } else {
            destinationsBB = MoveGenerator.getAttackBB(square, pieceType, board.gameBB) & ~ownBB;
        }
        int score = BitUtils.bitCount(destinationsBB) * mobilityWeight(pieceType);

        final int file = BitUtils.fileOf(square);
        final int rank = BitUtils.rankOf(square);
        if(file >= 2 && file <= 5 && rank >= 2 && rank <= 5) {
            score += Mobility.CENTER_BONUS;
        } else if(file >= 1 && file <= 6 && rank >= 1 && rank <= 6) {
            score += Mobility.EXTENDED_CENTER_BONUS;
        }
        return score;
    }

    static int kingSafety(Game game, GamePhase phase) {
        if(phase.isEndgame()) {
            return 0;
        }
        int score = 0;
        if(KingSafety.isSafe(game, ColorUtils.WHITE)) {
            score += KING_SAFETY_WEIGHT;
        }
        if(KingSafety.isSafe(game, ColorUtils.BLACK)) {
            score -= KING_SAFETY_WEIGHT;
        }
        return score;
    }

    static int development(Game game, int color) {
        final Board board = game.board();
        final boolean white = ColorUtils.isWhite(color);
        final int base = white ? 0 : 56;
        final long ownBB = board.colorBB(color);
        int score = 0;

        // Minor pieces gone from b/g and c/f
        if(!BitUtils.isSet(board.knightBB & ownBB, base + 1)) score++;
        if(!BitUtils.isSet(board.knightBB & ownBB, base + 6)) score++;
        if(!BitUtils.isSet(board.bishopBB & ownBB, base + 2)) score++;
        if(!BitUtils.isSet(board.bishopBB & ownBB, base + 5)) score++;

        final boolean canCastle = white
                ? game.whiteCanCastleKingSide || game.whiteCanCastleQueenSide
                : game.blackCanCastleKingSide || game.blackCanCastleQueenSide;
        final int kingSquare = game.kingSquare(color);
        if(!canCastle && (kingSquare == base + 6 || kingSquare == base + 2)) {
            score += 2;
        }

        final long queensBB = board.queenBB & ownBB;
        if(queensBB != 0 && BitUtils.bitScanForward(queensBB) != base + 3 && game.pliesPlayed() < EARLY_QUEEN_PLIES) {
            score--;
        }
        return score;
    }

    static int centerControl(Game game, int color) {
        final Board board = game.board();
        final long ownBB = board.colorBB(color);
        int score = 0;
        for(int square : CENTER_SQUARES) {
            if(BitUtils.isSet(ownBB, square)) {
                score += board.getPieceTypeAt(square) == PieceUtils.PAWN ? 2 : 1;
            }
            score += BitUtils.bitCount(game.attackersOf(square, color)) / 2;
        }
        score += BitUtils.bitCount(board.pawnBB & ownBB & EXTENDED_CENTER_BB);
        return score;
    }

    /**
     * Weighted motifs of the best moves {@code color} could play. When it is not that side's turn, a pass is played
     * on a scratch copy first; if passing is not possible, the side gets nothing.
     */
    public int tactics(Game game, int color) {
        final Game scratch = game.copy();
        if(scratch.currentPlayer != color) {
            if(!config.nullMoveThreats || !scratch.canPlayNullMove()) {
                return 0;
            }
            scratch.playNullMove();
        }
        final int[] moves = scratch.getLegalMoves();
        final int n = Math.min(moves.length, config.tacticalPrefix);
        if(n == 0 || config.tacticalTopK == 0) {
            return 0;
        }

        final MotifSignals[] signals = new MotifSignals[n];
        final int[] totals = new int[n];
        final int[] order = new int[n];
        for(int i = 0; i < n; i++) {
            signals[i] = recognizer.analyze(scratch, moves[i]);
            totals[i] = signals[i].total();
            order[i] = i;
        }
        // Stable: equal totals keep generation order
        IntArrays.mergeSort(order, (a, b) -> Integer.compare(totals[b], totals[a]));

        int score = 0;
        for(int i = 0; i < Math.min(n, config.tacticalTopK); i++) {
            score += TacticalWeights.weigh(signals[order[i]]);
        }
        return score;
    }

    private static long squares(int... squares) {
        long bb = 0L;
        for(int square : squares) {
            bb |= BitUtils.getPositionIndexBitMask(square);
        }
        return bb;
    }
}
