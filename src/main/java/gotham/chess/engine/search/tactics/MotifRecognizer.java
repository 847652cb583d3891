package gotham.chess.engine.search.tactics;

import gotham.chess.engine.game.Game;
import gotham.chess.engine.movegen.Move;
import gotham.chess.engine.movegen.utils.BitBoardUtils;
import gotham.chess.engine.movegen.utils.BitBoardUtils.Direction;
import gotham.chess.engine.search.evaluator.PieceValues;
import gotham.chess.engine.utils.BitUtils;
import gotham.chess.engine.utils.ColorUtils;
import gotham.chess.engine.utils.PieceUtils;

/**
 * Tactical motifs created by a single move. The move is played on a scratch copy of the game, so
 * {@link #analyze(Game, int)} never touches the caller's position.
 * <p>
 * Magnitudes are centipawn-like integers. A move that mates right away only reports {@link MotifKind#MATE_IN_ONE}.
 */
public final class MotifRecognizer {
    public static final int MATE_IN_ONE_VALUE = 10_000;
    public static final int MATE_IN_TWO_VALUE = 5_000;
    public static final int BACK_RANK_VALUE = 500;
    public static final int EN_PASSANT_VALUE = 100;

    static final double FORK_FACTOR = 0.8;
    static final double ROYAL_FORK_FACTOR = 2.0;
    static final double PIN_FACTOR = 0.7;
    static final double SKEWER_FACTOR = 0.9;
    static final double DISCOVERED_FACTOR = 0.6;
    static final double DEFLECTION_FACTOR = 0.3;
    static final double SACRIFICE_FACTOR = 0.5;

    private static final Direction[] ALL_DIRECTIONS = Direction.values();

    private final boolean detectMateInTwo;

    public MotifRecognizer() {
        this(false);
    }

    public MotifRecognizer(boolean detectMateInTwo) {
        this.detectMateInTwo = detectMateInTwo;
    }

    /**
     * @param game the position before the move, left unchanged
     * @param move a legal move of the side to move
     * @return the motifs found, never null
     */
    public MotifSignals analyze(Game game, int move) {
        final Game scratch = game.copy();
        final int mover = scratch.currentPlayer;
        final int enemy = ColorUtils.switchColor(mover);
        final int startPosition = Move.getStartPosition(move);
        final int endPosition = Move.getEndPosition(move);
        final boolean enPassant = Move.isEnPassant(move);
        final byte captured = scratch.capturedPieceOf(move);
        final int movingValue = PieceValues.pieceTypeToValue(Move.getPieceType(move));

        scratch.playMove(move);
        if(scratch.isCheckmate()) {
            return MotifSignals.of(MotifKind.MATE_IN_ONE, MATE_IN_ONE_VALUE);
        }
        final boolean check = scratch.inCheck();

        MotifSignals signals = new MotifSignals();
        // The piece now standing on the destination (promotions included)
        final byte landedType = scratch.pieceAt(endPosition);

        signals.put(MotifKind.FORK, fork(scratch, endPosition, enemy));
        if(PieceUtils.isSlider(landedType)) {
            lineTactics(scratch, endPosition, landedType, mover, signals);
        }
        if(!Move.isCastle(move)) {
            signals.put(MotifKind.DISCOVERED_ATTACK, discoveredAttack(scratch, startPosition, endPosition, mover));
        }

        if(captured != PieceUtils.NONE && !enPassant) {
            int capturedValue = PieceValues.pieceTypeToValue(captured);
            signals.put(MotifKind.DEFLECTION, (int) (capturedValue * DEFLECTION_FACTOR));
            if(movingValue > capturedValue && check) {
                signals.put(MotifKind.SACRIFICE, (int) ((movingValue - capturedValue) * SACRIFICE_FACTOR));
            }
        }
        if(enPassant) {
            signals.put(MotifKind.EN_PASSANT, EN_PASSANT_VALUE);
        }
        if(isBackRankWeak(scratch, enemy)) {
            signals.put(MotifKind.BACK_RANK, BACK_RANK_VALUE);
        }
        if(detectMateInTwo && check && MateDetector.isMateUnavoidable(scratch)) {
            signals.put(MotifKind.MATE_IN_TWO, MATE_IN_TWO_VALUE);
        }
        return signals;
    }

    // Enemy pieces attacked from the destination square, the king counting for nothing but doubling the haul
    static int fork(Game game, int square, int enemy) {
        long attackedBB = game.attacks(square) & game.board().colorBB(enemy);
        if(BitUtils.bitCount(attackedBB) < 2) {
            return 0;
        }
        int total = 0;
        boolean royal = false;
        while(attackedBB != 0) {
            int target = BitUtils.bitScanForward(attackedBB);
            attackedBB &= attackedBB - 1;
            byte pieceType = game.pieceAt(target);
            if(pieceType == PieceUtils.KING) {
                royal = true;
            }
            total += PieceValues.pieceTypeToValue(pieceType);
        }
        return (int) (total * (royal ? ROYAL_FORK_FACTOR : FORK_FACTOR));
    }

    private static void lineTactics(Game game, int square, byte sliderType, int mover, MotifSignals signals) {
        int pin = 0;
        int skewer = 0;
        for(Direction direction : slidingDirections(sliderType)) {
            int front = -1;
            int back = -1;
            long sqBB = BitUtils.getPositionIndexBitMask(square);
            for(int step = 0; step < 7; step++) {
                sqBB = BitBoardUtils.shift(sqBB, direction);
                if(sqBB == 0) {
                    break;
                }
                int target = BitUtils.bitScanForward(sqBB);
                int color = game.colorAt(target);
                if(color == 0) {
                    continue;
                }
                if(color == mover) {
                    break;
                }
                if(front == -1) {
                    front = target;
                } else {
                    back = target;
                    break;
                }
            }
            if(back == -1) {
                continue;
            }
            byte frontType = game.pieceAt(front);
            byte backType = game.pieceAt(back);
            int frontRank = PieceValues.importance(frontType);
            int backRank = PieceValues.importance(backType);
            if(backRank > frontRank) {
                pin += (int) (PieceValues.pieceTypeToValue(frontType) * PIN_FACTOR);
            } else if(frontRank > backRank) {
                skewer += (int) (PieceValues.pieceTypeToValue(backType) * SKEWER_FACTOR);
            }
        }
        signals.put(MotifKind.PIN, pin);
        signals.put(MotifKind.SKEWER, skewer);
    }

    // Friendly sliders behind the vacated square now seeing an enemy piece in front of it
    static int discoveredAttack(Game game, int vacated, int destination, int mover) {
        int total = 0;
        for(Direction direction : ALL_DIRECTIONS) {
            int behind = firstPieceSquare(game, vacated, BitBoardUtils.opposite(direction));
            if(behind == -1 || behind == destination || game.colorAt(behind) != mover) {
                continue;
            }
            if(!canSlide(game.pieceAt(behind), direction)) {
                continue;
            }
            int target = firstPieceSquare(game, vacated, direction);
            if(target != -1 && game.colorAt(target) == ColorUtils.switchColor(mover)) {
                total += (int) (PieceValues.pieceTypeToValue(game.pieceAt(target)) * DISCOVERED_FACTOR);
            }
        }
        return total;
    }

    // King on its home rank with at most one free square in front of it
    static boolean isBackRankWeak(Game game, int kingColor) {
        int kingSquare = game.kingSquare(kingColor);
        if(kingSquare == -1 || BitUtils.rankOf(kingSquare) != ColorUtils.homeRank(kingColor)) {
            return false;
        }
        int rank = BitUtils.rankOf(kingSquare) + ColorUtils.forward(kingColor);
        int file = BitUtils.fileOf(kingSquare);
        int empty = 0;
        for(int f = file - 1; f <= file + 1; f++) {
            if(BitUtils.isOnBoard(f, rank) && game.colorAt(BitUtils.square(f, rank)) == 0) {
                empty++;
            }
        }
        return empty <= 1;
    }

    private static int firstPieceSquare(Game game, int from, Direction direction) {
        long rayBB = BitBoardUtils.generateRayAttack(from, direction, game.board().gameBB);
        long hitBB = rayBB & game.board().gameBB;
        if(hitBB == 0) {
            return -1;
        }
        // The ray stops on its first blocker, so at most one square is occupied
        return BitUtils.bitScanForward(hitBB);
    }

    private static boolean canSlide(byte pieceType, Direction direction) {
        return switch (pieceType) {
            case PieceUtils.QUEEN -> true;
            case PieceUtils.BISHOP -> BitBoardUtils.isDiagonal(direction);
            case PieceUtils.ROOK -> !BitBoardUtils.isDiagonal(direction);
            default -> false;
        };
    }

    private static Direction[] slidingDirections(byte sliderType) {
        return switch (sliderType) {
            case PieceUtils.BISHOP -> BitBoardUtils.DIAGONALS;
            case PieceUtils.ROOK -> BitBoardUtils.ORTHOGONALS;
            default -> ALL_DIRECTIONS;
        };
    }
}
