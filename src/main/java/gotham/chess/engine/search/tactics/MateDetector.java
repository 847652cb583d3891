package gotham.chess.engine.search.tactics;

import gotham.chess.engine.game.Game;
import gotham.chess.engine.movegen.pieces.King;
import gotham.chess.engine.movegen.pieces.Knight;
import gotham.chess.engine.utils.BitUtils;
import gotham.chess.engine.utils.ColorUtils;
import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Short forced-mate detection and mate pattern classification. Every method works on its own scratch copy, the
 * game given in input is left untouched.
 */
public final class MateDetector {
    public static final int MAX_MATE_IN_TWO_RESULTS = 3;

    private static final long CORNERS_BB = BitUtils.getPositionIndexBitMask(0) | BitUtils.getPositionIndexBitMask(7)
            | BitUtils.getPositionIndexBitMask(56) | BitUtils.getPositionIndexBitMask(63);

    /** Every legal move of the side to move that checkmates immediately, in generation order. */
    public static IntArrayList findMateInOne(Game game) {
        Game scratch = game.copy();
        IntArrayList mates = new IntArrayList();
        for(int move : scratch.getLegalMoves()) {
            long changes = scratch.playMove(move);
            if(scratch.isCheckmate()) {
                mates.add(move);
            }
            scratch.undoMove(changes);
        }
        return mates;
    }

    public static boolean hasMateInOne(Game game) {
        return firstMateInOne(game.copy()) != 0;
    }

    /**
     * First moves after which every defence still allows a mate in one. At most
     * {@link #MAX_MATE_IN_TWO_RESULTS} moves are returned; immediate mates are not repeated here.
     */
    public static IntArrayList findMateInTwo(Game game) {
        Game scratch = game.copy();
        IntArrayList firstMoves = new IntArrayList();
        for(int move : scratch.getLegalMoves()) {
            long changes = scratch.playMove(move);
            boolean forced = !scratch.isCheckmate() && isMateUnavoidable(scratch);
            scratch.undoMove(changes);
            if(forced) {
                firstMoves.add(move);
                if(firstMoves.size() >= MAX_MATE_IN_TWO_RESULTS) {
                    break;
                }
            }
        }
        return firstMoves;
    }

    /** True when {@code move} leaves the opponent with at least one reply, each of them allowing a mate in one. */
    public static boolean forcesMateAfter(Game game, int move) {
        Game scratch = game.copy();
        scratch.playMove(move);
        return isMateUnavoidable(scratch);
    }

    // The side to move is the defender here
    static boolean isMateUnavoidable(Game game) {
        int[] defences = game.getLegalMoves();
        if(defences.length == 0) {
            return false;
        }
        for(int defence : defences) {
            long changes = game.playMove(defence);
            boolean mate = firstMateInOne(game) != 0;
            game.undoMove(changes);
            if(!mate) {
                return false;
            }
        }
        return true;
    }

    private static int firstMateInOne(Game game) {
        for(int move : game.getLegalMoves()) {
            long changes = game.playMove(move);
            boolean mate = game.isCheckmate();
            game.undoMove(changes);
            if(mate) {
                return move;
            }
        }
        return 0;
    }

    /** Pattern of the mate on the board, {@link MateType#NONE} when the side to move is not checkmated. */
    public static MateType classify(Game game) {
        if(!game.isCheckmate()) {
            return MateType.NONE;
        }
        final int matedColor = game.currentPlayer;
        final int kingSquare = game.kingSquare(matedColor);
        final long ownBB = game.board().colorBB(matedColor);
        final long kingZoneBB = King.getAttackBB(kingSquare);
        final long checkersBB = game.attackersOf(kingSquare, ColorUtils.switchColor(matedColor));

        if((checkersBB & game.board().knightBB) != 0 && (kingZoneBB & ~ownBB) == 0) {
            return MateType.SMOTHERED;
        }
        if((CORNERS_BB & BitUtils.getPositionIndexBitMask(kingSquare)) != 0 && isGuardedRookCheck(game, checkersBB, matedColor)) {
            return MateType.ARABIAN;
        }
        if(BitUtils.rankOf(kingSquare) == ColorUtils.homeRank(matedColor)
                && BitUtils.bitCount(kingZoneBB & ownBB) >= 2) {
            return MateType.BACK_RANK;
        }
        return MateType.STANDARD;
    }

    public static boolean isSmotheredMate(Game game) {
        return classify(game) == MateType.SMOTHERED;
    }

    // Rook delivering the check while an enemy knight covers it
    private static boolean isGuardedRookCheck(Game game, long checkersBB, int matedColor) {
        long rookCheckersBB = checkersBB & game.board().rookBB;
        long enemyKnightsBB = game.board().knightBB & game.board().colorBB(ColorUtils.switchColor(matedColor));
        while(rookCheckersBB != 0) {
            int rookSquare = BitUtils.bitScanForward(rookCheckersBB);
            rookCheckersBB &= rookCheckersBB - 1;
            if((Knight.getAttackBB(rookSquare) & enemyKnightsBB) != 0) {
                return true;
            }
        }
        return false;
    }

    private MateDetector() {}
}
