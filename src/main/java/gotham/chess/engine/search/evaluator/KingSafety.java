package gotham.chess.engine.search.evaluator;

import gotham.chess.engine.game.Game;
import gotham.chess.engine.movegen.pieces.King;
import gotham.chess.engine.utils.BitUtils;
import gotham.chess.engine.utils.ColorUtils;

// Middlegame only, ignored once the endgame starts
public final class KingSafety {
    public static final int CASTLED_FILE = +2;  // king on the c or g file
    public static final int SHIELD_PAWN = +1;   // per own pawn right in front of a back-rank king
    public static final int IN_CHECK = -2;
    public static final int CROWDED_ZONE = -1;  // more than CROWDED_ZONE_ATTACKS enemy attacks around the king
    public static final int CROWDED_ZONE_ATTACKS = 2;

    public static final int SAFE_THRESHOLD = 1;
    public static final int SAFE_KING_BONUS = 50;

    /** Raw safety score of the king of {@code color}; a missing king scores 0. */
    public static int score(Game game, int color) {
        final int kingSquare = game.kingSquare(color);
        if(kingSquare == -1) {
            return 0;
        }
        final int enemy = ColorUtils.switchColor(color);
        final int file = BitUtils.fileOf(kingSquare);
        final int rank = BitUtils.rankOf(kingSquare);
        int score = 0;

        if(file == 6 || file == 2) {
            score += CASTLED_FILE;
        }

        if(rank == ColorUtils.homeRank(color)) {
            final long ownPawnsBB = game.board().pawnBB & game.board().colorBB(color);
            final int shieldRank = rank + ColorUtils.forward(color);
            for(int f = file - 1; f <= file + 1; f++) {
                if(BitUtils.isOnBoard(f, shieldRank) && BitUtils.isSet(ownPawnsBB, BitUtils.square(f, shieldRank))) {
                    score += SHIELD_PAWN;
                }
            }
        }

        if(game.isSquareAttacked(kingSquare, enemy)) {
            score += IN_CHECK;
        }

        long zoneBB = King.getAttackBB(kingSquare);
        int zoneAttacks = 0;
        while(zoneBB != 0) {
            final int square = BitUtils.bitScanForward(zoneBB);
            zoneBB &= zoneBB - 1;
            zoneAttacks += BitUtils.bitCount(game.attackersOf(square, enemy));
        }
        if(zoneAttacks > CROWDED_ZONE_ATTACKS) {
            score += CROWDED_ZONE;
        }
        return score;
    }

    public static boolean isSafe(Game game, int color) {
        return game.kingSquare(color) != -1 && score(game, color) >= SAFE_THRESHOLD;
    }

    private KingSafety() {}
}
