package gotham.chess.engine.movegen.pieces;

import gotham.chess.engine.movegen.utils.BitBoardUtils;

public final class Rook {

    public static long getLegalMovesBB(int positionIndex, long friendlyPiecesBB, long occupiedBB) {
        return getAttackBB(positionIndex, occupiedBB) & ~friendlyPiecesBB;
    }

    public static long getAttackBB(int positionIndex, long occupiedBB) {
        long attacks = 0L;
        for (BitBoardUtils.Direction direction : BitBoardUtils.ORTHOGONALS) {
            attacks |= BitBoardUtils.generateRayAttack(positionIndex, direction, occupiedBB);
        }
        return attacks;
    }

    private Rook() {}
}
