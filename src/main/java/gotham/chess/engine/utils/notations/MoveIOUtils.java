package gotham.chess.engine.utils.notations;

import gotham.chess.engine.game.Game;
import gotham.chess.engine.movegen.Move;
import gotham.chess.engine.utils.BitUtils;
import gotham.chess.engine.utils.PieceUtils;

public final class MoveIOUtils {

    /** Long algebraic (UCI) form, e.g. {@code e2e4} or {@code e7e8q}. */
    public static String writeAlgebraicNotation(int move) {
        if(move == Move.NONE) {
            return "0000";
        }
        String initialPosition = getSquareFromPosition(Move.getStartPosition(move));
        String targetPosition = getSquareFromPosition(Move.getEndPosition(move));
        byte promotion = Move.getPromotion(move);
        String promotedPiece = promotion == PieceUtils.NONE ? "" : String.valueOf(PieceUtils.toLetter(promotion));
        return initialPosition + targetPosition + promotedPiece;
    }

    /**
     * Resolves a UCI move string against the legal moves of the game.
     *
     * @throws IllegalArgumentException if the text is malformed or names no legal move
     */
    public static int readMove(Game game, String uci) {
        if(uci == null || (uci.length() != 4 && uci.length() != 5)) {
            throw new IllegalArgumentException("Move should be formatted like 'e2e4' or 'e7e8q': " + uci);
        }
        int startPosition = getPositionFromSquare(uci.substring(0, 2));
        int endPosition = getPositionFromSquare(uci.substring(2, 4));
        byte promotion = uci.length() == 5 ? PieceUtils.fromLetter(uci.charAt(4)) : PieceUtils.NONE;

        for(int move : game.getLegalMoves()) {
            if(Move.getStartPosition(move) == startPosition
                    && Move.getEndPosition(move) == endPosition
                    && Move.getPromotion(move) == promotion) {
                return move;
            }
        }
        throw new IllegalArgumentException("Illegal move " + uci);
    }

    public static String getSquareFromPosition(int positionIndex) {
        return String.valueOf((char) ('a' + BitUtils.fileOf(positionIndex))) + (BitUtils.rankOf(positionIndex) + 1);
    }

    public static int getPositionFromSquare(String square) {
        if(square == null || square.length() != 2) {
            throw new IllegalArgumentException("square should be format 'a1': " + square);
        }
        int file = square.charAt(0) - 'a';
        int rank = square.charAt(1) - '1';
        if(!BitUtils.isOnBoard(file, rank)) {
            throw new IllegalArgumentException("square should be in [a-h][1-8]: " + square);
        }
        return BitUtils.square(file, rank);
    }

    private MoveIOUtils() {}
}
