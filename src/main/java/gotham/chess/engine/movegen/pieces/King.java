package gotham.chess.engine.movegen.pieces;

import gotham.chess.engine.game.Game;
import gotham.chess.engine.game.board.Board;
import gotham.chess.engine.movegen.MoveGenerator;
import gotham.chess.engine.utils.BitUtils;
import gotham.chess.engine.utils.ColorUtils;
import gotham.chess.engine.utils.PieceUtils;

public final class King {
    public static final long[] KING_MOVES_BB = new long[64];
    private static final long BIT_MASK_KING_CASTLE_WHITE_PASSAGE_SQUARES = (0b11L << 5);
    private static final long BIT_MASK_QUEEN_CASTLE_WHITE_PASSAGE_SQUARES = (0b111L << 1);
    private static final long BIT_MASK_KING_CASTLE_BLACK_PASSAGE_SQUARES = (0b11L << 61);
    private static final long BIT_MASK_QUEEN_CASTLE_BLACK_PASSAGE_SQUARES = (0b111L << 57);

    static {
        generateKingMovesBB();
    }

    public static long getAttackBB(int positionIndex) {
        return KING_MOVES_BB[positionIndex];
    }

    public static long getPseudoLegalMovesBB(int positionIndex, long friendlySquaresOccupiedBB) {
        return KING_MOVES_BB[positionIndex] & ~friendlySquaresOccupiedBB;
    }

    public static boolean isCastleKingSideLegal(int kingColor, Game game, boolean isKingInCheck) {
        boolean white = ColorUtils.isWhite(kingColor);
        boolean canCastle = white ? game.whiteCanCastleKingSide : game.blackCanCastleKingSide;
        if (!canCastle || isKingInCheck) {
            return false;
        }
        Board board = game.board();
        int kingSquare = white ? 4 : 60;
        int rookSquare = white ? 7 : 63;
        long passage = white ? BIT_MASK_KING_CASTLE_WHITE_PASSAGE_SQUARES : BIT_MASK_KING_CASTLE_BLACK_PASSAGE_SQUARES;
        if (!hasOwnPiece(board, kingSquare, PieceUtils.KING, kingColor) || !hasOwnPiece(board, rookSquare, PieceUtils.ROOK, kingColor)
                || (board.gameBB & passage) != 0) {
            return false;
        }
        int opponent = ColorUtils.switchColor(kingColor);
        return !MoveGenerator.isSquareAttacked(kingSquare + 1, board, opponent)
                && !MoveGenerator.isSquareAttacked(kingSquare + 2, board, opponent);
    }

    public static boolean isCastleQueenSideLegal(int kingColor, Game game, boolean isKingInCheck) {
        boolean white = ColorUtils.isWhite(kingColor);
        boolean canCastle = white ? game.whiteCanCastleQueenSide : game.blackCanCastleQueenSide;
        if (!canCastle || isKingInCheck) {
            return false;
        }
        Board board = game.board();
        int kingSquare = white ? 4 : 60;
        int rookSquare = white ? 0 : 56;
        long passage = white ? BIT_MASK_QUEEN_CASTLE_WHITE_PASSAGE_SQUARES : BIT_MASK_QUEEN_CASTLE_BLACK_PASSAGE_SQUARES;
        if (!hasOwnPiece(board, kingSquare, PieceUtils.KING, kingColor) || !hasOwnPiece(board, rookSquare, PieceUtils.ROOK, kingColor)
                || (board.gameBB & passage) != 0) {
            return false;
        }
        // b-file square only has to be empty, the king never crosses it
        int opponent = ColorUtils.switchColor(kingColor);
        return !MoveGenerator.isSquareAttacked(kingSquare - 1, board, opponent)
                && !MoveGenerator.isSquareAttacked(kingSquare - 2, board, opponent);
    }

    private static boolean hasOwnPiece(Board board, int square, byte pieceType, int color) {
        return board.getPieceTypeAt(square) == pieceType && board.getColorAt(square) == color;
    }

    private static void generateKingMovesBB() {
        for (int i = 0; i < 64; i++) {
            int file = BitUtils.fileOf(i);
            int rank = BitUtils.rankOf(i);
            long movesBB = 0;
            for (int df = -1; df <= 1; df++) {
                for (int dr = -1; dr <= 1; dr++) {
                    if ((df != 0 || dr != 0) && BitUtils.isOnBoard(file + df, rank + dr)) {
                        movesBB |= BitUtils.getPositionIndexBitMask(BitUtils.square(file + df, rank + dr));
                    }
                }
            }
            KING_MOVES_BB[i] = movesBB;
        }
    }

    private King() {}
}
