package gotham.chess.engine.movegen;

import gotham.chess.engine.game.Game;
import gotham.chess.engine.game.board.Board;
import gotham.chess.engine.movegen.pieces.Bishop;
import gotham.chess.engine.movegen.pieces.King;
import gotham.chess.engine.movegen.pieces.Knight;
import gotham.chess.engine.movegen.pieces.Pawn;
import gotham.chess.engine.movegen.pieces.Rook;
import gotham.chess.engine.utils.BitUtils;
import gotham.chess.engine.utils.ColorUtils;
import gotham.chess.engine.utils.PieceUtils;

import java.util.Arrays;

/**
 * Legal move generation. Moves are first generated pseudo-legally, then each one is played and
 * kept only if it does not leave the mover's king attacked.
 * <p>
 * Generation order is stable: pawns, knights, bishops, rooks, queens, king, then castles,
 * each piece kind by ascending square.
 */
public final class MoveGenerator {
    // Upper bound of pseudo-legal moves in any reachable position
    public static final int MAX_MOVES = 256;

    public static int[] generateMoves(Game game) {
        int[] moves = new int[MAX_MOVES];
        int count = generateMoves(game, moves);
        return Arrays.copyOf(moves, count);
    }

    public static int countMoves(Game game) {
        return generateMoves(game, new int[MAX_MOVES]);
    }

    public static int generateMoves(Game game, int[] buffer) {
        int pseudoLegalCount = generatePseudoLegalMoves(game, buffer);
        int side = game.currentPlayer;
        int legalCount = 0;
        for(int i = 0; i < pseudoLegalCount; i++) {
            int move = buffer[i];
            long changes = game.playMove(move);
            boolean legal = !isKingAttacked(game.board(), side);
            game.undoMove(changes);
            if(legal) {
                buffer[legalCount++] = move;
            }
        }
        return legalCount;
    }

    private static int generatePseudoLegalMoves(Game game, int[] buffer) {
        final Board board = game.board();
        final int side = game.currentPlayer;
        final boolean isWhiteTurn = ColorUtils.isWhite(side);
        final long friendlyOccupiedSquareBB = board.colorBB(side);
        final long enemyOccupiedSquareBB = board.colorBB(ColorUtils.switchColor(side));
        final long occupiedSquareBB = board.gameBB;
        int count = 0;

        // Pawn moves
        long friendlyPawnBB = board.pawnBB & friendlyOccupiedSquareBB;
        while(friendlyPawnBB != 0) {
            final int pawnPosition = BitUtils.bitScanForward(friendlyPawnBB);
            friendlyPawnBB &= friendlyPawnBB - 1;
            long pawnMovesBB = Pawn.getPushesBB(pawnPosition, side, occupiedSquareBB)
                    | (Pawn.getAttackBB(pawnPosition, side) & enemyOccupiedSquareBB);
            while(pawnMovesBB != 0) {
                final int endPosition = BitUtils.bitScanForward(pawnMovesBB);
                pawnMovesBB &= pawnMovesBB - 1;
                if(Pawn.isPromotionRank(endPosition, side)) {
                    for(byte promotion : PieceUtils.PROMOTIONS) {
                        buffer[count++] = Move.asBytes(pawnPosition, endPosition, PieceUtils.PAWN, promotion);
                    }
                } else {
                    buffer[count++] = Move.asBytes(pawnPosition, endPosition, PieceUtils.PAWN);
                }
            }

            final int enPassantIndex = board.enPassantIndex;
            if(enPassantIndex != -1
                    && (Pawn.getAttackBB(pawnPosition, side) & BitUtils.getPositionIndexBitMask(enPassantIndex)) != 0
                    && (occupiedSquareBB & BitUtils.getPositionIndexBitMask(enPassantIndex)) == 0
                    && (board.pawnBB & enemyOccupiedSquareBB & BitUtils.getPositionIndexBitMask(enPassantIndex - 8 * ColorUtils.forward(side))) != 0) {
                buffer[count++] = Move.asBytesEnPassant(pawnPosition, enPassantIndex);
            }
        }

        count = addPieceMoves(board, PieceUtils.KNIGHT, friendlyOccupiedSquareBB, buffer, count);
        count = addPieceMoves(board, PieceUtils.BISHOP, friendlyOccupiedSquareBB, buffer, count);
        count = addPieceMoves(board, PieceUtils.ROOK, friendlyOccupiedSquareBB, buffer, count);
        count = addPieceMoves(board, PieceUtils.QUEEN, friendlyOccupiedSquareBB, buffer, count);
        count = addPieceMoves(board, PieceUtils.KING, friendlyOccupiedSquareBB, buffer, count);

        // Castles
        final boolean isKingInCheck = isKingAttacked(board, side);
        if(King.isCastleKingSideLegal(side, game, isKingInCheck)) {
            buffer[count++] = isWhiteTurn ? Move.CASTLE_KING_SIDE_WHITE_MOVE : Move.CASTLE_KING_SIDE_BLACK_MOVE;
        }
        if(King.isCastleQueenSideLegal(side, game, isKingInCheck)) {
            buffer[count++] = isWhiteTurn ? Move.CASTLE_QUEEN_SIDE_WHITE_MOVE : Move.CASTLE_QUEEN_SIDE_BLACK_MOVE;
        }

        return count;
    }

    private static int addPieceMoves(Board board, byte pieceType, long friendlyOccupiedSquareBB, int[] buffer, int count) {
        long piecesBB = board.pieceBB(pieceType) & friendlyOccupiedSquareBB;
        while(piecesBB != 0) {
            final int startPosition = BitUtils.bitScanForward(piecesBB);
            piecesBB &= piecesBB - 1;
            long movesBB = getAttackBB(startPosition, pieceType, board.gameBB) & ~friendlyOccupiedSquareBB;
            while(movesBB != 0) {
                final int endPosition = BitUtils.bitScanForward(movesBB);
                movesBB &= movesBB - 1;
                buffer[count++] = Move.asBytes(startPosition, endPosition, pieceType);
            }
        }
        return count;
    }

    /** Squares attacked by a non-pawn piece of the given type standing on {@code positionIndex}. */
    public static long getAttackBB(int positionIndex, byte pieceType, long occupiedBB) {
        return switch (pieceType) {
            case PieceUtils.KNIGHT -> Knight.getAttackBB(positionIndex);
            case PieceUtils.BISHOP -> Bishop.getAttackBB(positionIndex, occupiedBB);
            case PieceUtils.ROOK -> Rook.getAttackBB(positionIndex, occupiedBB);
            case PieceUtils.QUEEN -> Bishop.getAttackBB(positionIndex, occupiedBB) | Rook.getAttackBB(positionIndex, occupiedBB);
            case PieceUtils.KING -> King.getAttackBB(positionIndex);
            default -> 0L;
        };
    }

    /** Squares attacked by whatever stands on {@code positionIndex}, empty for an empty square. */
    public static long getAttackBB(int positionIndex, Board board) {
        byte pieceType = board.getPieceTypeAt(positionIndex);
        if(pieceType == PieceUtils.NONE) {
            return 0L;
        }
        if(pieceType == PieceUtils.PAWN) {
            return Pawn.getAttackBB(positionIndex, board.getColorAt(positionIndex));
        }
        return getAttackBB(positionIndex, pieceType, board.gameBB);
    }

    /** Pieces of {@code attackerColor} attacking {@code positionIndex}. */
    public static long getAttackersBB(int positionIndex, Board board, int attackerColor) {
        final long attackerBB = board.colorBB(attackerColor);
        final long occupiedBB = board.gameBB;
        final long bishopLikeBB = (board.bishopBB | board.queenBB) & attackerBB;
        final long rookLikeBB = (board.rookBB | board.queenBB) & attackerBB;

        // A pawn of ours on the target square would attack exactly the squares enemy pawns attack it from
        return (Pawn.getAttackBB(positionIndex, ColorUtils.switchColor(attackerColor)) & board.pawnBB & attackerBB)
                | (Knight.getAttackBB(positionIndex) & board.knightBB & attackerBB)
                | (King.getAttackBB(positionIndex) & board.kingBB & attackerBB)
                | (Bishop.getAttackBB(positionIndex, occupiedBB) & bishopLikeBB)
                | (Rook.getAttackBB(positionIndex, occupiedBB) & rookLikeBB);
    }

    public static boolean isSquareAttacked(int positionIndex, Board board, int attackerColor) {
        return getAttackersBB(positionIndex, board, attackerColor) != 0;
    }

    /** Every square attacked by at least one piece of {@code color}. */
    public static long getAttackedSquaresBB(Board board, int color) {
        long attackedBB = 0L;
        long piecesBB = board.colorBB(color);
        while(piecesBB != 0) {
            final int position = BitUtils.bitScanForward(piecesBB);
            piecesBB &= piecesBB - 1;
            attackedBB |= getAttackBB(position, board);
        }
        return attackedBB;
    }

    // A side without a king is never in check
    public static boolean isKingAttacked(Board board, int kingColor) {
        long kingBB = board.kingBB & board.colorBB(kingColor);
        if(kingBB == 0) {
            return false;
        }
        return isSquareAttacked(BitUtils.bitScanForward(kingBB), board, ColorUtils.switchColor(kingColor));
    }

    private MoveGenerator() {}
}
