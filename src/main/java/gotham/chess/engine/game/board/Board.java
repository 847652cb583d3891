package gotham.chess.engine.game.board;

import gotham.chess.engine.game.Game;
import gotham.chess.engine.movegen.Move;
import gotham.chess.engine.utils.BitUtils;
import gotham.chess.engine.utils.ColorUtils;
import gotham.chess.engine.utils.PieceUtils;

import java.util.Arrays;

public class Board {
    private final Game game;
    public long bishopBB = 0;
    public long queenBB = 0;
    public long kingBB = 0;
    public long knightBB = 0;
    public long rookBB = 0;
    public long pawnBB = 0;

    public long whiteBB = 0;
    public long blackBB = 0;

    public long gameBB = 0;

    public int enPassantIndex = -1;

    private final byte[] pieceAt;

    public Board(Game game) {
        this.game = game;
        this.pieceAt = new byte[64];
        Arrays.fill(pieceAt, PieceUtils.NONE);
    }

    public Board(Game game, Board other) {
        this.game = game;
        this.bishopBB = other.bishopBB;
        this.queenBB = other.queenBB;
        this.kingBB = other.kingBB;
        this.knightBB = other.knightBB;
        this.rookBB = other.rookBB;
        this.pawnBB = other.pawnBB;
        this.whiteBB = other.whiteBB;
        this.blackBB = other.blackBB;
        this.gameBB = other.gameBB;
        this.enPassantIndex = other.enPassantIndex;
        this.pieceAt = other.pieceAt.clone();
    }

    public byte getPieceTypeAt(int positionIndex) {
        return pieceAt[positionIndex];
    }

    /** {@link ColorUtils#WHITE}, {@link ColorUtils#BLACK}, or 0 for an empty square. */
    public int getColorAt(int positionIndex) {
        long positionBB = BitUtils.getPositionIndexBitMask(positionIndex);
        if((whiteBB & positionBB) != 0) {
            return ColorUtils.WHITE;
        } else if((blackBB & positionBB) != 0) {
            return ColorUtils.BLACK;
        }
        return 0;
    }

    public long colorBB(int color) {
        return ColorUtils.isWhite(color) ? whiteBB : blackBB;
    }

    public long pieceBB(byte pieceType) {
        return switch (pieceType) {
            case PieceUtils.PAWN -> pawnBB;
            case PieceUtils.KNIGHT -> knightBB;
            case PieceUtils.BISHOP -> bishopBB;
            case PieceUtils.ROOK -> rookBB;
            case PieceUtils.QUEEN -> queenBB;
            case PieceUtils.KING -> kingBB;
            default -> 0L;
        };
    }

    public int playMove(int move) {
        if(Move.isCastleKingSide(move)) {
            return playCastleKingSide(move);
        } else if(Move.isCastleQueenSide(move)) {
            return playCastleQueenSide(move);
        }
        boolean isEnPassant = Move.isEnPassant(move);
        byte pieceType = Move.getPieceType(move);
        int startPosition = Move.getStartPosition(move);
        int endPosition = Move.getEndPosition(move);
        byte promotion = Move.getPromotion(move);
        int originalEnPassantIndex = enPassantIndex;
        long startPositionBB = BitUtils.getPositionIndexBitMask(startPosition);
        long endPositionBB = BitUtils.getPositionIndexBitMask(endPosition);
        long pieceEatenBB = endPositionBB;
        byte pieceEaten;
        int pieceColor = game.currentPlayer;

        if(isEnPassant) {
            int enPassantEatenIndex = (ColorUtils.isWhite(pieceColor) ? endPosition - 8 : endPosition + 8);
            pieceEaten = PieceUtils.PAWN;
            pieceEatenBB = BitUtils.getPositionIndexBitMask(enPassantEatenIndex);
        } else {
            pieceEaten = pieceAt[endPosition];
        }

        if(pieceType == PieceUtils.PAWN && Math.abs(endPosition - startPosition) == 16) {
            enPassantIndex = ColorUtils.isWhite(pieceColor) ? startPosition + 8 : startPosition - 8;
        } else {
            enPassantIndex = -1;
        }

        if(pieceEaten != PieceUtils.NONE) {
            removeFromBBs(pieceEatenBB, pieceEaten, ColorUtils.switchColor(pieceColor));
        }

        if(promotion != PieceUtils.NONE) {
            removeFromBBs(startPositionBB, pieceType, pieceColor);
            addToBBs(endPositionBB, promotion, pieceColor);
        } else {
            updateBBs(startPositionBB, endPositionBB, pieceType, pieceColor);
        }

        return MovePlayed.asBytes(move, pieceEaten, originalEnPassantIndex);
    }

    /** Only the en passant square changes when a side passes its turn. */
    public int playNullMove() {
        int originalEnPassantIndex = enPassantIndex;
        enPassantIndex = -1;
        return MovePlayed.asBytes(Move.NONE, PieceUtils.NONE, originalEnPassantIndex);
    }

    public void undoNullMove(int movePlayed) {
        enPassantIndex = MovePlayed.getPreviousEnPassantIndex(movePlayed);
    }

    private int playCastleQueenSide(int move) {
        int originalEnPassantIndex = enPassantIndex;
        castleQueenSide(game.currentPlayer);
        enPassantIndex = -1;
        return MovePlayed.asBytes(move, PieceUtils.NONE, originalEnPassantIndex);
    }

    private int playCastleKingSide(int move) {
        int originalEnPassantIndex = enPassantIndex;
        castleKingSide(game.currentPlayer);
        enPassantIndex = -1;
        return MovePlayed.asBytes(move, PieceUtils.NONE, originalEnPassantIndex);
    }

    private void castleKingSide(int color) {
        int homeSquare = ColorUtils.isWhite(color) ? 4 : 60;
        moveCastlingPieces(color, homeSquare, homeSquare + 2, homeSquare + 3, homeSquare + 1);
    }

    private void undoCastleKingSide(int color) {
        int homeSquare = ColorUtils.isWhite(color) ? 4 : 60;
        moveCastlingPieces(color, homeSquare + 2, homeSquare, homeSquare + 1, homeSquare + 3);
    }

    private void castleQueenSide(int color) {
        int homeSquare = ColorUtils.isWhite(color) ? 4 : 60;
        moveCastlingPieces(color, homeSquare, homeSquare - 2, homeSquare - 4, homeSquare - 1);
    }

    private void undoCastleQueenSide(int color) {
        int homeSquare = ColorUtils.isWhite(color) ? 4 : 60;
        moveCastlingPieces(color, homeSquare - 2, homeSquare, homeSquare - 1, homeSquare - 4);
    }

    private void moveCastlingPieces(int color, int kingFrom, int kingTo, int rookFrom, int rookTo) {
        updateBBs(BitUtils.getPositionIndexBitMask(kingFrom), BitUtils.getPositionIndexBitMask(kingTo), PieceUtils.KING, color);
        updateBBs(BitUtils.getPositionIndexBitMask(rookFrom), BitUtils.getPositionIndexBitMask(rookTo), PieceUtils.ROOK, color);
    }

    private void removeFromBBs(long bb, byte pieceType, int color) {
        switch (pieceType) {
            case PieceUtils.PAWN -> pawnBB &= ~bb;
            case PieceUtils.KNIGHT -> knightBB &= ~bb;
            case PieceUtils.BISHOP -> bishopBB &= ~bb;
            case PieceUtils.ROOK -> rookBB &= ~bb;
            case PieceUtils.QUEEN -> queenBB &= ~bb;
            case PieceUtils.KING -> kingBB &= ~bb;
            default -> {
                return;
            }
        }
        if(ColorUtils.isWhite(color)) {
            whiteBB &= ~bb;
        } else {
            blackBB &= ~bb;
        }
        gameBB &= ~bb;

        pieceAt[BitUtils.bitScanForward(bb)] = PieceUtils.NONE;
    }

    public void addToBBs(long bb, byte pieceType, int color) {
        switch (pieceType) {
            case PieceUtils.PAWN -> pawnBB |= bb;
            case PieceUtils.KNIGHT -> knightBB |= bb;
            case PieceUtils.BISHOP -> bishopBB |= bb;
            case PieceUtils.ROOK -> rookBB |= bb;
            case PieceUtils.QUEEN -> queenBB |= bb;
            case PieceUtils.KING -> kingBB |= bb;
            default -> {
                return;
            }
        }
        if(ColorUtils.isWhite(color)) {
            whiteBB |= bb;
        } else {
            blackBB |= bb;
        }
        gameBB |= bb;

        pieceAt[BitUtils.bitScanForward(bb)] = pieceType;
    }

    private void updateBBs(long oldBB, long newBB, byte pieceType, int color) {
        removeFromBBs(oldBB, pieceType, color);
        addToBBs(newBB, pieceType, color);
    }

    public void undoMove(int movePlayed) {
        final int move = MovePlayed.getMove(movePlayed);
        int pieceColor = ColorUtils.switchColor(game.currentPlayer);

        if(Move.isCastleKingSide(move)) {
            undoCastleKingSide(pieceColor);
        } else if(Move.isCastleQueenSide(move)) {
            undoCastleQueenSide(pieceColor);
        } else {
            int startPosition = Move.getStartPosition(move);
            int endPosition = Move.getEndPosition(move);
            byte promotion = Move.getPromotion(move);
            byte pieceEaten = MovePlayed.getPieceEaten(movePlayed);
            long startPositionBB = BitUtils.getPositionIndexBitMask(startPosition);
            long endPositionBB = BitUtils.getPositionIndexBitMask(endPosition);
            byte pieceType = Move.getPieceType(move);
            if(promotion != PieceUtils.NONE) {
                removeFromBBs(endPositionBB, promotion, pieceColor);
                addToBBs(startPositionBB, PieceUtils.PAWN, pieceColor);
            } else {
                updateBBs(endPositionBB, startPositionBB, pieceType, pieceColor);
            }

            if(pieceEaten != PieceUtils.NONE) {
                if(Move.isEnPassant(move)) {
                    int enPassantEatenIndex = ColorUtils.isWhite(pieceColor)
                            ? endPosition - 8
                            : endPosition + 8;
                    addToBBs(BitUtils.getPositionIndexBitMask(enPassantEatenIndex),
                            PieceUtils.PAWN, ColorUtils.switchColor(pieceColor));
                } else {
                    addToBBs(endPositionBB, pieceEaten, ColorUtils.switchColor(pieceColor));
                }
            }
        }

        enPassantIndex = MovePlayed.getPreviousEnPassantIndex(movePlayed);
    }

    public Game game() {
        return game;
    }
}
