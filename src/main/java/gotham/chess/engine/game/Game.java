package gotham.chess.engine.game;

import gotham.chess.engine.game.board.Board;
import gotham.chess.engine.game.board.MovePlayed;
import gotham.chess.engine.movegen.Move;
import gotham.chess.engine.movegen.MoveGenerator;
import gotham.chess.engine.movegen.utils.BitBoardUtils;
import gotham.chess.engine.utils.BitUtils;
import gotham.chess.engine.utils.ColorUtils;
import gotham.chess.engine.utils.PieceUtils;
import gotham.chess.engine.utils.notations.MoveIOUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class Game {
    private final Board board;

    public int currentPlayer = ColorUtils.WHITE;
    public boolean whiteCanCastleKingSide = true;
    public boolean whiteCanCastleQueenSide = true;
    public boolean blackCanCastleKingSide = true;
    public boolean blackCanCastleQueenSide = true;

    public int halfMoveClock = 0;
    public int fullMoveClock = 1;

    public Game() {
        board = new Board(this);
    }

    private Game(Game other) {
        this.board = new Board(this, other.board);
        this.currentPlayer = other.currentPlayer;
        this.whiteCanCastleKingSide = other.whiteCanCastleKingSide;
        this.whiteCanCastleQueenSide = other.whiteCanCastleQueenSide;
        this.blackCanCastleKingSide = other.blackCanCastleKingSide;
        this.blackCanCastleQueenSide = other.blackCanCastleQueenSide;
        this.halfMoveClock = other.halfMoveClock;
        this.fullMoveClock = other.fullMoveClock;
    }

    /** Independent scratch copy, safe to mutate without touching this game. */
    public Game copy() {
        return new Game(this);
    }

    public int[] getLegalMoves() {
        return MoveGenerator.generateMoves(this);
    }

    public int getLegalMoves(int[] buffer) {
        return MoveGenerator.generateMoves(this, buffer);
    }

    public int getLegalMovesCount() {
        return MoveGenerator.countMoves(this);
    }

    public boolean isADraw() {
        return isInsufficientMaterial()
                || halfMoveClock >= 100;  // 50-moves rule
    }

    public long playMove(int move) {
        int previousHalfMoveClock = halfMoveClock;
        boolean previousWhiteCanCastleKingSide = whiteCanCastleKingSide;
        boolean previousWhiteCanCastleQueenSide = whiteCanCastleQueenSide;
        boolean previousBlackCanCastleKingSide = blackCanCastleKingSide;
        boolean previousBlackCanCastleQueenSide = blackCanCastleQueenSide;
        byte pieceType = Move.getPieceType(move);
        final int movePlayed = board.playMove(move);

        if(ColorUtils.isBlack(currentPlayer)) {
            fullMoveClock++;
        }

        int startPosition = Move.getStartPosition(move);
        int endPosition = Move.getEndPosition(move);
        if(pieceType == PieceUtils.KING) {
            if(ColorUtils.isWhite(currentPlayer)) {
                whiteCanCastleKingSide = false;
                whiteCanCastleQueenSide = false;
            } else {
                blackCanCastleKingSide = false;
                blackCanCastleQueenSide = false;
            }
        }

        // Removing castling rights when a rook leaves or is taken on its corner
        if(endPosition == 7 || startPosition == 7) {
            whiteCanCastleKingSide = false;
        }
        if(endPosition == 0 || startPosition == 0) {
            whiteCanCastleQueenSide = false;
        }
        if(endPosition == 63 || startPosition == 63) {
            blackCanCastleKingSide = false;
        }
        if(endPosition == 56 || startPosition == 56) {
            blackCanCastleQueenSide = false;
        }

        if(pieceType == PieceUtils.PAWN || MovePlayed.getPieceEaten(movePlayed) != PieceUtils.NONE) {
            halfMoveClock = 0;
        } else {
            halfMoveClock++;
        }

        nextTurn();

        return GameChanges.asBytes(movePlayed, previousHalfMoveClock, previousWhiteCanCastleKingSide, previousWhiteCanCastleQueenSide,
                previousBlackCanCastleKingSide, previousBlackCanCastleQueenSide);
    }

    public void undoMove(long gameChanges) {
        int movePlayed = GameChanges.getMovePlayed(gameChanges);
        board.undoMove(movePlayed);

        whiteCanCastleKingSide = GameChanges.getPreviousWhiteCanCastleKingSide(gameChanges);
        whiteCanCastleQueenSide = GameChanges.getPreviousWhiteCanCastleQueenSide(gameChanges);
        blackCanCastleKingSide = GameChanges.getPreviousBlackCanCastleKingSide(gameChanges);
        blackCanCastleQueenSide = GameChanges.getPreviousBlackCanCastleQueenSide(gameChanges);

        this.halfMoveClock = GameChanges.getPreviousHalfMoveClock(gameChanges);
        previousTurn();

        if(ColorUtils.isBlack(currentPlayer)) {
            fullMoveClock--;
        }
    }

    /** Passing is only allowed when it cannot leave the side to move's king capturable. */
    public boolean canPlayNullMove() {
        return hasBothKings() && !inCheck();
    }

    public long playNullMove() {
        int previousHalfMoveClock = halfMoveClock;
        final int movePlayed = board.playNullMove();

        if(ColorUtils.isBlack(currentPlayer)) {
            fullMoveClock++;
        }
        halfMoveClock++;
        nextTurn();

        return GameChanges.asBytes(movePlayed, previousHalfMoveClock, whiteCanCastleKingSide, whiteCanCastleQueenSide,
                blackCanCastleKingSide, blackCanCastleQueenSide);
    }

    public void undoNullMove(long gameChanges) {
        board.undoNullMove(GameChanges.getMovePlayed(gameChanges));
        this.halfMoveClock = GameChanges.getPreviousHalfMoveClock(gameChanges);
        previousTurn();
        if(ColorUtils.isBlack(currentPlayer)) {
            fullMoveClock--;
        }
    }

    public PlayerState getPlayerState() {
        boolean legalMovePossible = MoveGenerator.countMoves(this) > 0;
        if(!legalMovePossible) {
            // No legal move: either pat or checkmate depending on the king check state
            return inCheck() ? PlayerState.CHECKMATE : PlayerState.PAT;
        }
        if(isADraw()) {
            return PlayerState.DRAW;
        }
        return PlayerState.IN_PROGRESS;
    }

    public boolean inCheck() {
        return MoveGenerator.isKingAttacked(board, currentPlayer);
    }

    public boolean isCheckmate() {
        return inCheck() && MoveGenerator.countMoves(this) == 0;
    }

    public boolean isStalemate() {
        return !inCheck() && MoveGenerator.countMoves(this) == 0;
    }

    /**
     * No pawn, rook or queen left, and either at most one minor piece on the board or
     * only bishops all standing on the same square colour.
     */
    public boolean isInsufficientMaterial() {
        if((board.pawnBB | board.rookBB | board.queenBB) != 0) {
            return false;
        }
        long minorsBB = board.knightBB | board.bishopBB;
        if(BitUtils.bitCount(minorsBB) <= 1) {
            return true;
        }
        if(board.knightBB != 0) {
            return false;
        }
        return (board.bishopBB & BitBoardUtils.LIGHT_SQUARES) == 0
                || (board.bishopBB & BitBoardUtils.DARK_SQUARES) == 0;
    }

    public boolean isCapture(int move) {
        return Move.isEnPassant(move) || capturedPieceOf(move) != PieceUtils.NONE;
    }

    public boolean isCastling(int move) {
        return Move.isCastle(move);
    }

    public boolean isEnPassant(int move) {
        return Move.isEnPassant(move);
    }

    /** Piece type the move would capture, {@link PieceUtils#NONE} for quiet moves and castles. */
    public byte capturedPieceOf(int move) {
        if(Move.isCastle(move)) {
            return PieceUtils.NONE;
        }
        if(Move.isEnPassant(move)) {
            return PieceUtils.PAWN;
        }
        return board.getPieceTypeAt(Move.getEndPosition(move));
    }

    public boolean givesCheck(int move) {
        long changes = playMove(move);
        boolean check = inCheck();
        undoMove(changes);
        return check;
    }

    public byte pieceAt(int positionIndex) {
        return board.getPieceTypeAt(positionIndex);
    }

    public int colorAt(int positionIndex) {
        return board.getColorAt(positionIndex);
    }

    /** Squares attacked by the piece on {@code positionIndex}. */
    public long attacks(int positionIndex) {
        return MoveGenerator.getAttackBB(positionIndex, board);
    }

    public long attackersOf(int positionIndex, int attackerColor) {
        return MoveGenerator.getAttackersBB(positionIndex, board, attackerColor);
    }

    public boolean isSquareAttacked(int positionIndex, int attackerColor) {
        return MoveGenerator.isSquareAttacked(positionIndex, board, attackerColor);
    }

    /** Square of that colour's king, or -1 when it has none. */
    public int kingSquare(int color) {
        long kingBB = board.kingBB & board.colorBB(color);
        return kingBB == 0 ? -1 : BitUtils.bitScanForward(kingBB);
    }

    public boolean hasBothKings() {
        return kingSquare(ColorUtils.WHITE) != -1 && kingSquare(ColorUtils.BLACK) != -1;
    }

    /** Half moves played since the start of the game, derived from the move counters. */
    public int pliesPlayed() {
        return 2 * (fullMoveClock - 1) + (ColorUtils.isBlack(currentPlayer) ? 1 : 0);
    }

    public List<Long> playMoves(String moves) {
        return playMoves(Arrays.stream(moves.trim().split("\\s+")).toList());
    }

    public List<Long> playMoves(List<String> moveList) {
        List<Long> gameChangesList = new ArrayList<>(moveList.size());
        for(String move : moveList) {
            gameChangesList.add(playMove(MoveIOUtils.readMove(this, move)));
        }
        return gameChangesList;
    }

    public Board board() {
        return board;
    }

    public void nextTurn() {
        this.currentPlayer = ColorUtils.switchColor(currentPlayer);
    }

    public void previousTurn() {
        this.currentPlayer = ColorUtils.switchColor(currentPlayer);
    }

    @Override
    public String toString() {
        return boardAscii(this);
    }

    /** Returns an ASCII diagram of the board (ranks 8..1). */
    public static String boardAscii(Game game) {
        Board b = game.board();
        StringBuilder sb = new StringBuilder(8 * (8 + 4));
        for (int rank = 7; rank >= 0; rank--) {
            sb.append(rank + 1).append("  ");
            for (int file = 0; file < 8; file++) {
                int sq = rank * 8 + file;
                sb.append(PieceUtils.toFENLetter(b.getPieceTypeAt(sq), b.getColorAt(sq))).append(' ');
            }
            sb.append('\n');
        }
        sb.append("\n   a b c d e f g h");
        return sb.toString();
    }
}
