package gotham.chess.engine.utils.notations;

import gotham.chess.engine.game.Game;
import gotham.chess.engine.game.GameChanges;
import gotham.chess.engine.utils.BitUtils;
import gotham.chess.engine.utils.ColorUtils;
import gotham.chess.engine.utils.PieceUtils;

// FEN Visualizer: https://www.redhotpawn.com/chess/chess-fen-viewer.php
public final class FENUtils {

    // https://en.wikipedia.org/wiki/Forsyth%E2%80%93Edwards_Notation
    public static Game getBoardFrom(String FEN) {
        if(FEN == null) {
            throw new IllegalArgumentException("FEN record is null");
        }
        String[] fenFields = FEN.trim().split("\\s+");

        // Clocks are optional, as in EPD records
        if(fenFields.length != 6 && fenFields.length != 4) {
            throw new IllegalArgumentException("Invalid FEN record: " + FEN);
        }

        Game game = new Game();
        injectPiecePlacement(game, fenFields[0]);
        injectCurrentTurn(game, fenFields[1]);
        injectCastlingRights(game, fenFields[2]);
        injectEnPassantSquare(game, fenFields[3]);
        if(fenFields.length == 6) {
            game.halfMoveClock = parseClock(fenFields[4], FEN);
            // Leaves room for the plies a search plays on top of it
            if(game.halfMoveClock > GameChanges.MAX_HALF_MOVE_CLOCK / 2) {
                throw new IllegalArgumentException("Half move clock out of range in FEN record: " + FEN);
            }
            game.fullMoveClock = Math.max(1, parseClock(fenFields[5], FEN));
        }
        return game;
    }

    public static String getFENFromBoard(Game game) {
        StringBuilder fen = new StringBuilder(positionKey(game));
        fen.append(' ');
        int enPassantIndex = game.board().enPassantIndex;
        fen.append(enPassantIndex != -1 ? MoveIOUtils.getSquareFromPosition(enPassantIndex) : "-");
        fen.append(' ').append(game.halfMoveClock);
        fen.append(' ').append(game.fullMoveClock);
        return fen.toString();
    }

    /** Placement, side to move and castling rights: the part of a FEN identifying a book position. */
    public static String positionKey(Game game) {
        StringBuilder fen = new StringBuilder();
        injectPiecePlacement(game, fen);
        fen.append(' ').append(ColorUtils.isBlack(game.currentPlayer) ? 'b' : 'w');
        fen.append(' ');
        injectCastlingRights(game, fen);
        return fen.toString();
    }

    private static void injectCastlingRights(Game game, StringBuilder fen) {
        int length = fen.length();
        if(game.whiteCanCastleKingSide) {
            fen.append('K');
        }
        if(game.whiteCanCastleQueenSide) {
            fen.append('Q');
        }
        if(game.blackCanCastleKingSide) {
            fen.append('k');
        }
        if(game.blackCanCastleQueenSide) {
            fen.append('q');
        }
        if(fen.length() == length) {
            fen.append('-');
        }
    }

    private static void injectPiecePlacement(Game game, StringBuilder fen) {
        for(int rank = 7; rank >= 0; rank--) {
            int emptySpaceCounter = 0;
            if(rank != 7) {
                fen.append('/');
            }
            for(int file = 0; file < 8; file++) {
                int square = BitUtils.square(file, rank);
                byte pieceType = game.board().getPieceTypeAt(square);
                if(pieceType == PieceUtils.NONE) {
                    emptySpaceCounter++;
                    continue;
                }
                if(emptySpaceCounter != 0) {
                    fen.append(emptySpaceCounter);
                    emptySpaceCounter = 0;
                }
                fen.append(PieceUtils.toFENLetter(pieceType, game.board().getColorAt(square)));
            }
            if(emptySpaceCounter != 0) {
                fen.append(emptySpaceCounter);
            }
        }
    }

    private static int parseClock(String clock, String fen) {
        try {
            int value = Integer.parseInt(clock);
            if(value < 0) {
                throw new IllegalArgumentException("Negative clock in FEN record: " + fen);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid clock in FEN record: " + fen, e);
        }
    }

    private static void injectEnPassantSquare(Game game, String enPassantSquare) {
        if("-".equals(enPassantSquare)) {
            game.board().enPassantIndex = -1;
        } else {
            game.board().enPassantIndex = MoveIOUtils.getPositionFromSquare(enPassantSquare);
        }
    }

    private static void injectCastlingRights(Game game, String castlingRights) {
        game.whiteCanCastleKingSide = false;
        game.whiteCanCastleQueenSide = false;
        game.blackCanCastleKingSide = false;
        game.blackCanCastleQueenSide = false;
        if("-".equals(castlingRights)) {
            return;
        }

        for(char character : castlingRights.toCharArray()) {
            switch (character) {
                case 'K' -> game.whiteCanCastleKingSide = true;
                case 'k' -> game.blackCanCastleKingSide = true;
                case 'Q' -> game.whiteCanCastleQueenSide = true;
                case 'q' -> game.blackCanCastleQueenSide = true;
                default -> throw new IllegalArgumentException("Invalid castling rights: " + castlingRights);
            }
        }
    }

    private static void injectCurrentTurn(Game game, String currentTurn) {
        game.currentPlayer = switch (currentTurn) {
            case "w" -> ColorUtils.WHITE;
            case "b" -> ColorUtils.BLACK;
            default -> throw new IllegalArgumentException("Invalid side to move: " + currentTurn);
        };
    }

    private static void injectPiecePlacement(Game game, String piecePlacement) {
        String[] piecePlacementRows = piecePlacement.split("/");
        if(piecePlacementRows.length != 8) {
            throw new IllegalArgumentException("Piece placement should have 8 ranks: " + piecePlacement);
        }
        int rank = 7;
        for(String piecePlacementRow : piecePlacementRows) {
            int file = 0;
            for(char character : piecePlacementRow.toCharArray()) {
                if(character >= '1' && character <= '8') {
                    file += character - '0';
                    continue;
                }
                if(file > 7) {
                    throw new IllegalArgumentException("Rank overflow in piece placement: " + piecePlacement);
                }
                byte pieceType = PieceUtils.fromLetter(character);
                int color = Character.isUpperCase(character) ? ColorUtils.WHITE : ColorUtils.BLACK;
                game.board().addToBBs(BitUtils.getPositionIndexBitMask(BitUtils.square(file, rank)), pieceType, color);
                file++;
            }
            if(file != 8) {
                throw new IllegalArgumentException("Rank should describe 8 squares: " + piecePlacementRow);
            }
            rank--;
        }
    }

    private FENUtils() {}
}
