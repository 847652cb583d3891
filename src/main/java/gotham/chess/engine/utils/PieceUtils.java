package gotham.chess.engine.utils;

public final class PieceUtils {
    public static final byte NONE = 0;
    public static final byte PAWN = 1;
    public static final byte KNIGHT = 2;
    public static final byte BISHOP = 3;
    public static final byte ROOK = 4;
    public static final byte QUEEN = 5;
    public static final byte KING = 6;

    // Promotion choices, strongest first
    public static final byte[] PROMOTIONS = {QUEEN, ROOK, BISHOP, KNIGHT};

    public static boolean isSlider(int pieceType) {
        return pieceType == BISHOP || pieceType == ROOK || pieceType == QUEEN;
    }

    public static boolean isMinor(int pieceType) {
        return pieceType == KNIGHT || pieceType == BISHOP;
    }

    public static boolean isMajor(int pieceType) {
        return pieceType == ROOK || pieceType == QUEEN;
    }

    /** Lowercase FEN letter, or '.' for an empty square. */
    public static char toLetter(int pieceType) {
        return switch (pieceType) {
            case PAWN -> 'p';
            case KNIGHT -> 'n';
            case BISHOP -> 'b';
            case ROOK -> 'r';
            case QUEEN -> 'q';
            case KING -> 'k';
            default -> '.';
        };
    }

    public static char toFENLetter(int pieceType, int color) {
        char letter = toLetter(pieceType);
        return ColorUtils.isWhite(color) ? Character.toUpperCase(letter) : letter;
    }

    /** Parses a piece letter of either case; throws on anything else. */
    public static byte fromLetter(char letter) {
        return switch (Character.toLowerCase(letter)) {
            case 'p' -> PAWN;
            case 'n' -> KNIGHT;
            case 'b' -> BISHOP;
            case 'r' -> ROOK;
            case 'q' -> QUEEN;
            case 'k' -> KING;
            default -> throw new IllegalArgumentException("Unknown piece letter " + letter);
        };
    }

    private PieceUtils() {}
}
