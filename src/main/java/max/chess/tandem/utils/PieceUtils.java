package max.chess.tandem.utils;

public final class PieceUtils {
    // 4th bit is the color
    private static final int COLOR_SHIFT = 3;
    private static final int PIECE_TYPE_MASK = 0b0111;

    public static final byte NONE = 0;
    public static final byte PAWN = 1;
    public static final byte KNIGHT = 2;
    public static final byte BISHOP = 3;
    public static final byte ROOK = 4;
    public static final byte QUEEN = 5;
    public static final byte KING = 6;

    private static final String LETTERS = ".pnbrqk";

    private PieceUtils() {}

    public static int encode(int pieceType, int color) {
        return (color << COLOR_SHIFT) | pieceType;
    }

    public static int toPieceType(int code) {
        return code & PIECE_TYPE_MASK;
    }

    public static int toColor(int code) {
        return code >>> COLOR_SHIFT;
    }

    public static boolean isEmpty(int code) {
        return code == NONE;
    }

    /** Lowercase letter for a piece type ('p', 'n', ...), '.' for none. */
    public static char toLetter(int pieceType) {
        return LETTERS.charAt(pieceType);
    }

    /** FEN letter for a coded piece: uppercase for white, lowercase for black. */
    public static char toFenLetter(int code) {
        char c = toLetter(toPieceType(code));
        return toColor(code) == ColorUtils.WHITE ? Character.toUpperCase(c) : c;
    }

    /** Piece type for a letter of either case, or NONE if the letter is not a piece. */
    public static int fromLetter(char letter) {
        int idx = LETTERS.indexOf(Character.toLowerCase(letter));
        return idx <= 0 ? NONE : idx;
    }
}
