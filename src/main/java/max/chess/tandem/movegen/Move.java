package max.chess.tandem.movegen;

import max.chess.tandem.utils.PieceUtils;

/**
 * Moves are packed ints, never objects on the hot path.
 * <pre>
 * [5..0]   end square
 * [11..6]  start square
 * [14..12] promotion piece type (PieceUtils), 0 when none
 * [16..15] flags: 01 en passant, 10 castle
 * </pre>
 * {@code 0} is "no move" (written {@code 0000}).
 */
public final class Move {
    public static final int NONE = 0;

    private static final int FLAGS_MASK = 0b11 << 15;
    private static final int EN_PASSANT_FLAG = 0b01 << 15;
    private static final int CASTLE_FLAG = 0b10 << 15;

    private Move() {}

    public static int of(int startPosition, int endPosition) {
        return (startPosition << 6) | endPosition;
    }

    public static int promote(int startPosition, int endPosition, int promotion) {
        return (promotion << 12) | of(startPosition, endPosition);
    }

    public static int enPassant(int startPosition, int endPosition) {
        return of(startPosition, endPosition) | EN_PASSANT_FLAG;
    }

    public static int castle(int startPosition, int endPosition) {
        return of(startPosition, endPosition) | CASTLE_FLAG;
    }

    public static int getStartPosition(int move) {
        return (move >>> 6) & 0b111111;
    }

    public static int getEndPosition(int move) {
        return move & 0b111111;
    }

    public static int getPromotion(int move) {
        return (move >>> 12) & 0b111;
    }

    public static boolean isPromotion(int move) {
        return getPromotion(move) != PieceUtils.NONE;
    }

    public static boolean isEnPassant(int move) {
        return (move & FLAGS_MASK) == EN_PASSANT_FLAG;
    }

    public static boolean isCastle(int move) {
        return (move & FLAGS_MASK) == CASTLE_FLAG;
    }
}
