package max.chess.tandem.movegen.utils;

/** Precomputed mailbox geometry: knight/king targets and sliding rays, a1 = 0. */
public final class SquareUtils {
    public static final int NORTH = 0;
    public static final int SOUTH = 1;
    public static final int EAST = 2;
    public static final int WEST = 3;
    public static final int NORTH_EAST = 4;
    public static final int NORTH_WEST = 5;
    public static final int SOUTH_EAST = 6;
    public static final int SOUTH_WEST = 7;

    // {file delta, rank delta} per direction, orthogonals first
    private static final int[][] DIRECTION_DELTAS = {
            {0, 1}, {0, -1}, {1, 0}, {-1, 0},
            {1, 1}, {-1, 1}, {1, -1}, {-1, -1}
    };
    private static final int[][] KNIGHT_DELTAS = {
            {1, 2}, {2, 1}, {2, -1}, {1, -2}, {-1, -2}, {-2, -1}, {-2, 1}, {-1, 2}
    };

    public static final int[][] KNIGHT_TARGETS = new int[64][];
    public static final int[][] KING_TARGETS = new int[64][];
    /** RAYS[direction][square] = squares walked from (excluded) square to the board edge. */
    public static final int[][][] RAYS = new int[8][64][];

    static {
        for (int square = 0; square < 64; square++) {
            KNIGHT_TARGETS[square] = targets(square, KNIGHT_DELTAS);
            KING_TARGETS[square] = targets(square, DIRECTION_DELTAS);
            for (int direction = 0; direction < 8; direction++) {
                RAYS[direction][square] = ray(square, DIRECTION_DELTAS[direction]);
            }
        }
    }

    private SquareUtils() {}

    public static int file(int square) {
        return square & 7;
    }

    public static int rank(int square) {
        return square >>> 3;
    }

    public static int square(int file, int rank) {
        return (rank << 3) | file;
    }

    public static boolean isOrthogonal(int direction) {
        return direction < 4;
    }

    private static int[] targets(int square, int[][] deltas) {
        int[] buffer = new int[deltas.length];
        int count = 0;
        for (int[] delta : deltas) {
            int f = file(square) + delta[0];
            int r = rank(square) + delta[1];
            if (f >= 0 && f < 8 && r >= 0 && r < 8) buffer[count++] = square(f, r);
        }
        int[] result = new int[count];
        System.arraycopy(buffer, 0, result, 0, count);
        return result;
    }

    private static int[] ray(int square, int[] delta) {
        int[] buffer = new int[7];
        int count = 0;
        int f = file(square) + delta[0];
        int r = rank(square) + delta[1];
        while (f >= 0 && f < 8 && r >= 0 && r < 8) {
            buffer[count++] = square(f, r);
            f += delta[0];
            r += delta[1];
        }
        int[] result = new int[count];
        System.arraycopy(buffer, 0, result, 0, count);
        return result;
    }
}
