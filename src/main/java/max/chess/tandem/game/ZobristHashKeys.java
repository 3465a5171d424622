package max.chess.tandem.game;

import java.util.SplittableRandom;

/** Fixed-seed Zobrist tables, shared by every Game. */
public final class ZobristHashKeys {
    // indexed by coded piece (type | color << 3), 16 slots to keep indexing branch-free
    static final long[][] PIECE_SQUARE = new long[16][64];
    static final long[] CASTLING = new long[16];
    static final long[] EN_PASSANT_FILE = new long[8];
    static final long SIDE_TO_MOVE;

    static {
        SplittableRandom random = new SplittableRandom(0x5EEDC0FFEEL);
        for (int piece = 0; piece < 16; piece++) {
            for (int square = 0; square < 64; square++) {
                PIECE_SQUARE[piece][square] = random.nextLong();
            }
        }
        for (int i = 0; i < 16; i++) CASTLING[i] = random.nextLong();
        for (int i = 0; i < 8; i++) EN_PASSANT_FILE[i] = random.nextLong();
        SIDE_TO_MOVE = random.nextLong();
    }

    private ZobristHashKeys() {}

    /** Full recomputation; Game keeps the key incrementally and uses this for (re)initialisation and checks. */
    public static long getHashKey(Game game) {
        long key = 0L;
        for (int square = 0; square < 64; square++) {
            int piece = game.pieceAt(square);
            if (piece != 0) key ^= PIECE_SQUARE[piece][square];
        }
        key ^= CASTLING[game.castlingRights()];
        if (game.enPassantSquare() >= 0) key ^= EN_PASSANT_FILE[game.enPassantSquare() & 7];
        if (game.currentPlayer() != 0) key ^= SIDE_TO_MOVE;
        return key;
    }
}
