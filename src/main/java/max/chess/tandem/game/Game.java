package max.chess.tandem.game;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import max.chess.tandem.movegen.utils.CheckUtils;
import max.chess.tandem.movegen.Move;
import max.chess.tandem.movegen.MoveGenerator;
import max.chess.tandem.search.evaluator.PieceValues;
import max.chess.tandem.utils.ColorUtils;
import max.chess.tandem.utils.PieceUtils;

import java.util.Arrays;

/**
 * Position state: 64-square mailbox (a1 = 0, h8 = 63), side to move, castling rights,
 * en-passant square, clocks, incremental Zobrist key, key history and undo stack.
 * Mutated in place by {@link #playMove(int)} / {@link #undoMove(long)}; a lookahead must always
 * restore the exact previous state.
 */
public class Game {
    public static final int CASTLE_WHITE_KING_SIDE = 1;
    public static final int CASTLE_WHITE_QUEEN_SIDE = 2;
    public static final int CASTLE_BLACK_KING_SIDE = 4;
    public static final int CASTLE_BLACK_QUEEN_SIDE = 8;

    // rights kept after a move touches the square (king/rook moved or rook captured)
    private static final int[] CASTLE_MASK = new int[64];
    static {
        Arrays.fill(CASTLE_MASK, 15);
        CASTLE_MASK[0] = 15 & ~CASTLE_WHITE_QUEEN_SIDE;
        CASTLE_MASK[4] = 15 & ~(CASTLE_WHITE_KING_SIDE | CASTLE_WHITE_QUEEN_SIDE);
        CASTLE_MASK[7] = 15 & ~CASTLE_WHITE_KING_SIDE;
        CASTLE_MASK[56] = 15 & ~CASTLE_BLACK_QUEEN_SIDE;
        CASTLE_MASK[60] = 15 & ~(CASTLE_BLACK_KING_SIDE | CASTLE_BLACK_QUEEN_SIDE);
        CASTLE_MASK[63] = 15 & ~CASTLE_BLACK_KING_SIDE;
    }

    // undo word: [16..0]=move, [20..17]=captured, [24..21]=castling, [31..25]=ep+1, [47..32]=halfmove, [48]=null
    private static final long NULL_MOVE_FLAG = 1L << 48;

    private final int[] squares = new int[64];
    private final int[] kingSquare = {-1, -1};
    private int currentPlayer = ColorUtils.WHITE;
    private int castlingRights;
    private int enPassantSquare = -1;
    private int halfMoveClock = 0;
    private int fullMoveClock = 1;
    private long zobristKey;

    private final LongArrayList keyHistory = new LongArrayList(256);
    private final LongArrayList undoStack = new LongArrayList(256);

    // scratch buffer for terminal checks, never shared with callers
    private final int[] scratch = new int[MoveGenerator.MAX_MOVES];

    public Game() {
        recomputeZobristKey();
    }

    /* -------------------- setup (FEN) -------------------- */

    public void setPiece(int square, int code) {
        squares[square] = code;
        if (PieceUtils.toPieceType(code) == PieceUtils.KING) {
            kingSquare[PieceUtils.toColor(code)] = square;
        }
    }

    public void setCurrentPlayer(int color) { this.currentPlayer = color; }
    public void setCastlingRights(int rights) { this.castlingRights = rights & 15; }
    public void setEnPassantSquare(int square) { this.enPassantSquare = square; }
    public void setHalfMoveClock(int clock) { this.halfMoveClock = clock; }
    public void setFullMoveClock(int clock) { this.fullMoveClock = clock; }

    public void recomputeZobristKey() {
        zobristKey = ZobristHashKeys.getHashKey(this);
    }

    /* -------------------- accessors -------------------- */

    public int pieceAt(int square) { return squares[square]; }
    public int currentPlayer() { return currentPlayer; }
    public int castlingRights() { return castlingRights; }
    public int enPassantSquare() { return enPassantSquare; }
    public int halfMoveClock() { return halfMoveClock; }
    public int fullMoveClock() { return fullMoveClock; }
    public long zobristKey() { return zobristKey; }
    public int kingSquare(int color) { return kingSquare[color]; }

    /** Depth of the undo stack; pass to {@link #rewind(int)} to restore this exact state. */
    public int mark() { return undoStack.size(); }

    /* -------------------- move generation & status -------------------- */

    public int getLegalMoves(int[] buffer) {
        return MoveGenerator.generateLegalMoves(this, buffer);
    }

    public boolean hasLegalMove() {
        return getLegalMoves(scratch) > 0;
    }

    public boolean inCheck() {
        int king = kingSquare[currentPlayer];
        return king >= 0 && CheckUtils.isSquareAttacked(this, king, ColorUtils.switchColor(currentPlayer));
    }

    public boolean isCheckmate() {
        return inCheck() && !hasLegalMove();
    }

    public boolean isStalemate() {
        return !inCheck() && !hasLegalMove();
    }

    public boolean isFiftyMoveDraw() {
        return halfMoveClock >= 100;
    }

    /**
     * True when the current position occurred at least {@code count - 1} times before, looking only at
     * positions since the last irreversible move with the same side to move.
     */
    public boolean isRepetition(int count) {
        int seen = 1;
        int size = keyHistory.size();
        int limit = Math.max(0, size - halfMoveClock);
        for (int i = size - 2; i >= limit; i -= 2) {
            if (keyHistory.getLong(i) == zobristKey && ++seen >= count) return true;
        }
        return false;
    }

    /** Threefold repetition or fifty-move rule. */
    public boolean canClaimDraw() {
        return isFiftyMoveDraw() || isRepetition(3);
    }

    public boolean isInsufficientMaterial() {
        int minors = 0;
        int lightBishops = 0, darkBishops = 0, knights = 0;
        for (int sq = 0; sq < 64; sq++) {
            int type = PieceUtils.toPieceType(squares[sq]);
            switch (type) {
                case PieceUtils.PAWN, PieceUtils.ROOK, PieceUtils.QUEEN -> { return false; }
                case PieceUtils.KNIGHT -> { knights++; minors++; }
                case PieceUtils.BISHOP -> {
                    minors++;
                    if ((((sq >>> 3) + (sq & 7)) & 1) == 0) darkBishops++; else lightBishops++;
                }
                default -> { }
            }
        }
        if (minors <= 1) return true;
        // only bishops, all on one square colour
        return knights == 0 && (lightBishops == 0 || darkBishops == 0);
    }

    /** Knight/bishop/rook/queen material of one side, in centipawns. */
    public int nonPawnMaterial(int color) {
        int total = 0;
        for (int sq = 0; sq < 64; sq++) {
            int code = squares[sq];
            if (code == 0 || PieceUtils.toColor(code) != color) continue;
            int type = PieceUtils.toPieceType(code);
            if (type != PieceUtils.PAWN && type != PieceUtils.KING) total += PieceValues.VAL[type];
        }
        return total;
    }

    public boolean isCapture(int move) {
        return Move.isEnPassant(move) || squares[Move.getEndPosition(move)] != 0;
    }

    /** Capture or promotion. */
    public boolean isTactical(int move) {
        return isCapture(move) || Move.isPromotion(move);
    }

    /** Type of the piece a move captures (pawn for en passant), NONE for quiet moves. */
    public int capturedPieceType(int move) {
        if (Move.isEnPassant(move)) return PieceUtils.PAWN;
        return PieceUtils.toPieceType(squares[Move.getEndPosition(move)]);
    }

    public int movingPieceType(int move) {
        return PieceUtils.toPieceType(squares[Move.getStartPosition(move)]);
    }

    public boolean givesCheck(int move) {
        long undo = playMove(move);
        boolean check = inCheck();
        undoMove(undo);
        return check;
    }

    /* -------------------- make / unmake -------------------- */

    public long playMove(int move) {
        final int us = currentPlayer;
        final int from = Move.getStartPosition(move);
        final int to = Move.getEndPosition(move);
        final int piece = squares[from];
        final boolean enPassant = Move.isEnPassant(move);
        final int captureSquare = enPassant ? (us == ColorUtils.WHITE ? to - 8 : to + 8) : to;
        final int captured = squares[captureSquare];

        long undo = (move & 0x1FFFFL)
                | ((long) captured << 17)
                | ((long) castlingRights << 21)
                | ((long) (enPassantSquare + 1) << 25)
                | ((long) halfMoveClock << 32);
        keyHistory.add(zobristKey);
        undoStack.add(undo);

        long key = zobristKey;
        if (enPassantSquare >= 0) key ^= ZobristHashKeys.EN_PASSANT_FILE[enPassantSquare & 7];
        key ^= ZobristHashKeys.CASTLING[castlingRights];

        if (captured != 0) {
            squares[captureSquare] = 0;
            key ^= ZobristHashKeys.PIECE_SQUARE[captured][captureSquare];
        }
        squares[from] = 0;
        key ^= ZobristHashKeys.PIECE_SQUARE[piece][from];
        final int promotion = Move.getPromotion(move);
        final int placed = promotion != PieceUtils.NONE ? PieceUtils.encode(promotion, us) : piece;
        squares[to] = placed;
        key ^= ZobristHashKeys.PIECE_SQUARE[placed][to];

        final int type = PieceUtils.toPieceType(piece);
        if (type == PieceUtils.KING) {
            kingSquare[us] = to;
            if (Move.isCastle(move)) {
                int rookFrom = to > from ? from + 3 : from - 4;
                int rookTo = to > from ? from + 1 : from - 1;
                int rook = squares[rookFrom];
                squares[rookFrom] = 0;
                squares[rookTo] = rook;
                key ^= ZobristHashKeys.PIECE_SQUARE[rook][rookFrom] ^ ZobristHashKeys.PIECE_SQUARE[rook][rookTo];
            }
        }

        castlingRights &= CASTLE_MASK[from] & CASTLE_MASK[to];
        key ^= ZobristHashKeys.CASTLING[castlingRights];

        enPassantSquare = -1;
        if (type == PieceUtils.PAWN && Math.abs(to - from) == 16) {
            enPassantSquare = (from + to) >>> 1;
            key ^= ZobristHashKeys.EN_PASSANT_FILE[enPassantSquare & 7];
        }

        halfMoveClock = (type == PieceUtils.PAWN || captured != 0) ? 0 : halfMoveClock + 1;
        if (us == ColorUtils.BLACK) fullMoveClock++;
        currentPlayer = ColorUtils.switchColor(us);
        key ^= ZobristHashKeys.SIDE_TO_MOVE;
        zobristKey = key;
        return undo;
    }

    public void undoMove(long undo) {
        if ((undo & NULL_MOVE_FLAG) != 0) {
            undoNullMove(undo);
            return;
        }
        undoStack.popLong();
        final int move = (int) (undo & 0x1FFFFL);
        final int us = ColorUtils.switchColor(currentPlayer);
        currentPlayer = us;
        if (us == ColorUtils.BLACK) fullMoveClock--;

        final int from = Move.getStartPosition(move);
        final int to = Move.getEndPosition(move);
        final int placed = squares[to];
        final int piece = Move.isPromotion(move) ? PieceUtils.encode(PieceUtils.PAWN, us) : placed;
        squares[from] = piece;
        squares[to] = 0;

        final int captured = (int) ((undo >>> 17) & 0xF);
        if (captured != 0) {
            int captureSquare = Move.isEnPassant(move) ? (us == ColorUtils.WHITE ? to - 8 : to + 8) : to;
            squares[captureSquare] = captured;
        }
        if (PieceUtils.toPieceType(piece) == PieceUtils.KING) {
            kingSquare[us] = from;
            if (Move.isCastle(move)) {
                int rookFrom = to > from ? from + 3 : from - 4;
                int rookTo = to > from ? from + 1 : from - 1;
                squares[rookFrom] = squares[rookTo];
                squares[rookTo] = 0;
            }
        }
        restoreIrreversible(undo);
    }

    /** Passes the turn. Clears en passant; used by null-move pruning only. */
    public long playNullMove() {
        long undo = NULL_MOVE_FLAG
                | ((long) castlingRights << 21)
                | ((long) (enPassantSquare + 1) << 25)
                | ((long) halfMoveClock << 32);
        keyHistory.add(zobristKey);
        undoStack.add(undo);
        long key = zobristKey;
        if (enPassantSquare >= 0) key ^= ZobristHashKeys.EN_PASSANT_FILE[enPassantSquare & 7];
        enPassantSquare = -1;
        halfMoveClock++;
        currentPlayer = ColorUtils.switchColor(currentPlayer);
        zobristKey = key ^ ZobristHashKeys.SIDE_TO_MOVE;
        return undo;
    }

    public void undoNullMove(long undo) {
        undoStack.popLong();
        currentPlayer = ColorUtils.switchColor(currentPlayer);
        restoreIrreversible(undo);
    }

    /** Undo everything played since {@code mark} was taken. */
    public void rewind(int mark) {
        while (undoStack.size() > mark) {
            undoMove(undoStack.getLong(undoStack.size() - 1));
        }
    }

    private void restoreIrreversible(long undo) {
        castlingRights = (int) ((undo >>> 21) & 0xF);
        enPassantSquare = (int) ((undo >>> 25) & 0x7F) - 1;
        halfMoveClock = (int) ((undo >>> 32) & 0xFFFF);
        zobristKey = keyHistory.popLong();
    }

    /** Independent deep copy, history included. */
    public Game copy() {
        return new Game(this);
    }

    protected Game(Game source) {
        System.arraycopy(source.squares, 0, squares, 0, 64);
        kingSquare[0] = source.kingSquare[0];
        kingSquare[1] = source.kingSquare[1];
        currentPlayer = source.currentPlayer;
        castlingRights = source.castlingRights;
        enPassantSquare = source.enPassantSquare;
        halfMoveClock = source.halfMoveClock;
        fullMoveClock = source.fullMoveClock;
        zobristKey = source.zobristKey;
        keyHistory.addAll(source.keyHistory);
        undoStack.addAll(source.undoStack);
    }
}
