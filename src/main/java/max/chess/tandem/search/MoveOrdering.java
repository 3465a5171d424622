package max.chess.tandem.search;

import max.chess.tandem.game.Game;
import max.chess.tandem.movegen.Move;
import max.chess.tandem.search.evaluator.PieceValues;

/**
 * Priority: TT move > MVV-LVA captures > promotions > killers > checking moves > history > rest.
 * Sorting is an insertion sort over the move buffer of the ply, with flags carried along.
 */
public final class MoveOrdering {
    static final int FLAG_TACTICAL = 1;
    static final int FLAG_CHECK = 2;

    private static final int TT_MOVE_SCORE = 1_000_000;
    private static final int CAPTURE_BASE = 100_000;
    private static final int PROMOTION_BASE = 90_000;
    private static final int KILLER_1_SCORE = 80_000;
    private static final int KILLER_2_SCORE = 79_000;
    private static final int CHECK_SCORE = 70_000;
    private static final int HISTORY_CAP = 60_000;

    private MoveOrdering() {}

    /** Scores, flags and sorts {@code moves[0..n)} for a full-width node at {@code ply}. */
    static void scoreAndSort(Game g, SearchContext ctx, int[] moves, int n, int ttMove, int ply) {
        final int[] scores = ctx.scoreBuf[ply];
        final int[] flags = ctx.flagBuf[ply];
        final int side = g.currentPlayer();
        final int[] killers = ply < SearchConstants.MAX_PLY ? ctx.killer[ply] : null;

        for (int i = 0; i < n; i++) {
            final int m = moves[i];
            final boolean capture = g.isCapture(m);
            final boolean tactical = capture || Move.isPromotion(m);
            final boolean check = g.givesCheck(m);
            flags[i] = (tactical ? FLAG_TACTICAL : 0) | (check ? FLAG_CHECK : 0);

            int s;
            if (m == ttMove) s = TT_MOVE_SCORE;
            else if (capture) s = CAPTURE_BASE + mvvLva(g, m);
            else if (tactical) s = PROMOTION_BASE + PieceValues.VAL[Move.getPromotion(m)];
            else if (killers != null && m == killers[0]) s = KILLER_1_SCORE;
            else if (killers != null && m == killers[1]) s = KILLER_2_SCORE;
            else if (check) s = CHECK_SCORE;
            else s = Math.min(HISTORY_CAP, ctx.history[side][Move.getEndPosition(m)]);
            scores[i] = s;
        }
        sort(moves, scores, flags, 0, n);
    }

    /**
     * Keeps captures, promotions and (when {@code withChecks}) checking moves, scored MVV-LVA first.
     * Returns how many moves were kept at the front of {@code moves}.
     */
    static int partitionTactical(Game g, SearchContext ctx, int[] moves, int n, boolean withChecks, int ply) {
        final int[] scores = ctx.scoreBuf[ply];
        final int[] flags = ctx.flagBuf[ply];
        int k = 0;
        for (int i = 0; i < n; i++) {
            final int m = moves[i];
            final boolean capture = g.isCapture(m);
            final boolean tactical = capture || Move.isPromotion(m);
            final boolean check = (withChecks || tactical) && g.givesCheck(m);
            if (!tactical && !check) continue;
            moves[k] = m;
            flags[k] = (tactical ? FLAG_TACTICAL : 0) | (check ? FLAG_CHECK : 0);
            if (capture) scores[k] = CAPTURE_BASE + mvvLva(g, m);
            else if (tactical) scores[k] = PROMOTION_BASE + PieceValues.VAL[Move.getPromotion(m)];
            else scores[k] = CHECK_SCORE;
            k++;
        }
        sort(moves, scores, flags, 0, k);
        return k;
    }

    /** Victim value first, cheaper attacker breaks ties. Always positive for captures. */
    public static int mvvLva(Game g, int move) {
        int victim = g.capturedPieceType(move);
        if (victim == 0) return 0;
        int attacker = g.movingPieceType(move);
        return PieceValues.VAL[victim] * 8 - PieceValues.lvaRankOfPiece(attacker);
    }

    /** Records a quiet move that failed high. */
    static void recordQuietCutoff(Game g, SearchContext ctx, int move, int depth, int ply) {
        if (ply < SearchConstants.MAX_PLY) {
            int[] k = ctx.killer[ply];
            if (k[0] != move) {
                k[1] = k[0];
                k[0] = move;
            }
        }
        ctx.history[g.currentPlayer()][Move.getEndPosition(move)] += depth * depth;
    }

    private static void sort(int[] moves, int[] scores, int[] flags, int from, int to) {
        for (int i = from + 1; i < to; i++) {
            int m = moves[i], s = scores[i], f = flags[i], j = i - 1;
            while (j >= from && scores[j] < s) {
                moves[j + 1] = moves[j];
                scores[j + 1] = scores[j];
                flags[j + 1] = flags[j];
                j--;
            }
            moves[j + 1] = m;
            scores[j + 1] = s;
            flags[j + 1] = f;
        }
    }
}
