package max.chess.tandem.search;

import max.chess.tandem.game.Game;
import max.chess.tandem.search.evaluator.GameValues;
import max.chess.tandem.search.evaluator.PieceValues;
import max.chess.tandem.search.evaluator.PositionEvaluator;

import static max.chess.tandem.search.SearchConstants.STACK_PLY;

/**
 * Leaf search over captures and promotions (plus checking moves in the first
 * {@code qsCheckPlies} plies), fail-hard around the stand-pat score. In check, all evasions.
 */
final class Quiescence {

    private Quiescence() {}

    static int search(Game g, SearchContext ctx, int alpha, int beta, int ply, int qPly) {
        if (ctx.shouldStop()) return 0;
        ctx.qNodes++;

        if (ply >= STACK_PLY - 1) return PositionEvaluator.evaluateStatic(g);

        final boolean inCheck = g.inCheck();
        final int[] moves = ctx.moveBuf[ply];
        final int n = g.getLegalMoves(moves);
        if (n == 0) {
            return inCheck ? -(GameValues.CHECKMATE_VALUE - ply) : GameValues.PAT_VALUE;
        }

        if (inCheck) {
            MoveOrdering.scoreAndSort(g, ctx, moves, n, 0, ply);
            for (int i = 0; i < n; i++) {
                long u = g.playMove(moves[i]);
                int score = -search(g, ctx, -beta, -alpha, ply + 1, qPly + 1);
                g.undoMove(u);
                if (ctx.stopped) return 0;
                if (score >= beta) return beta;
                if (score > alpha) alpha = score;
            }
            return alpha;
        }

        final int standPat = PositionEvaluator.evaluateStatic(g);
        if (standPat >= beta) return beta;
        if (standPat > alpha) alpha = standPat;

        final boolean delta = ctx.cfg.useDeltaPruning;
        if (delta && standPat + ctx.cfg.deltaMargin < alpha) return alpha;

        final int k = MoveOrdering.partitionTactical(g, ctx, moves, n, qPly < ctx.cfg.qsCheckPlies, ply);
        final int[] flags = ctx.flagBuf[ply];
        for (int i = 0; i < k; i++) {
            final int m = moves[i];

            // Skip captures that cannot lift the score to alpha, unless they check
            if (delta && (flags[i] & MoveOrdering.FLAG_CHECK) == 0 && g.isCapture(m)
                    && standPat + PieceValues.VAL[g.capturedPieceType(m)] + ctx.cfg.deltaMargin < alpha) {
                continue;
            }

            long u = g.playMove(m);
            int score = -search(g, ctx, -beta, -alpha, ply + 1, qPly + 1);
            g.undoMove(u);
            if (ctx.stopped) return 0;

            if (score >= beta) return beta;
            if (score > alpha) alpha = score;
        }
        return alpha;
    }
}
