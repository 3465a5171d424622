package max.chess.tandem.search;

import max.chess.tandem.game.Game;
import max.chess.tandem.search.evaluator.GameValues;
import max.chess.tandem.search.evaluator.PositionEvaluator;
import max.chess.tandem.search.transpositiontable.TranspositionTable;
import max.chess.tandem.utils.ColorUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import static max.chess.tandem.search.SearchConstants.INF;
import static max.chess.tandem.search.SearchConstants.MAX_PLY;

/**
 * Fail-soft negamax with TT bounds, check extension, null move, frontier futility, move count
 * pruning, late move reductions and PVS. A stopped search returns 0 with {@code ctx.stopped}
 * set; callers must discard that value.
 */
final class Negamax {
    private static final Logger LOGGER = LogManager.getLogger(Negamax.class);

    private Negamax() {}

    static int search(Game game, SearchContext ctx, int depth, int ply, int alpha, int beta) {
        return search(game, ctx, depth, ply, alpha, beta, true, true);
    }

    static int search(Game game, SearchContext ctx, int depth, int ply,
                      int alpha, int beta, boolean isPV, boolean allowNull) {
        if (ctx.shouldStop()) return 0;
        ctx.nodes++;

        alpha = Math.max(alpha, -INF + 1);
        beta = Math.min(beta, INF - 1);
        if (alpha >= beta) alpha = beta - 1;

        if (ply >= MAX_PLY - 1) return PositionEvaluator.evaluateStatic(game);

        final long key = game.zobristKey();
        final int alphaOrig = alpha;
        final TranspositionTable tt = ctx.tt;
        int ttMove = 0;

        if (ply > 0) {
            if (game.isFiftyMoveDraw() || game.isRepetition(2) || game.isInsufficientMaterial()) {
                return GameValues.DRAW_VALUE;
            }
        }

        if (tt != null) {
            TranspositionTable.Hit hit = ctx.hits[ply];
            // the root never cuts on the TT so every iteration names its own move
            if (tt.probe(key, depth, ply, hit) && ply > 0) {
                if (hit.flag == TranspositionTable.TT_EXACT
                        || (hit.flag == TranspositionTable.TT_LOWER && hit.score >= beta)
                        || (hit.flag == TranspositionTable.TT_UPPER && hit.score <= alpha)) {
                    tt.countCutoff();
                    return hit.score;
                }
            }
            ttMove = hit.move;
        }

        final boolean inCheck = game.inCheck();
        final int localDepth = inCheck ? depth + 1 : depth;
        if (localDepth <= 0) {
            return Quiescence.search(game, ctx, alpha, beta, ply, 0);
        }

        // Null move: pass and see whether a reduced search still fails high
        if (ctx.cfg.useNullMove && allowNull && !inCheck && ply > 0
                && localDepth >= ctx.cfg.nullMinDepth
                && !likelyZugzwang(game, ctx.cfg.nullMinMaterial)) {
            final int mark = game.mark();
            try {
                long undoNull = game.playNullMove();
                int score = -search(game, ctx, localDepth - 1 - ctx.cfg.nullReduction, ply + 1,
                        -beta, -beta + 1, false, false);
                game.undoNullMove(undoNull);
                if (ctx.stopped) return 0;
                if (score >= beta) return beta;
            } catch (RuntimeException e) {
                LOGGER.debug("null move probe failed at ply {}: {}", ply, e.toString());
                game.rewind(mark);
            }
        }

        final int[] moves = ctx.moveBuf[ply];
        final int n = game.getLegalMoves(moves);
        if (n == 0) {
            return inCheck ? -(GameValues.CHECKMATE_VALUE - ply) : GameValues.PAT_VALUE;
        }
        MoveOrdering.scoreAndSort(game, ctx, moves, n, ttMove, ply);
        final int[] flags = ctx.flagBuf[ply];

        int bestScore = -INF;
        int bestMove = 0;
        int moveIndex = 0;
        int staticEval = Integer.MIN_VALUE;

        for (int i = 0; i < n; i++) {
            final int m = moves[i];
            final boolean tactical = (flags[i] & MoveOrdering.FLAG_TACTICAL) != 0;
            final boolean givesCheck = (flags[i] & MoveOrdering.FLAG_CHECK) != 0;
            final boolean quiet = !tactical && !givesCheck;

            if (quiet && !inCheck && moveIndex > 0) {
                if (ctx.cfg.useFutility && localDepth == 1) {
                    if (staticEval == Integer.MIN_VALUE) staticEval = PositionEvaluator.evaluateStatic(game);
                    if (staticEval + ctx.cfg.futilityMargin <= alpha) {
                        moveIndex++;
                        continue;
                    }
                }
                if (ctx.cfg.useMoveCountPruning && localDepth >= ctx.cfg.mcpMinDepth
                        && moveIndex >= ctx.cfg.mcpStartAt) {
                    moveIndex++;
                    continue;
                }
            }

            long u = game.playMove(m);
            int score;
            if (moveIndex == 0) {
                score = -search(game, ctx, localDepth - 1, ply + 1, -beta, -alpha, isPV, true);
            } else if (ctx.cfg.useLMR && !isPV && quiet && !inCheck
                    && localDepth >= ctx.cfg.lmrMinDepth && moveIndex >= ctx.cfg.lmrMinMove) {
                int reduce = ctx.cfg.lmrBase + (moveIndex >= 6 ? 1 : 0);
                int newDepth = Math.max(1, localDepth - 1 - reduce);
                score = -search(game, ctx, newDepth, ply + 1, -alpha - 1, -alpha, false, true);
                if (!ctx.stopped && score > alpha) {
                    score = -search(game, ctx, localDepth - 1, ply + 1, -beta, -alpha, false, true);
                }
            } else {
                score = -search(game, ctx, localDepth - 1, ply + 1, -alpha - 1, -alpha, false, true);
                if (!ctx.stopped && score > alpha && score < beta) {
                    score = -search(game, ctx, localDepth - 1, ply + 1, -beta, -alpha, true, true);
                }
            }
            game.undoMove(u);
            if (ctx.stopped) return 0;
            moveIndex++;

            if (score > bestScore) {
                bestScore = score;
                bestMove = m;
                if (ply == 0) ctx.rootBestMove = m;
                if (score > alpha) {
                    alpha = score;
                    if (alpha >= beta) {
                        if (!tactical) MoveOrdering.recordQuietCutoff(game, ctx, m, localDepth, ply);
                        break;
                    }
                }
            }
        }

        if (tt != null) {
            byte flag = bestScore <= alphaOrig ? TranspositionTable.TT_UPPER
                    : bestScore >= beta ? TranspositionTable.TT_LOWER
                    : TranspositionTable.TT_EXACT;
            tt.store(key, bestMove, depth, bestScore, flag, ply);
        }
        return bestScore;
    }

    // Both sides low on pieces: passing may be the best move
    static boolean likelyZugzwang(Game game, int minMaterial) {
        return game.nonPawnMaterial(ColorUtils.WHITE) + game.nonPawnMaterial(ColorUtils.BLACK) <= minMaterial;
    }
}
