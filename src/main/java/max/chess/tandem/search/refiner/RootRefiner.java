package max.chess.tandem.search.refiner;

import max.chess.tandem.game.Game;
import max.chess.tandem.movegen.Move;
import max.chess.tandem.movegen.MoveGenerator;
import max.chess.tandem.search.CancellationToken;
import max.chess.tandem.search.Deadline;
import max.chess.tandem.search.MoveOrdering;
import max.chess.tandem.search.SearchConfig;
import max.chess.tandem.search.evaluator.PieceValues;
import max.chess.tandem.search.evaluator.PositionEvaluator;
import max.chess.tandem.utils.PieceUtils;
import max.chess.tandem.utils.notations.MoveIOUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.SplittableRandom;
import java.util.function.Consumer;

/**
 * Monte-Carlo refinement restricted to the root moves. Each root move keeps visits, a value sum
 * and a prior; selection is PUCT, playouts are short capture-biased rollouts scored by the static
 * evaluator. Runs until the deadline minus the safety margin, the rollout limit, or cancellation.
 */
public final class RootRefiner {
    private static final Logger LOGGER = LogManager.getLogger(RootRefiner.class);

    private static final int CHECK_PRIOR_BONUS = 50;

    private final SearchConfig cfg;
    private final int[] rolloutBuf = new int[MoveGenerator.MAX_MOVES];

    public RootRefiner(SearchConfig cfg) {
        this.cfg = cfg;
    }

    /**
     * @param hintMove    the searcher's last best move, given a prior bonus; also the answer when
     *                    no rollout completes
     * @param maxRollouts negative for no limit
     */
    public RefinerResult refine(Game game, int hintMove, Deadline deadline, CancellationToken token,
                                int maxRollouts, Consumer<String> out) {
        final int[] moves = new int[MoveGenerator.MAX_MOVES];
        final int n = game.getLegalMoves(moves);
        if (n == 0) {
            return RefinerResult.none(0);
        }

        final double[] prior = priors(game, moves, n, hintMove);
        final int[] visits = new int[n];
        final double[] valueSum = new double[n];
        final SplittableRandom random = new SplittableRandom(game.zobristKey());
        final Deadline stopAt = deadline.minusMillis(cfg.safetyMarginMs);

        int rollouts = 0;
        while ((maxRollouts < 0 || rollouts < maxRollouts) && !stopAt.expired() && !token.isCancelled()) {
            int pick = select(prior, visits, valueSum, n, rollouts);
            double value = rollout(game, moves[pick], random);
            visits[pick]++;
            valueSum[pick] += value;
            rollouts++;
            if (rollouts % cfg.rolloutBatch == 0) {
                out.accept(batchInfo(moves, visits, valueSum, n, rollouts));
            }
        }

        int best = -1;
        for (int i = 0; i < n; i++) {
            if (visits[i] == 0) continue;
            if (best < 0 || mean(valueSum, visits, i) > mean(valueSum, visits, best)
                    || (mean(valueSum, visits, i) == mean(valueSum, visits, best) && visits[i] > visits[best])) {
                best = i;
            }
        }
        LOGGER.debug("refiner finished: {} rollouts over {} root moves", rollouts, n);
        if (best < 0) {
            int fallback = hintMove != 0 && MoveGenerator.isLegal(game, hintMove) ? hintMove : 0;
            return new RefinerResult(fallback, 0.0, 0, rollouts);
        }
        return new RefinerResult(moves[best], mean(valueSum, visits, best), visits[best], rollouts);
    }

    // mean value plus an exploration term scaled by the prior and shrinking with visits
    private int select(double[] prior, int[] visits, double[] valueSum, int n, int totalVisits) {
        final double sqrtTotal = Math.sqrt(totalVisits + 1.0);
        int best = 0;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < n; i++) {
            double q = visits[i] == 0 ? 0.0 : valueSum[i] / visits[i];
            double u = cfg.refinerExploration * prior[i] * sqrtTotal / (1 + visits[i]);
            if (q + u > bestScore) {
                bestScore = q + u;
                best = i;
            }
        }
        return best;
    }

    /** Soft-max over capture value, check and promotion bonuses; the hint move gets an extra bonus. */
    double[] priors(Game game, int[] moves, int n, int hintMove) {
        double[] logits = new double[n];
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < n; i++) {
            int m = moves[i];
            double h = PieceValues.VAL[game.capturedPieceType(m)];
            if (Move.getPromotion(m) == PieceUtils.QUEEN) h += PieceValues.QUEEN_VALUE - PieceValues.PAWN_VALUE;
            if (game.givesCheck(m)) h += CHECK_PRIOR_BONUS;
            logits[i] = h / cfg.priorTemperature;
            max = Math.max(max, logits[i]);
        }
        double sum = 0;
        double[] prior = new double[n];
        for (int i = 0; i < n; i++) {
            prior[i] = Math.exp(logits[i] - max);
            sum += prior[i];
        }
        double total = 0;
        for (int i = 0; i < n; i++) {
            prior[i] /= sum;
            if (moves[i] == hintMove) prior[i] += cfg.hintBonus;
            total += prior[i];
        }
        for (int i = 0; i < n; i++) prior[i] /= total;
        return prior;
    }

    /**
     * Plays {@code first} then up to {@code rolloutPlies} heuristic moves, stopping early on a
     * terminal or (after the minimum plies) quiet position. Value is from the root mover's side.
     */
    double rollout(Game game, int first, SplittableRandom random) {
        final int mark = game.mark();
        try {
            game.playMove(first);
            int plies = 1;
            while (plies < cfg.rolloutPlies) {
                int count = game.getLegalMoves(rolloutBuf);
                if (count == 0) break;
                int bestCapture = 0, bestCaptureScore = 0;
                for (int i = 0; i < count; i++) {
                    int s = MoveOrdering.mvvLva(game, rolloutBuf[i]);
                    if (s > bestCaptureScore) {
                        bestCaptureScore = s;
                        bestCapture = rolloutBuf[i];
                    }
                }
                if (bestCapture == 0 && plies >= cfg.rolloutMinPlies && !game.inCheck()) break;
                int next = (bestCapture != 0 && random.nextDouble() < cfg.rolloutCaptureBias)
                        ? bestCapture
                        : rolloutBuf[random.nextInt(count)];
                game.playMove(next);
                plies++;
            }
            double value = Math.tanh(PositionEvaluator.evaluate(game) / cfg.rolloutValueScale);
            return (plies & 1) == 0 ? value : -value;
        } finally {
            game.rewind(mark);
        }
    }

    private static double mean(double[] valueSum, int[] visits, int i) {
        return valueSum[i] / visits[i];
    }

    private static String batchInfo(int[] moves, int[] visits, double[] valueSum, int n, int rollouts) {
        int best = 0;
        for (int i = 1; i < n; i++) if (visits[i] > visits[best]) best = i;
        return String.format("info string refiner rollouts=%d top=%s visits=%d q=%.3f",
                rollouts, MoveIOUtils.toUci(moves[best]), visits[best],
                visits[best] == 0 ? 0.0 : valueSum[best] / visits[best]);
    }
}
