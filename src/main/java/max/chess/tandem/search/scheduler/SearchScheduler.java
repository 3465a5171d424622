package max.chess.tandem.search.scheduler;

import max.chess.tandem.game.Game;
import max.chess.tandem.search.CancellationToken;
import max.chess.tandem.search.Deadline;
import max.chess.tandem.search.IterativeDeepening;
import max.chess.tandem.search.SearchConfig;
import max.chess.tandem.search.SearchContext;
import max.chess.tandem.search.SearchResult;
import max.chess.tandem.search.refiner.RefinerResult;
import max.chess.tandem.search.refiner.RootRefiner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.function.Consumer;

/**
 * One scheduling turn: alpha-beta depth by depth under a soft deadline that keeps a reserve for
 * the refiner, then the refiner until the shared deadline less the safety margin. Both phases run
 * on the caller's thread, one after the other.
 */
public final class SearchScheduler {
    private static final Logger LOGGER = LogManager.getLogger(SearchScheduler.class);

    private final SearchConfig cfg;
    private final SearchContext ctx;
    private final RootRefiner refiner;

    public SearchScheduler(SearchConfig cfg) {
        this(cfg, new SearchContext(cfg));
    }

    private SearchScheduler(SearchConfig cfg, SearchContext ctx) {
        this.cfg = cfg;
        this.ctx = ctx;
        this.refiner = new RootRefiner(cfg);
    }

    /** A scheduler running with {@code next} on this session's tables. */
    public SearchScheduler withConfig(SearchConfig next) {
        return new SearchScheduler(next, ctx.withConfig(next));
    }

    public SearchContext context() {
        return ctx;
    }

    public void newGame() {
        ctx.newGame();
    }

    public ScheduledMove run(Game game, SearchBudget budget, CancellationToken token, Consumer<String> out) {
        final Deadline deadline = budget.isBounded() ? Deadline.afterMillis(budget.budgetMs()) : Deadline.never();
        final boolean refinerWanted = cfg.useRefiner && budget.maxRollouts() != 0;
        final long reserveMs = refinerWanted ? cfg.refinerReserveMs : cfg.safetyMarginMs;
        final int maxDepth = Math.max(1, Math.min(budget.maxDepth(), cfg.maxDepth));

        ctx.newSearch(token, deadline.minusMillis(reserveMs));
        final IterativeDeepening id = new IterativeDeepening(game, ctx);
        final DepthCostModel costModel = new DepthCostModel(cfg.minGrowth, cfg.maxGrowth);

        while (id.completedDepth() < maxDepth && !id.mateProven() && !token.isCancelled()) {
            if (deadline.isBounded() && costModel.samples() > 0) {
                long predicted = costModel.predictNextMs();
                long remaining = deadline.remainingMillis();
                if (predicted + reserveMs > remaining) {
                    LOGGER.debug("stopping before depth {}: predicted {}ms + reserve {}ms > remaining {}ms",
                            id.completedDepth() + 1, predicted, reserveMs, remaining);
                    break;
                }
            }
            out.accept("info string iter depth=" + (id.completedDepth() + 1));
            long startNs = System.nanoTime();
            SearchResult r = id.searchNextDepth();
            if (r == null) break;
            costModel.record((System.nanoTime() - startNs) / 1_000_000L);
            out.accept(r.toUCIInfo());
        }

        if (ctx.tt != null) out.accept(ctx.tt.stats().toInfoStringForUCI());

        final SearchResult searched = id.last();
        RefinerResult refined = null;
        if (refinerWanted && !token.isCancelled() && !provedWin(searched) && refinerHasTime(deadline, budget)) {
            refined = refiner.refine(game, searched == null ? 0 : searched.move(),
                    deadline, token, budget.maxRollouts(), out);
        }

        if (refined != null && refined.hasMove() && refined.visits() > 0) {
            return new ScheduledMove(refined.move(), ScheduledMove.Source.REFINER, searched, refined);
        }
        if (searched != null && searched.move() != 0) {
            return new ScheduledMove(searched.move(), ScheduledMove.Source.SEARCHER, searched, refined);
        }
        int fallback = FallbackMove.choose(game);
        LOGGER.debug("no searched move, falling back");
        return new ScheduledMove(fallback, ScheduledMove.Source.FALLBACK, searched, refined);
    }

    private static boolean provedWin(SearchResult r) {
        return r != null && r.isMate() && r.score() > 0;
    }

    // an unbounded turn only refines with an explicit rollout cap
    private boolean refinerHasTime(Deadline deadline, SearchBudget budget) {
        if (!deadline.isBounded()) return budget.maxRollouts() > 0;
        return deadline.remainingMillis() > cfg.safetyMarginMs;
    }
}
