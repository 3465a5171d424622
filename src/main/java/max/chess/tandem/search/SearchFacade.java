package max.chess.tandem.search;

import max.chess.tandem.game.Game;
import max.chess.tandem.movegen.MoveGenerator;
import max.chess.tandem.search.scheduler.ScheduledMove;
import max.chess.tandem.search.scheduler.SearchBudget;
import max.chess.tandem.search.scheduler.SearchScheduler;
import max.chess.tandem.uci.UciServer;
import max.chess.tandem.utils.ColorUtils;

import java.util.function.Consumer;

/** Turns a {@code go} command into a scheduling turn on a session that outlives single searches. */
public final class SearchFacade {

    private final SearchConfig cfg;
    private final SearchScheduler scheduler;

    public SearchFacade(SearchConfig cfg) {
        this(cfg, new SearchScheduler(cfg));
    }

    private SearchFacade(SearchConfig cfg, SearchScheduler scheduler) {
        this.cfg = cfg;
        this.scheduler = scheduler;
    }

    /** Same session (TT, killers, history) under new settings; a new TT size starts an empty table. */
    public SearchFacade reconfigure(SearchConfig next) {
        return new SearchFacade(next, scheduler.withConfig(next));
    }

    public SearchConfig config() {
        return cfg;
    }

    public SearchContext context() {
        return scheduler.context();
    }

    /** Clears TT, killers and history. */
    public void newGame() {
        scheduler.newGame();
    }

    public ScheduledMove findBestMove(Game game, CancellationToken token, UciServer.GoParams go, Consumer<String> out) {
        final ScheduledMove result = scheduler.run(game, toBudget(game, go), token, out);

        if (cfg.debug && result.move() != 0 && !MoveGenerator.isLegal(game, result.move())) {
            throw new IllegalStateException("Illegal best move from " + result.source() + ": " + result.move());
        }
        return result;
    }

    SearchBudget toBudget(Game game, UciServer.GoParams go) {
        final int rollouts = go.rollouts;
        if (go.depth > 0) {
            return SearchBudget.forDepth(go.depth, Math.max(0, rollouts));
        }
        long budgetMs = TimeControl.computeBudgetMs(ColorUtils.isWhite(game.currentPlayer()), go, cfg);
        if (budgetMs == TimeControl.UNBOUNDED) {
            return new SearchBudget(TimeControl.UNBOUNDED, cfg.maxDepth, Math.max(0, rollouts));
        }
        return new SearchBudget(budgetMs, cfg.maxDepth, rollouts >= 0 ? rollouts : -1);
    }
}
