package max.chess.tandem.search;

import max.chess.tandem.game.Game;

import java.util.function.Consumer;

import static max.chess.tandem.search.SearchConstants.INF;

/**
 * Drives the root depth by depth, each depth inside an aspiration window around the previous
 * score. The window doubles and re-centres on the failing score; at the cap the full window is
 * used, so every depth converges.
 */
public final class IterativeDeepening {
    private final Game game;
    private final SearchContext ctx;
    private final long startNs = System.nanoTime();

    private SearchResult last;
    private int prevScore;

    public IterativeDeepening(Game game, SearchContext ctx) {
        this.game = game;
        this.ctx = ctx;
    }

    /** Runs depths until {@code maxDepth}, a proven mate, or a stop; returns the last completed one. */
    public static SearchResult run(Game game, SearchContext ctx, int maxDepth, Consumer<SearchResult> onDepth) {
        IterativeDeepening id = new IterativeDeepening(game, ctx);
        while (id.completedDepth() < maxDepth && !id.mateProven()) {
            SearchResult r = id.searchNextDepth();
            if (r == null) break;
            onDepth.accept(r);
        }
        return id.last();
    }

    /** Searches one depth deeper; null when the search was stopped before the depth completed. */
    public SearchResult searchNextDepth() {
        final int depth = completedDepth() + 1;

        int window = ctx.cfg.aspirationCp;
        int alpha = depth == 1 ? -INF : prevScore - window;
        int beta = depth == 1 ? INF : prevScore + window;

        int score;
        while (true) {
            score = Negamax.search(game, ctx, depth, 0, alpha, beta);
            if (ctx.stopped) return null;
            if (score > alpha && score < beta) break;
            if (window >= ctx.cfg.aspirationCap) {
                alpha = -INF;
                beta = INF;
            } else {
                window = Math.min(ctx.cfg.aspirationCap, window * 2);
                alpha = score - window;
                beta = score + window;
            }
        }

        prevScore = score;
        long timeMs = (System.nanoTime() - startNs) / 1_000_000L;
        long nodes = ctx.totalNodes();
        long nps = nodes * 1000L / Math.max(1, timeMs);
        int[] pv = PrincipalVariation.extract(game, ctx.tt, ctx.rootBestMove, depth);
        last = new SearchResult(ctx.rootBestMove, score, depth, nodes, timeMs, nps, pv);
        return last;
    }

    public SearchResult last() {
        return last;
    }

    public int completedDepth() {
        return last == null ? 0 : last.depth();
    }

    /** A mate was found within the searched horizon; deeper iterations cannot change it. */
    public boolean mateProven() {
        return last != null && last.isMate()
                && Math.abs(SearchResult.mateInMoves(last.score())) * 2 <= last.depth() + 1;
    }
}
