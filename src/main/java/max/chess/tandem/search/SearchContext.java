package max.chess.tandem.search;

import max.chess.tandem.search.transpositiontable.TranspositionTable;

import java.util.Arrays;

import static max.chess.tandem.search.SearchConstants.*;

/**
 * Per-session search state: TT, killers and history live for one game and are reset by
 * {@link #newGame()}; counters, root best move and the stop state are reset per search.
 */
public final class SearchContext {
    // Buffers per ply (qsearch can go deeper than MAX_PLY)
    public final int[][] moveBuf  = new int[STACK_PLY][MAX_MOVES];
    public final int[][] scoreBuf = new int[STACK_PLY][MAX_MOVES];
    // bit 0: capture or promotion, bit 1: gives check
    public final int[][] flagBuf  = new int[STACK_PLY][MAX_MOVES];

    public final TranspositionTable.Hit[] hits = new TranspositionTable.Hit[MAX_PLY];

    // Heuristics at search ply only
    public final int[][] killer;
    public final int[][] history;

    // Counters
    public long nodes, qNodes;

    public int rootBestMove;

    public boolean stopped;

    public final TranspositionTable tt; // null if disabled
    public final SearchConfig cfg;

    private CancellationToken token = new CancellationToken();
    private Deadline deadline = Deadline.never();

    public SearchContext(SearchConfig cfg) {
        this(cfg, cfg.useTT ? new TranspositionTable(cfg.ttSizeMb) : null, new int[MAX_PLY][2], new int[2][64]);
    }

    private SearchContext(SearchConfig cfg, TranspositionTable tt, int[][] killer, int[][] history) {
        this.cfg = cfg;
        this.tt = tt;
        this.killer = killer;
        this.history = history;
        for (int p = 0; p < MAX_PLY; p++) hits[p] = new TranspositionTable.Hit();
    }

    /**
     * A context for {@code next} that keeps this session's TT, killers and history. The TT is
     * only reallocated (empty) when its size or enablement changes.
     */
    public SearchContext withConfig(SearchConfig next) {
        if (next.useTT != cfg.useTT || next.ttSizeMb != cfg.ttSizeMb) {
            TranspositionTable table = next.useTT ? new TranspositionTable(next.ttSizeMb) : null;
            return new SearchContext(next, table, killer, history);
        }
        return new SearchContext(next, tt, killer, history);
    }

    public void newGame() {
        if (tt != null) tt.clear();
        for (int[] k : killer) Arrays.fill(k, 0);
        for (int[] h : history) Arrays.fill(h, 0);
    }

    public void newSearch(CancellationToken token, Deadline deadline) {
        this.token = token;
        this.deadline = deadline;
        nodes = qNodes = 0;
        rootBestMove = 0;
        stopped = false;
        if (tt != null) { tt.newSearch(); tt.stats().clear(); }
    }

    /** Sticky stop check: cancellation every call, clock every 256 nodes. */
    public boolean shouldStop() {
        if (stopped) return true;
        if (token.isCancelled()
                || (((nodes + qNodes) & 255) == 0 && TimeControl.aborted(token, deadline))) {
            stopped = true;
        }
        return stopped;
    }

    public long totalNodes() {
        return nodes + qNodes;
    }
}
