package max.chess.tandem.search;

import max.chess.tandem.uci.UciServer;

public final class TimeControl {
    public static final long UNBOUNDED = -1;

    private TimeControl() {}

    /**
     * Wall-clock budget for one {@code go}: movetime (less a small overhead), else 2% of the mover's
     * clock, else the configured default; {@link #UNBOUNDED} for {@code go infinite}.
     */
    public static long computeBudgetMs(boolean whiteToMove, UciServer.GoParams go, SearchConfig cfg) {
        long ms = go.movetime;
        if (ms != -1) {
            return ms <= 20 ? Math.max(1, ms / 2) : ms - 10;
        }
        ms = whiteToMove ? go.wtime : go.btime;
        if (ms != -1) {
            long inc = whiteToMove ? go.winc : go.binc;
            return Math.max(10, 2L * ms / 100L + inc / 2);
        }
        if (go.infinite) {
            return UNBOUNDED;
        }
        return cfg.defaultBudgetMs;
    }

    public static boolean aborted(CancellationToken token, Deadline deadline) {
        return token.isCancelled() || deadline.expired();
    }
}
