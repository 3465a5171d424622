package max.chess.tandem.search;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal threaded through one search. Observed at node boundaries, never
 * interrupts a computation.
 */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
