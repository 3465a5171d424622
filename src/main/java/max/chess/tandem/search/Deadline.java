package max.chess.tandem.search;

/** Absolute point in time (monotonic clock) shared by every phase of one request. */
public final class Deadline {
    private static final Deadline NEVER = new Deadline(Long.MAX_VALUE, false);

    private final long deadlineNs;
    private final boolean bounded;

    private Deadline(long deadlineNs, boolean bounded) {
        this.deadlineNs = deadlineNs;
        this.bounded = bounded;
    }

    public static Deadline afterMillis(long millis) {
        return new Deadline(System.nanoTime() + Math.max(0, millis) * 1_000_000L, true);
    }

    public static Deadline never() {
        return NEVER;
    }

    public boolean isBounded() {
        return bounded;
    }

    public boolean expired() {
        return bounded && System.nanoTime() - deadlineNs >= 0;
    }

    public long remainingMillis() {
        if (!bounded) return Long.MAX_VALUE;
        return Math.max(0, (deadlineNs - System.nanoTime()) / 1_000_000L);
    }

    /** The same deadline brought forward by {@code millis}. */
    public Deadline minusMillis(long millis) {
        if (!bounded) return this;
        return new Deadline(deadlineNs - millis * 1_000_000L, true);
    }
}
