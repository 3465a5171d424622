package max.chess.tandem.search.scheduler;

/**
 * Predicts the wall-clock cost of the next iterative-deepening depth from the growth between the
 * last two completed depths, clamped to {@code [minGrowth, maxGrowth]}. With a single sample the
 * minimum growth is assumed.
 */
public final class DepthCostModel {
    private final double minGrowth;
    private final double maxGrowth;
    private long previousMs = -1;
    private long lastMs = -1;

    public DepthCostModel(double minGrowth, double maxGrowth) {
        this.minGrowth = minGrowth;
        this.maxGrowth = maxGrowth;
    }

    public void record(long durationMs) {
        previousMs = lastMs;
        lastMs = Math.max(0, durationMs);
    }

    /** 0 before any sample. */
    public long predictNextMs() {
        if (lastMs < 0) return 0;
        double growth = minGrowth;
        if (previousMs > 0) {
            growth = Math.max(minGrowth, Math.min(maxGrowth, (double) lastMs / previousMs));
        }
        return (long) Math.ceil(Math.max(1, lastMs) * growth);
    }

    public int samples() {
        return lastMs < 0 ? 0 : previousMs < 0 ? 1 : 2;
    }
}
