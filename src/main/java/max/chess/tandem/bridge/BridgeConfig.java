package max.chess.tandem.bridge;

/** Timeouts and buffer sizes of the worker supervisor. All durations in milliseconds. */
public final class BridgeConfig {
    public final long handshakeTimeoutMs;
    public final long readyTimeoutMs;
    public final long readSliceMs;        // poll slice while waiting for readyok
    public final long searchReadSliceMs;  // poll slice while a search streams
    public final long stopThrottleMs;
    public final long drainTimeoutMs;
    public final long drainSliceMs;
    public final int retainedLines;
    public final int crashReportLines;
    public final long quitGraceMs;

    private BridgeConfig(Builder b) {
        this.handshakeTimeoutMs = b.handshakeTimeoutMs;
        this.readyTimeoutMs = b.readyTimeoutMs;
        this.readSliceMs = b.readSliceMs;
        this.searchReadSliceMs = b.searchReadSliceMs;
        this.stopThrottleMs = b.stopThrottleMs;
        this.drainTimeoutMs = b.drainTimeoutMs;
        this.drainSliceMs = b.drainSliceMs;
        this.retainedLines = b.retainedLines;
        this.crashReportLines = b.crashReportLines;
        this.quitGraceMs = b.quitGraceMs;
    }

    public static BridgeConfig defaults() {
        return new Builder().build();
    }

    public static BridgeConfig fromSystemProperties() {
        Builder b = new Builder();
        b.handshakeTimeoutMs(Long.getLong("bridge.handshakeTimeout", b.handshakeTimeoutMs));
        b.readyTimeoutMs(Long.getLong("bridge.readyTimeout", b.readyTimeoutMs));
        b.readSliceMs(Long.getLong("bridge.readSlice", b.readSliceMs));
        b.searchReadSliceMs(Long.getLong("bridge.searchReadSlice", b.searchReadSliceMs));
        b.stopThrottleMs(Long.getLong("bridge.stopThrottle", b.stopThrottleMs));
        b.drainTimeoutMs(Long.getLong("bridge.drainTimeout", b.drainTimeoutMs));
        b.retainedLines(Integer.getInteger("bridge.retainedLines", b.retainedLines));
        b.crashReportLines(Integer.getInteger("bridge.crashReportLines", b.crashReportLines));
        b.quitGraceMs(Long.getLong("bridge.quitGrace", b.quitGraceMs));
        return b.build();
    }

    public static class Builder {
        private long handshakeTimeoutMs = 3_000;
        private long readyTimeoutMs = 2_000;
        private long readSliceMs = 250;
        private long searchReadSliceMs = 5_000;
        private long stopThrottleMs = 100;
        private long drainTimeoutMs = 800;
        private long drainSliceMs = 100;
        private int retainedLines = 50;
        private int crashReportLines = 5;
        private long quitGraceMs = 100;

        public Builder handshakeTimeoutMs(long v){handshakeTimeoutMs=v;return this;}
        public Builder readyTimeoutMs(long v){readyTimeoutMs=v;return this;}
        public Builder readSliceMs(long v){readSliceMs=Math.max(1, v);return this;}
        public Builder searchReadSliceMs(long v){searchReadSliceMs=Math.max(1, v);return this;}
        public Builder stopThrottleMs(long v){stopThrottleMs=v;return this;}
        public Builder drainTimeoutMs(long v){drainTimeoutMs=v;return this;}
        public Builder drainSliceMs(long v){drainSliceMs=Math.max(1, v);return this;}
        public Builder retainedLines(int v){retainedLines=Math.max(1, v);return this;}
        public Builder crashReportLines(int v){crashReportLines=Math.max(1, v);return this;}
        public Builder quitGraceMs(long v){quitGraceMs=v;return this;}

        public BridgeConfig build(){return new BridgeConfig(this);}
    }
}
