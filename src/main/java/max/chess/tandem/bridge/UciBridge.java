package max.chess.tandem.bridge;

import max.chess.tandem.game.Game;
import max.chess.tandem.search.CancellationToken;
import max.chess.tandem.utils.notations.MoveIOUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Supervises one worker speaking the line protocol and turns its output into {@link BridgeEvent}s.
 * <p>
 * Every read of the worker's output goes through a single lock. Commands of one request are
 * issued in order (position, readiness probe, go) and at most one search streams at a time; a
 * new request first sends a stop to whatever is running. A stop is only written while a go is
 * outstanding; it is throttled, and drained here only when no caller is streaming that search.
 * Whoever reads the bestmove of a stopped search then reads up to a readyok, so a second
 * bestmove from a stop that reached an idle worker is never taken for the next search.
 */
public final class UciBridge implements AutoCloseable {
    private static final Logger LOGGER = LogManager.getLogger(UciBridge.class);

    private static final long NO_STOP = Long.MIN_VALUE;

    private final BridgeConfig cfg;
    private final WorkerLauncher launcher;

    private final ReentrantLock readLock = new ReentrantLock();
    private final ReentrantLock searchLock = new ReentrantLock();
    private final Object lifecycle = new Object();

    private volatile WorkerSession session;
    private volatile WorkerSession lastSession;
    // a caller is streaming the outstanding search and will read its bestmove
    private volatile boolean searchActive;

    private final Object searchState = new Object();
    // guarded by searchState: a go was written and its bestmove not read yet
    private boolean goOutstanding;
    // guarded by searchState: a stop was written for the outstanding go
    private boolean stopPending;

    private final AtomicLong lastStopNs = new AtomicLong(NO_STOP);
    private final AtomicInteger workerStarts = new AtomicInteger();
    private final AtomicInteger stopsSent = new AtomicInteger();

    public UciBridge(WorkerLauncher launcher, BridgeConfig cfg) {
        this.launcher = launcher;
        this.cfg = cfg;
    }

    /* -------------------- worker lifecycle -------------------- */

    /**
     * Starts the worker if none is running, retrying the handshake once.
     *
     * @throws BridgeException when the second handshake fails as well
     */
    public void start() {
        ensureStarted();
    }

    private WorkerSession ensureStarted() {
        synchronized (lifecycle) {
            WorkerSession s = session;
            if (s != null && s.isAlive()) return s;
            if (s != null) {
                session = null;
                s.destroy(cfg.quitGraceMs);
            }
            try {
                return startWithHandshake();
            } catch (BridgeException first) {
                LOGGER.warn("{}; restarting worker once", first.getMessage());
                return startWithHandshake();
            }
        }
    }

    private WorkerSession startWithHandshake() {
        final int id = workerStarts.incrementAndGet();
        final WorkerSession s;
        try {
            s = new WorkerSession(launcher.launch(), cfg.retainedLines, id);
        } catch (IOException e) {
            throw new BridgeException("cannot start worker: " + e.getMessage(), e);
        }
        lastSession = s;
        try {
            s.send("uci");
            final long deadline = System.nanoTime() + cfg.handshakeTimeoutMs * 1_000_000L;
            while (true) {
                long leftMs = (deadline - System.nanoTime()) / 1_000_000L;
                if (leftMs <= 0) throw new BridgeException("uci handshake timed out");
                String line = readLine(s, leftMs);
                if (line == null) continue;
                if (line.isEmpty()) throw new BridgeException("engine terminated during uci handshake");
                if (line.equals("uciok")) break;
            }
        } catch (IOException e) {
            s.destroy(cfg.quitGraceMs);
            throw new BridgeException("cannot talk to worker: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            s.destroy(cfg.quitGraceMs);
            throw new BridgeException("interrupted during uci handshake", e);
        } catch (BridgeException e) {
            s.destroy(cfg.quitGraceMs);
            throw e;
        }
        clearSearchState();
        session = s;
        LOGGER.info("worker {} handshake ok", id);
        return s;
    }

    /** Replaces the worker with one handshake attempt; null when that attempt fails. */
    private WorkerSession restartWorker() {
        LOGGER.info("restarting worker");
        synchronized (lifecycle) {
            discard(session);
            try {
                return startWithHandshake();
            } catch (BridgeException e) {
                LOGGER.warn("restart failed: {}", e.getMessage());
                return null;
            }
        }
    }

    private void discard(WorkerSession s) {
        if (s == null) return;
        synchronized (lifecycle) {
            if (session == s) {
                session = null;
                clearSearchState();
            }
        }
        s.destroy(cfg.quitGraceMs);
    }

    private void clearSearchState() {
        synchronized (searchState) {
            goOutstanding = false;
            stopPending = false;
        }
    }

    /** Writes go; a stop can only be written after it. */
    private void sendGo(WorkerSession s, String command) throws IOException {
        synchronized (searchState) {
            goOutstanding = true;
            stopPending = false;
            s.send(command);
        }
    }

    /** Records that the outstanding search answered; true when a stop had been written for it. */
    private boolean markBestMoveRead() {
        synchronized (searchState) {
            boolean stopped = stopPending;
            goOutstanding = false;
            stopPending = false;
            return stopped;
        }
    }

    private boolean isGoOutstanding() {
        synchronized (searchState) {
            return goOutstanding;
        }
    }

    /** Sends quit and ends the worker. A later request starts a fresh one. */
    public void shutdown() {
        synchronized (lifecycle) {
            WorkerSession s = session;
            session = null;
            clearSearchState();
            if (s == null) return;
            try {
                s.send("quit");
            } catch (IOException e) {
                LOGGER.debug("quit not delivered: {}", e.getMessage());
            }
            s.destroy(cfg.quitGraceMs);
            LOGGER.info("worker shut down");
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    /* -------------------- i/o helpers -------------------- */

    /** Serialised read: null on timeout, empty once the worker's output ended. */
    private String readLine(WorkerSession s, long timeoutMs) throws InterruptedException {
        readLock.lockInterruptibly();
        try {
            return s.readLine(Math.max(1, timeoutMs));
        } finally {
            readLock.unlock();
        }
    }

    /* -------------------- public operations -------------------- */

    /**
     * Probes the worker with isready, replacing it once (a single handshake attempt) if no
     * readyok arrives in time. Never waits longer than the readiness timeout per attempt.
     *
     * @return false when neither attempt was answered, or the replacement could not be started
     * @throws BridgeException when no worker is running and none can be started
     */
    public boolean isReady(boolean restartOnTimeout) {
        WorkerSession s = ensureStarted();
        try {
            s.send("isready");
            for (int attempt = 1; attempt <= 2; attempt++) {
                final long deadline = System.nanoTime() + cfg.readyTimeoutMs * 1_000_000L;
                long leftMs;
                while ((leftMs = (deadline - System.nanoTime()) / 1_000_000L) > 0) {
                    String line = readLine(s, Math.min(cfg.readSliceMs, leftMs));
                    if (line == null) continue;
                    if (line.isEmpty()) return false;
                    if (line.equals("readyok")) return true;
                }
                if (!restartOnTimeout || attempt == 2) break;
                LOGGER.warn("isready timed out after {}ms", cfg.readyTimeoutMs);
                s = restartWorker();
                if (s == null) return false;
                s.send("isready");
            }
        } catch (IOException e) {
            LOGGER.warn("isready not delivered: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    /**
     * Best-effort stop of a running search. Nothing is sent when no go is outstanding, and a repeat
     * within the throttle window is a no-op. When a caller is streaming the search, that caller
     * consumes the final bestmove; otherwise it is drained here for a bounded time.
     *
     * @return whether a stop was sent
     */
    public boolean abortCurrentSearch() {
        final WorkerSession s = session;
        if (s == null || !s.isAlive()) return false;

        synchronized (searchState) {
            if (!goOutstanding) {
                LOGGER.debug("no search outstanding, stop not sent");
                return false;
            }
            final long now = System.nanoTime();
            final long last = lastStopNs.get();
            if (last != NO_STOP && now - last < cfg.stopThrottleMs * 1_000_000L) {
                LOGGER.debug("stop throttled");
                return false;
            }
            lastStopNs.set(now);
            try {
                s.send("stop");
            } catch (IOException e) {
                LOGGER.warn("stop not delivered: {}", e.getMessage());
                return false;
            }
            stopsSent.incrementAndGet();
            stopPending = true;
        }

        if (searchActive || readLock.isLocked()) {
            LOGGER.debug("reader active, leaving the bestmove to it");
            return true;
        }
        drain(s);
        return true;
    }

    /** Reads to the outstanding search's bestmove, bounded by the drain timeout. */
    private void drain(WorkerSession s) {
        final long deadline = System.nanoTime() + cfg.drainTimeoutMs * 1_000_000L;
        try {
            while (System.nanoTime() < deadline) {
                String line = readLine(s, cfg.drainSliceMs);
                if (line == null) continue;
                if (line.isEmpty()) return;
                if (line.startsWith("bestmove")) {
                    LOGGER.debug("drained {}", line);
                    if (markBestMoveRead()) settle(s);
                    return;
                }
            }
            LOGGER.warn("no bestmove within {}ms of stop", cfg.drainTimeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Reads up to a readyok, dropping the extra bestmove a worker sends for a stop that found it idle. */
    private void settle(WorkerSession s) throws InterruptedException {
        try {
            s.send("isready");
        } catch (IOException e) {
            LOGGER.warn("isready not delivered after stop: {}", e.getMessage());
            return;
        }
        final long deadline = System.nanoTime() + cfg.readyTimeoutMs * 1_000_000L;
        long leftMs;
        while ((leftMs = (deadline - System.nanoTime()) / 1_000_000L) > 0) {
            String line = readLine(s, Math.min(cfg.readSliceMs, leftMs));
            if (line == null) continue;
            if (line.isEmpty() || line.equals("readyok")) return;
            if (line.startsWith("bestmove")) LOGGER.debug("dropping late {}", line);
        }
        LOGGER.warn("no readyok within {}ms after stop", cfg.readyTimeoutMs);
    }

    /**
     * Finishes a search whose streaming caller went away: stop, drain, and replace the worker if
     * the bestmove never came.
     */
    private WorkerSession finishAbandonedSearch(WorkerSession s) throws IOException {
        if (!isGoOutstanding()) return s;
        synchronized (searchState) {
            s.send("stop");
            stopsSent.incrementAndGet();
            stopPending = true;
        }
        drain(s);
        if (!isGoOutstanding()) return s;
        LOGGER.warn("abandoned search did not stop, replacing worker");
        discard(s);
        return ensureStarted();
    }

    /**
     * Runs one search and streams its events to {@code sink}: info events per worker info line,
     * then {@code bestmove} and {@code done}, or a single {@code error}. Returns after the last event.
     */
    public void think(SearchRequest request, CancellationToken token, Consumer<BridgeEvent> sink) {
        final Game position;
        try {
            position = request.validate();
        } catch (IllegalArgumentException e) {
            LOGGER.warn("rejected request: {}", e.getMessage());
            sink.accept(BridgeEvent.error(e.getMessage()));
            return;
        }

        try {
            abortCurrentSearch();
        } catch (RuntimeException e) {
            LOGGER.debug("preflight stop failed: {}", e.getMessage());
        }

        searchLock.lock();
        try {
            if (token.isCancelled()) {
                sink.accept(BridgeEvent.error("search cancelled"));
                return;
            }
            streamSearch(request, position, token, sink);
        } catch (BridgeException e) {
            LOGGER.error("search request failed: {}", e.getMessage());
            sink.accept(BridgeEvent.error(e.getMessage()));
        } finally {
            searchLock.unlock();
        }
    }

    private void streamSearch(SearchRequest request, Game position, CancellationToken token, Consumer<BridgeEvent> sink) {
        WorkerSession s = ensureStarted();
        try {
            s = finishAbandonedSearch(s);
            s.send(request.positionCommand());
            if (!isReady(true)) {
                sink.accept(BridgeEvent.error("engine not ready"));
                return;
            }
            if (session != s) {
                // restarted while probing: the new worker has not seen the position
                s = session;
                s.send(request.positionCommand());
                if (!isReady(false)) {
                    sink.accept(BridgeEvent.error("engine not ready"));
                    return;
                }
            }
        } catch (IOException e) {
            reportCrash(s, sink);
            return;
        }

        searchActive = true;
        boolean stopSent = false;
        try {
            sendGo(s, request.goCommand());
            while (true) {
                long slice = token.isCancelled() && !stopSent
                        ? Math.max(1, cfg.stopThrottleMs) : cfg.searchReadSliceMs;
                String line = readLine(s, slice);
                if (token.isCancelled() && !stopSent) {
                    stopSent = abortCurrentSearch();
                }
                if (line == null) continue;
                if (line.isEmpty()) {
                    reportCrash(s, sink);
                    return;
                }
                if (line.startsWith("bestmove")) {
                    boolean stopped = markBestMoveRead();
                    finishWithBestMove(line, position, sink);
                    if (stopped) settle(s);
                    return;
                }
                if (line.startsWith("info ")) {
                    sink.accept(BridgeEvent.info(InfoLineParser.parse(line)));
                }
            }
        } catch (IOException e) {
            reportCrash(s, sink);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sink.accept(BridgeEvent.error("interrupted"));
        } finally {
            searchActive = false;
        }
    }

    private void finishWithBestMove(String line, Game position, Consumer<BridgeEvent> sink) {
        String[] parts = line.split("\\s+");
        String text = parts.length > 1 ? parts[1] : MoveIOUtils.NULL_MOVE;
        if (MoveIOUtils.NULL_MOVE.equals(text)) {
            String reason = position.hasLegalMove() ? "engine returned no move" : "no legal move in position";
            sink.accept(BridgeEvent.error(reason));
            return;
        }
        if (MoveIOUtils.parseUci(position, text) == 0) {
            LOGGER.warn("worker answered illegal move {}", text);
            sink.accept(BridgeEvent.error("engine returned illegal move " + text));
            return;
        }
        sink.accept(BridgeEvent.bestMove(text));
        sink.accept(BridgeEvent.done());
    }

    private void reportCrash(WorkerSession s, Consumer<BridgeEvent> sink) {
        discard(s);
        String message = "engine terminated unexpectedly (code=" + s.exitCode() + ") last="
                + s.lastLines(cfg.crashReportLines);
        LOGGER.error(message);
        sink.accept(BridgeEvent.error(message));
    }

    /**
     * Stops any search, sends ucinewgame and waits for the worker to be ready.
     *
     * @throws BridgeException if the worker cannot be made ready
     */
    public void newGame() {
        abortCurrentSearch();
        searchLock.lock();
        try {
            WorkerSession s = finishAbandonedSearch(ensureStarted());
            s.send("ucinewgame");
            if (!isReady(true)) throw new BridgeException("engine not ready");
            LOGGER.info("new game");
        } catch (IOException e) {
            throw new BridgeException("ucinewgame not delivered: " + e.getMessage(), e);
        } finally {
            searchLock.unlock();
        }
    }

    /** Most recent worker output lines, oldest first. */
    public List<String> lastLines() {
        WorkerSession s = lastSession;
        return s == null ? List.of() : s.lastLines(cfg.retainedLines);
    }

    public int workerStarts() {
        return workerStarts.get();
    }

    public int stopsSent() {
        return stopsSent.get();
    }
}
