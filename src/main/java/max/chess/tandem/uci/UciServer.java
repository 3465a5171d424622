package max.chess.tandem.uci;

import max.chess.tandem.search.CancellationToken;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Worker side of the line protocol. Commands are read on the calling thread; each search runs on
 * its own "uci-search" thread and ends with exactly one {@code bestmove} line.
 */
public final class UciServer {
    private static final Logger LOGGER = LogManager.getLogger(UciServer.class);

    private static final long JOIN_TIMEOUT_MS = 5_000;

    private final String name;
    private final String author;
    private final UciEngine engine;

    private final PrintWriter out;
    private final BufferedReader in;

    private final Object searchLock = new Object();
    private Thread searchThread;
    private CancellationToken searchToken;
    private boolean searching; // guarded by searchLock

    public UciServer(String name, String author, UciEngine engine, InputStream input, OutputStream output) {
        this.name = Objects.requireNonNull(name);
        this.author = Objects.requireNonNull(author);
        this.engine = Objects.requireNonNull(engine);
        this.in = new BufferedReader(new InputStreamReader(input, StandardCharsets.US_ASCII));
        this.out = new PrintWriter(new BufferedWriter(new OutputStreamWriter(output, StandardCharsets.US_ASCII)), true);
    }

    /** Run the UCI loop on the current thread until "quit" or end of input. */
    public void run() {
        try {
            String line;
            while ((line = in.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty()) continue;
                LOGGER.debug("<< {}", line);
                if (line.equals("uci")) {
                    send("id name " + name);
                    send("id author " + author);
                    send("uciok");
                } else if (line.equals("isready")) {
                    engine.onIsReady();
                    send("readyok");
                } else if (line.startsWith("setoption")) {
                    handleSetOption(line);
                } else if (line.equals("ucinewgame")) {
                    requestStopAndJoin();
                    engine.newGame();
                } else if (line.startsWith("position")) {
                    handlePosition(line);
                } else if (line.startsWith("go")) {
                    handleGo(line);
                } else if (line.equals("stop")) {
                    handleStop();
                } else if (line.equals("quit")) {
                    requestStopAndJoin();
                    engine.onQuit();
                    break;
                } else {
                    LOGGER.debug("ignoring unknown command '{}'", line);
                }
            }
        } catch (IOException e) {
            LOGGER.debug("input closed: {}", e.getMessage());
            requestStopAndJoin();
        }
    }

    /* -------------------- command handlers -------------------- */

    private void handleSetOption(String line) {
        // setoption name <id> [value <x>]
        String rest = line.substring("setoption".length()).trim();
        if (rest.isEmpty()) return;

        String optName = null, value = null;
        List<String> toks = Arrays.asList(rest.split("\\s+"));
        for (int i = 0; i < toks.size(); i++) {
            String t = toks.get(i);
            if (t.equals("name")) {
                StringBuilder sb = new StringBuilder();
                i++;
                while (i < toks.size() && !toks.get(i).equals("value")) {
                    if (sb.length() > 0) sb.append(' ');
                    sb.append(toks.get(i++));
                }
                i--;
                optName = sb.toString();
            } else if (t.equals("value")) {
                StringBuilder sb = new StringBuilder();
                i++;
                while (i < toks.size()) {
                    if (sb.length() > 0) sb.append(' ');
                    sb.append(toks.get(i++));
                }
                i--;
                value = sb.toString();
            }
        }
        if (optName != null) engine.setOption(optName, value == null ? "" : value);
    }

    private void handlePosition(String line) {
        // position [startpos | fen <FEN...>] [moves <m1> <m2> ...]
        String rest = line.substring("position".length()).trim();
        try {
            if (rest.startsWith("startpos")) {
                List<String> moves = Collections.emptyList();
                int idx = rest.indexOf("moves");
                if (idx >= 0) {
                    moves = splitMoves(rest.substring(idx + "moves".length()).trim());
                }
                engine.setPositionStartpos(moves);
            } else if (rest.startsWith("fen")) {
                String afterFen = rest.substring(3).trim();
                String fen, movesPart = null;
                int movesIdx = afterFen.indexOf(" moves");
                if (movesIdx >= 0) {
                    fen = afterFen.substring(0, movesIdx).trim();
                    movesPart = afterFen.substring(movesIdx + " moves".length()).trim();
                } else {
                    fen = afterFen.trim();
                }
                List<String> moves = movesPart == null ? Collections.emptyList() : splitMoves(movesPart);
                engine.setPositionFEN(fen, moves);
            } else {
                throw new IllegalArgumentException("expected startpos or fen");
            }
        } catch (IllegalArgumentException e) {
            LOGGER.warn("rejected position '{}': {}", rest, e.getMessage());
            send("info string error " + e.getMessage());
        }
    }

    private static List<String> splitMoves(String s) {
        if (s.isEmpty()) return Collections.emptyList();
        return Arrays.asList(s.trim().split("\\s+"));
    }

    private void handleGo(String line) {
        final GoParams gp = parseGo(line);
        requestStopAndJoin();
        final CancellationToken token = new CancellationToken();
        synchronized (searchLock) {
            searchToken = token;
            searching = true;
        }
        if (gp.depth > 0) {
            sendInfo("info string go depth=" + gp.depth + " rollouts=" + Math.max(0, gp.rollouts));
        }
        Thread t = new Thread(() -> runSearch(gp, token), "uci-search");
        t.setDaemon(true);
        searchThread = t;
        t.start();
    }

    private void runSearch(GoParams gp, CancellationToken token) {
        String best;
        try {
            UciResult res = engine.search(gp, token, this::sendInfo);
            best = res == null || res.bestmove() == null || res.bestmove().isEmpty() ? "0000" : res.bestmove();
        } catch (RuntimeException e) {
            LOGGER.error("search failed, answering with the default move", e);
            best = engine.bestMoveNow();
        }
        synchronized (searchLock) {
            send("bestmove " + best);
            searching = false;
        }
    }

    private void handleStop() {
        synchronized (searchLock) {
            if (searching) {
                searchToken.cancel();
            } else {
                send("bestmove " + engine.bestMoveNow());
                return;
            }
        }
        joinSearch();
    }

    static GoParams parseGo(String line) {
        GoParams gp = new GoParams();
        String[] t = line.split("\\s+");
        for (int i = 1; i < t.length; i++) {
            switch (t[i]) {
                case "wtime": gp.wtime = parseLong(t, ++i); break;
                case "btime": gp.btime = parseLong(t, ++i); break;
                case "winc": gp.winc = parseLong(t, ++i); break;
                case "binc": gp.binc = parseLong(t, ++i); break;
                case "movestogo": gp.movestogo = (int) parseLong(t, ++i); break;
                case "movetime": gp.movetime = parseLong(t, ++i); break;
                case "depth": gp.depth = (int) parseLong(t, ++i); break;
                case "rollouts": gp.rollouts = (int) parseLong(t, ++i); break;
                case "infinite": gp.infinite = true; break;
                default: LOGGER.debug("ignoring go token '{}'", t[i]); break;
            }
        }
        return gp;
    }

    private static long parseLong(String[] tok, int i) {
        if (i >= tok.length) return 0;
        try {
            return Long.parseLong(tok[i]);
        } catch (NumberFormatException e) {
            LOGGER.warn("bad number '{}' in go command", tok[i]);
            return 0;
        }
    }

    /* -------------------- lifecycle helpers -------------------- */

    private void requestStopAndJoin() {
        synchronized (searchLock) {
            if (searching) searchToken.cancel();
        }
        joinSearch();
    }

    private void joinSearch() {
        Thread t = searchThread;
        if (t == null || t == Thread.currentThread()) return;
        try {
            t.join(JOIN_TIMEOUT_MS);
            if (t.isAlive()) LOGGER.warn("search thread did not stop within {}ms", JOIN_TIMEOUT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private synchronized void send(String line) {
        LOGGER.debug(">> {}", line);
        out.println(line);
        out.flush();
    }

    private void sendInfo(String infoLine) {
        if (infoLine == null || infoLine.isEmpty()) return;
        if (!infoLine.startsWith("info")) send("info " + infoLine);
        else send(infoLine);
    }

    /** Search parameters passed on "go". All values are milliseconds unless noted, -1 when absent. */
    public static final class GoParams {
        public long wtime = -1, btime = -1, winc = 0, binc = 0;
        public int movestogo = -1;
        public long movetime = -1;
        public int depth = -1;
        /** Refiner rollout cap; -1 when not given. */
        public int rollouts = -1;
        public boolean infinite = false;
    }
}
