package max.chess.tandem.bridge;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * One launched worker. A pump thread moves its output lines into a queue so reads can time out;
 * the last lines received are retained for crash reports.
 */
final class WorkerSession {
    private static final Logger LOGGER = LogManager.getLogger(WorkerSession.class);

    /** Returned by {@link #readLine(long)} once the worker's output has ended. */
    static final String EOF = "";

    private static final Object EOF_MARKER = new Object();

    private final WorkerHandle handle;
    private final OutputStream input;
    // output lines, then EOF_MARKER
    private final BlockingQueue<Object> lines = new LinkedBlockingQueue<>();
    private final Deque<String> lastLines = new ArrayDeque<>();
    private final int retainedLines;
    private volatile boolean ended;

    WorkerSession(WorkerHandle handle, int retainedLines, int id) {
        this.handle = handle;
        this.input = handle.input();
        this.retainedLines = retainedLines;
        Thread pump = new Thread(this::pump, "worker-reader-" + id);
        pump.setDaemon(true);
        pump.start();
    }

    private void pump() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(handle.output(), StandardCharsets.US_ASCII))) {
            String line;
            while ((line = reader.readLine()) != null) {
                line = line.trim();
                if (!line.isEmpty()) lines.add(line);
            }
        } catch (IOException e) {
            LOGGER.debug("worker output closed: {}", e.getMessage());
        } finally {
            lines.add(EOF_MARKER);
        }
    }

    synchronized void send(String command) throws IOException {
        LOGGER.debug(">> {}", command);
        input.write((command + "\n").getBytes(StandardCharsets.US_ASCII));
        input.flush();
    }

    /**
     * Next output line.
     *
     * @return the line, null if none arrived within {@code timeoutMs}, or {@link #EOF} once the
     * output has ended
     */
    String readLine(long timeoutMs) throws InterruptedException {
        if (ended) return EOF;
        Object item = lines.poll(timeoutMs, TimeUnit.MILLISECONDS);
        if (item == null) return null;
        if (item == EOF_MARKER) {
            ended = true;
            return EOF;
        }
        String line = (String) item;
        LOGGER.debug("<< {}", line);
        synchronized (lastLines) {
            lastLines.addLast(line);
            while (lastLines.size() > retainedLines) lastLines.removeFirst();
        }
        return line;
    }

    boolean isAlive() {
        return !ended && handle.isAlive();
    }

    Integer exitCode() {
        return handle.exitCode();
    }

    List<String> lastLines(int count) {
        synchronized (lastLines) {
            List<String> all = new ArrayList<>(lastLines);
            return all.subList(Math.max(0, all.size() - count), all.size());
        }
    }

    void destroy(long graceMs) {
        handle.destroy(graceMs);
    }
}
