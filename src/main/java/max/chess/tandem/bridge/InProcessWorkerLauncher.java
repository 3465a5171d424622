package max.chess.tandem.bridge;

import max.chess.tandem.uci.UciEngine;
import max.chess.tandem.uci.UciServer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.Pipe;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs the worker on a thread of this JVM, connected through two {@link Pipe}s. When the body
 * returns, its output is closed and the host reads end of stream, as with an exiting process.
 */
public final class InProcessWorkerLauncher implements WorkerLauncher {
    private static final Logger LOGGER = LogManager.getLogger(InProcessWorkerLauncher.class);

    /** The worker program: reads commands from {@code in}, writes replies to {@code out}. */
    @FunctionalInterface
    public interface WorkerBody {
        void run(InputStream in, OutputStream out) throws IOException;
    }

    private final WorkerBody body;
    private final AtomicInteger launches = new AtomicInteger();

    public InProcessWorkerLauncher(WorkerBody body) {
        this.body = body;
    }

    public static InProcessWorkerLauncher forEngine(String name, Supplier<UciEngine> engine) {
        return new InProcessWorkerLauncher((in, out) -> new UciServer(name, "tandem", engine.get(), in, out).run());
    }

    public int launches() {
        return launches.get();
    }

    @Override
    public WorkerHandle launch() throws IOException {
        final Pipe toWorker = Pipe.open();
        final Pipe fromWorker = Pipe.open();
        final InProcessHandle handle = new InProcessHandle(toWorker, fromWorker);
        final int id = launches.incrementAndGet();
        Thread t = new Thread(() -> {
            int code = 0;
            try (InputStream in = Channels.newInputStream(toWorker.source());
                 OutputStream out = Channels.newOutputStream(fromWorker.sink())) {
                body.run(in, out);
            } catch (IOException | RuntimeException e) {
                LOGGER.debug("in-process worker {} ended with {}", id, e.toString());
                code = 1;
            }
            handle.exitCode = code;
        }, "worker-" + id);
        t.setDaemon(true);
        handle.thread = t;
        t.start();
        return handle;
    }

    private static final class InProcessHandle implements WorkerHandle {
        private final Pipe toWorker;
        private final Pipe fromWorker;
        private final InputStream output;
        private final OutputStream input;
        private volatile Thread thread;
        private volatile Integer exitCode;

        InProcessHandle(Pipe toWorker, Pipe fromWorker) {
            this.toWorker = toWorker;
            this.fromWorker = fromWorker;
            this.output = Channels.newInputStream(fromWorker.source());
            this.input = Channels.newOutputStream(toWorker.sink());
        }

        @Override public InputStream output() { return output; }
        @Override public OutputStream input() { return input; }
        @Override public boolean isAlive() { return thread != null && thread.isAlive(); }
        @Override public Integer exitCode() { return exitCode; }

        @Override
        public void destroy(long graceMs) {
            closeQuietly(toWorker.sink());
            Thread t = thread;
            if (t == null) return;
            try {
                t.join(graceMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (t.isAlive()) {
                t.interrupt();
                closeQuietly(toWorker.source());
                closeQuietly(fromWorker.sink());
            }
            closeQuietly(fromWorker.source());
        }

        private static void closeQuietly(java.nio.channels.Channel c) {
            try {
                c.close();
            } catch (IOException e) {
                LOGGER.debug("closing worker pipe: {}", e.getMessage());
            }
        }
    }
}
