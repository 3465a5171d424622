package max.chess.tandem.bridge;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.concurrent.TimeUnit;

/** Spawns the worker as an operating-system process; its stderr goes to ours. */
public final class ProcessWorkerLauncher implements WorkerLauncher {
    private static final Logger LOGGER = LogManager.getLogger(ProcessWorkerLauncher.class);

    private final List<String> command;

    public ProcessWorkerLauncher(List<String> command) {
        if (command == null || command.isEmpty()) throw new IllegalArgumentException("empty worker command");
        this.command = List.copyOf(command);
    }

    @Override
    public WorkerHandle launch() throws IOException {
        LOGGER.info("starting worker: {}", String.join(" ", command));
        Process process = new ProcessBuilder(command)
                .redirectError(ProcessBuilder.Redirect.INHERIT)
                .start();
        return new ProcessHandle(process);
    }

    private static final class ProcessHandle implements WorkerHandle {
        private final Process process;

        ProcessHandle(Process process) {
            this.process = process;
        }

        @Override public InputStream output() { return process.getInputStream(); }
        @Override public OutputStream input() { return process.getOutputStream(); }
        @Override public boolean isAlive() { return process.isAlive(); }

        @Override
        public Integer exitCode() {
            return process.isAlive() ? null : process.exitValue();
        }

        @Override
        public void destroy(long graceMs) {
            process.destroy();
            try {
                if (!process.waitFor(graceMs, TimeUnit.MILLISECONDS)) {
                    LOGGER.warn("worker did not exit within {}ms, killing it", graceMs);
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
            }
        }
    }
}
