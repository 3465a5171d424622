package max.chess.tandem.uci;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.Pipe;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/** Runs a {@link UciServer} on its own thread, talking to it through pipes. */
final class UciTestHarness implements AutoCloseable {
    private final OutputStream toServer;
    private final BufferedReader fromServer;
    private final Thread serverThread;
    final List<String> received = new ArrayList<>();

    UciTestHarness(UciEngine engine) throws IOException {
        Pipe commands = Pipe.open();
        Pipe replies = Pipe.open();
        UciServer server = new UciServer("test", "tester", engine,
                Channels.newInputStream(commands.source()), Channels.newOutputStream(replies.sink()));
        this.toServer = Channels.newOutputStream(commands.sink());
        this.fromServer = new BufferedReader(new InputStreamReader(Channels.newInputStream(replies.source()), StandardCharsets.US_ASCII));
        this.serverThread = new Thread(server::run, "uci-test-server");
        this.serverThread.setDaemon(true);
        this.serverThread.start();
    }

    void send(String command) throws IOException {
        toServer.write((command + "\n").getBytes(StandardCharsets.US_ASCII));
        toServer.flush();
    }

    /** Reads until a line matches, returning it; every line read is kept in {@link #received}. */
    String readUntil(Predicate<String> done) throws IOException {
        String line;
        while ((line = fromServer.readLine()) != null) {
            received.add(line);
            if (done.test(line)) return line;
        }
        throw new IOException("server output ended; got " + received);
    }

    long count(String prefix) {
        return received.stream().filter(l -> l.startsWith(prefix)).count();
    }

    boolean serverStopped(long waitMs) throws InterruptedException {
        serverThread.join(waitMs);
        return !serverThread.isAlive();
    }

    @Override
    public void close() throws IOException {
        toServer.close();
    }
}
