package max.chess.tandem;

import max.chess.tandem.bridge.BridgeConfig;
import max.chess.tandem.bridge.BridgeEvent;
import max.chess.tandem.bridge.InProcessWorkerLauncher;
import max.chess.tandem.bridge.ProcessWorkerLauncher;
import max.chess.tandem.bridge.SearchRequest;
import max.chess.tandem.bridge.UciBridge;
import max.chess.tandem.bridge.WorkerLauncher;
import max.chess.tandem.search.CancellationToken;
import max.chess.tandem.search.SearchConfig;
import max.chess.tandem.uci.EngineRegistry;
import max.chess.tandem.uci.UciServer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * {@code Main [engine]} runs a protocol worker on stdin/stdout ({@code tandem} or {@code ab}).
 * {@code Main bridge --fen F (--depth N [--rollouts R] | --movetime MS) [--engine E] [--worker cmd...]}
 * runs one search behind the bridge and prints its events as JSON lines.
 */
public final class Main {
    private static final Logger LOGGER = LogManager.getLogger(Main.class);

    private Main() {}

    public static void main(String[] args) {
        if (args.length > 0 && args[0].equals("bridge")) {
            System.exit(runBridge(Arrays.copyOfRange(args, 1, args.length), System.out));
        }
        String name = EngineRegistry.resolve(args.length > 0 ? args[0] : EngineRegistry.DEFAULT);
        SearchConfig cfg = SearchConfig.fromSystemProperties();
        LOGGER.info("worker '{}' starting", name);
        new UciServer("tandem-" + name, "tandem", EngineRegistry.create(name, cfg), System.in, System.out).run();
    }

    static int runBridge(String[] args, PrintStream out) {
        String fen = null;
        String engine = EngineRegistry.TANDEM;
        Integer depth = null, rollouts = null;
        Long movetime = null;
        List<String> worker = new ArrayList<>();
        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--fen" -> fen = args[++i];
                    case "--depth" -> depth = Integer.parseInt(args[++i]);
                    case "--rollouts" -> rollouts = Integer.parseInt(args[++i]);
                    case "--movetime" -> movetime = Long.parseLong(args[++i]);
                    case "--engine" -> engine = args[++i];
                    case "--worker" -> {
                        worker.addAll(Arrays.asList(args).subList(i + 1, args.length));
                        i = args.length;
                    }
                    default -> throw new IllegalArgumentException("unknown argument " + args[i]);
                }
            }
        } catch (ArrayIndexOutOfBoundsException | IllegalArgumentException e) {
            out.println(BridgeEvent.error("usage: bridge --fen <fen> (--depth N [--rollouts R] | --movetime MS)"
                    + " [--engine name] [--worker command...]: " + e.getMessage()).toJson());
            return 2;
        }

        final String engineName = engine;
        final SearchConfig cfg = SearchConfig.fromSystemProperties();
        WorkerLauncher launcher = worker.isEmpty()
                ? InProcessWorkerLauncher.forEngine(engineName, () -> EngineRegistry.create(engineName, cfg))
                : new ProcessWorkerLauncher(worker);

        SearchRequest request = new SearchRequest(fen, List.of(), depth, rollouts, movetime);
        final boolean[] failed = {false};
        try (UciBridge bridge = new UciBridge(launcher, BridgeConfig.fromSystemProperties())) {
            bridge.think(request, new CancellationToken(), event -> {
                if (BridgeEvent.ERROR.equals(event.type())) failed[0] = true;
                out.println(event.toJson());
            });
        }
        return failed[0] ? 1 : 0;
    }
}
