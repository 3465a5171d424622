package max.chess.tandem.bridge;

import java.io.IOException;

@FunctionalInterface
public interface WorkerLauncher {
    WorkerHandle launch() throws IOException;
}
