package max.chess.tandem.bridge;

import java.io.InputStream;
import java.io.OutputStream;

/** A running worker: its protocol streams and its lifecycle. */
public interface WorkerHandle {
    /** What the worker writes. */
    InputStream output();

    /** What the worker reads. */
    OutputStream input();

    boolean isAlive();

    /** Exit code once the worker has ended, null while it runs or when unknown. */
    Integer exitCode();

    /** Ends the worker, forcibly if it does not exit within {@code graceMs}. */
    void destroy(long graceMs);
}
