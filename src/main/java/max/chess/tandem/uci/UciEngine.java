package max.chess.tandem.uci;

import max.chess.tandem.search.CancellationToken;

import java.util.List;
import java.util.function.Consumer;

/** What the protocol loop drives: a position, searches over it, and session lifecycle. */
public interface UciEngine {
    /** Called on "ucinewgame". Clears every table the session keeps across searches. */
    void newGame();

    /** Called on "isready". Do any lazy init; return when ready. */
    default void onIsReady() {}

    /** Called on "setoption name X value Y". Unknown names are ignored. */
    default void setOption(String name, String value) {}

    /**
     * "position startpos [moves ...]"
     *
     * @throws IllegalArgumentException if a move is malformed or illegal; the previous position is kept
     */
    void setPositionStartpos(List<String> uciMoves);

    /**
     * "position fen &lt;fen&gt; [moves ...]"
     *
     * @throws IllegalArgumentException if the FEN or a move is rejected; the previous position is kept
     */
    void setPositionFEN(String fen, List<String> uciMoves);

    /**
     * Runs one search on the current position, emitting info lines through {@code infoSink}, and
     * returns as soon as possible once {@code token} is cancelled.
     */
    UciResult search(UciServer.GoParams go, CancellationToken token, Consumer<String> infoSink);

    /** Move to report for a "stop" that arrives while no search is running. */
    String bestMoveNow();

    /** Called once before the loop exits on "quit". */
    default void onQuit() {}
}
