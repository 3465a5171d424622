package max.chess.tandem.search;

public final class SearchConstants {
    public static final int INF     =  30000;

    // Nominal ply bound for principal variation & heuristic arrays
    public static final int MAX_PLY = 128;

    // Extra headroom for per-ply move/score buffers used by qsearch
    public static final int STACK_PLY = 256;

    public static final int MAX_MOVES = 256;

    private SearchConstants() {}
}
