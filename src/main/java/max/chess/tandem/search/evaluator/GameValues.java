package max.chess.tandem.search.evaluator;

public final class GameValues {
    public static final int CHECKMATE_VALUE = 29000;
    public static final int DRAW_VALUE = 0;
    public static final int PAT_VALUE = DRAW_VALUE;

    private GameValues() {}
}
