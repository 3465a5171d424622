package max.chess.tandem.search.refiner;

/** Move picked by the refiner (0 when nothing was visited), its mean value in [-1, 1], and effort. */
public record RefinerResult(int move, double meanValue, int visits, int rollouts) {
    public static RefinerResult none(int rollouts) {
        return new RefinerResult(0, 0.0, 0, rollouts);
    }

    public boolean hasMove() {
        return move != 0;
    }
}
