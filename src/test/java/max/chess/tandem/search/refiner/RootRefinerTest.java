package max.chess.tandem.search.refiner;

import max.chess.tandem.game.Game;
import max.chess.tandem.movegen.MoveGenerator;
import max.chess.tandem.search.CancellationToken;
import max.chess.tandem.search.Deadline;
import max.chess.tandem.search.SearchConfig;
import max.chess.tandem.utils.notations.FENUtils;
import max.chess.tandem.utils.notations.MoveIOUtils;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RootRefinerTest {

    @Test
    public void rolloutLimitIsHonouredAndPositionRestored() {
        // Given
        Game game = FENUtils.newStandardGame();
        RootRefiner refiner = new RootRefiner(SearchConfig.defaults());
        List<String> lines = new ArrayList<>();

        // When
        RefinerResult result = refiner.refine(game, 0, Deadline.never(), new CancellationToken(), 96, lines::add);

        // Then
        assertEquals(96, result.rollouts());
        assertTrue(result.visits() > 0);
        assertTrue(MoveGenerator.isLegal(game, result.move()));
        assertTrue(result.meanValue() >= -1.0 && result.meanValue() <= 1.0);
        assertEquals(3, lines.size());
        assertTrue(lines.get(0).startsWith("info string refiner rollouts=32"));
        assertEquals(FENUtils.STARTING_POSITION, FENUtils.write(game));
    }

    @Test
    public void sameSeedSameChoice() {
        // Given
        Game game = FENUtils.parse("r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q1p/PPPBBPPP/R3K2R w KQkq - 0 1");
        RootRefiner refiner = new RootRefiner(SearchConfig.defaults());

        // When
        RefinerResult first = refiner.refine(game, 0, Deadline.never(), new CancellationToken(), 200, l -> { });
        RefinerResult second = refiner.refine(game, 0, Deadline.never(), new CancellationToken(), 200, l -> { });

        // Then
        assertEquals(first, second);
    }

    @Test
    public void hangingQueenIsTaken() {
        // Given
        Game game = FENUtils.parse("4k3/8/8/3q4/8/4N3/4P3/4K3 w - - 0 1");
        RootRefiner refiner = new RootRefiner(SearchConfig.defaults());

        // When
        RefinerResult result = refiner.refine(game, 0, Deadline.never(), new CancellationToken(), 300, l -> { });

        // Then
        assertEquals("e3d5", MoveIOUtils.toUci(result.move()));
        assertTrue(result.meanValue() > 0);
    }

    @Test
    public void priorsAreADistributionFavouringCapturesAndTheHint() {
        // Given
        Game game = FENUtils.parse("4k3/8/8/3q4/8/4N3/4P3/4K3 w - - 0 1");
        SearchConfig cfg = SearchConfig.defaults();
        RootRefiner refiner = new RootRefiner(cfg);
        int[] moves = new int[MoveGenerator.MAX_MOVES];
        int n = game.getLegalMoves(moves);
        int capture = MoveIOUtils.parseUci(game, "e3d5");
        int quiet = MoveIOUtils.parseUci(game, "e1d1");

        // When
        double[] plain = refiner.priors(game, moves, n, 0);
        double[] hinted = refiner.priors(game, moves, n, quiet);

        // Then
        double sum = 0;
        int captureIdx = -1, quietIdx = -1;
        for (int i = 0; i < n; i++) {
            sum += plain[i];
            if (moves[i] == capture) captureIdx = i;
            if (moves[i] == quiet) quietIdx = i;
        }
        assertEquals(1.0, sum, 1e-9);
        assertTrue(plain[captureIdx] > plain[quietIdx]);
        assertTrue(hinted[quietIdx] > plain[quietIdx]);
    }

    @Test
    public void stopsAtTheDeadlineLessTheSafetyMargin() {
        // Given
        Game game = FENUtils.newStandardGame();
        SearchConfig cfg = SearchConfig.defaults();
        RootRefiner refiner = new RootRefiner(cfg);
        long start = System.nanoTime();

        // When
        RefinerResult result = refiner.refine(game, 0, Deadline.afterMillis(150), new CancellationToken(), -1, l -> { });

        // Then
        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;
        assertTrue(elapsedMs <= 150 + 50, "took " + elapsedMs + "ms");
        assertTrue(result.rollouts() > 0);
    }

    @Test
    public void cancelledOrMovelessRefinementFallsBack() {
        // Given
        Game game = FENUtils.newStandardGame();
        int hint = MoveIOUtils.parseUci(game, "e2e4");
        CancellationToken cancelled = new CancellationToken();
        cancelled.cancel();
        RootRefiner refiner = new RootRefiner(SearchConfig.defaults());

        // When
        RefinerResult result = refiner.refine(game, hint, Deadline.never(), cancelled, -1, l -> { });
        RefinerResult stalemate = refiner.refine(FENUtils.parse("7k/5Q2/6K1/8/8/8/8/8 b - - 0 1"),
                0, Deadline.never(), new CancellationToken(), 10, l -> { });

        // Then
        assertEquals(0, result.rollouts());
        assertEquals(hint, result.move());
        assertFalse(stalemate.hasMove());
    }
}
