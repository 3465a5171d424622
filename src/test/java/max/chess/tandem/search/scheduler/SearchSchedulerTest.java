package max.chess.tandem.search.scheduler;

import max.chess.tandem.game.Game;
import max.chess.tandem.movegen.MoveGenerator;
import max.chess.tandem.search.CancellationToken;
import max.chess.tandem.search.SearchConfig;
import max.chess.tandem.utils.notations.FENUtils;
import max.chess.tandem.utils.notations.MoveIOUtils;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SearchSchedulerTest {
    private static final String KIWIPETE = "r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q1p/PPPBBPPP/R3K2R w KQkq - 0 1";

    @Test
    public void searcherAndRefinerStayWithinTheBudget() {
        // Given
        SearchConfig cfg = SearchConfig.defaults();
        SearchScheduler scheduler = new SearchScheduler(cfg);
        Game game = FENUtils.parse(KIWIPETE);
        long budgetMs = 400;
        List<String> lines = new ArrayList<>();
        long start = System.nanoTime();

        // When
        ScheduledMove result = scheduler.run(game, SearchBudget.forMovetime(budgetMs, cfg.maxDepth),
                new CancellationToken(), lines::add);

        // Then
        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;
        // the margin covers timer granularity on a loaded machine
        assertTrue(elapsedMs <= budgetMs + cfg.safetyMarginMs + 100, "took " + elapsedMs + "ms");
        assertTrue(MoveGenerator.isLegal(game, result.move()));
        assertNotNull(result.searchResult());
        assertTrue(lines.contains("info string iter depth=1"));
        assertEquals(KIWIPETE, FENUtils.write(game));
    }

    @Test
    public void depthModeRefinesWithTheRequestedRollouts() {
        // Given
        SearchScheduler scheduler = new SearchScheduler(SearchConfig.defaults());
        Game game = FENUtils.newStandardGame();

        // When
        ScheduledMove result = scheduler.run(game, SearchBudget.forDepth(2, 64), new CancellationToken(), l -> { });

        // Then
        assertEquals(ScheduledMove.Source.REFINER, result.source());
        assertEquals(64, result.refinerResult().rollouts());
        assertEquals(2, result.searchResult().depth());
        assertTrue(MoveGenerator.isLegal(game, result.move()));
    }

    @Test
    public void provenMateSkipsTheRefiner() {
        // Given
        SearchScheduler scheduler = new SearchScheduler(SearchConfig.defaults());
        Game game = FENUtils.parse("6k1/5ppp/8/8/8/8/8/R5K1 w - - 0 1");

        // When
        ScheduledMove result = scheduler.run(game, SearchBudget.forMovetime(300, 64), new CancellationToken(), l -> { });

        // Then
        assertEquals(ScheduledMove.Source.SEARCHER, result.source());
        assertNull(result.refinerResult());
        assertEquals("a1a8", MoveIOUtils.toUci(result.move()));
    }

    @Test
    public void disabledRefinerLeavesTheSearcherMove() {
        // Given
        SearchScheduler scheduler = new SearchScheduler(SearchConfig.defaults().toBuilder().useRefiner(false).build());
        Game game = FENUtils.newStandardGame();

        // When
        ScheduledMove result = scheduler.run(game, SearchBudget.forDepth(3, 64), new CancellationToken(), l -> { });

        // Then
        assertEquals(ScheduledMove.Source.SEARCHER, result.source());
        assertNull(result.refinerResult());
    }

    @Test
    public void cancelledTurnFallsBackToTheDefaultMove() {
        // Given
        SearchScheduler scheduler = new SearchScheduler(SearchConfig.defaults());
        Game game = FENUtils.newStandardGame();
        CancellationToken token = new CancellationToken();
        token.cancel();

        // When
        ScheduledMove result = scheduler.run(game, SearchBudget.forMovetime(1_000, 64), token, l -> { });

        // Then
        assertEquals(ScheduledMove.Source.FALLBACK, result.source());
        assertEquals("a2a3", MoveIOUtils.toUci(result.move()));
    }

    @Test
    public void newGameKeepsResultsReproducible() {
        // Given
        SearchScheduler scheduler = new SearchScheduler(SearchConfig.defaults().toBuilder().useRefiner(false).build());
        Game game = FENUtils.parse(KIWIPETE);

        // When
        ScheduledMove first = scheduler.run(game, SearchBudget.forDepth(3, 0), new CancellationToken(), l -> { });
        scheduler.newGame();
        ScheduledMove second = scheduler.run(game, SearchBudget.forDepth(3, 0), new CancellationToken(), l -> { });

        // Then
        assertEquals(first.move(), second.move());
        assertEquals(first.searchResult().score(), second.searchResult().score());
        assertEquals(first.searchResult().nodes(), second.searchResult().nodes());
    }
}
