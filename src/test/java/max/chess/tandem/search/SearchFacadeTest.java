package max.chess.tandem.search;

import max.chess.tandem.game.Game;
import max.chess.tandem.movegen.MoveGenerator;
import max.chess.tandem.search.evaluator.PositionEvaluator;
import max.chess.tandem.search.scheduler.ScheduledMove;
import max.chess.tandem.search.scheduler.SearchBudget;
import max.chess.tandem.uci.UciServer;
import max.chess.tandem.utils.notations.FENUtils;
import max.chess.tandem.utils.notations.MoveIOUtils;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SearchFacadeTest {

    private static UciServer.GoParams depth(int depth) {
        UciServer.GoParams go = new UciServer.GoParams();
        go.depth = depth;
        return go;
    }

    @Test
    public void startPositionAtDepthFour() {
        // Given
        Game game = FENUtils.newStandardGame();
        SearchFacade facade = new SearchFacade(SearchConfig.defaults());
        List<String> lines = new ArrayList<>();

        // When
        ScheduledMove result = facade.findBestMove(game, new CancellationToken(), depth(4), lines::add);

        // Then
        assertTrue(MoveGenerator.isLegal(game, result.move()));
        assertEquals(ScheduledMove.Source.SEARCHER, result.source());
        SearchResult searched = result.searchResult();
        assertNotNull(searched);
        assertEquals(4, searched.depth());
        assertTrue(searched.nodes() > 0);
        assertTrue(searched.principalVariation().length <= 4);
        assertEquals(searched.move(), searched.principalVariation()[0]);
        assertTrue(lines.contains("info string iter depth=1"));
        assertTrue(lines.stream().anyMatch(l -> l.startsWith("info depth 4 ")));
        assertTrue(lines.stream().anyMatch(l -> l.startsWith("info string tt probes=")));
        assertEquals(FENUtils.STARTING_POSITION, FENUtils.write(game));
    }

    @Test
    public void reconfiguringKeepsTheSessionTables() {
        // Given
        SearchFacade facade = new SearchFacade(SearchConfig.defaults().toBuilder().ttSizeMb(1).build());
        facade.findBestMove(FENUtils.newStandardGame(), new CancellationToken(), depth(3), line -> { });
        SearchContext before = facade.context();

        // When
        SearchFacade margin = facade.reconfigure(facade.config().toBuilder().safetyMarginMs(40).build());
        SearchFacade resized = margin.reconfigure(margin.config().toBuilder().ttSizeMb(margin.config().ttSizeMb + 1).build());

        // Then
        assertEquals(40, margin.config().safetyMarginMs);
        assertSame(before.tt, margin.context().tt);
        assertSame(before.history, margin.context().history);
        assertSame(before.killer, margin.context().killer);
        assertTrue(margin.context().tt.peekMove(FENUtils.newStandardGame().zobristKey()) != 0);
        assertNotSame(before.tt, resized.context().tt);
        assertSame(before.history, resized.context().history);
    }

    @Test
    public void mateInOneIsFoundAndReportedAsMate() {
        for (int depth = 1; depth <= 3; depth++) {
            // Given
            Game game = FENUtils.parse("6k1/5ppp/8/8/8/8/8/R5K1 w - - 0 1");
            SearchFacade facade = new SearchFacade(SearchConfig.defaults());
            List<String> lines = new ArrayList<>();

            // When
            ScheduledMove result = facade.findBestMove(game, new CancellationToken(), depth(depth), lines::add);

            // Then
            assertEquals("a1a8", MoveIOUtils.toUci(result.move()));
            assertTrue(result.searchResult().isMate());
            assertEquals(1, SearchResult.mateInMoves(result.searchResult().score()));
            assertTrue(lines.stream().anyMatch(l -> l.contains("score mate 1")));
            game.playMove(result.move());
            assertTrue(game.isCheckmate());
        }
    }

    @Test
    public void stalemateHasNoMoveAndScoresZero() {
        // Given
        Game game = FENUtils.parse("7k/5Q2/6K1/8/8/8/8/8 b - - 0 1");
        SearchFacade facade = new SearchFacade(SearchConfig.defaults());

        // When
        ScheduledMove result = facade.findBestMove(game, new CancellationToken(), depth(3), l -> { });

        // Then
        assertEquals(0, PositionEvaluator.evaluate(game));
        assertEquals(0, game.getLegalMoves(new int[MoveGenerator.MAX_MOVES]));
        assertEquals(0, result.move());
        assertEquals(0, result.searchResult().score());
        assertEquals(ScheduledMove.Source.FALLBACK, result.source());
    }

    @Test
    public void winningMaterialIsTaken() {
        // Given
        // black queen hangs to the knight
        Game game = FENUtils.parse("4k3/8/8/3q4/8/4N3/4P3/4K3 w - - 0 1");
        SearchFacade facade = new SearchFacade(SearchConfig.defaults());

        // When
        ScheduledMove result = facade.findBestMove(game, new CancellationToken(), depth(3), l -> { });

        // Then
        assertEquals("e3d5", MoveIOUtils.toUci(result.move()));
    }

    @Test
    public void budgetsFollowTheGoCommand() {
        // Given
        SearchFacade facade = new SearchFacade(SearchConfig.defaults());
        Game game = FENUtils.newStandardGame();
        UciServer.GoParams byDepth = depth(5);
        byDepth.rollouts = 64;
        UciServer.GoParams byTime = new UciServer.GoParams();
        byTime.movetime = 500;
        UciServer.GoParams byClock = new UciServer.GoParams();
        byClock.wtime = 60_000;
        byClock.winc = 1_000;
        UciServer.GoParams infinite = new UciServer.GoParams();
        infinite.infinite = true;

        // When
        SearchBudget depthBudget = facade.toBudget(game, byDepth);
        SearchBudget timeBudget = facade.toBudget(game, byTime);
        SearchBudget clockBudget = facade.toBudget(game, byClock);
        SearchBudget infiniteBudget = facade.toBudget(game, infinite);

        // Then
        assertEquals(new SearchBudget(TimeControl.UNBOUNDED, 5, 64), depthBudget);
        assertEquals(490, timeBudget.budgetMs());
        assertEquals(-1, timeBudget.maxRollouts());
        assertEquals(1_700, clockBudget.budgetMs());
        assertEquals(TimeControl.UNBOUNDED, infiniteBudget.budgetMs());
        assertEquals(0, infiniteBudget.maxRollouts());
    }
}
