package max.chess.tandem.uci;

import max.chess.tandem.search.CancellationToken;
import max.chess.tandem.search.SearchConfig;
import max.chess.tandem.search.SearchContext;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;

public class UciEngineImplTest {

    private static UciEngineImpl engine() {
        return new UciEngineImpl(SearchConfig.defaults().toBuilder().ttSizeMb(1).build(), true);
    }

    private static UciServer.GoParams depth(int depth) {
        UciServer.GoParams go = new UciServer.GoParams();
        go.depth = depth;
        return go;
    }

    @Test
    public void bestMoveNowForgetsTheSearchOfAnEarlierPosition() {
        // Given
        UciEngineImpl engine = engine();
        engine.setPositionFEN("6k1/5ppp/8/8/8/8/8/R5K1 w - - 0 1", List.of());
        UciResult searched = engine.search(depth(2), new CancellationToken(), line -> { });

        // When
        engine.setPositionFEN("6k1/5ppp/8/8/8/8/8/R1n3K1 w - - 0 1", List.of());

        // Then
        assertEquals("a1a8", searched.bestmove());
        assertEquals("a1c1", engine.bestMoveNow());
    }

    @Test
    public void bestMoveNowRemembersTheSearchOfTheCurrentPosition() {
        // Given
        UciEngineImpl engine = engine();
        engine.setPositionStartpos(List.of("e2e4"));

        // When
        UciResult searched = engine.search(depth(2), new CancellationToken(), line -> { });

        // Then
        assertEquals(searched.bestmove(), engine.bestMoveNow());
    }

    @Test
    public void optionsOtherThanHashKeepTheSessionTables() {
        // Given
        UciEngineImpl engine = engine();
        engine.search(depth(3), new CancellationToken(), line -> { });
        SearchContext before = engine.facade().context();

        // When
        engine.setOption("SafetyMargin", "35");
        engine.setOption("DefaultBudget", "800");
        SearchContext afterTuning = engine.facade().context();
        engine.setOption("Hash", "2");
        SearchContext afterHash = engine.facade().context();

        // Then
        assertEquals(35, engine.config().safetyMarginMs);
        assertEquals(800, engine.config().defaultBudgetMs);
        assertSame(before.tt, afterTuning.tt);
        assertSame(before.killer, afterTuning.killer);
        assertSame(before.history, afterTuning.history);
        assertNotSame(before.tt, afterHash.tt);
        assertEquals(2, engine.config().ttSizeMb);
    }

    @Test
    public void alphaBetaEngineKeepsTheRefinerOff() {
        // Given
        UciEngineImpl ab = new UciEngineImpl(SearchConfig.defaults().toBuilder().ttSizeMb(1).build(), false);

        // When
        ab.setOption("Refiner", "true");

        // Then
        assertFalse(ab.config().useRefiner);
    }
}
