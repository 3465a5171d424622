package max.chess.tandem.search.scheduler;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class DepthCostModelTest {

    @Test
    public void predictionFollowsTheLastGrowthWithinBounds() {
        // Given
        DepthCostModel model = new DepthCostModel(1.5, 8.0);

        // Then
        assertEquals(0, model.predictNextMs());

        model.record(100);
        assertEquals(150, model.predictNextMs());

        model.record(400);
        assertEquals(1_600, model.predictNextMs());

        model.record(40_000);
        assertEquals(320_000, model.predictNextMs());

        model.record(100);
        assertEquals(150, model.predictNextMs());
        assertEquals(2, model.samples());
    }

    @Test
    public void instantDepthsStillPredictSomething() {
        // Given
        DepthCostModel model = new DepthCostModel(1.5, 8.0);

        // When
        model.record(0);
        model.record(0);

        // Then
        assertEquals(2, model.predictNextMs());
    }
}
