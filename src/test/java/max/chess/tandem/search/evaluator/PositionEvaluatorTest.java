package max.chess.tandem.search.evaluator;

import max.chess.tandem.game.Game;
import max.chess.tandem.utils.notations.FENUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PositionEvaluatorTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1",
            "r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q1p/PPPBBPPP/R3K2R w KQkq - 0 1",
            "8/2p5/3p4/KP5r/1R3p1k/8/4P1P1/8 w - - 0 1",
    })
    public void evaluationIsIdempotent(String fen) {
        // Given
        Game game = FENUtils.parse(fen);
        String before = FENUtils.write(game);

        // When
        int first = PositionEvaluator.evaluate(game);
        int second = PositionEvaluator.evaluate(game);

        // Then
        assertEquals(first, second);
        assertEquals(before, FENUtils.write(game));
    }

    @Test
    public void startPositionIsBalanced() {
        assertEquals(0, PositionEvaluator.evaluate(FENUtils.newStandardGame()));
    }

    @Test
    public void scoreIsFromTheSideToMove() {
        // Given
        // white is a queen up
        Game whiteToMove = FENUtils.parse("rnb1kbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1");
        Game blackToMove = FENUtils.parse("rnb1kbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR b KQkq - 0 1");

        // Then
        assertTrue(PositionEvaluator.evaluate(whiteToMove) > 700);
        assertEquals(-PositionEvaluator.evaluate(whiteToMove), PositionEvaluator.evaluate(blackToMove));
    }

    @Test
    public void terminalPositions() {
        // Given
        Game stalemate = FENUtils.parse("7k/5Q2/6K1/8/8/8/8/8 b - - 0 1");
        Game mated = FENUtils.parse("R5k1/5ppp/8/8/8/8/8/6K1 b - - 1 1");
        Game bareKings = FENUtils.parse("8/8/4k3/8/8/3K4/8/8 w - - 0 1");

        // Then
        assertEquals(GameValues.DRAW_VALUE, PositionEvaluator.evaluate(stalemate));
        assertEquals(-GameValues.CHECKMATE_VALUE, PositionEvaluator.evaluate(mated));
        assertEquals(GameValues.DRAW_VALUE, PositionEvaluator.evaluate(bareKings));
    }
}
