package max.chess.tandem.search.scheduler;

import max.chess.tandem.game.Game;
import max.chess.tandem.utils.notations.FENUtils;
import max.chess.tandem.utils.notations.MoveIOUtils;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class FallbackMoveTest {

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            // quiet only: lowest UCI string
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1; a2a3",
            // two captures: the queen before the pawn
            "4k3/8/8/2p1q3/3P4/8/8/4K3 w - - 0 1; d4e5",
            // same victim: the cheaper attacker
            "4k3/8/8/3r4/2P5/4N3/8/4K3 w - - 0 1; c4d5",
            // no capture: a checking move first
            "4k3/8/8/8/8/8/8/R3K3 w Q - 0 1; a1a8",
            // nothing to play
            "7k/5Q2/6K1/8/8/8/8/8 b - - 0 1; 0000",
    })
    public void choiceIsDeterministic(String fen, String expected) {
        // Given
        Game game = FENUtils.parse(fen);

        // When
        int move = FallbackMove.choose(game);

        // Then
        assertEquals(expected, MoveIOUtils.toUci(move));
        assertEquals(move, FallbackMove.choose(game));
    }
}
