package max.chess.tandem.uci;

import max.chess.tandem.game.Game;
import max.chess.tandem.search.SearchConfig;
import max.chess.tandem.utils.notations.FENUtils;
import max.chess.tandem.utils.notations.MoveIOUtils;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class UciServerTest {
    private static final Duration TIMEOUT = Duration.ofSeconds(20);

    private static UciEngine engine() {
        return EngineRegistry.create(EngineRegistry.TANDEM, SearchConfig.defaults());
    }

    private static String moveOf(String bestmoveLine) {
        return bestmoveLine.split(" ")[1];
    }

    @Test
    public void handshakeAndReadiness() {
        assertTimeoutPreemptively(TIMEOUT, () -> {
            try (UciTestHarness uci = new UciTestHarness(engine())) {
                // When
                uci.send("uci");
                uci.readUntil("uciok"::equals);
                uci.send("isready");
                uci.readUntil("readyok"::equals);

                // Then
                assertEquals("id name test", uci.received.get(0));
                assertEquals("id author tester", uci.received.get(1));
                uci.send("quit");
                assertTrue(uci.serverStopped(5_000));
            }
        });
    }

    @Test
    public void depthSearchAnswersOneLegalBestMove() {
        assertTimeoutPreemptively(TIMEOUT, () -> {
            try (UciTestHarness uci = new UciTestHarness(engine())) {
                // Given
                uci.send("position startpos moves e2e4 e7e5");
                Game expected = FENUtils.parse("rnbqkbnr/pppp1ppp/8/4p3/4P3/8/PPPP1PPP/RNBQKBNR w KQkq e6 0 2");

                // When
                uci.send("go depth 3");
                String best = uci.readUntil(l -> l.startsWith("bestmove"));
                uci.send("isready");
                uci.readUntil("readyok"::equals);

                // Then
                assertTrue(MoveIOUtils.parseUci(expected, moveOf(best)) != 0, best);
                assertEquals(1, uci.count("bestmove"));
                assertTrue(uci.received.contains("info string go depth=3 rollouts=0"));
                assertTrue(uci.received.stream().anyMatch(l -> l.startsWith("info depth 3 ")));
            }
        });
    }

    @Test
    public void rejectedPositionKeepsThePreviousOne() {
        assertTimeoutPreemptively(TIMEOUT, () -> {
            try (UciTestHarness uci = new UciTestHarness(engine())) {
                // Given
                String fen = "6k1/5ppp/8/8/8/8/8/R5K1 w - - 0 1";
                uci.send("position fen " + fen);

                // When
                uci.send("position fen 6k1/5ppp/8/8/8/8/8/R5K1 w - - x 1");
                String error1 = uci.readUntil(l -> l.startsWith("info string error"));
                uci.send("position fen " + fen + " moves a1a9");
                String error2 = uci.readUntil(l -> l.startsWith("info string error"));
                uci.send("go depth 2");
                String best = uci.readUntil(l -> l.startsWith("bestmove"));

                // Then
                assertTrue(error1.contains("clock"), error1);
                assertTrue(error2.contains("a1a9"), error2);
                assertEquals("bestmove a1a8", best);
            }
        });
    }

    @Test
    public void stopEndsARunningSearchWithExactlyOneBestMove() {
        assertTimeoutPreemptively(TIMEOUT, () -> {
            try (UciTestHarness uci = new UciTestHarness(engine())) {
                // Given
                uci.send("position startpos");
                uci.send("go infinite");
                uci.readUntil(l -> l.startsWith("info depth 2 "));

                // When
                uci.send("stop");
                String best = uci.readUntil(l -> l.startsWith("bestmove"));
                uci.send("stop");
                String idle = uci.readUntil(l -> l.startsWith("bestmove"));
                uci.send("isready");
                uci.readUntil("readyok"::equals);

                // Then
                Game start = FENUtils.newStandardGame();
                assertTrue(MoveIOUtils.parseUci(start, moveOf(best)) != 0, best);
                assertEquals(best, idle);
                assertEquals(2, uci.count("bestmove"));
            }
        });
    }

    @Test
    public void newGoStopsThePreviousSearchFirst() {
        assertTimeoutPreemptively(TIMEOUT, () -> {
            try (UciTestHarness uci = new UciTestHarness(engine())) {
                // Given
                uci.send("position startpos");
                uci.send("go infinite");
                uci.readUntil(l -> l.startsWith("info depth 1 "));

                // When
                uci.send("go depth 1");
                uci.readUntil(l -> l.startsWith("bestmove"));
                uci.readUntil(l -> l.startsWith("bestmove"));
                uci.send("isready");
                uci.readUntil("readyok"::equals);

                // Then
                assertEquals(2, uci.count("bestmove"));
            }
        });
    }

    @Test
    public void idleStopOnAFreshPositionUsesTheDefaultMove() {
        assertTimeoutPreemptively(TIMEOUT, () -> {
            try (UciTestHarness uci = new UciTestHarness(engine())) {
                // When
                uci.send("setoption name Hash value 8");
                uci.send("position fen 4k3/8/8/2p1q3/3P4/8/8/4K3 w - - 0 1");
                uci.send("stop");
                String best = uci.readUntil(l -> l.startsWith("bestmove"));

                // Then
                assertEquals("bestmove d4e5", best);
            }
        });
    }

    @Test
    public void goParameters() {
        // When
        UciServer.GoParams go = UciServer.parseGo("go wtime 1000 btime 2000 winc 10 binc 20 movestogo 5 depth 7 rollouts 300");
        UciServer.GoParams movetime = UciServer.parseGo("go movetime 250");

        // Then
        assertEquals(1000, go.wtime);
        assertEquals(2000, go.btime);
        assertEquals(10, go.winc);
        assertEquals(20, go.binc);
        assertEquals(5, go.movestogo);
        assertEquals(7, go.depth);
        assertEquals(300, go.rollouts);
        assertEquals(250, movetime.movetime);
        assertEquals(-1, movetime.depth);
        assertEquals(-1, movetime.rollouts);
    }

    @Test
    public void registryFallsBackToAlphaBeta() {
        assertEquals(EngineRegistry.ALPHA_BETA, EngineRegistry.resolve("mcts-v9"));
        assertEquals(EngineRegistry.TANDEM, EngineRegistry.resolve("tandem"));
        assertTrue(EngineRegistry.create("nope", SearchConfig.defaults()) instanceof UciEngineImpl);
    }
}
