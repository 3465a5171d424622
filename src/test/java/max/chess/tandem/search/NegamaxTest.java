package max.chess.tandem.search;

import max.chess.tandem.game.Game;
import max.chess.tandem.utils.notations.FENUtils;
import org.junit.jupiter.api.Test;

import static max.chess.tandem.search.SearchConstants.INF;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class NegamaxTest {
    private static final String MIDDLEGAME = "r1bqkbnr/pppp1ppp/2n5/4p3/4P3/5N2/PPPP1PPP/RNBQKB1R w KQkq - 2 3";
    private static final String PAWN_ENDING = "8/8/4k3/8/4P3/4K3/8/8 w - - 0 1";

    /** Counts null moves and, when asked, fails right after playing one. */
    private static final class NullMoveSpy extends Game {
        private final boolean fail;
        int nullMoves;

        NullMoveSpy(Game source, boolean fail) {
            super(source);
            this.fail = fail;
        }

        @Override
        public long playNullMove() {
            nullMoves++;
            long undo = super.playNullMove();
            if (fail) throw new IllegalStateException("null move rejected");
            return undo;
        }
    }

    private static SearchContext freshContext(SearchConfig cfg) {
        SearchContext ctx = new SearchContext(cfg);
        ctx.newSearch(new CancellationToken(), Deadline.never());
        return ctx;
    }

    @Test
    public void failingNullMoveIsRewoundAndTheNodeSearchedUnpruned() {
        // Given
        SearchConfig cfg = SearchConfig.defaults().toBuilder().ttSizeMb(1).build();
        NullMoveSpy game = new NullMoveSpy(FENUtils.parse(MIDDLEGAME), true);
        Game reference = FENUtils.parse(MIDDLEGAME);
        SearchContext ctx = freshContext(cfg);
        SearchContext referenceCtx = freshContext(cfg.toBuilder().useNullMove(false).build());

        // When
        int score = Negamax.search(game, ctx, 4, 0, -INF, INF);
        int referenceScore = Negamax.search(reference, referenceCtx, 4, 0, -INF, INF);

        // Then
        assertTrue(game.nullMoves > 0);
        assertEquals(MIDDLEGAME, FENUtils.write(game));
        assertEquals(FENUtils.parse(MIDDLEGAME).zobristKey(), game.zobristKey());
        assertEquals(referenceScore, score);
        assertEquals(referenceCtx.rootBestMove, ctx.rootBestMove);
        assertEquals(referenceCtx.nodes, ctx.nodes);
    }

    @Test
    public void nullMoveIsTriedWithPiecesOnTheBoard() {
        // Given
        NullMoveSpy game = new NullMoveSpy(FENUtils.parse(MIDDLEGAME), false);

        // When
        Negamax.search(game, freshContext(SearchConfig.defaults().toBuilder().ttSizeMb(1).build()), 4, 0, -INF, INF);

        // Then
        assertTrue(game.nullMoves > 0);
        assertEquals(MIDDLEGAME, FENUtils.write(game));
    }

    @Test
    public void nullMoveIsNeverTriedInAPawnEnding() {
        // Given
        NullMoveSpy game = new NullMoveSpy(FENUtils.parse(PAWN_ENDING), false);

        // When
        Negamax.search(game, freshContext(SearchConfig.defaults().toBuilder().ttSizeMb(1).build()), 6, 0, -INF, INF);

        // Then
        assertEquals(0, game.nullMoves);
    }

    @Test
    public void zugzwangGuardCountsBothSidesPieces() {
        // Given
        int limit = SearchConfig.defaults().nullMinMaterial;

        // Then
        assertTrue(Negamax.likelyZugzwang(FENUtils.parse(PAWN_ENDING), limit));
        assertTrue(Negamax.likelyZugzwang(FENUtils.parse("4k3/8/8/8/8/8/8/R3K2R w - - 0 1"), limit));
        assertFalse(Negamax.likelyZugzwang(FENUtils.parse("4k3/8/8/8/8/8/8/R2QK3 w - - 0 1"), limit));
        assertFalse(Negamax.likelyZugzwang(FENUtils.newStandardGame(), limit));
    }
}
