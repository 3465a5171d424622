package max.chess.tandem.search.scheduler;

import max.chess.tandem.game.Game;
import max.chess.tandem.movegen.MoveGenerator;
import max.chess.tandem.search.MoveOrdering;
import max.chess.tandem.utils.notations.MoveIOUtils;

/**
 * Deterministic default move: the best capture by MVV-LVA, else a checking move, else any legal
 * move. Ties go to the lowest UCI string.
 */
public final class FallbackMove {
    private static final int CAPTURE = 2;
    private static final int CHECK = 1;

    private FallbackMove() {}

    /** 0 when the side to move has no legal move. */
    public static int choose(Game game) {
        final int[] moves = new int[MoveGenerator.MAX_MOVES];
        final int n = game.getLegalMoves(moves);
        int best = 0;
        int bestClass = -1;
        int bestMvvLva = 0;
        String bestText = null;
        for (int i = 0; i < n; i++) {
            int m = moves[i];
            int cls = game.isCapture(m) ? CAPTURE : game.givesCheck(m) ? CHECK : 0;
            int mvvLva = cls == CAPTURE ? MoveOrdering.mvvLva(game, m) : 0;
            String text = MoveIOUtils.toUci(m);
            boolean better;
            if (cls != bestClass) better = cls > bestClass;
            else if (mvvLva != bestMvvLva) better = mvvLva > bestMvvLva;
            else better = text.compareTo(bestText) < 0;
            if (better) {
                best = m;
                bestClass = cls;
                bestMvvLva = mvvLva;
                bestText = text;
            }
        }
        return best;
    }
}
