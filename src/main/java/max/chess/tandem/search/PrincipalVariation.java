package max.chess.tandem.search;

import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import max.chess.tandem.game.Game;
import max.chess.tandem.movegen.MoveGenerator;
import max.chess.tandem.search.transpositiontable.TranspositionTable;

final class PrincipalVariation {

    private PrincipalVariation() {}

    /**
     * Root best move followed by TT best moves, at most {@code maxLen} long, stopping at the first
     * missing, illegal or repeating continuation. The position is restored before returning.
     */
    static int[] extract(Game game, TranspositionTable tt, int rootMove, int maxLen) {
        if (rootMove == 0 || maxLen <= 0) return new int[0];
        int[] pv = new int[Math.min(maxLen, SearchConstants.MAX_PLY)];
        LongOpenHashSet seen = new LongOpenHashSet();
        seen.add(game.zobristKey());

        int mark = game.mark();
        int len = 0;
        int move = rootMove;
        try {
            while (len < pv.length && move != 0 && MoveGenerator.isLegal(game, move)) {
                game.playMove(move);
                pv[len++] = move;
                if (!seen.add(game.zobristKey())) break;
                move = tt != null ? tt.peekMove(game.zobristKey()) : 0;
            }
        } finally {
            game.rewind(mark);
        }
        int[] out = new int[len];
        System.arraycopy(pv, 0, out, 0, len);
        return out;
    }
}
