package max.chess.tandem.search;

import max.chess.tandem.search.evaluator.GameValues;
import max.chess.tandem.utils.notations.MoveIOUtils;

public record SearchResult(int move, int score, int depth, long nodes, long timeMs, long nps, int[] principalVariation) {

    public static boolean isMateScore(int score) {
        return Math.abs(score) >= GameValues.CHECKMATE_VALUE - SearchConstants.MAX_PLY;
    }

    /** Full moves to mate, positive when the side to move mates. */
    public static int mateInMoves(int score) {
        int plies = GameValues.CHECKMATE_VALUE - Math.abs(score);
        return score > 0 ? (plies + 1) / 2 : -(plies / 2);
    }

    public boolean isMate() {
        return isMateScore(score);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("SearchResult\n")
            .append("best move: ").append(MoveIOUtils.toUci(move)).append("\n")
            .append("score: ").append(score).append("\n")
            .append("depth: ").append(depth).append("\n")
            .append("search time (ms): ").append(timeMs).append("\n")
            .append("nodes/sec: ").append(nps).append("\n")
            .append("PV: ");
        for(int move :  principalVariation) {
            sb.append(MoveIOUtils.toUci(move)).append(" ");
        }
        return sb.toString();
    }

    public String toUCIInfo() {
        StringBuilder sb = new StringBuilder("info")
            .append(" depth ").append(depth)
                .append(" nodes ").append(nodes)
                .append(" nps ").append(nps);
        if (isMate()) {
            sb.append(" score mate ").append(mateInMoves(score));
        } else {
            sb.append(" score cp ").append(score);
        }
        sb.append(" time ").append(timeMs).append(" pv");
        for(int move :  principalVariation) {
            sb.append(' ').append(MoveIOUtils.toUci(move));
        }
        return sb.toString();
    }
}
