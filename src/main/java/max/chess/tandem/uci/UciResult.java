package max.chess.tandem.uci;

import max.chess.tandem.utils.notations.MoveIOUtils;

/** Engine should return this at the end of search. {@code source} is informational, may be null. */
public record UciResult(String bestmove, String source) {
    public static UciResult best(String bm) {
        return new UciResult(bm, null);
    }

    public static UciResult none() {
        return new UciResult(MoveIOUtils.NULL_MOVE, null);
    }
}
