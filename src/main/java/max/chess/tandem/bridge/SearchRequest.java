package max.chess.tandem.bridge;

import max.chess.tandem.game.Game;
import max.chess.tandem.utils.notations.FENUtils;
import max.chess.tandem.utils.notations.MoveIOUtils;

import java.util.List;

/**
 * A position and its search limits. Exactly one of {@code depth} and {@code movetimeMs} is set;
 * {@code rollouts} only goes with depth.
 *
 * @param fen   null for the standard start position
 * @param moves moves played from {@code fen}, in UCI notation
 */
public record SearchRequest(String fen, List<String> moves, Integer depth, Integer rollouts, Long movetimeMs) {

    public SearchRequest {
        moves = moves == null ? List.of() : List.copyOf(moves);
    }

    public static SearchRequest depth(String fen, int depth, Integer rollouts) {
        return new SearchRequest(fen, List.of(), depth, rollouts, null);
    }

    public static SearchRequest movetime(String fen, long movetimeMs) {
        return new SearchRequest(fen, List.of(), null, null, movetimeMs);
    }

    /**
     * Checks the limits and replays the position.
     *
     * @return the position the worker will search
     * @throws IllegalArgumentException describing the first problem found
     */
    public Game validate() {
        if ((depth == null) == (movetimeMs == null)) {
            throw new IllegalArgumentException("exactly one of depth or movetime is required");
        }
        if (depth != null && depth < 1) {
            throw new IllegalArgumentException("depth must be positive: " + depth);
        }
        if (movetimeMs != null && movetimeMs < 0) {
            throw new IllegalArgumentException("movetime must not be negative: " + movetimeMs);
        }
        if (rollouts != null && rollouts < 0) {
            throw new IllegalArgumentException("rollouts must not be negative: " + rollouts);
        }
        if (rollouts != null && depth == null) {
            throw new IllegalArgumentException("rollouts require a depth search");
        }
        Game game = fen == null ? FENUtils.newStandardGame() : FENUtils.parse(fen);
        for (String text : moves) {
            if (!MoveIOUtils.isWellFormed(text)) {
                throw new IllegalArgumentException("malformed move: " + text);
            }
            int move = MoveIOUtils.parseUci(game, text);
            if (move == 0) {
                throw new IllegalArgumentException("illegal move: " + text);
            }
            game.playMove(move);
        }
        return game;
    }

    public String positionCommand() {
        StringBuilder sb = new StringBuilder("position ");
        sb.append(fen == null ? "startpos" : "fen " + fen.trim());
        if (!moves.isEmpty()) sb.append(" moves ").append(String.join(" ", moves));
        return sb.toString();
    }

    public String goCommand() {
        if (depth != null) {
            return rollouts == null ? "go depth " + depth : "go depth " + depth + " rollouts " + rollouts;
        }
        return "go movetime " + movetimeMs;
    }
}
