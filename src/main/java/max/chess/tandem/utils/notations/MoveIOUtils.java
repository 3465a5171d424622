package max.chess.tandem.utils.notations;

import max.chess.tandem.game.Game;
import max.chess.tandem.movegen.Move;
import max.chess.tandem.movegen.MoveGenerator;
import max.chess.tandem.movegen.utils.SquareUtils;
import max.chess.tandem.utils.PieceUtils;

import java.util.regex.Pattern;

public final class MoveIOUtils {
    public static final String NULL_MOVE = "0000";
    private static final Pattern UCI_MOVE = Pattern.compile("^[a-h][1-8][a-h][1-8][qrbn]?$");

    private MoveIOUtils() {}

    public static boolean isWellFormed(String text) {
        return text != null && UCI_MOVE.matcher(text).matches();
    }

    public static String toUci(int move) {
        if (move == Move.NONE) {
            return NULL_MOVE;
        }
        String text = toSquare(Move.getStartPosition(move)) + toSquare(Move.getEndPosition(move));
        return Move.isPromotion(move) ? text + PieceUtils.toLetter(Move.getPromotion(move)) : text;
    }

    /** The legal move matching {@code text} in {@code game}, or {@link Move#NONE}. */
    public static int parseUci(Game game, String text) {
        if (!isWellFormed(text)) {
            return Move.NONE;
        }
        int[] buffer = new int[MoveGenerator.MAX_MOVES];
        int count = game.getLegalMoves(buffer);
        for (int i = 0; i < count; i++) {
            if (toUci(buffer[i]).equals(text)) {
                return buffer[i];
            }
        }
        return Move.NONE;
    }

    public static String toSquare(int square) {
        return "" + (char) ('a' + SquareUtils.file(square)) + (char) ('1' + SquareUtils.rank(square));
    }

    /** Square index for "e4"-style text, -1 when malformed. */
    public static int parseSquare(String square) {
        if (square == null || square.length() != 2) {
            return -1;
        }
        int file = square.charAt(0) - 'a';
        int rank = square.charAt(1) - '1';
        if (file < 0 || file > 7 || rank < 0 || rank > 7) {
            return -1;
        }
        return SquareUtils.square(file, rank);
    }
}
