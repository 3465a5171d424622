package max.chess.tandem.search.evaluator;

import max.chess.tandem.game.Game;
import max.chess.tandem.utils.ColorUtils;
import max.chess.tandem.utils.PieceUtils;

import static max.chess.tandem.search.evaluator.PieceValues.*;

/**
 * Static scorer: tapered material + piece-square tables + bishop pair, in centipawns from the
 * side to move's point of view. Pure and deterministic.
 */
public final class PositionEvaluator {
    private PositionEvaluator() {}

    /**
     * Score with terminal shortcuts: mated side gets {@code -CHECKMATE_VALUE}, stalemate,
     * insufficient material and claimable draws are 0.
     */
    public static int evaluate(Game game) {
        if (!game.hasLegalMove()) {
            return game.inCheck() ? -GameValues.CHECKMATE_VALUE : GameValues.PAT_VALUE;
        }
        if (game.isInsufficientMaterial() || game.canClaimDraw()) {
            return GameValues.DRAW_VALUE;
        }
        return evaluateStatic(game);
    }

    /** Material and placement only, no terminal detection. */
    public static int evaluateStatic(Game game) {
        int[] mg = new int[2];
        int[] eg = new int[2];
        int[] bishops = new int[2];
        int phase = 0;

        for (int square = 0; square < 64; square++) {
            int code = game.pieceAt(square);
            if (code == 0) continue;
            int type = PieceUtils.toPieceType(code);
            int color = PieceUtils.toColor(code);
            int idx = tableIndex(square, color);
            phase += PHASE[type];
            switch (type) {
                case PieceUtils.PAWN -> {
                    mg[color] += PAWN_VALUE + P_MG[idx];
                    eg[color] += PAWN_VALUE + P_EG[idx];
                }
                case PieceUtils.KNIGHT -> {
                    mg[color] += KNIGHT_VALUE + N_PST[idx];
                    eg[color] += KNIGHT_VALUE + N_PST[idx];
                }
                case PieceUtils.BISHOP -> {
                    bishops[color]++;
                    mg[color] += BISHOP_VALUE + B_PST[idx];
                    eg[color] += BISHOP_VALUE + B_PST[idx];
                }
                case PieceUtils.ROOK -> {
                    mg[color] += ROOK_VALUE + R_PST[idx];
                    eg[color] += ROOK_VALUE + R_PST[idx];
                }
                case PieceUtils.QUEEN -> {
                    mg[color] += QUEEN_VALUE + Q_PST[idx];
                    eg[color] += QUEEN_VALUE + Q_PST[idx];
                }
                case PieceUtils.KING -> {
                    mg[color] += K_MG[idx];
                    eg[color] += K_EG[idx];
                }
                default -> { }
            }
        }
        for (int color = 0; color < 2; color++) {
            if (bishops[color] >= 2) {
                mg[color] += BISHOP_PAIR_BONUS;
                eg[color] += BISHOP_PAIR_BONUS;
            }
        }

        phase = Math.min(phase, MAX_PHASE);
        int mgScore = mg[ColorUtils.WHITE] - mg[ColorUtils.BLACK];
        int egScore = eg[ColorUtils.WHITE] - eg[ColorUtils.BLACK];
        int white = (mgScore * phase + egScore * (MAX_PHASE - phase)) / MAX_PHASE;
        return ColorUtils.isWhite(game.currentPlayer()) ? white : -white;
    }
}
