package max.chess.tandem.movegen.utils;

import max.chess.tandem.game.Game;
import max.chess.tandem.utils.ColorUtils;
import max.chess.tandem.utils.PieceUtils;

public final class CheckUtils {
    private CheckUtils() {}

    public static boolean isSquareAttacked(Game game, int square, int byColor) {
        if (isAttackedByPawn(game, square, byColor)) return true;

        int knight = PieceUtils.encode(PieceUtils.KNIGHT, byColor);
        for (int from : SquareUtils.KNIGHT_TARGETS[square]) {
            if (game.pieceAt(from) == knight) return true;
        }
        int king = PieceUtils.encode(PieceUtils.KING, byColor);
        for (int from : SquareUtils.KING_TARGETS[square]) {
            if (game.pieceAt(from) == king) return true;
        }

        int queen = PieceUtils.encode(PieceUtils.QUEEN, byColor);
        int rook = PieceUtils.encode(PieceUtils.ROOK, byColor);
        int bishop = PieceUtils.encode(PieceUtils.BISHOP, byColor);
        for (int direction = 0; direction < 8; direction++) {
            int slider = SquareUtils.isOrthogonal(direction) ? rook : bishop;
            for (int from : SquareUtils.RAYS[direction][square]) {
                int code = game.pieceAt(from);
                if (code == 0) continue;
                if (code == slider || code == queen) return true;
                break;
            }
        }
        return false;
    }

    private static boolean isAttackedByPawn(Game game, int square, int byColor) {
        int pawn = PieceUtils.encode(PieceUtils.PAWN, byColor);
        int file = SquareUtils.file(square);
        if (ColorUtils.isWhite(byColor)) {
            if (file > 0 && square - 9 >= 0 && game.pieceAt(square - 9) == pawn) return true;
            return file < 7 && square - 7 >= 0 && game.pieceAt(square - 7) == pawn;
        }
        if (file > 0 && square + 7 < 64 && game.pieceAt(square + 7) == pawn) return true;
        return file < 7 && square + 9 < 64 && game.pieceAt(square + 9) == pawn;
    }
}
