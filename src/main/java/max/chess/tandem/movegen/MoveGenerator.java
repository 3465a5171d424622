package max.chess.tandem.movegen;

import max.chess.tandem.game.Game;
import max.chess.tandem.movegen.utils.CheckUtils;
import max.chess.tandem.movegen.utils.SquareUtils;
import max.chess.tandem.utils.ColorUtils;
import max.chess.tandem.utils.PieceUtils;

/**
 * Pseudo-legal generation over the mailbox, filtered by a king-safety test after make/unmake.
 */
public final class MoveGenerator {
    public static final int MAX_MOVES = 256;

    private static final int[] PROMOTIONS = {PieceUtils.QUEEN, PieceUtils.ROOK, PieceUtils.BISHOP, PieceUtils.KNIGHT};

    private MoveGenerator() {}

    /** Writes the legal moves of the side to move into {@code buffer}, returns how many. */
    public static int generateLegalMoves(Game game, int[] buffer) {
        int count = generatePseudoLegalMoves(game, buffer);
        int us = game.currentPlayer();
        int them = ColorUtils.switchColor(us);
        int legal = 0;
        for (int i = 0; i < count; i++) {
            int move = buffer[i];
            long undo = game.playMove(move);
            boolean leavesKingAttacked = CheckUtils.isSquareAttacked(game, game.kingSquare(us), them);
            game.undoMove(undo);
            if (!leavesKingAttacked) {
                buffer[legal++] = move;
            }
        }
        return legal;
    }

    public static boolean isLegal(Game game, int move) {
        if (move == Move.NONE) return false;
        int[] buffer = new int[MAX_MOVES];
        int count = generateLegalMoves(game, buffer);
        for (int i = 0; i < count; i++) {
            if (buffer[i] == move) return true;
        }
        return false;
    }

    static int generatePseudoLegalMoves(Game game, int[] buffer) {
        int us = game.currentPlayer();
        int count = 0;
        for (int square = 0; square < 64; square++) {
            int code = game.pieceAt(square);
            if (code == 0 || PieceUtils.toColor(code) != us) continue;
            switch (PieceUtils.toPieceType(code)) {
                case PieceUtils.PAWN -> count = addPawnMoves(game, square, us, buffer, count);
                case PieceUtils.KNIGHT -> count = addStepMoves(game, square, us, SquareUtils.KNIGHT_TARGETS[square], buffer, count);
                case PieceUtils.BISHOP -> count = addSlidingMoves(game, square, us, 4, 8, buffer, count);
                case PieceUtils.ROOK -> count = addSlidingMoves(game, square, us, 0, 4, buffer, count);
                case PieceUtils.QUEEN -> count = addSlidingMoves(game, square, us, 0, 8, buffer, count);
                case PieceUtils.KING -> {
                    count = addStepMoves(game, square, us, SquareUtils.KING_TARGETS[square], buffer, count);
                    count = addCastles(game, square, us, buffer, count);
                }
                default -> { }
            }
        }
        return count;
    }

    private static int addPawnMoves(Game game, int square, int us, int[] buffer, int count) {
        boolean white = ColorUtils.isWhite(us);
        int forward = white ? 8 : -8;
        int startRank = white ? 1 : 6;
        int promotionRank = white ? 7 : 0;
        int file = SquareUtils.file(square);

        int one = square + forward;
        if (game.pieceAt(one) == 0) {
            count = addPawnMove(square, one, promotionRank, buffer, count);
            int two = one + forward;
            if (SquareUtils.rank(square) == startRank && game.pieceAt(two) == 0) {
                buffer[count++] = Move.of(square, two);
            }
        }
        for (int fileDelta = -1; fileDelta <= 1; fileDelta += 2) {
            int targetFile = file + fileDelta;
            if (targetFile < 0 || targetFile > 7) continue;
            int target = one + fileDelta;
            int code = game.pieceAt(target);
            if (code != 0 && PieceUtils.toColor(code) != us) {
                count = addPawnMove(square, target, promotionRank, buffer, count);
            } else if (code == 0 && target == game.enPassantSquare()) {
                buffer[count++] = Move.enPassant(square, target);
            }
        }
        return count;
    }

    private static int addPawnMove(int from, int to, int promotionRank, int[] buffer, int count) {
        if (SquareUtils.rank(to) == promotionRank) {
            for (int promotion : PROMOTIONS) {
                buffer[count++] = Move.promote(from, to, promotion);
            }
        } else {
            buffer[count++] = Move.of(from, to);
        }
        return count;
    }

    private static int addStepMoves(Game game, int square, int us, int[] targets, int[] buffer, int count) {
        for (int target : targets) {
            int code = game.pieceAt(target);
            if (code == 0 || PieceUtils.toColor(code) != us) {
                buffer[count++] = Move.of(square, target);
            }
        }
        return count;
    }

    private static int addSlidingMoves(Game game, int square, int us, int firstDirection, int lastDirection, int[] buffer, int count) {
        for (int direction = firstDirection; direction < lastDirection; direction++) {
            for (int target : SquareUtils.RAYS[direction][square]) {
                int code = game.pieceAt(target);
                if (code == 0) {
                    buffer[count++] = Move.of(square, target);
                    continue;
                }
                if (PieceUtils.toColor(code) != us) {
                    buffer[count++] = Move.of(square, target);
                }
                break;
            }
        }
        return count;
    }

    private static int addCastles(Game game, int square, int us, int[] buffer, int count) {
        boolean white = ColorUtils.isWhite(us);
        int home = white ? 4 : 60;
        int rights = game.castlingRights();
        if (square != home) return count;
        int kingSide = white ? Game.CASTLE_WHITE_KING_SIDE : Game.CASTLE_BLACK_KING_SIDE;
        int queenSide = white ? Game.CASTLE_WHITE_QUEEN_SIDE : Game.CASTLE_BLACK_QUEEN_SIDE;
        if ((rights & (kingSide | queenSide)) == 0) return count;

        int them = ColorUtils.switchColor(us);
        if (CheckUtils.isSquareAttacked(game, home, them)) return count;
        int rook = PieceUtils.encode(PieceUtils.ROOK, us);

        if ((rights & kingSide) != 0
                && game.pieceAt(home + 3) == rook
                && game.pieceAt(home + 1) == 0 && game.pieceAt(home + 2) == 0
                && !CheckUtils.isSquareAttacked(game, home + 1, them)
                && !CheckUtils.isSquareAttacked(game, home + 2, them)) {
            buffer[count++] = Move.castle(home, home + 2);
        }
        if ((rights & queenSide) != 0
                && game.pieceAt(home - 4) == rook
                && game.pieceAt(home - 1) == 0 && game.pieceAt(home - 2) == 0 && game.pieceAt(home - 3) == 0
                && !CheckUtils.isSquareAttacked(game, home - 1, them)
                && !CheckUtils.isSquareAttacked(game, home - 2, them)) {
            buffer[count++] = Move.castle(home, home - 2);
        }
        return count;
    }
}
