package max.chess.tandem.utils.notations;

import max.chess.tandem.game.Game;
import max.chess.tandem.movegen.utils.SquareUtils;
import max.chess.tandem.utils.ColorUtils;
import max.chess.tandem.utils.PieceUtils;

// https://en.wikipedia.org/wiki/Forsyth%E2%80%93Edwards_Notation
public final class FENUtils {
    public static final String STARTING_POSITION = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";

    private FENUtils() {}

    public static Game newStandardGame() {
        return parse(STARTING_POSITION);
    }

    /**
     * Parses 4 to 6 FEN fields, half-move and full-move clocks default to 0 and 1.
     *
     * @throws IllegalArgumentException when the record is malformed
     */
    public static Game parse(String fen) {
        if (fen == null || fen.isBlank()) {
            throw new IllegalArgumentException("empty FEN");
        }
        String[] fenFields = fen.trim().split("\\s+");
        if (fenFields.length < 4 || fenFields.length > 6) {
            throw new IllegalArgumentException("FEN needs 4 to 6 fields, got " + fenFields.length);
        }

        Game game = new Game();
        injectPiecePlacement(game, fenFields[0]);
        injectCurrentTurn(game, fenFields[1]);
        injectCastlingRights(game, fenFields[2]);
        injectEnPassantSquare(game, fenFields[3]);
        game.setHalfMoveClock(fenFields.length > 4 ? parseClock(fenFields[4], 0) : 0);
        game.setFullMoveClock(fenFields.length > 5 ? parseClock(fenFields[5], 1) : 1);

        game.recomputeZobristKey();
        return game;
    }

    public static String write(Game game) {
        StringBuilder fen = new StringBuilder();
        for (int rank = 7; rank >= 0; rank--) {
            int emptySpaceCounter = 0;
            if (rank != 7) {
                fen.append('/');
            }
            for (int file = 0; file < 8; file++) {
                int code = game.pieceAt(SquareUtils.square(file, rank));
                if (code == 0) {
                    emptySpaceCounter++;
                    continue;
                }
                if (emptySpaceCounter != 0) {
                    fen.append(emptySpaceCounter);
                    emptySpaceCounter = 0;
                }
                fen.append(PieceUtils.toFenLetter(code));
            }
            if (emptySpaceCounter != 0) {
                fen.append(emptySpaceCounter);
            }
        }

        fen.append(' ').append(ColorUtils.isBlack(game.currentPlayer()) ? 'b' : 'w');

        fen.append(' ');
        int rights = game.castlingRights();
        if (rights == 0) {
            fen.append('-');
        } else {
            if ((rights & Game.CASTLE_WHITE_KING_SIDE) != 0) fen.append('K');
            if ((rights & Game.CASTLE_WHITE_QUEEN_SIDE) != 0) fen.append('Q');
            if ((rights & Game.CASTLE_BLACK_KING_SIDE) != 0) fen.append('k');
            if ((rights & Game.CASTLE_BLACK_QUEEN_SIDE) != 0) fen.append('q');
        }

        fen.append(' ');
        int enPassant = game.enPassantSquare();
        fen.append(enPassant >= 0 ? MoveIOUtils.toSquare(enPassant) : "-");

        fen.append(' ').append(game.halfMoveClock());
        fen.append(' ').append(game.fullMoveClock());
        return fen.toString();
    }

    private static void injectPiecePlacement(Game game, String piecePlacement) {
        String[] rows = piecePlacement.split("/", -1);
        if (rows.length != 8) {
            throw new IllegalArgumentException("piece placement needs 8 ranks: " + piecePlacement);
        }
        int[] kings = new int[2];
        for (int row = 0; row < 8; row++) {
            int rank = 7 - row;
            int file = 0;
            for (char character : rows[row].toCharArray()) {
                if (character >= '1' && character <= '8') {
                    file += character - '0';
                    continue;
                }
                int pieceType = PieceUtils.fromLetter(character);
                if (pieceType == PieceUtils.NONE) {
                    throw new IllegalArgumentException("unexpected FEN letter '" + character + "'");
                }
                if (file > 7) {
                    throw new IllegalArgumentException("rank " + (rank + 1) + " overflows");
                }
                if (pieceType == PieceUtils.PAWN && (rank == 0 || rank == 7)) {
                    throw new IllegalArgumentException("pawn on back rank");
                }
                int color = Character.isUpperCase(character) ? ColorUtils.WHITE : ColorUtils.BLACK;
                if (pieceType == PieceUtils.KING) kings[color]++;
                game.setPiece(SquareUtils.square(file, rank), PieceUtils.encode(pieceType, color));
                file++;
            }
            if (file != 8) {
                throw new IllegalArgumentException("rank " + (rank + 1) + " has " + file + " files");
            }
        }
        if (kings[ColorUtils.WHITE] != 1 || kings[ColorUtils.BLACK] != 1) {
            throw new IllegalArgumentException("each side needs exactly one king");
        }
    }

    private static void injectCurrentTurn(Game game, String currentTurn) {
        switch (currentTurn) {
            case "w" -> game.setCurrentPlayer(ColorUtils.WHITE);
            case "b" -> game.setCurrentPlayer(ColorUtils.BLACK);
            default -> throw new IllegalArgumentException("side to move must be w or b: " + currentTurn);
        }
    }

    private static void injectCastlingRights(Game game, String castlingRights) {
        int rights = 0;
        if (!"-".equals(castlingRights)) {
            for (char character : castlingRights.toCharArray()) {
                rights |= switch (character) {
                    case 'K' -> Game.CASTLE_WHITE_KING_SIDE;
                    case 'Q' -> Game.CASTLE_WHITE_QUEEN_SIDE;
                    case 'k' -> Game.CASTLE_BLACK_KING_SIDE;
                    case 'q' -> Game.CASTLE_BLACK_QUEEN_SIDE;
                    default -> throw new IllegalArgumentException("bad castling field: " + castlingRights);
                };
            }
        }
        game.setCastlingRights(rights);
    }

    private static void injectEnPassantSquare(Game game, String enPassantSquare) {
        if ("-".equals(enPassantSquare)) {
            game.setEnPassantSquare(-1);
            return;
        }
        int square = MoveIOUtils.parseSquare(enPassantSquare);
        int rank = SquareUtils.rank(square);
        if (square < 0 || (rank != 2 && rank != 5)) {
            throw new IllegalArgumentException("bad en-passant square: " + enPassantSquare);
        }
        game.setEnPassantSquare(square);
    }

    private static int parseClock(String value, int minimum) {
        try {
            int clock = Integer.parseInt(value);
            if (clock < minimum) {
                throw new IllegalArgumentException("clock out of range: " + value);
            }
            return clock;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("clock is not a number: " + value, e);
        }
    }
}
