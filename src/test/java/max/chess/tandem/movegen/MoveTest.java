package max.chess.tandem.movegen;

import max.chess.tandem.utils.PieceUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MoveTest {

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 7, 8, 36, 62, 63})
    public void testSquareEncoding(int square) {
        // When
        int move = Move.of(square, 63 - square);

        // Then
        assertEquals(square, Move.getStartPosition(move));
        assertEquals(63 - square, Move.getEndPosition(move));
        assertFalse(Move.isPromotion(move));
    }

    @ParameterizedTest
    @ValueSource(bytes = {PieceUtils.KNIGHT, PieceUtils.BISHOP, PieceUtils.ROOK, PieceUtils.QUEEN})
    public void testPromotionEncoding(byte promotion) {
        // When
        int move = Move.promote(52, 60, promotion);

        // Then
        assertTrue(Move.isPromotion(move));
        assertEquals(promotion, Move.getPromotion(move));
        assertFalse(Move.isCastle(move));
    }

    @Test
    public void testFlags() {
        // Given
        int ep = Move.enPassant(36, 43);
        int castle = Move.castle(4, 6);

        // Then
        assertTrue(Move.isEnPassant(ep));
        assertFalse(Move.isCastle(ep));
        assertTrue(Move.isCastle(castle));
        assertFalse(Move.isEnPassant(castle));
        assertTrue(ep != Move.NONE && castle != Move.NONE);
    }
}
