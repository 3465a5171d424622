package max.chess.tandem.bridge;

import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class BridgeEventTest {

    @Test
    public void serialisedShapes() {
        assertEquals("{\"type\":\"bestmove\",\"move\":\"e7e8q\"}", BridgeEvent.bestMove("e7e8q").toJson());
        assertEquals("{\"type\":\"done\"}", BridgeEvent.done().toJson());
        assertEquals("{\"type\":\"error\",\"message\":\"engine not ready\"}", BridgeEvent.error("engine not ready").toJson());
    }

    @Test
    public void infoCopiesParsedFields() {
        // Given
        JsonObject fields = InfoLineParser.parse("info depth 2 score cp 15 pv d2d4");

        // When
        BridgeEvent event = BridgeEvent.info(fields);
        fields.addProperty("depth", 99);

        // Then
        assertEquals("{\"type\":\"info\",\"depth\":2,\"score\":{\"cp\":15},\"pv\":[\"d2d4\"]}", event.toJson());
        assertFalse(event.isTerminal());
    }

    @Test
    public void parsesBack() {
        // Given
        BridgeEvent error = BridgeEvent.error("a <b> & c");

        // When
        BridgeEvent back = BridgeEvent.fromJson(error.toJson());

        // Then
        assertEquals(error, back);
        assertTrue(back.isTerminal());
        assertEquals("a <b> & c", back.getString("message"));
    }
}
