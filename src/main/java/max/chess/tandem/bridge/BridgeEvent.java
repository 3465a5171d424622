package max.chess.tandem.bridge;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

import java.util.Objects;

/**
 * One unit of bridge output: {@code info}, {@code bestmove}, {@code done} or {@code error}, each
 * serialised as a single compact JSON object carrying a {@code type} field.
 */
public final class BridgeEvent {
    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    public static final String INFO = "info";
    public static final String BESTMOVE = "bestmove";
    public static final String DONE = "done";
    public static final String ERROR = "error";

    private final JsonObject body;

    private BridgeEvent(JsonObject body) {
        this.body = body;
    }

    /** @param fields parsed info fields; copied, and tagged with the info type */
    public static BridgeEvent info(JsonObject fields) {
        JsonObject o = new JsonObject();
        o.addProperty("type", INFO);
        for (var e : fields.entrySet()) o.add(e.getKey(), e.getValue().deepCopy());
        return new BridgeEvent(o);
    }

    public static BridgeEvent bestMove(String move) {
        JsonObject o = new JsonObject();
        o.addProperty("type", BESTMOVE);
        o.addProperty("move", Objects.requireNonNull(move));
        return new BridgeEvent(o);
    }

    public static BridgeEvent done() {
        JsonObject o = new JsonObject();
        o.addProperty("type", DONE);
        return new BridgeEvent(o);
    }

    public static BridgeEvent error(String message) {
        JsonObject o = new JsonObject();
        o.addProperty("type", ERROR);
        o.addProperty("message", message == null ? "unknown error" : message);
        return new BridgeEvent(o);
    }

    public static BridgeEvent fromJson(String json) {
        return new BridgeEvent(GSON.fromJson(json, JsonObject.class));
    }

    public String type() {
        return body.get("type").getAsString();
    }

    public boolean isTerminal() {
        String t = type();
        return DONE.equals(t) || ERROR.equals(t);
    }

    /** A copy of the event body. */
    public JsonObject body() {
        return body.deepCopy();
    }

    public String getString(String field) {
        return body.has(field) ? body.get(field).getAsString() : null;
    }

    public String toJson() {
        return GSON.toJson(body);
    }

    @Override
    public String toString() {
        return toJson();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BridgeEvent other && body.equals(other.body);
    }

    @Override
    public int hashCode() {
        return body.hashCode();
    }
}
