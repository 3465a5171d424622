package max.chess.tandem.bridge;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Parses worker {@code info} lines into the fields carried by info events. */
public final class InfoLineParser {
    private static final Logger LOGGER = LogManager.getLogger(InfoLineParser.class);

    private InfoLineParser() {}

    /**
     * Known keys: depth, nodes, nps, time, hashfull, score (cp or mate), pv (rest of the line) and
     * string (rest of the line). Unknown tokens are skipped; a bad number drops only its field.
     */
    public static JsonObject parse(String line) {
        final JsonObject out = new JsonObject();
        final String[] t = line.trim().split("\\s+");
        for (int i = 0; i < t.length; i++) {
            switch (t[i]) {
                case "info":
                    break;
                case "depth":
                case "nodes":
                case "nps":
                case "time":
                case "hashfull":
                    if (i + 1 < t.length) addNumber(out, t[i], t[++i]);
                    break;
                case "score":
                    if (i + 2 < t.length && (t[i + 1].equals("cp") || t[i + 1].equals("mate"))) {
                        JsonObject score = new JsonObject();
                        addNumber(score, t[i + 1], t[i + 2]);
                        if (score.size() > 0) out.add("score", score);
                        i += 2;
                    }
                    break;
                case "pv": {
                    JsonArray pv = new JsonArray();
                    for (int j = i + 1; j < t.length; j++) pv.add(t[j]);
                    out.add("pv", pv);
                    return out;
                }
                case "string": {
                    String rest = line.trim();
                    int idx = rest.indexOf("string");
                    out.addProperty("string", rest.substring(idx + "string".length()).trim());
                    return out;
                }
                default:
                    break;
            }
        }
        return out;
    }

    private static void addNumber(JsonObject target, String key, String value) {
        try {
            target.addProperty(key, Long.parseLong(value));
        } catch (NumberFormatException e) {
            LOGGER.debug("dropping {}: bad number '{}'", key, value);
        }
    }
}
