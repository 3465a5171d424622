package max.chess.tandem.uci;

import max.chess.tandem.search.SearchConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/** Engines selectable by name. Unknown names fall back to {@link #DEFAULT}. */
public final class EngineRegistry {
    private static final Logger LOGGER = LogManager.getLogger(EngineRegistry.class);

    public static final String TANDEM = "tandem";
    public static final String ALPHA_BETA = "ab";
    public static final String DEFAULT = ALPHA_BETA;

    private static final Map<String, Function<SearchConfig, UciEngine>> ENGINES;

    static {
        Map<String, Function<SearchConfig, UciEngine>> m = new LinkedHashMap<>();
        m.put(TANDEM, cfg -> new UciEngineImpl(cfg, true));
        m.put(ALPHA_BETA, cfg -> new UciEngineImpl(cfg, false));
        ENGINES = Collections.unmodifiableMap(m);
    }

    private EngineRegistry() {}

    public static Set<String> names() {
        return ENGINES.keySet();
    }

    public static String resolve(String name) {
        if (name != null && ENGINES.containsKey(name)) return name;
        LOGGER.warn("unknown engine '{}', using '{}'", name, DEFAULT);
        return DEFAULT;
    }

    public static UciEngine create(String name, SearchConfig cfg) {
        return ENGINES.get(resolve(name)).apply(cfg);
    }
}
