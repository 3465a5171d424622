package max.chess.tandem.uci;

import max.chess.tandem.game.Game;
import max.chess.tandem.movegen.MoveGenerator;
import max.chess.tandem.search.CancellationToken;
import max.chess.tandem.search.SearchConfig;
import max.chess.tandem.search.SearchFacade;
import max.chess.tandem.search.scheduler.FallbackMove;
import max.chess.tandem.search.scheduler.ScheduledMove;
import max.chess.tandem.utils.notations.FENUtils;
import max.chess.tandem.utils.notations.MoveIOUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.function.Consumer;

/**
 * Engine behind the protocol loop. Searches run on a copy of the current position so a position
 * command never races a running search.
 */
public class UciEngineImpl implements UciEngine {
    private static final Logger LOGGER = LogManager.getLogger(UciEngineImpl.class);

    private final boolean refinerAllowed;
    private volatile SearchConfig cfg;
    private volatile SearchFacade engine;
    private volatile Game game = FENUtils.newStandardGame();
    private volatile int lastBestMove;

    /** @param refinerAllowed false for the alpha-beta-only engine, which accepts and ignores rollouts */
    public UciEngineImpl(SearchConfig cfg, boolean refinerAllowed) {
        this.refinerAllowed = refinerAllowed;
        this.cfg = refinerAllowed ? cfg : cfg.toBuilder().useRefiner(false).build();
        this.engine = new SearchFacade(this.cfg);
    }

    @Override
    public void newGame() {
        engine.newGame();
        lastBestMove = 0;
        LOGGER.info("new game");
    }

    @Override
    public void setOption(String name, String value) {
        SearchConfig.Builder b = cfg.toBuilder();
        switch (name.toLowerCase()) {
            case "hash" -> b.ttSizeMb(clampInt(value, 1, 4096, cfg.ttSizeMb));
            case "refiner" -> b.useRefiner(refinerAllowed && Boolean.parseBoolean(value));
            case "safetymargin" -> b.safetyMarginMs(clampInt(value, 0, 10_000, (int) cfg.safetyMarginMs));
            case "defaultbudget" -> b.defaultBudgetMs(clampInt(value, 1, 3_600_000, (int) cfg.defaultBudgetMs));
            default -> {
                LOGGER.debug("ignoring option {}", name);
                return;
            }
        }
        cfg = b.build();
        // TT, killers and history carry over; only a new Hash size starts an empty table
        engine = engine.reconfigure(cfg);
        LOGGER.info("option {} = {}", name, value);
    }

    @Override
    public void setPositionStartpos(List<String> uciMoves) {
        setPositionFEN(FENUtils.STARTING_POSITION, uciMoves);
    }

    @Override
    public void setPositionFEN(String fen, List<String> uciMoves) {
        Game next = FENUtils.parse(fen);
        for (String text : uciMoves) {
            int move = MoveIOUtils.parseUci(next, text);
            if (move == 0) {
                throw new IllegalArgumentException("illegal move " + text + " in " + FENUtils.write(next));
            }
            next.playMove(move);
        }
        game = next;
        lastBestMove = 0;
    }

    @Override
    public UciResult search(UciServer.GoParams go, CancellationToken token, Consumer<String> infoSink) {
        final Game searched = game;
        final ScheduledMove result = engine.findBestMove(searched.copy(), token, go, infoSink);
        if (!result.hasMove()) {
            return UciResult.none();
        }
        // a position set meanwhile has already cleared it
        if (game == searched) lastBestMove = result.move();
        return new UciResult(MoveIOUtils.toUci(result.move()), result.source().name().toLowerCase());
    }

    @Override
    public String bestMoveNow() {
        Game current = game;
        int move = lastBestMove;
        if (move == 0 || !MoveGenerator.isLegal(current, move)) {
            move = FallbackMove.choose(current);
        }
        return MoveIOUtils.toUci(move);
    }

    Game position() {
        return game;
    }

    SearchConfig config() {
        return cfg;
    }

    SearchFacade facade() {
        return engine;
    }

    private static int clampInt(String s, int lo, int hi, int dflt) {
        try {
            int v = Integer.parseInt(s.trim());
            return Math.min(hi, Math.max(lo, v));
        } catch (NumberFormatException e) {
            LOGGER.warn("bad numeric option value '{}', keeping {}", s, dflt);
            return dflt;
        }
    }
}
