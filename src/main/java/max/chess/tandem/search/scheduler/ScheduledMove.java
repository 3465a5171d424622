package max.chess.tandem.search.scheduler;

import max.chess.tandem.search.SearchResult;
import max.chess.tandem.search.refiner.RefinerResult;

/** The move chosen for a turn and which phase produced it. Either result may be null. */
public record ScheduledMove(int move, Source source, SearchResult searchResult, RefinerResult refinerResult) {

    public enum Source {
        REFINER,
        SEARCHER,
        FALLBACK
    }

    public boolean hasMove() {
        return move != 0;
    }
}
