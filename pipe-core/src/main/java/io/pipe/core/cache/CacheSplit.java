package io.pipe.core.cache;

import io.pipe.core.turn.Turn;
import java.util.ArrayList;
import java.util.List;

/**
 * Chronological history split into the prefix served from the provider cache and the suffix sent
 * with every request. An empty {@code cachedTurns} means no cache is used.
 */
public record CacheSplit(List<Turn> cachedTurns, List<Turn> bufferedTurns, boolean updateCache) {

    public CacheSplit {
        cachedTurns = cachedTurns == null ? List.of() : List.copyOf(cachedTurns);
        bufferedTurns = bufferedTurns == null ? List.of() : List.copyOf(bufferedTurns);
    }

    static CacheSplit uncached(List<Turn> turns) {
        return new CacheSplit(List.of(), turns, false);
    }

    public boolean hasCache() {
        return !cachedTurns.isEmpty();
    }

    public int cachedTurnCount() {
        return cachedTurns.size();
    }

    public List<Turn> allTurns() {
        List<Turn> all = new ArrayList<>(cachedTurns);
        all.addAll(bufferedTurns);
        return all;
    }
}
