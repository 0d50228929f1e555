package io.pipe.core.cache;

import io.pipe.core.turn.Turn;
import java.util.List;

/**
 * What to send for one request: the cache to reference (null for none), the turns it covers and
 * the turns sent inline.
 */
public record CachePlan(String cacheName, List<Turn> cachedTurns, List<Turn> bufferedTurns) {

    public CachePlan {
        cachedTurns = cachedTurns == null ? List.of() : List.copyOf(cachedTurns);
        bufferedTurns = bufferedTurns == null ? List.of() : List.copyOf(bufferedTurns);
    }

    static CachePlan uncached(List<Turn> turns) {
        return new CachePlan(null, List.of(), turns);
    }

    public boolean usesCache() {
        return cacheName != null;
    }
}
