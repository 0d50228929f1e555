package io.pipe.core.cache;

import io.pipe.core.turn.Turn;
import io.pipe.core.turn.TurnCollection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides which prefix of the prompt history belongs in the provider-side context cache.
 *
 * <p>Once the tokens sent outside the cache reach {@code updateThreshold}, the whole history becomes
 * the new cached prefix. Below the threshold an existing cache keeps covering the fraction of turns
 * matching its share of the prompt tokens. That fraction assumes every turn costs the same number
 * of tokens.
 */
public final class CacheSplitPolicy {
    private static final Logger LOG = LoggerFactory.getLogger(CacheSplitPolicy.class);
    public static final int CACHE_UPDATE_THRESHOLD = 20000;

    private final int updateThreshold;
    private final int toolResponseLimit;

    public CacheSplitPolicy() {
        this(CACHE_UPDATE_THRESHOLD, TurnCollection.DEFAULT_TOOL_RESPONSE_LIMIT);
    }

    public CacheSplitPolicy(int updateThreshold, int toolResponseLimit) {
        if (updateThreshold <= 0) {
            throw new IllegalArgumentException("updateThreshold must be > 0");
        }
        if (toolResponseLimit < 0) {
            throw new IllegalArgumentException("toolResponseLimit must be >= 0");
        }
        this.updateThreshold = updateThreshold;
        this.toolResponseLimit = toolResponseLimit;
    }

    public int updateThreshold() {
        return updateThreshold;
    }

    public int toolResponseLimit() {
        return toolResponseLimit;
    }

    public CacheSplit split(TurnCollection turns, TokenCountSummary summary) {
        return split(turns, summary.cachedTokens(), summary.currentPromptTokens());
    }

    public CacheSplit split(TurnCollection turns, int cachedContentTokenCount, int promptTokenCount) {
        List<Turn> allTurns = turns.promptHistory(toolResponseLimit);
        if (allTurns.isEmpty()) {
            return CacheSplit.uncached(List.of());
        }

        boolean cacheExists = cachedContentTokenCount > 0;
        int bufferedTokens = cacheExists ? promptTokenCount - cachedContentTokenCount : promptTokenCount;
        if (bufferedTokens >= updateThreshold) {
            LOG.info("Buffered tokens {} reached threshold {}; caching all {} turns",
                bufferedTokens, updateThreshold, allTurns.size());
            return new CacheSplit(allTurns, List.of(), true);
        }

        if (!cacheExists) {
            LOG.info("No cache and {} buffered tokens; sending all {} turns", bufferedTokens, allTurns.size());
            return CacheSplit.uncached(allTurns);
        }

        double cacheRatio = promptTokenCount == 0 ? 0.0 : (double) cachedContentTokenCount / promptTokenCount;
        int boundary = (int) Math.floor(allTurns.size() * cacheRatio);
        if (boundary <= 0) {
            LOG.info("Cache ratio {} gives an empty prefix; sending all {} turns", cacheRatio, allTurns.size());
            return CacheSplit.uncached(allTurns);
        }
        boundary = Math.min(boundary, allTurns.size());
        LOG.info("Cache ratio {}: {} cached turns, {} buffered turns",
            cacheRatio, boundary, allTurns.size() - boundary);
        return new CacheSplit(allTurns.subList(0, boundary), allTurns.subList(boundary, allTurns.size()), false);
    }
}
