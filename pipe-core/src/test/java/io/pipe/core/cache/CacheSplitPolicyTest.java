package io.pipe.core.cache;

import static org.assertj.core.api.Assertions.assertThat;

import io.pipe.core.turn.ModelResponseTurn;
import io.pipe.core.turn.Turn;
import io.pipe.core.turn.TurnCollection;
import io.pipe.core.turn.UserTaskTurn;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class CacheSplitPolicyTest {

    private static final OffsetDateTime T0 = OffsetDateTime.of(2025, 3, 1, 9, 0, 0, 0, ZoneOffset.UTC);

    private final CacheSplitPolicy policy = new CacheSplitPolicy();

    @Test
    void shouldCacheWholeHistoryOnceBufferedTokensReachThreshold() {
        TurnCollection turns = historyOf(10);

        CacheSplit split = policy.split(turns, 0, 100_000);

        assertThat(split.cachedTurns()).hasSize(10);
        assertThat(split.bufferedTurns()).isEmpty();
        assertThat(split.updateCache()).isTrue();
        assertThat(split.cachedTurns()).isEqualTo(turns.promptHistory(3));
    }

    @Test
    void shouldSplitAtRatioOfCachedTokens() {
        TurnCollection turns = historyOf(8);
        List<Turn> history = turns.promptHistory(3);

        CacheSplit split = policy.split(turns, 5_000, 10_000);

        assertThat(split.updateCache()).isFalse();
        assertThat(split.cachedTurns()).isEqualTo(history.subList(0, 4));
        assertThat(split.bufferedTurns()).isEqualTo(history.subList(4, 8));
        assertThat(split.cachedTurnCount()).isEqualTo(4);
    }

    @Test
    void shouldTreatZeroPromptTokensAsNoCacheEvenWhenCacheExists() {
        TurnCollection turns = historyOf(8);

        CacheSplit split = policy.split(turns, 5_000, 0);

        assertThat(split.hasCache()).isFalse();
        assertThat(split.cachedTurns()).isEmpty();
        assertThat(split.bufferedTurns()).hasSize(8);
    }

    @Test
    void shouldBufferEverythingWithoutCacheBelowThreshold() {
        CacheSplit split = policy.split(historyOf(6), 0, 19_999);

        assertThat(split.hasCache()).isFalse();
        assertThat(split.bufferedTurns()).hasSize(6);
        assertThat(split.updateCache()).isFalse();
    }

    @Test
    void shouldUpdateWhenBufferedTokensEqualThreshold() {
        CacheSplit split = policy.split(historyOf(4), 10_000, 30_000);

        assertThat(split.updateCache()).isTrue();
        assertThat(split.cachedTurns()).hasSize(4);
    }

    @Test
    void shouldReturnEmptySplitForEmptyHistory() {
        CacheSplit split = policy.split(new TurnCollection(), 0, 100_000);

        assertThat(split.cachedTurns()).isEmpty();
        assertThat(split.bufferedTurns()).isEmpty();
        assertThat(split.updateCache()).isFalse();
    }

    @Test
    void shouldBeDeterministicAndAcceptUsageSummary() {
        TurnCollection turns = historyOf(8);
        TokenCountSummary summary = TokenCountSummary.from(new UsageMetadata(5_000, 10_000));

        CacheSplit first = policy.split(turns, summary);
        CacheSplit second = policy.split(turns, 5_000, 10_000);

        assertThat(summary.bufferedTokens()).isEqualTo(5_000);
        assertThat(first).isEqualTo(second);
    }

    /** {@code count} history turns followed by the current task. */
    private static TurnCollection historyOf(int count) {
        List<Turn> turns = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            turns.add(i % 2 == 0
                ? new UserTaskTurn("task " + i, T0.plusMinutes(i))
                : new ModelResponseTurn("reply " + i, T0.plusMinutes(i)));
        }
        turns.add(new UserTaskTurn("current", T0.plusMinutes(count)));
        return new TurnCollection(turns);
    }
}
