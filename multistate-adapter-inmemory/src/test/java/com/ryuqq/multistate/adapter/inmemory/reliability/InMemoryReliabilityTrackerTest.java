package com.ryuqq.multistate.adapter.inmemory.reliability;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link InMemoryReliabilityTracker}.
 *
 * <p><strong>Test Coverage:</strong></p>
 * <ul>
 *   <li>Statistics recording and snapshots</li>
 *   <li>Dynamic cost formula and clamping</li>
 *   <li>Summary, least/most reliable ranking, reset</li>
 *   <li>Concurrent recording</li>
 * </ul>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
class InMemoryReliabilityTrackerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private InMemoryReliabilityTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new InMemoryReliabilityTracker(new ReliabilityConfig(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Recorded executions are reflected in the snapshot")
    void recordExecution_UpdatesStats() {
        // when
        tracker.recordExecution("login", true, Duration.ofMillis(30));
        tracker.recordExecution("login", false, Duration.ofMillis(10));
        tracker.recordExecution("login", true, Duration.ofMillis(20));

        // then
        TransitionStats stats = tracker.stats("login").orElseThrow();
        assertThat(stats.successCount()).isEqualTo(2);
        assertThat(stats.failureCount()).isEqualTo(1);
        assertThat(stats.totalAttempts()).isEqualTo(3);
        assertThat(stats.successRate()).isCloseTo(2.0 / 3.0, within(1e-9));
        assertThat(stats.totalTime()).isEqualTo(Duration.ofMillis(60));
        assertThat(stats.averageTime()).isEqualTo(Duration.ofMillis(20));
        assertThat(stats.lastSuccess()).contains(NOW);
        assertThat(stats.lastFailure()).contains(NOW);
    }

    @Test
    @DisplayName("Null or negative elapsed time counts as zero")
    void record_NullOrNegativeElapsed_CountsAsZero() {
        tracker.recordSuccess("login", null);
        tracker.recordFailure("login", Duration.ofMillis(-5));

        assertThat(tracker.stats("login").orElseThrow().totalTime()).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("Snapshots of untouched transitions are absent and reliable")
    void stats_NoHistory() {
        assertThat(tracker.stats("unknown")).isEmpty();

        TransitionStats empty = new TransitionStats("x", 0, 0, Duration.ZERO, null, null);
        assertThat(empty.successRate()).isEqualTo(1.0);
        assertThat(empty.failureRate()).isEqualTo(0.0);
        assertThat(empty.averageTime()).isEqualTo(Duration.ZERO);
        assertThat(empty.lastSuccess()).isEmpty();
    }

    @Test
    @DisplayName("Without history the base cost is returned")
    void getDynamicCost_NoHistory_ReturnsBaseCost() {
        assertThat(tracker.getDynamicCost("login", 3.5)).isEqualTo(3.5);
        assertThat(tracker.getDynamicCost(null, 3.5)).isEqualTo(3.5);
    }

    @Test
    @DisplayName("Cost is base * (1 + failureRate * (penalty - 1))")
    void getDynamicCost_AppliesFailurePenalty() {
        // given: 50% failure rate
        tracker.recordSuccess("login", Duration.ZERO);
        tracker.recordFailure("login", Duration.ZERO);

        // then
        assertThat(tracker.getDynamicCost("login", 4.0)).isCloseTo(6.0, within(1e-9));
    }

    @Test
    @DisplayName("Only successes keep the base cost")
    void getDynamicCost_AllSuccesses_ReturnsBaseCost() {
        tracker.recordSuccess("login", Duration.ZERO);
        tracker.recordSuccess("login", Duration.ZERO);

        assertThat(tracker.getDynamicCost("login", 2.0)).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Multiplier is clamped to the configured bounds")
    void getDynamicCost_ClampsMultiplier() {
        // given
        InMemoryReliabilityTracker harsh = new InMemoryReliabilityTracker(
            new ReliabilityConfig(25.0, 1.5, 10.0));
        harsh.recordFailure("flaky", Duration.ZERO);
        harsh.recordSuccess("solid", Duration.ZERO);

        // then
        assertThat(harsh.getDynamicCost("flaky", 1.0)).isEqualTo(10.0);
        assertThat(harsh.getDynamicCost("solid", 2.0)).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Summary aggregates every transition")
    void summary_AggregatesAllTransitions() {
        // given
        tracker.recordSuccess("a", Duration.ZERO);
        tracker.recordSuccess("a", Duration.ZERO);
        tracker.recordFailure("b", Duration.ZERO);
        tracker.recordSuccess("c", Duration.ZERO);

        // when
        ReliabilitySummary summary = tracker.summary();

        // then
        assertThat(summary.totalTransitions()).isEqualTo(3);
        assertThat(summary.totalAttempts()).isEqualTo(4);
        assertThat(summary.totalSuccesses()).isEqualTo(3);
        assertThat(summary.totalFailures()).isEqualTo(1);
        assertThat(summary.overallSuccessRate()).isEqualTo(0.75);
        assertThat(summary.transitions()).containsOnlyKeys("a", "b", "c");
    }

    @Test
    @DisplayName("Empty summary has zero success rate")
    void summary_Empty() {
        ReliabilitySummary summary = tracker.summary();

        assertThat(summary.totalTransitions()).isZero();
        assertThat(summary.overallSuccessRate()).isEqualTo(0.0);
        assertThat(summary.transitions()).isEmpty();
    }

    @Test
    @DisplayName("Least/most reliable rank by success rate")
    void ranking_BySuccessRate() {
        // given
        tracker.recordSuccess("good", Duration.ZERO);
        tracker.recordFailure("bad", Duration.ZERO);
        tracker.recordSuccess("mixed", Duration.ZERO);
        tracker.recordFailure("mixed", Duration.ZERO);
        tracker.recordSuccess("also-good", Duration.ZERO);

        // when
        List<TransitionStats> least = tracker.leastReliable(2);
        List<TransitionStats> most = tracker.mostReliable(10);

        // then
        assertThat(least).extracting(TransitionStats::transitionId).containsExactly("bad", "mixed");
        assertThat(most).extracting(TransitionStats::transitionId)
            .containsExactly("good", "also-good", "mixed", "bad");
        assertThat(tracker.leastReliable(0)).isEmpty();
        assertThatThrownBy(() -> tracker.mostReliable(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("limit must be >= 0");
    }

    @Test
    @DisplayName("Reset clears one or every transition")
    void reset_ClearsHistory() {
        tracker.recordFailure("a", Duration.ZERO);
        tracker.recordFailure("b", Duration.ZERO);

        assertThat(tracker.reset("a")).isTrue();
        assertThat(tracker.reset("a")).isFalse();
        assertThat(tracker.getDynamicCost("a", 1.0)).isEqualTo(1.0);
        assertThat(tracker.getDynamicCost("b", 1.0)).isEqualTo(2.0);

        tracker.reset();

        assertThat(tracker.allStats()).isEmpty();
        assertThat(tracker.getDynamicCost("b", 1.0)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Invalid arguments are rejected")
    void invalidArguments_ThrowException() {
        assertThatThrownBy(() -> tracker.recordSuccess(null, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("transitionId cannot be null");
        assertThatThrownBy(() -> new InMemoryReliabilityTracker(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config cannot be null");
        assertThatThrownBy(() -> new InMemoryReliabilityTracker(new ReliabilityConfig(), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("clock cannot be null");
    }

    @Test
    @DisplayName("Concurrent recording loses no executions")
    void recordExecution_Concurrent_CountsEveryCall() throws Exception {
        // given
        int threads = 8;
        int perThread = 1_000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);

        // when
        for (int t = 0; t < threads; t++) {
            boolean success = t % 2 == 0;
            pool.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        tracker.recordExecution("shared", success, Duration.ofNanos(1));
                        tracker.getDynamicCost("shared", 1.0);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        boolean finished = done.await(30, TimeUnit.SECONDS);
        pool.shutdownNow();

        // then
        assertThat(finished).isTrue();
        TransitionStats stats = tracker.stats("shared").orElseThrow();
        assertThat(stats.totalAttempts()).isEqualTo((long) threads * perThread);
        assertThat(stats.successCount()).isEqualTo(4_000);
        assertThat(stats.totalTime()).isEqualTo(Duration.ofNanos(8_000));
        assertThat(tracker.getDynamicCost("shared", 1.0)).isCloseTo(1.5, within(1e-9));
    }
}
