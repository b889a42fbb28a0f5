package com.ryuqq.multistate.adapter.inmemory.reliability;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Immutable snapshot of one transition's execution history.
 *
 * @param transitionId the transition id
 * @param successCount number of successful executions
 * @param failureCount number of failed executions
 * @param totalTime sum of execution times
 * @param lastSuccessAt time of the last success, or null
 * @param lastFailureAt time of the last failure, or null
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public record TransitionStats(
    String transitionId,
    long successCount,
    long failureCount,
    Duration totalTime,
    Instant lastSuccessAt,
    Instant lastFailureAt
) {

    public long totalAttempts() {
        return successCount + failureCount;
    }

    /**
     * Success rate in [0, 1]. A transition with no history is considered fully reliable.
     *
     * @return success rate
     */
    public double successRate() {
        long attempts = totalAttempts();
        return attempts == 0 ? 1.0 : (double) successCount / attempts;
    }

    public double failureRate() {
        return 1.0 - successRate();
    }

    /**
     * Average execution time.
     *
     * @return average, or zero when there is no history
     */
    public Duration averageTime() {
        long attempts = totalAttempts();
        return attempts == 0 ? Duration.ZERO : totalTime.dividedBy(attempts);
    }

    public Optional<Instant> lastSuccess() {
        return Optional.ofNullable(lastSuccessAt);
    }

    public Optional<Instant> lastFailure() {
        return Optional.ofNullable(lastFailureAt);
    }
}
