package com.ryuqq.multistate.adapter.inmemory.reliability;

import com.ryuqq.multistate.core.spi.CostProvider;
import com.ryuqq.multistate.core.spi.ExecutionRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory reliability tracker, acting as both {@link ExecutionRecorder} and
 * {@link CostProvider}.
 *
 * <p>Wire the same instance into a TransitionExecutor (as recorder) and a
 * MultiTargetPathFinder (as cost provider): transitions that fail often become
 * more expensive, so later searches route around them.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Storage:</strong> insertion-ordered map of mutable counters, guarded by this instance's monitor</li>
 *   <li><strong>Reads:</strong> always return immutable {@link TransitionStats} snapshots</li>
 *   <li><strong>Time:</strong> last success/failure instants come from the injected {@link Clock}</li>
 * </ul>
 *
 * <p><strong>Cost Formula:</strong></p>
 * <pre>
 * no history  → baseCost
 * otherwise   → baseCost * clamp(1 + failureRate * (costMultiplierOnFailure - 1), min, max)
 * </pre>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryReliabilityTracker tracker = new InMemoryReliabilityTracker();
 * TransitionExecutor executor = new TransitionExecutor(new ExecutorConfig(), tracker, registry);
 * MultiTargetPathFinder finder = new MultiTargetPathFinder(transitions, new PathFinderConfig(), tracker);
 *
 * executor.execute(login, active);                 // recorded
 * tracker.leastReliable(5);                        // worst offenders first
 * </pre>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public class InMemoryReliabilityTracker implements CostProvider, ExecutionRecorder {

    private static final Logger log = LoggerFactory.getLogger(InMemoryReliabilityTracker.class);

    private final ReliabilityConfig config;
    private final Clock clock;
    private final Map<String, MutableStats> stats = new LinkedHashMap<>();

    /**
     * Creates a tracker with default config and the system UTC clock.
     */
    public InMemoryReliabilityTracker() {
        this(new ReliabilityConfig());
    }

    public InMemoryReliabilityTracker(ReliabilityConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * Constructor.
     *
     * @param config cost multiplier settings
     * @param clock clock used for last success/failure timestamps
     * @throws IllegalArgumentException if config or clock is null
     */
    public InMemoryReliabilityTracker(ReliabilityConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
    }

    public ReliabilityConfig getConfig() {
        return config;
    }

    @Override
    public void recordExecution(String transitionId, boolean success, Duration elapsed) {
        if (success) {
            recordSuccess(transitionId, elapsed);
        } else {
            recordFailure(transitionId, elapsed);
        }
    }

    /**
     * Records a successful execution.
     *
     * @param transitionId the transition id
     * @param elapsed execution time (null is treated as zero)
     * @throws IllegalArgumentException if transitionId is null
     */
    public synchronized void recordSuccess(String transitionId, Duration elapsed) {
        MutableStats entry = entryFor(transitionId);
        entry.successCount++;
        entry.totalTime = entry.totalTime.plus(nonNegative(elapsed));
        entry.lastSuccessAt = clock.instant();
        log.debug("Recorded success: transitionId={}, successRate={}", transitionId, entry.snapshot().successRate());
    }

    /**
     * Records a failed execution.
     *
     * @param transitionId the transition id
     * @param elapsed execution time (null is treated as zero)
     * @throws IllegalArgumentException if transitionId is null
     */
    public synchronized void recordFailure(String transitionId, Duration elapsed) {
        MutableStats entry = entryFor(transitionId);
        entry.failureCount++;
        entry.totalTime = entry.totalTime.plus(nonNegative(elapsed));
        entry.lastFailureAt = clock.instant();
        log.debug("Recorded failure: transitionId={}, successRate={}", transitionId, entry.snapshot().successRate());
    }

    /**
     * Returns the reliability-adjusted cost of a transition.
     *
     * @param transitionId the transition id
     * @param baseCost the transition's declared cost
     * @return baseCost when there is no history, otherwise baseCost times the clamped multiplier
     */
    @Override
    public synchronized double getDynamicCost(String transitionId, double baseCost) {
        MutableStats entry = transitionId == null ? null : stats.get(transitionId);
        if (entry == null || entry.totalAttempts() == 0) {
            return baseCost;
        }
        return baseCost * config.multiplierFor(entry.snapshot().failureRate());
    }

    public synchronized Optional<TransitionStats> stats(String transitionId) {
        if (transitionId == null) {
            return Optional.empty();
        }
        MutableStats entry = stats.get(transitionId);
        return entry == null ? Optional.empty() : Optional.of(entry.snapshot());
    }

    /**
     * Snapshots of every tracked transition, in first-recorded order.
     *
     * @return immutable list of snapshots
     */
    public synchronized List<TransitionStats> allStats() {
        List<TransitionStats> snapshots = new ArrayList<>(stats.size());
        for (MutableStats entry : stats.values()) {
            snapshots.add(entry.snapshot());
        }
        return List.copyOf(snapshots);
    }

    public synchronized ReliabilitySummary summary() {
        long successes = 0;
        long failures = 0;
        Map<String, TransitionStats> snapshots = new LinkedHashMap<>();
        for (MutableStats entry : stats.values()) {
            successes += entry.successCount;
            failures += entry.failureCount;
            snapshots.put(entry.transitionId, entry.snapshot());
        }
        long attempts = successes + failures;
        double rate = attempts == 0 ? 0.0 : (double) successes / attempts;
        return new ReliabilitySummary(stats.size(), attempts, successes, failures, rate, snapshots);
    }

    /**
     * Transitions with at least one attempt, lowest success rate first.
     *
     * @param limit maximum number of entries
     * @return up to {@code limit} snapshots
     * @throws IllegalArgumentException if limit is negative
     */
    public List<TransitionStats> leastReliable(int limit) {
        return ranked(limit, Comparator.comparingDouble(TransitionStats::successRate));
    }

    /**
     * Transitions with at least one attempt, highest success rate first.
     *
     * @param limit maximum number of entries
     * @return up to {@code limit} snapshots
     * @throws IllegalArgumentException if limit is negative
     */
    public List<TransitionStats> mostReliable(int limit) {
        return ranked(limit, Comparator.comparingDouble(TransitionStats::successRate).reversed());
    }

    /**
     * Clears every transition's history.
     */
    public synchronized void reset() {
        int cleared = stats.size();
        stats.clear();
        log.info("Reliability statistics reset: clearedTransitions={}", cleared);
    }

    /**
     * Clears one transition's history.
     *
     * @param transitionId the transition id
     * @return true if the transition had history
     */
    public synchronized boolean reset(String transitionId) {
        boolean removed = transitionId != null && stats.remove(transitionId) != null;
        if (removed) {
            log.info("Reliability statistics reset: transitionId={}", transitionId);
        }
        return removed;
    }

    private List<TransitionStats> ranked(int limit, Comparator<TransitionStats> order) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0 (current: " + limit + ")");
        }
        List<TransitionStats> candidates = new ArrayList<>();
        for (TransitionStats snapshot : allStats()) {
            if (snapshot.totalAttempts() > 0) {
                candidates.add(snapshot);
            }
        }
        // List.sort is stable: ties keep first-recorded order
        candidates.sort(order);
        return List.copyOf(candidates.subList(0, Math.min(limit, candidates.size())));
    }

    private MutableStats entryFor(String transitionId) {
        if (transitionId == null) {
            throw new IllegalArgumentException("transitionId cannot be null");
        }
        return stats.computeIfAbsent(transitionId, MutableStats::new);
    }

    private static Duration nonNegative(Duration elapsed) {
        if (elapsed == null || elapsed.isNegative()) {
            return Duration.ZERO;
        }
        return elapsed;
    }

    private static final class MutableStats {

        private final String transitionId;
        private long successCount;
        private long failureCount;
        private Duration totalTime = Duration.ZERO;
        private Instant lastSuccessAt;
        private Instant lastFailureAt;

        private MutableStats(String transitionId) {
            this.transitionId = transitionId;
        }

        private long totalAttempts() {
            return successCount + failureCount;
        }

        private TransitionStats snapshot() {
            return new TransitionStats(transitionId, successCount, failureCount, totalTime,
                lastSuccessAt, lastFailureAt);
        }
    }
}
