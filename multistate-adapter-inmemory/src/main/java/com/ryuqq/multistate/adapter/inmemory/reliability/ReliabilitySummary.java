package com.ryuqq.multistate.adapter.inmemory.reliability;

import java.util.Map;

/**
 * Aggregate statistics across all tracked transitions.
 *
 * @param totalTransitions number of tracked transitions
 * @param totalAttempts sum of attempts
 * @param totalSuccesses sum of successes
 * @param totalFailures sum of failures
 * @param overallSuccessRate totalSuccesses / totalAttempts, or 0.0 without attempts
 * @param transitions per-transition snapshots keyed by transition id
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public record ReliabilitySummary(
    int totalTransitions,
    long totalAttempts,
    long totalSuccesses,
    long totalFailures,
    double overallSuccessRate,
    Map<String, TransitionStats> transitions
) {

    public ReliabilitySummary {
        transitions = Map.copyOf(transitions);
    }
}
