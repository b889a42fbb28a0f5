package com.ryuqq.multistate.adapter.inmemory.reliability;

/**
 * Configuration for {@link InMemoryReliabilityTracker}.
 *
 * <p>The cost multiplier grows linearly with the failure rate:</p>
 * <pre>
 * multiplier = clamp(1 + failureRate * (costMultiplierOnFailure - 1), minCostMultiplier, maxCostMultiplier)
 * dynamicCost = baseCost * multiplier
 * </pre>
 *
 * <p><strong>Defaults:</strong></p>
 * <ul>
 *   <li>costMultiplierOnFailure: 2.0 (an always-failing transition costs twice its base cost)</li>
 *   <li>minCostMultiplier: 1.0</li>
 *   <li>maxCostMultiplier: 10.0</li>
 * </ul>
 *
 * @param costMultiplierOnFailure multiplier applied at a 100% failure rate (&gt;= 1.0)
 * @param minCostMultiplier lower clamp bound (&gt;= 0.0)
 * @param maxCostMultiplier upper clamp bound (&gt;= minCostMultiplier)
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public record ReliabilityConfig(
    double costMultiplierOnFailure,
    double minCostMultiplier,
    double maxCostMultiplier
) {

    /**
     * Creates a config with default values.
     */
    public ReliabilityConfig() {
        this(2.0, 1.0, 10.0);
    }

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if any parameter is out of range
     */
    public ReliabilityConfig {
        if (Double.isNaN(costMultiplierOnFailure) || costMultiplierOnFailure < 1.0) {
            throw new IllegalArgumentException(
                "costMultiplierOnFailure must be >= 1.0 (current: " + costMultiplierOnFailure + ")");
        }
        if (Double.isNaN(minCostMultiplier) || minCostMultiplier < 0.0) {
            throw new IllegalArgumentException(
                "minCostMultiplier must be >= 0.0 (current: " + minCostMultiplier + ")");
        }
        if (Double.isNaN(maxCostMultiplier) || maxCostMultiplier < minCostMultiplier) {
            throw new IllegalArgumentException(
                "maxCostMultiplier must be >= minCostMultiplier (current: " + maxCostMultiplier
                    + ", min: " + minCostMultiplier + ")");
        }
    }

    public ReliabilityConfig withCostMultiplierOnFailure(double costMultiplierOnFailure) {
        return new ReliabilityConfig(costMultiplierOnFailure, minCostMultiplier, maxCostMultiplier);
    }

    public ReliabilityConfig withMinCostMultiplier(double minCostMultiplier) {
        return new ReliabilityConfig(costMultiplierOnFailure, minCostMultiplier, maxCostMultiplier);
    }

    public ReliabilityConfig withMaxCostMultiplier(double maxCostMultiplier) {
        return new ReliabilityConfig(costMultiplierOnFailure, minCostMultiplier, maxCostMultiplier);
    }

    /**
     * Computes the clamped multiplier for a failure rate.
     *
     * @param failureRate failure rate in [0, 1]
     * @return the cost multiplier
     */
    public double multiplierFor(double failureRate) {
        double multiplier = 1.0 + failureRate * (costMultiplierOnFailure - 1.0);
        return Math.min(maxCostMultiplier, Math.max(minCostMultiplier, multiplier));
    }
}
