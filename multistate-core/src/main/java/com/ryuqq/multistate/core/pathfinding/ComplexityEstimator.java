package com.ryuqq.multistate.core.pathfinding;

import java.math.BigInteger;

/**
 * 다중 목표 탐색 공간 크기 계산.
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public final class ComplexityEstimator {

    private ComplexityEstimator() {
    }

    /**
     * (State 수, 목표 수)에 대한 이론적 탐색 공간 크기 계산.
     *
     * @param numStates 선언된 State 수
     * @param numTargets 목표 수
     * @return 보고서
     * @throws IllegalArgumentException 음수인 경우
     */
    public static ComplexityReport estimate(int numStates, int numTargets) {
        if (numStates < 0) {
            throw new IllegalArgumentException("numStates must not be negative (current: " + numStates + ")");
        }
        if (numTargets < 0) {
            throw new IllegalArgumentException("numTargets must not be negative (current: " + numTargets + ")");
        }
        BigInteger configurations = BigInteger.TWO.pow(numStates);
        BigInteger progress = BigInteger.TWO.pow(numTargets);
        return new ComplexityReport(
            numStates,
            numTargets,
            configurations,
            progress,
            configurations.multiply(progress),
            "O(V * 2^k) where V=" + numStates + ", k=" + numTargets,
            "Single target: O(V), Multi: O(V * 2^" + numTargets + ")",
            true
        );
    }
}
