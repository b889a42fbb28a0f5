package com.ryuqq.multistate.core.pathfinding;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ComplexityEstimator 테스트.
 *
 * @author MultiState Team
 * @since 1.0.0
 */
class ComplexityEstimatorTest {

    @Test
    void estimate_SmallInputs() {
        // When
        ComplexityReport report = ComplexityEstimator.estimate(4, 2);

        // Then
        assertEquals(BigInteger.valueOf(16), report.stateConfigurations());
        assertEquals(BigInteger.valueOf(4), report.targetProgressConfigurations());
        assertEquals(BigInteger.valueOf(64), report.totalSearchSpace());
        assertEquals("O(V * 2^k) where V=4, k=2", report.complexityClass());
        assertEquals("Single target: O(V), Multi: O(V * 2^2)", report.comparisonToSingle());
        assertTrue(report.exponentialInTargets());
    }

    @Test
    void estimate_LargeInputs_DoNotOverflow() {
        // When
        ComplexityReport report = ComplexityEstimator.estimate(100, 20);

        // Then
        assertEquals(BigInteger.TWO.pow(120), report.totalSearchSpace());
        assertEquals(BigInteger.TWO.pow(120), report.toMap().get("total_search_space"));
    }

    @Test
    void estimate_NegativeInput_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ComplexityEstimator.estimate(-1, 0));
        assertThrows(IllegalArgumentException.class, () -> ComplexityEstimator.estimate(0, -1));
    }
}
