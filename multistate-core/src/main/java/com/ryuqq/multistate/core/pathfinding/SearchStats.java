package com.ryuqq.multistate.core.pathfinding;

import java.time.Duration;

/**
 * 탐색 통계.
 *
 * @param expandedNodes 확장(후속 노드 생성)한 노드 수
 * @param generatedNodes 아레나에 생성된 노드 수 (시작 노드 포함)
 * @param elapsedNanos 탐색 소요 시간 (나노초)
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public record SearchStats(
    long expandedNodes,
    long generatedNodes,
    long elapsedNanos
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 음수 값이 있는 경우
     */
    public SearchStats {
        if (expandedNodes < 0 || generatedNodes < 0 || elapsedNanos < 0) {
            throw new IllegalArgumentException(
                "stats must not be negative (expanded: " + expandedNodes
                    + ", generated: " + generatedNodes + ", elapsedNanos: " + elapsedNanos + ")");
        }
    }

    public Duration elapsed() {
        return Duration.ofNanos(elapsedNanos);
    }
}
