package com.ryuqq.multistate.core.pathfinding;

/**
 * 경로 탐색기 설정.
 *
 * <p>탐색 공간은 목표 수에 대해 지수적으로 커지므로, 노드 수와 시간 예산으로
 * 탐색을 제한합니다. 예산을 넘기면 {@link SearchAborted}가 반환됩니다.</p>
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>maxExpandedNodes: 1,000,000</li>
 *   <li>maxSearchTimeMs: 0 (제한 없음)</li>
 * </ul>
 *
 * @param maxExpandedNodes 최대 확장 노드 수 (1 이상)
 * @param maxSearchTimeMs 최대 탐색 시간 (밀리초, 0이면 제한 없음)
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public record PathFinderConfig(
    long maxExpandedNodes,
    long maxSearchTimeMs
) {

    public static final long DEFAULT_MAX_EXPANDED_NODES = 1_000_000L;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 설정 값이 유효하지 않은 경우
     */
    public PathFinderConfig {
        if (maxExpandedNodes <= 0) {
            throw new IllegalArgumentException(
                "maxExpandedNodes must be positive (current: " + maxExpandedNodes + ")");
        }
        if (maxSearchTimeMs < 0) {
            throw new IllegalArgumentException(
                "maxSearchTimeMs must not be negative (current: " + maxSearchTimeMs + ")");
        }
    }

    /**
     * 기본 설정으로 생성.
     */
    public PathFinderConfig() {
        this(DEFAULT_MAX_EXPANDED_NODES, 0L);
    }

    /**
     * 시간 제한이 설정되어 있는지 확인.
     *
     * @return maxSearchTimeMs가 0보다 크면 true
     */
    public boolean hasTimeBudget() {
        return maxSearchTimeMs > 0;
    }

    public PathFinderConfig withMaxExpandedNodes(long maxExpandedNodes) {
        return new PathFinderConfig(maxExpandedNodes, this.maxSearchTimeMs);
    }

    public PathFinderConfig withMaxSearchTimeMs(long maxSearchTimeMs) {
        return new PathFinderConfig(this.maxExpandedNodes, maxSearchTimeMs);
    }
}
