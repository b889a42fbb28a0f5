package com.ryuqq.multistate.core.pathfinding;

/**
 * 다중 목표 경로 탐색 전략.
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public enum SearchStrategy {

    /**
     * 너비 우선 탐색. 전이 개수(단계 수)가 최소인 경로를 반환합니다.
     */
    BFS,

    /**
     * Dijkstra. 전이 비용 합이 최소인 경로를 반환합니다.
     */
    DIJKSTRA,

    /**
     * A*. Dijkstra에 허용 가능한(admissible) 휴리스틱을 더해 탐색 노드 수를 줄입니다.
     * 결과 비용은 Dijkstra와 같습니다.
     */
    A_STAR
}
