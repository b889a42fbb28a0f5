package com.ryuqq.multistate.core.pathfinding;

/**
 * 탐색 중단 사유.
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public enum AbortReason {

    /** 확장 노드 수가 {@link PathFinderConfig#maxExpandedNodes()}에 도달함. */
    NODE_BUDGET_EXCEEDED,

    /** 경과 시간이 {@link PathFinderConfig#maxSearchTimeMs()}를 넘김. */
    TIME_BUDGET_EXCEEDED,

    /** 탐색 스레드가 인터럽트됨. */
    INTERRUPTED,

    /** 목표 State가 63개를 넘어 도달 비트마스크로 표현할 수 없음. */
    TOO_MANY_TARGETS
}
