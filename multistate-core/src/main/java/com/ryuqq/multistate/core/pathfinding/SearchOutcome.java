package com.ryuqq.multistate.core.pathfinding;

/**
 * 다중 목표 탐색 결과.
 *
 * <ul>
 *   <li>{@link PathFound}: 모든 목표를 방문하는 최적 경로를 찾음</li>
 *   <li>{@link PathAbsent}: 탐색 공간을 모두 소진했지만 경로가 없음 (오류 아님)</li>
 *   <li>{@link SearchAborted}: 예산 초과 또는 인터럽트로 탐색을 중단함</li>
 * </ul>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public sealed interface SearchOutcome permits PathFound, PathAbsent, SearchAborted {

    /**
     * 탐색 통계.
     *
     * @return 통계
     */
    SearchStats stats();

    default boolean isFound() {
        return this instanceof PathFound;
    }

    default boolean isAbsent() {
        return this instanceof PathAbsent;
    }

    default boolean isAborted() {
        return this instanceof SearchAborted;
    }
}
