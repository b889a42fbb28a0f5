package com.ryuqq.multistate.core.pathfinding;

/**
 * 경로 없음. 도달 가능한 탐색 공간을 모두 확인했지만 목표를 모두 방문하는 경로가 없습니다.
 *
 * @param stats 탐색 통계
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public record PathAbsent(SearchStats stats) implements SearchOutcome {

    public PathAbsent {
        if (stats == null) {
            throw new IllegalArgumentException("stats cannot be null");
        }
    }
}
