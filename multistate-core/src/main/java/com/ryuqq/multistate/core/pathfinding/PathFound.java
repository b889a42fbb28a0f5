package com.ryuqq.multistate.core.pathfinding;

/**
 * 경로 발견.
 *
 * @param path 모든 목표를 방문하는 경로
 * @param stats 탐색 통계
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public record PathFound(Path path, SearchStats stats) implements SearchOutcome {

    public PathFound {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (stats == null) {
            throw new IllegalArgumentException("stats cannot be null");
        }
    }
}
