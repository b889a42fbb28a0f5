package com.ryuqq.multistate.core.pathfinding;

/**
 * 탐색 중단. 경로가 없다는 뜻이 아니라 결론을 내리지 못했다는 뜻입니다.
 *
 * @param reason 중단 사유
 * @param stats 중단 시점까지의 탐색 통계
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public record SearchAborted(AbortReason reason, SearchStats stats) implements SearchOutcome {

    public SearchAborted {
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        if (stats == null) {
            throw new IllegalArgumentException("stats cannot be null");
        }
    }
}
