package com.ryuqq.multistate.core.transition;

/**
 * 전이 후 출발 State의 가시성 지시.
 *
 * <p>VISIBILITY 단계는 살아남은 출발 State(fromStates − exit 집합)에 대해
 * 이 지시에 따라 show/hide 권고 집합을 계산합니다.</p>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public enum VisibilityDirective {

    /**
     * 출발 State를 계속 표시.
     */
    SHOW_SOURCE,

    /**
     * 출발 State를 숨김.
     */
    HIDE_SOURCE,

    /**
     * 지시 없음 (상위 컨테이너 또는 기본 동작을 따름).
     */
    INHERIT
}
