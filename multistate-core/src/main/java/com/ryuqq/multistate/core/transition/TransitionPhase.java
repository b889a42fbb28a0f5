package com.ryuqq.multistate.core.transition;

/**
 * 전이 실행 단계.
 *
 * <p><strong>실행 순서:</strong></p>
 * <pre>
 * VALIDATE → OUTGOING → ACTIVATE → INCOMING → EXIT → VISIBILITY → CLEANUP
 *
 * 실패 가능: VALIDATE, OUTGOING, INCOMING
 * 실패 불가: ACTIVATE, EXIT, VISIBILITY (순수 집합 연산)
 * 항상 실행: CLEANUP
 * </pre>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public enum TransitionPhase {

    /**
     * 사전 조건 검증 (출발 State, 차단 상태, 그룹 원자성).
     */
    VALIDATE,

    /**
     * 전이 자체의 outgoing 동작 실행.
     */
    OUTGOING,

    /**
     * 활성화 대상 State를 작업 사본에 추가.
     */
    ACTIVATE,

    /**
     * 활성화된 모든 State의 incoming 동작 실행.
     */
    INCOMING,

    /**
     * 종료 대상 State를 작업 사본에서 제거.
     */
    EXIT,

    /**
     * 출발 State의 show/hide 권고 계산.
     */
    VISIBILITY,

    /**
     * 결과 확정 및 예기치 못한 오류 수집.
     */
    CLEANUP;

    /**
     * 실패할 수 있는 단계인지 확인.
     *
     * @return VALIDATE, OUTGOING, INCOMING이면 true
     */
    public boolean isFallible() {
        return this == VALIDATE || this == OUTGOING || this == INCOMING;
    }
}
