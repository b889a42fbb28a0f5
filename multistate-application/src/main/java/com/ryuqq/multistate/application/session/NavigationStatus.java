package com.ryuqq.multistate.application.session;

/**
 * 목표 탐색 + 실행(navigation) 결과 상태.
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public enum NavigationStatus {

    /**
     * 계획한 경로의 모든 전이를 실행함.
     */
    COMPLETED,

    /**
     * 모든 목표를 방문하는 경로가 없음. 아무 전이도 실행하지 않음.
     */
    NO_PATH,

    /**
     * 탐색 예산 초과 또는 인터럽트로 계획을 세우지 못함. 아무 전이도 실행하지 않음.
     */
    ABORTED,

    /**
     * 경로 실행 중 전이가 실패함. 실패 직전까지의 전이는 반영된 상태.
     */
    FAILED
}
