package com.ryuqq.multistate.core.transition;

import java.util.Map;

/**
 * 단일 단계의 실행 결과.
 *
 * @param phase 단계
 * @param success 성공 여부
 * @param message 설명 메시지
 * @param data 부가 데이터 (예: "activated" → State id 집합)
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public record PhaseResult(
    TransitionPhase phase,
    boolean success,
    String message,
    Map<String, Object> data
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException phase가 null인 경우
     */
    public PhaseResult {
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        message = message == null ? "" : message;
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public static PhaseResult success(TransitionPhase phase, String message) {
        return new PhaseResult(phase, true, message, null);
    }

    public static PhaseResult success(TransitionPhase phase, String message, Map<String, Object> data) {
        return new PhaseResult(phase, true, message, data);
    }

    public static PhaseResult failure(TransitionPhase phase, String message) {
        return new PhaseResult(phase, false, message, null);
    }

    public static PhaseResult failure(TransitionPhase phase, String message, Map<String, Object> data) {
        return new PhaseResult(phase, false, message, data);
    }
}
