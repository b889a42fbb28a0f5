package com.ryuqq.multistate.core.executor;

/**
 * TransitionExecutor 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>successPolicy: INCOMING 단계 판정 정책 (기본 STRICT)</li>
 *   <li>successThreshold: THRESHOLD 정책 임계값 (기본 0.8)</li>
 *   <li>validateGroupAtomicity: VALIDATE 단계에서 그룹 원자성 검증 여부 (기본 true)</li>
 * </ul>
 *
 * @author MultiState Team
 * @since 1.0.0
 * @param successPolicy INCOMING 판정 정책 (null 불가)
 * @param successThreshold 임계값 (0.0 ~ 1.0)
 * @param validateGroupAtomicity 그룹 원자성 검증 여부
 */
public record ExecutorConfig(
    SuccessPolicy successPolicy,
    double successThreshold,
    boolean validateGroupAtomicity
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: successPolicy=STRICT, successThreshold=0.8, validateGroupAtomicity=true</p>
     */
    public ExecutorConfig() {
        this(SuccessPolicy.STRICT, 0.8, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ExecutorConfig {
        if (successPolicy == null) {
            throw new IllegalArgumentException("successPolicy cannot be null");
        }
        if (Double.isNaN(successThreshold) || successThreshold < 0.0 || successThreshold > 1.0) {
            throw new IllegalArgumentException(
                "successThreshold must be between 0.0 and 1.0 (current: " + successThreshold + ")"
            );
        }
    }

    /**
     * THRESHOLD 정책 설정 생성.
     *
     * @param threshold 임계값 (0.0 ~ 1.0)
     * @return THRESHOLD 정책 설정
     */
    public static ExecutorConfig threshold(double threshold) {
        return new ExecutorConfig(SuccessPolicy.THRESHOLD, threshold, true);
    }

    /**
     * successPolicy만 변경한 새 인스턴스 생성.
     */
    public ExecutorConfig withSuccessPolicy(SuccessPolicy successPolicy) {
        return new ExecutorConfig(successPolicy, successThreshold, validateGroupAtomicity);
    }

    /**
     * successThreshold만 변경한 새 인스턴스 생성.
     */
    public ExecutorConfig withSuccessThreshold(double successThreshold) {
        return new ExecutorConfig(successPolicy, successThreshold, validateGroupAtomicity);
    }

    /**
     * validateGroupAtomicity만 변경한 새 인스턴스 생성.
     */
    public ExecutorConfig withValidateGroupAtomicity(boolean validateGroupAtomicity) {
        return new ExecutorConfig(successPolicy, successThreshold, validateGroupAtomicity);
    }
}
