package com.ryuqq.multistate.core.executor;

/**
 * INCOMING 단계의 개별 결과를 하나의 성공/실패로 판정하는 정책.
 *
 * <p>n개의 State가 활성화되고 그중 f개의 incoming 동작이 실패했을 때:</p>
 * <ul>
 *   <li>STRICT: f = 0 일 때만 성공</li>
 *   <li>LENIENT: 항상 성공 (실패는 메타데이터에만 기록)</li>
 *   <li>THRESHOLD(θ): (n − f) / n ≥ θ 일 때 성공</li>
 * </ul>
 *
 * <p>활성화된 State가 없으면(n = 0) 모든 정책에서 성공입니다.</p>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public enum SuccessPolicy {

    /**
     * 모든 incoming 동작이 성공해야 함.
     */
    STRICT,

    /**
     * incoming 실패를 허용함.
     */
    LENIENT,

    /**
     * 성공 비율이 임계값 이상이어야 함.
     */
    THRESHOLD;

    /**
     * INCOMING 단계 성공 여부 판정.
     *
     * @param activated 활성화된 State 수 (n)
     * @param failed incoming 동작이 실패한 State 수 (f)
     * @param threshold THRESHOLD 정책의 임계값 (θ, 다른 정책에서는 무시)
     * @return 정책상 성공이면 true
     * @throws IllegalArgumentException 0 ≤ f ≤ n 을 만족하지 않는 경우
     */
    public boolean evaluate(int activated, int failed, double threshold) {
        if (activated < 0 || failed < 0 || failed > activated) {
            throw new IllegalArgumentException(
                String.format("Invalid incoming counts (activated: %d, failed: %d)", activated, failed));
        }
        if (activated == 0) {
            return true;
        }
        return switch (this) {
            case STRICT -> failed == 0;
            case LENIENT -> true;
            case THRESHOLD -> (double) (activated - failed) / activated >= threshold;
        };
    }
}
