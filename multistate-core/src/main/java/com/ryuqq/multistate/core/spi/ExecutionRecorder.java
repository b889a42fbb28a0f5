package com.ryuqq.multistate.core.spi;

import java.time.Duration;

/**
 * 전이 실행 결과 기록 SPI.
 *
 * <p>TransitionExecutor는 매 실행이 끝날 때마다 이 SPI에 결과를 보고합니다.
 * 신뢰도 추적기는 이 기록을 바탕으로 {@link CostProvider#getDynamicCost(String, double)}
 * 값을 조정합니다.</p>
 *
 * <p><strong>동시성:</strong> 여러 Executor가 공유할 수 있으므로
 * 구현체는 내부적으로 동기화되어야 합니다.</p>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public interface ExecutionRecorder {

    /**
     * 실행 결과 기록.
     *
     * @param transitionId 전이 id
     * @param success 성공 여부
     * @param elapsed 실행 소요 시간
     */
    void recordExecution(String transitionId, boolean success, Duration elapsed);
}
