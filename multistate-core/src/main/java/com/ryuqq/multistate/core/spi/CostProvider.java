package com.ryuqq.multistate.core.spi;

/**
 * 전이 비용 제공자 SPI.
 *
 * <p>경로 탐색기는 각 전이의 기본 비용({@code Transition.getCost()}) 대신
 * 이 SPI가 반환하는 값을 사용합니다. 신뢰도 추적기처럼 과거 실행 이력에 따라
 * 비용을 조정하는 구현체를 주입할 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CostProvider provider = ...;
 * double cost = provider.getDynamicCost("open_editor", 1.0);
 * }</pre>
 *
 * <p><strong>동시성:</strong> 여러 탐색이 동시에 같은 인스턴스를 조회할 수 있으므로
 * 구현체는 thread-safe해야 합니다.</p>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public interface CostProvider {

    /**
     * 동적 비용 계산.
     *
     * @param transitionId 전이 id
     * @param baseCost 기본 비용 (0 이상)
     * @return 조정된 비용 (0 이상이어야 함)
     */
    double getDynamicCost(String transitionId, double baseCost);
}
