package com.ryuqq.multistate.core.spi.noop;

import com.ryuqq.multistate.core.spi.CostProvider;

/**
 * Cost Provider NoOp 구현.
 *
 * <p>항상 기본 비용을 그대로 반환합니다.</p>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public final class NoOpCostProvider implements CostProvider {

    @Override
    public double getDynamicCost(String transitionId, double baseCost) {
        return baseCost;
    }
}
