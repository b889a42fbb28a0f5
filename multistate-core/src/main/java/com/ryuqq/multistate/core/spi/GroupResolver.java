package com.ryuqq.multistate.core.spi;

import com.ryuqq.multistate.core.model.State;
import com.ryuqq.multistate.core.model.StateGroup;

import java.util.Optional;

/**
 * State가 속한 그룹을 조회하는 SPI.
 *
 * <p>그룹 원자성 검증과 차단 상태 판정에서 사용됩니다.
 * 기본 구현은 {@link com.ryuqq.multistate.core.model.StateRegistry}입니다.</p>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public interface GroupResolver {

    /**
     * State의 소속 그룹 조회.
     *
     * @param state 조회할 State
     * @return 소속 그룹 (없으면 empty)
     */
    Optional<StateGroup> groupOf(State state);
}
