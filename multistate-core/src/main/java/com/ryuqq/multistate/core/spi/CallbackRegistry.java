package com.ryuqq.multistate.core.spi;

import com.ryuqq.multistate.core.transition.Action;

import java.util.Optional;

/**
 * 전이 단계별 콜백 조회 SPI.
 *
 * <p>Transition에 인라인으로 선언한 action / incomingActions 대신
 * 외부에서 콜백을 등록하고자 할 때 사용합니다. 등록된 콜백이 있으면
 * 인라인 action보다 우선합니다.</p>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public interface CallbackRegistry {

    /**
     * OUTGOING 단계 콜백 조회.
     *
     * @param transitionId 전이 id
     * @return 등록된 콜백 (없으면 empty)
     */
    Optional<Action> outgoing(String transitionId);

    /**
     * INCOMING 단계 콜백 조회.
     *
     * @param transitionId 전이 id
     * @param stateId 활성화되는 State id
     * @return 등록된 콜백 (없으면 empty)
     */
    Optional<Action> incoming(String transitionId, String stateId);
}
