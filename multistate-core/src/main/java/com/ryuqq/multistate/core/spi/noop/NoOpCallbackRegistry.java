package com.ryuqq.multistate.core.spi.noop;

import com.ryuqq.multistate.core.spi.CallbackRegistry;
import com.ryuqq.multistate.core.transition.Action;

import java.util.Optional;

/**
 * Callback Registry NoOp 구현.
 *
 * <p>등록된 콜백이 없는 것처럼 동작하므로, Executor는 Transition의
 * 인라인 action만 사용합니다.</p>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public final class NoOpCallbackRegistry implements CallbackRegistry {

    @Override
    public Optional<Action> outgoing(String transitionId) {
        return Optional.empty();
    }

    @Override
    public Optional<Action> incoming(String transitionId, String stateId) {
        return Optional.empty();
    }
}
