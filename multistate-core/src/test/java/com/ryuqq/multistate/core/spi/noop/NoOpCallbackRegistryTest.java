package com.ryuqq.multistate.core.spi.noop;

import com.ryuqq.multistate.core.spi.CallbackRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NoOpCallbackRegistry 유닛 테스트.
 *
 * @author MultiState Team
 * @since 1.0.0
 */
@DisplayName("NoOpCallbackRegistry 테스트")
class NoOpCallbackRegistryTest {

    @Test
    @DisplayName("outgoing() / incoming() 은 항상 empty 를 반환한다")
    void 항상_empty_반환() {
        // given
        CallbackRegistry registry = new NoOpCallbackRegistry();

        // then
        assertTrue(registry.outgoing("t1").isEmpty());
        assertTrue(registry.incoming("t1", "s1").isEmpty());
    }
}
