package com.ryuqq.multistate.core.spi.noop;

import com.ryuqq.multistate.core.spi.ExecutionRecorder;

import java.time.Duration;

/**
 * Execution Recorder NoOp 구현.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>recordExecution(): 아무 동작 안 함</li>
 * </ul>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public final class NoOpExecutionRecorder implements ExecutionRecorder {

    @Override
    public void recordExecution(String transitionId, boolean success, Duration elapsed) {
        // NoOp
    }
}
