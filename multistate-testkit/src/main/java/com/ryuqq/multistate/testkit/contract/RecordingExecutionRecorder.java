package com.ryuqq.multistate.testkit.contract;

import com.ryuqq.multistate.core.spi.ExecutionRecorder;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 보고된 실행 결과를 순서대로 모으는 ExecutionRecorder.
 *
 * <p>Thread-safe: 여러 Executor가 동시에 보고해도 됩니다.</p>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public final class RecordingExecutionRecorder implements ExecutionRecorder {

    private final List<Execution> executions = new CopyOnWriteArrayList<>();

    @Override
    public void recordExecution(String transitionId, boolean success, Duration elapsed) {
        executions.add(new Execution(transitionId, success, elapsed));
    }

    public List<Execution> executions() {
        return List.copyOf(executions);
    }

    /**
     * 특정 전이의 보고 횟수.
     *
     * @param transitionId 전이 id
     * @return 보고 횟수
     */
    public long countFor(String transitionId) {
        return executions.stream().filter(execution -> execution.transitionId().equals(transitionId)).count();
    }

    public void clear() {
        executions.clear();
    }

    /**
     * 보고 한 건.
     *
     * @param transitionId 전이 id
     * @param success 성공 여부
     * @param elapsed 소요 시간
     */
    public record Execution(String transitionId, boolean success, Duration elapsed) {
    }
}
