package com.ryuqq.multistate.application.session;

import com.ryuqq.multistate.core.executor.TransitionExecutor;
import com.ryuqq.multistate.core.model.State;
import com.ryuqq.multistate.core.pathfinding.MultiTargetPathFinder;
import com.ryuqq.multistate.core.pathfinding.PathFound;
import com.ryuqq.multistate.core.pathfinding.SearchAborted;
import com.ryuqq.multistate.core.pathfinding.SearchOutcome;
import com.ryuqq.multistate.core.pathfinding.SearchStrategy;
import com.ryuqq.multistate.core.spi.CallbackRegistry;
import com.ryuqq.multistate.core.spi.noop.NoOpCallbackRegistry;
import com.ryuqq.multistate.core.transition.Transition;
import com.ryuqq.multistate.core.transition.TransitionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 하나의 활성 State 집합을 소유하는 세션.
 *
 * <p>Executor는 변화량만 반환하고 반영은 호출자 책임이므로, 이 클래스가
 * 실행과 반영(commit)을 하나의 잠금 구간으로 묶습니다.</p>
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * execute(t):
 *   lock
 *     snapshot = active
 *     result = executor.execute(t, snapshot)
 *     active = result.applyTo(snapshot)   // 실패면 그대로
 *   unlock
 *
 * navigateTo(targets):
 *   lock
 *     outcome = pathFinder.search(active, targets)
 *     PathFound → 경로의 전이를 순서대로 execute, 첫 실패에서 중단
 *   unlock
 * </pre>
 *
 * <p><strong>Thread-Safety:</strong> 모든 공개 메서드는 세션별 {@link ReentrantLock}으로 직렬화됩니다.
 * 서로 다른 세션은 Executor와 PathFinder를 공유해도 됩니다.</p>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public final class StateSession {

    private static final Logger log = LoggerFactory.getLogger(StateSession.class);

    private final TransitionExecutor executor;
    private final MultiTargetPathFinder pathFinder;
    private final CallbackRegistry callbacks;
    private final ReentrantLock lock = new ReentrantLock();

    private Set<State> active;

    /**
     * 콜백 레지스트리 없이 생성.
     *
     * @param executor 전이 실행기
     * @param pathFinder 경로 탐색기
     * @param initialActive 초기 활성 State 집합
     */
    public StateSession(TransitionExecutor executor, MultiTargetPathFinder pathFinder, Set<State> initialActive) {
        this(executor, pathFinder, new NoOpCallbackRegistry(), initialActive);
    }

    /**
     * 생성자.
     *
     * @param executor 전이 실행기
     * @param pathFinder 경로 탐색기
     * @param callbacks 실행 시 사용할 콜백 레지스트리
     * @param initialActive 초기 활성 State 집합
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public StateSession(TransitionExecutor executor, MultiTargetPathFinder pathFinder,
                        CallbackRegistry callbacks, Set<State> initialActive) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (pathFinder == null) {
            throw new IllegalArgumentException("pathFinder cannot be null");
        }
        if (callbacks == null) {
            throw new IllegalArgumentException("callbacks cannot be null");
        }
        if (initialActive == null) {
            throw new IllegalArgumentException("initialActive cannot be null");
        }
        this.executor = executor;
        this.pathFinder = pathFinder;
        this.callbacks = callbacks;
        this.active = Set.copyOf(initialActive);
    }

    /**
     * 현재 활성 State 스냅샷.
     *
     * @return 불변 Set
     */
    public Set<State> activeStates() {
        lock.lock();
        try {
            return active;
        } finally {
            lock.unlock();
        }
    }

    public boolean isActive(State state) {
        return activeStates().contains(state);
    }

    /**
     * 전이를 실행하고 성공하면 결과를 반영.
     *
     * @param transition 실행할 전이
     * @return 실행 결과
     * @throws IllegalArgumentException transition이 null인 경우
     */
    public TransitionResult execute(Transition transition) {
        if (transition == null) {
            throw new IllegalArgumentException("transition cannot be null");
        }
        lock.lock();
        try {
            Set<State> snapshot = active;
            TransitionResult result = executor.execute(transition, snapshot, callbacks);
            if (result.isSuccess()) {
                active = Set.copyOf(result.applyTo(snapshot));
                log.debug("Committed transition {}: active={}", transition.getId(), active.size());
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 모든 목표를 방문하는 경로를 계획하고 순서대로 실행.
     *
     * <p>전이가 실패하면 그 자리에서 멈춥니다. 이미 성공한 전이는 되돌리지 않습니다.</p>
     *
     * @param targets 목표 State 집합
     * @param strategy 탐색 전략
     * @return navigation 결과
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public NavigationResult navigateTo(Set<State> targets, SearchStrategy strategy) {
        if (targets == null) {
            throw new IllegalArgumentException("targets cannot be null");
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        lock.lock();
        try {
            SearchOutcome outcome = pathFinder.search(active, targets, strategy);
            if (outcome instanceof SearchAborted) {
                return NavigationResult.notPlanned(NavigationStatus.ABORTED, outcome, active);
            }
            if (!(outcome instanceof PathFound found)) {
                log.info("No path from {} active states to {} targets", active.size(), targets.size());
                return NavigationResult.notPlanned(NavigationStatus.NO_PATH, outcome, active);
            }

            List<TransitionResult> executed = new ArrayList<>();
            for (Transition transition : found.path().getTransitionsSequence()) {
                TransitionResult result = execute(transition);
                executed.add(result);
                if (!result.isSuccess()) {
                    log.warn("Navigation stopped at transition {} ({} of {}), failed phase: {}",
                        transition.getId(), executed.size(), found.path().length(),
                        result.failedPhase().map(Enum::name).orElse("none"));
                    return NavigationResult.failed(found, executed, active);
                }
            }
            log.info("Navigation completed: {} transitions, cost={}", executed.size(), found.path().getTotalCost());
            return NavigationResult.completed(found, executed, active);
        } finally {
            lock.unlock();
        }
    }
}
