package com.ryuqq.multistate.core.executor;

import com.ryuqq.multistate.core.model.State;
import com.ryuqq.multistate.core.model.StateGroup;
import com.ryuqq.multistate.core.spi.CallbackRegistry;
import com.ryuqq.multistate.core.spi.ExecutionRecorder;
import com.ryuqq.multistate.core.spi.GroupResolver;
import com.ryuqq.multistate.core.spi.noop.NoOpCallbackRegistry;
import com.ryuqq.multistate.core.spi.noop.NoOpExecutionRecorder;
import com.ryuqq.multistate.core.transition.Action;
import com.ryuqq.multistate.core.transition.PhaseResult;
import com.ryuqq.multistate.core.transition.Transition;
import com.ryuqq.multistate.core.transition.TransitionPhase;
import com.ryuqq.multistate.core.transition.TransitionResult;
import com.ryuqq.multistate.core.transition.VisibilityUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 단계별(phased) 전이 실행기.
 *
 * <p>하나의 Transition을 정해진 단계 순서대로 실행하고 구조화된 결과를 반환합니다.
 * 호출자의 활성 집합은 절대 변경하지 않으며, 변화량만 결과에 담아 돌려줍니다.</p>
 *
 * <p><strong>단계 순서:</strong></p>
 * <pre>
 * VALIDATE ─► OUTGOING ─► ACTIVATE ─► INCOMING ─► EXIT ─► VISIBILITY ─► CLEANUP
 *    │           │                       │
 *    └─ 실패 ────┴──── 실패 ─────────────┴─ 실패(정책) ──────────────► CLEANUP
 * </pre>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>시도한 단계마다 정확히 하나의 PhaseResult가 기록됨</li>
 *   <li>VALIDATE 통과 전에는 어떤 부수 효과도 없음</li>
 *   <li>ACTIVATE, EXIT, VISIBILITY는 실패하지 않음</li>
 *   <li>INCOMING은 활성화된 모든 State의 동작을 정확히 한 번씩 실행함 (단락 평가 없음)</li>
 *   <li>CLEANUP은 항상 마지막에 기록되며, 예기치 못한 오류를 결과에 담음</li>
 *   <li>execute()는 동작 실패나 예외를 호출자에게 던지지 않음</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 실행기 자체는 상태가 없어 공유해도 안전합니다.
 * 단, 같은 활성 집합에 대한 execute()와 반영(commit)은 호출자가 직렬화해야 합니다.</p>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public final class TransitionExecutor {

    private static final Logger log = LoggerFactory.getLogger(TransitionExecutor.class);

    private static final CallbackRegistry NO_CALLBACKS = new NoOpCallbackRegistry();
    private static final GroupResolver NO_GROUPS = state -> Optional.empty();

    private final ExecutorConfig config;
    private final ExecutionRecorder recorder;
    private final GroupResolver groupResolver;

    /**
     * 기본 설정으로 생성 (STRICT 정책, 기록자 없음, 그룹 조회 없음).
     */
    public TransitionExecutor() {
        this(new ExecutorConfig());
    }

    /**
     * 설정만 지정하여 생성.
     *
     * @param config 실행기 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public TransitionExecutor(ExecutorConfig config) {
        this(config, new NoOpExecutionRecorder(), NO_GROUPS);
    }

    /**
     * 생성자.
     *
     * @param config 실행기 설정
     * @param recorder 실행 결과 기록자
     * @param groupResolver State → 그룹 조회 (원자성 검증, 차단 판정에 사용)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public TransitionExecutor(ExecutorConfig config, ExecutionRecorder recorder, GroupResolver groupResolver) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (recorder == null) {
            throw new IllegalArgumentException("recorder cannot be null");
        }
        if (groupResolver == null) {
            throw new IllegalArgumentException("groupResolver cannot be null");
        }
        this.config = config;
        this.recorder = recorder;
        this.groupResolver = groupResolver;
    }

    public ExecutorConfig getConfig() {
        return config;
    }

    /**
     * VALIDATE 단계의 구조 검사만 단독 수행 (사전 점검용).
     *
     * <p>출발 State 조건과 차단 상태 거부권만 확인합니다. 어떤 동작도 실행하지 않습니다.</p>
     *
     * @param transition 확인할 전이
     * @param active 현재 활성 State 집합
     * @return 실행 가능하면 true
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public boolean canExecute(Transition transition, Set<State> active) {
        requireArguments(transition, active);
        return transition.canFire(active) && findBlockingVeto(transition, active).isEmpty();
    }

    /**
     * 전이 적용 결과를 부수 효과 없이 계산.
     *
     * @param transition 적용할 전이
     * @param active 현재 활성 State 집합
     * @return 적용 후 활성 집합 (새 인스턴스)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public Set<State> project(Transition transition, Set<State> active) {
        requireArguments(transition, active);
        return transition.project(active);
    }

    /**
     * 전이 실행 (인라인 action만 사용).
     *
     * @param transition 실행할 전이
     * @param active 현재 활성 State 집합 (변경되지 않음)
     * @return 실행 결과
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public TransitionResult execute(Transition transition, Set<State> active) {
        return execute(transition, active, NO_CALLBACKS);
    }

    /**
     * 전이 실행.
     *
     * <p>콜백 레지스트리에 등록된 동작이 있으면 Transition의 인라인 동작보다 우선합니다.</p>
     *
     * @param transition 실행할 전이
     * @param active 현재 활성 State 집합 (변경되지 않음)
     * @param callbacks 외부 콜백 레지스트리 (null이면 인라인 동작만 사용)
     * @return 실행 결과 (예외를 던지지 않음)
     * @throws IllegalArgumentException transition 또는 active가 null인 경우
     */
    public TransitionResult execute(Transition transition, Set<State> active, CallbackRegistry callbacks) {
        requireArguments(transition, active);
        CallbackRegistry registry = callbacks == null ? NO_CALLBACKS : callbacks;

        long startNanos = System.nanoTime();
        TransitionResult.Builder result = TransitionResult.builder()
            .metadata("transitionId", transition.getId())
            .metadata("policy", config.successPolicy().name());

        boolean completed = false;
        Throwable unexpected = null;
        try {
            completed = runPhases(transition, Set.copyOf(active), registry, result);
        } catch (RuntimeException e) {
            unexpected = e;
        }

        cleanup(transition, result, completed, unexpected, startNanos);
        TransitionResult built = result.build();
        report(transition, built.isSuccess(), System.nanoTime() - startNanos);
        return built;
    }

    private boolean runPhases(Transition transition, Set<State> active,
                              CallbackRegistry callbacks, TransitionResult.Builder result) {
        if (!validate(transition, active, result)) {
            return false;
        }
        if (!outgoing(transition, callbacks, result)) {
            return false;
        }

        Set<State> working = new HashSet<>(active);
        Set<State> activated = activate(transition, working, result);

        if (!incoming(transition, activated, callbacks, result)) {
            return false;
        }

        Set<State> deactivated = exit(transition, working, result);
        VisibilityUpdate visibility = visibility(transition, result);

        result.activatedStates(activated)
            .deactivatedStates(deactivated)
            .visibility(visibility);
        return true;
    }

    // ========== VALIDATE ==========

    private boolean validate(Transition transition, Set<State> active, TransitionResult.Builder result) {
        if (!transition.canFire(active)) {
            result.phase(PhaseResult.failure(TransitionPhase.VALIDATE,
                "Transition cannot execute from current states (requires one of " + ids(transition.getFromStates()) + ")"));
            log.warn("Transition {} rejected: no source state active", transition.getId());
            return false;
        }

        Optional<State> blocker = findBlockingVeto(transition, active);
        if (blocker.isPresent()) {
            result.phase(PhaseResult.failure(TransitionPhase.VALIDATE,
                "Blocked by active blocking state: " + blocker.get().getId(),
                Map.of("blockedBy", blocker.get().getId())));
            log.warn("Transition {} rejected: blocked by {}", transition.getId(), blocker.get().getId());
            return false;
        }

        if (config.validateGroupAtomicity()) {
            Optional<StateGroup> violated = findAtomicityViolation(transition, active);
            if (violated.isPresent()) {
                result.phase(PhaseResult.failure(TransitionPhase.VALIDATE,
                    "Group atomicity violation detected: " + violated.get().getId(),
                    Map.of("group", violated.get().getId())));
                log.warn("Transition {} rejected: would split group {}", transition.getId(), violated.get().getId());
                return false;
            }
        }

        result.phase(PhaseResult.success(TransitionPhase.VALIDATE, "All preconditions satisfied"));
        return true;
    }

    /**
     * 활성화를 거부하는 차단 상태 탐색.
     *
     * <p>활성 차단 상태는 활성화 대상 중 하나가 자신과 같은 그룹일 때만 전이를 허용합니다.
     * 그룹이 없는 차단 상태는 모든 전이를 거부합니다 (활성화 대상이 없거나 자신을 종료하는 전이 포함).</p>
     */
    private Optional<State> findBlockingVeto(Transition transition, Set<State> active) {
        Set<State> toActivate = transition.statesToActivate();
        for (State state : active) {
            if (!state.isBlocking()) {
                continue;
            }
            Optional<String> blockerGroup = groupIdOf(state);
            boolean joinsGroup = blockerGroup.isPresent()
                && toActivate.stream().anyMatch(candidate -> blockerGroup.equals(groupIdOf(candidate)));
            if (!joinsGroup) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }

    private Optional<StateGroup> findAtomicityViolation(Transition transition, Set<State> active) {
        Set<StateGroup> touched = new LinkedHashSet<>(transition.getActivateGroups());
        touched.addAll(transition.getExitGroups());
        for (State state : transition.statesToActivate()) {
            groupResolver.groupOf(state).ifPresent(touched::add);
        }
        for (State state : transition.statesToExit()) {
            groupResolver.groupOf(state).ifPresent(touched::add);
        }
        if (touched.isEmpty()) {
            return Optional.empty();
        }

        Set<State> projected = transition.project(active);
        for (StateGroup group : touched) {
            if (!group.validateAtomicity(projected)) {
                return Optional.of(group);
            }
        }
        return Optional.empty();
    }

    private Optional<String> groupIdOf(State state) {
        Optional<String> registered = groupResolver.groupOf(state).map(StateGroup::getId);
        return registered.isPresent() ? registered : state.getGroupId();
    }

    // ========== OUTGOING ==========

    private boolean outgoing(Transition transition, CallbackRegistry callbacks, TransitionResult.Builder result) {
        Optional<Action> action = callbacks.outgoing(transition.getId());
        if (action.isEmpty()) {
            action = transition.getAction();
        }
        if (action.isEmpty()) {
            result.phase(PhaseResult.success(TransitionPhase.OUTGOING, "No outgoing action"));
            return true;
        }

        ActionOutcome outcome = run(action.get());
        if (!outcome.success()) {
            result.phase(PhaseResult.failure(TransitionPhase.OUTGOING, "Outgoing action failed: " + outcome.reason()));
            log.warn("Transition {} outgoing action failed: {}", transition.getId(), outcome.reason());
            return false;
        }
        result.phase(PhaseResult.success(TransitionPhase.OUTGOING, "Outgoing action completed"));
        return true;
    }

    // ========== ACTIVATE ==========

    private Set<State> activate(Transition transition, Set<State> working, TransitionResult.Builder result) {
        Set<State> activated = transition.statesToActivate();
        working.addAll(activated);
        result.phase(PhaseResult.success(TransitionPhase.ACTIVATE,
            "Activated " + activated.size() + " states",
            Map.of("activated", idSet(activated))));
        log.debug("Transition {} activated {}", transition.getId(), ids(activated));
        return activated;
    }

    // ========== INCOMING ==========

    private boolean incoming(Transition transition, Set<State> activated,
                             CallbackRegistry callbacks, TransitionResult.Builder result) {
        List<State> ordered = activated.stream()
            .sorted(Comparator.comparing(State::getId))
            .collect(Collectors.toList());

        Set<String> succeeded = new LinkedHashSet<>();
        Set<String> failed = new LinkedHashSet<>();
        for (State state : ordered) {
            Optional<Action> action = callbacks.incoming(transition.getId(), state.getId());
            if (action.isEmpty()) {
                action = transition.incomingActionFor(state);
            }
            if (action.isEmpty()) {
                succeeded.add(state.getId());
                continue;
            }
            ActionOutcome outcome = run(action.get());
            if (outcome.success()) {
                succeeded.add(state.getId());
            } else {
                failed.add(state.getId());
                log.debug("Transition {} incoming action for {} failed: {}",
                    transition.getId(), state.getId(), outcome.reason());
            }
        }

        result.metadata("incomingFailures", failed.size());
        boolean accepted = config.successPolicy().evaluate(activated.size(), failed.size(), config.successThreshold());
        String message = String.format("%d/%d incoming actions succeeded", succeeded.size(), activated.size());
        Map<String, Object> data = Map.of("successful", Set.copyOf(succeeded), "failed", Set.copyOf(failed));

        if (!accepted) {
            result.phase(PhaseResult.failure(TransitionPhase.INCOMING, message, data));
            log.warn("Transition {} rejected by {} policy: {}", transition.getId(), config.successPolicy(), message);
            return false;
        }
        result.phase(PhaseResult.success(TransitionPhase.INCOMING, message, data));
        return true;
    }

    // ========== EXIT ==========

    private Set<State> exit(Transition transition, Set<State> working, TransitionResult.Builder result) {
        // 같은 전이가 종료와 활성화를 모두 선언한 State는 활성으로 남음
        Set<State> deactivated = new HashSet<>(transition.statesToExit());
        deactivated.removeAll(transition.statesToActivate());
        working.removeAll(deactivated);
        result.phase(PhaseResult.success(TransitionPhase.EXIT,
            "Deactivated " + deactivated.size() + " states",
            Map.of("deactivated", idSet(deactivated))));
        return deactivated;
    }

    // ========== VISIBILITY ==========

    private VisibilityUpdate visibility(Transition transition, TransitionResult.Builder result) {
        Set<State> surviving = new HashSet<>(transition.getFromStates());
        surviving.removeAll(transition.statesToExit());

        VisibilityUpdate update = switch (transition.getVisibility()) {
            case SHOW_SOURCE -> new VisibilityUpdate(surviving, Set.of());
            case HIDE_SOURCE -> new VisibilityUpdate(Set.of(), surviving);
            case INHERIT -> VisibilityUpdate.none();
        };

        result.phase(PhaseResult.success(TransitionPhase.VISIBILITY,
            "Visibility " + transition.getVisibility().name(),
            Map.of("shown", idSet(update.shown()), "hidden", idSet(update.hidden()))));
        return update;
    }

    // ========== CLEANUP ==========

    private void cleanup(Transition transition, TransitionResult.Builder result,
                         boolean completed, Throwable unexpected, long startNanos) {
        if (unexpected != null) {
            log.error("Unexpected error while executing transition {}", transition.getId(), unexpected);
            result.error(unexpected)
                .phase(PhaseResult.failure(TransitionPhase.CLEANUP, "Unexpected error: " + unexpected.getMessage()));
        } else if (completed) {
            result.phase(PhaseResult.success(TransitionPhase.CLEANUP, "Cleanup completed"));
        } else {
            result.phase(PhaseResult.success(TransitionPhase.CLEANUP, "Cleanup completed after rejected phase"));
        }

        boolean success = completed && unexpected == null && !result.hasFailedPhase();
        if (!success) {
            result.activatedStates(Set.of()).deactivatedStates(Set.of()).visibility(VisibilityUpdate.none());
        }
        result.success(success)
            .metadata("elapsedNanos", System.nanoTime() - startNanos);
    }

    private void report(Transition transition, boolean success, long elapsedNanos) {
        try {
            recorder.recordExecution(transition.getId(), success, Duration.ofNanos(elapsedNanos));
        } catch (RuntimeException e) {
            log.warn("Failed to record execution of transition {}", transition.getId(), e);
        }
    }

    // ========== helpers ==========

    private static ActionOutcome run(Action action) {
        try {
            return action.execute()
                ? ActionOutcome.SUCCEEDED
                : new ActionOutcome(false, "action returned false");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new ActionOutcome(false, "interrupted");
        } catch (Exception e) {
            return new ActionOutcome(false, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private static void requireArguments(Transition transition, Set<State> active) {
        if (transition == null) {
            throw new IllegalArgumentException("transition cannot be null");
        }
        if (active == null) {
            throw new IllegalArgumentException("active states cannot be null");
        }
    }

    private static Set<String> idSet(Set<State> states) {
        return states.stream().map(State::getId).collect(Collectors.toUnmodifiableSet());
    }

    private static List<String> ids(Set<State> states) {
        return states.stream().map(State::getId).sorted().collect(Collectors.toList());
    }

    private record ActionOutcome(boolean success, String reason) {
        static final ActionOutcome SUCCEEDED = new ActionOutcome(true, null);
    }
}
