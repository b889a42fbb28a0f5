package com.ryuqq.multistate.core.model;

import com.ryuqq.multistate.core.spi.GroupResolver;
import com.ryuqq.multistate.core.transition.Transition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * State, StateGroup, Transition의 id 기반 등록부.
 *
 * <p>State와 그룹 사이의 소속 관계는 State 객체가 아니라 이 등록부가 관리합니다.
 * 모든 등록은 충돌 시 {@link ConfigurationException}을 던지는 메서드 하나를 통해서만
 * 이루어집니다.</p>
 *
 * <p><strong>검증 규칙:</strong></p>
 * <ul>
 *   <li>같은 종류 안에서 id 중복 불가</li>
 *   <li>하나의 State는 최대 하나의 그룹에만 소속</li>
 *   <li>State가 선언한 groupId가 있다면, 등록되는 그룹 id와 일치해야 함</li>
 *   <li>groupId를 선언한 State는 그 id의 그룹이 등록되어 있다면 반드시 그 그룹에 포함되어야 함</li>
 *   <li>Transition이 참조하는 그룹은 미리 등록되어 있어야 함</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 구성 단계에서 단일 스레드로 채운 뒤 읽기 전용으로
 * 사용하는 것을 전제로 합니다. 내부 잠금은 없습니다.</p>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public final class StateRegistry implements GroupResolver {

    private final Map<String, State> statesById = new LinkedHashMap<>();
    private final Map<String, StateGroup> groupsById = new LinkedHashMap<>();
    private final Map<String, StateGroup> groupByStateId = new LinkedHashMap<>();
    private final Map<String, Transition> transitionsById = new LinkedHashMap<>();

    /**
     * State 등록.
     *
     * @param state 등록할 State
     * @return 등록된 State
     * @throws IllegalArgumentException state가 null인 경우
     * @throws ConfigurationException 같은 id가 이미 등록되었거나, 선언한 그룹이 이미 등록되어 있지만
     *                                 이 State를 포함하지 않는 경우
     */
    public State registerState(State state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (statesById.containsKey(state.getId())) {
            throw new ConfigurationException("Duplicate state id: " + state.getId());
        }
        Optional<String> declared = state.getGroupId();
        if (declared.isPresent() && groupsById.containsKey(declared.get())) {
            throw new ConfigurationException(String.format(
                "State '%s' declares group '%s' but is not a member of it", state.getId(), declared.get()));
        }
        statesById.put(state.getId(), state);
        return state;
    }

    /**
     * 여러 State 일괄 등록.
     *
     * @param states 등록할 State
     * @throws ConfigurationException 중복 id가 있는 경우
     */
    public void registerStates(Collection<State> states) {
        for (State state : states) {
            registerState(state);
        }
    }

    /**
     * 그룹 등록 및 소속 관계 기록.
     *
     * <p>등록되지 않은 소속 State는 함께 등록됩니다. 검증은 변경 전에 모두 수행되므로
     * 충돌이 발생하면 등록부는 변경되지 않습니다.</p>
     *
     * @param group 등록할 그룹
     * @return 등록된 그룹
     * @throws IllegalArgumentException group이 null인 경우
     * @throws ConfigurationException id 중복, 이중 소속, 선언된 groupId 불일치, 또는 이 그룹을 선언한
     *                                 등록된 State가 그룹에 빠진 경우
     */
    public StateGroup registerGroup(StateGroup group) {
        if (group == null) {
            throw new IllegalArgumentException("group cannot be null");
        }
        if (groupsById.containsKey(group.getId())) {
            throw new ConfigurationException("Duplicate group id: " + group.getId());
        }
        for (State state : group.getStates()) {
            StateGroup existing = groupByStateId.get(state.getId());
            if (existing != null) {
                throw new ConfigurationException(String.format(
                    "State '%s' already belongs to group '%s' (cannot join '%s')",
                    state.getId(), existing.getId(), group.getId()));
            }
            Optional<String> declared = state.getGroupId();
            if (declared.isPresent() && !declared.get().equals(group.getId())) {
                throw new ConfigurationException(String.format(
                    "State '%s' declares group '%s' but is registered into '%s'",
                    state.getId(), declared.get(), group.getId()));
            }
            State registered = statesById.get(state.getId());
            if (registered != null && registered != state) {
                throw new ConfigurationException("Conflicting state instance for id: " + state.getId());
            }
        }
        for (State registered : statesById.values()) {
            boolean declaresThisGroup = registered.getGroupId().filter(group.getId()::equals).isPresent();
            if (declaresThisGroup && !group.contains(registered)) {
                throw new ConfigurationException(String.format(
                    "State '%s' declares group '%s' but is not a member of it", registered.getId(), group.getId()));
            }
        }

        groupsById.put(group.getId(), group);
        for (State state : group.getStates()) {
            statesById.putIfAbsent(state.getId(), state);
            groupByStateId.put(state.getId(), group);
        }
        return group;
    }

    /**
     * Transition 등록.
     *
     * @param transition 등록할 Transition
     * @return 등록된 Transition
     * @throws IllegalArgumentException transition이 null인 경우
     * @throws ConfigurationException id 중복이거나 미등록 그룹을 참조하는 경우
     */
    public Transition registerTransition(Transition transition) {
        if (transition == null) {
            throw new IllegalArgumentException("transition cannot be null");
        }
        if (transitionsById.containsKey(transition.getId())) {
            throw new ConfigurationException("Duplicate transition id: " + transition.getId());
        }
        List<StateGroup> referenced = new ArrayList<>(transition.getActivateGroups());
        referenced.addAll(transition.getExitGroups());
        for (StateGroup group : referenced) {
            if (!groupsById.containsKey(group.getId())) {
                throw new ConfigurationException(String.format(
                    "Transition '%s' references unregistered group '%s'", transition.getId(), group.getId()));
            }
        }
        transitionsById.put(transition.getId(), transition);
        return transition;
    }

    @Override
    public Optional<StateGroup> groupOf(State state) {
        if (state == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(groupByStateId.get(state.getId()));
    }

    public Optional<State> state(String id) {
        return Optional.ofNullable(statesById.get(id));
    }

    public Optional<StateGroup> group(String id) {
        return Optional.ofNullable(groupsById.get(id));
    }

    public Optional<Transition> transition(String id) {
        return Optional.ofNullable(transitionsById.get(id));
    }

    /**
     * 등록 순서대로 State 목록 조회.
     *
     * @return 불변 리스트
     */
    public List<State> states() {
        return List.copyOf(statesById.values());
    }

    public List<StateGroup> groups() {
        return List.copyOf(groupsById.values());
    }

    /**
     * 등록 순서대로 Transition 목록 조회.
     *
     * <p>경로 탐색기의 후속 노드 생성 순서가 이 순서를 따릅니다.</p>
     *
     * @return 불변 리스트
     */
    public List<Transition> transitions() {
        return List.copyOf(transitionsById.values());
    }
}
