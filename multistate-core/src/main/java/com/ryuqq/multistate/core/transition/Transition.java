package com.ryuqq.multistate.core.transition;

import com.ryuqq.multistate.core.model.State;
import com.ryuqq.multistate.core.model.StateGroup;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 활성 State 집합의 변화량(delta)을 선언하는 전이.
 *
 * <p>하나의 전이는 여러 State를 동시에 활성화하고, 여러 State를 동시에 종료할 수 있으며,
 * 그룹 단위로도 활성화/종료할 수 있습니다.</p>
 *
 * <p><strong>구성 요소:</strong></p>
 * <ul>
 *   <li>fromStates: 출발 조건 (하나라도 활성이면 실행 가능, 비어 있으면 어디서든 실행 가능)</li>
 *   <li>activateStates / activateGroups: 활성화 대상</li>
 *   <li>exitStates / exitGroups: 종료 대상</li>
 *   <li>action: OUTGOING 단계 동작 (선택)</li>
 *   <li>incomingActions: 활성화된 State별 INCOMING 단계 동작 (선택)</li>
 *   <li>cost: 경로 탐색 비용 (0 이상, 기본 1.0)</li>
 *   <li>visibility: 출발 State 가시성 지시 (기본 INHERIT)</li>
 * </ul>
 *
 * <p><strong>집합 연산:</strong></p>
 * <pre>
 * statesToActivate = activateStates ∪ ⋃(activateGroups 소속 State)
 * statesToExit     = exitStates ∪ ⋃(exitGroups 소속 State)
 * project(C)       = (C − statesToExit) ∪ statesToActivate
 * </pre>
 *
 * <p><strong>식별성:</strong> equals/hashCode는 id만 사용합니다.
 * 생성 후 구조는 변경되지 않으므로 여러 탐색에서 동시에 공유해도 안전합니다.</p>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public final class Transition {

    private final String id;
    private final String name;
    private final Set<State> fromStates;
    private final Set<State> activateStates;
    private final Set<State> exitStates;
    private final Set<StateGroup> activateGroups;
    private final Set<StateGroup> exitGroups;
    private final Action action;
    private final Map<String, Action> incomingActions;
    private final double cost;
    private final VisibilityDirective visibility;
    private final Map<String, Object> metadata;

    private final Set<State> statesToActivate;
    private final Set<State> statesToExit;

    private Transition(Builder builder) {
        this.id = builder.id;
        this.name = builder.name;
        this.fromStates = Set.copyOf(builder.fromStates);
        this.activateStates = Set.copyOf(builder.activateStates);
        this.exitStates = Set.copyOf(builder.exitStates);
        this.activateGroups = Set.copyOf(builder.activateGroups);
        this.exitGroups = Set.copyOf(builder.exitGroups);
        this.action = builder.action;
        this.incomingActions = Map.copyOf(builder.incomingActions);
        this.cost = builder.cost;
        this.visibility = builder.visibility;
        this.metadata = Map.copyOf(builder.metadata);
        this.statesToActivate = union(activateStates, activateGroups);
        this.statesToExit = union(exitStates, exitGroups);
    }

    private static Set<State> union(Set<State> states, Set<StateGroup> groups) {
        Set<State> all = new HashSet<>(states);
        for (StateGroup group : groups) {
            all.addAll(group.getStates());
        }
        return Set.copyOf(all);
    }

    /**
     * Builder 생성.
     *
     * @param id 식별자
     * @param name 이름
     * @return Builder
     * @throws IllegalArgumentException id가 null이거나 빈 문자열인 경우
     */
    public static Builder builder(String id, String name) {
        return new Builder(id, name);
    }

    /**
     * id를 이름으로도 사용하는 Builder 생성.
     *
     * @param id 식별자 겸 이름
     * @return Builder
     */
    public static Builder builder(String id) {
        return new Builder(id, id);
    }

    /**
     * 주어진 활성 구성에서 이 전이가 발동 가능한지 확인.
     *
     * <p>fromStates가 비어 있으면(와일드카드) 항상 true, 그렇지 않으면
     * fromStates 중 하나라도 활성이어야 합니다. 부수 효과 없는 순수 함수입니다.</p>
     *
     * @param active 현재 활성 State 집합
     * @return 발동 가능하면 true
     */
    public boolean canFire(Set<State> active) {
        if (fromStates.isEmpty()) {
            return true;
        }
        for (State state : fromStates) {
            if (active.contains(state)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 전이 적용 후의 활성 구성 계산 (what-if).
     *
     * <p>입력 집합은 변경하지 않으며, 어떤 action도 실행하지 않습니다.</p>
     *
     * @param active 현재 활성 State 집합
     * @return (active − statesToExit) ∪ statesToActivate
     */
    public Set<State> project(Set<State> active) {
        Set<State> next = new HashSet<>(active);
        next.removeAll(statesToExit);
        next.addAll(statesToActivate);
        return next;
    }

    /**
     * 와일드카드 전이인지 확인.
     *
     * @return fromStates가 비어 있으면 true
     */
    public boolean isWildcard() {
        return fromStates.isEmpty();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Set<State> getFromStates() {
        return fromStates;
    }

    public Set<State> getActivateStates() {
        return activateStates;
    }

    public Set<State> getExitStates() {
        return exitStates;
    }

    public Set<StateGroup> getActivateGroups() {
        return activateGroups;
    }

    public Set<StateGroup> getExitGroups() {
        return exitGroups;
    }

    /**
     * 활성화될 모든 State (그룹 소속 포함).
     *
     * @return statesToActivate (불변)
     */
    public Set<State> statesToActivate() {
        return statesToActivate;
    }

    /**
     * 종료될 모든 State (그룹 소속 포함).
     *
     * @return statesToExit (불변)
     */
    public Set<State> statesToExit() {
        return statesToExit;
    }

    public Optional<Action> getAction() {
        return Optional.ofNullable(action);
    }

    public Map<String, Action> getIncomingActions() {
        return incomingActions;
    }

    /**
     * 특정 State의 인라인 incoming 동작 조회.
     *
     * @param state 활성화되는 State
     * @return 등록된 동작 (없으면 empty)
     */
    public Optional<Action> incomingActionFor(State state) {
        return Optional.ofNullable(incomingActions.get(state.getId()));
    }

    public double getCost() {
        return cost;
    }

    public VisibilityDirective getVisibility() {
        return visibility;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * 디버깅/로깅용 Map 변환.
     *
     * @return id, name, 각 State/그룹 id 목록, 비용 등을 담은 Map
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("name", name);
        map.put("fromStates", stateIds(fromStates));
        map.put("activateStates", stateIds(activateStates));
        map.put("exitStates", stateIds(exitStates));
        map.put("activateGroups", activateGroups.stream().map(StateGroup::getId).sorted().collect(Collectors.toList()));
        map.put("exitGroups", exitGroups.stream().map(StateGroup::getId).sorted().collect(Collectors.toList()));
        map.put("cost", cost);
        map.put("visibility", visibility.name());
        map.put("hasAction", action != null);
        map.put("incomingActions", incomingActions.keySet().stream().sorted().collect(Collectors.toList()));
        map.put("metadata", metadata);
        return map;
    }

    private static List<String> stateIds(Collection<State> states) {
        return states.stream().map(State::getId).sorted().collect(Collectors.toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Transition that = (Transition) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Transition{id='" + id + "', name='" + name + "', from=" + stateIds(fromStates)
            + ", activate=" + stateIds(statesToActivate) + ", exit=" + stateIds(statesToExit) + '}';
    }

    /**
     * Transition Builder.
     */
    public static final class Builder {

        private final String id;
        private final String name;
        private final Set<State> fromStates = new LinkedHashSet<>();
        private final Set<State> activateStates = new LinkedHashSet<>();
        private final Set<State> exitStates = new LinkedHashSet<>();
        private final Set<StateGroup> activateGroups = new LinkedHashSet<>();
        private final Set<StateGroup> exitGroups = new LinkedHashSet<>();
        private Action action;
        private final Map<String, Action> incomingActions = new LinkedHashMap<>();
        private double cost = 1.0;
        private VisibilityDirective visibility = VisibilityDirective.INHERIT;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(String id, String name) {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Transition id cannot be null or blank");
            }
            this.id = id;
            this.name = name == null ? id : name;
        }

        public Builder from(State... states) {
            this.fromStates.addAll(List.of(states));
            return this;
        }

        public Builder activate(State... states) {
            this.activateStates.addAll(List.of(states));
            return this;
        }

        public Builder exit(State... states) {
            this.exitStates.addAll(List.of(states));
            return this;
        }

        public Builder activateGroup(StateGroup... groups) {
            this.activateGroups.addAll(List.of(groups));
            return this;
        }

        public Builder exitGroup(StateGroup... groups) {
            this.exitGroups.addAll(List.of(groups));
            return this;
        }

        public Builder action(Action action) {
            this.action = action;
            return this;
        }

        /**
         * 활성화되는 State의 incoming 동작 등록.
         *
         * @param stateId State id
         * @param incoming 동작
         * @return Builder
         * @throws IllegalArgumentException 인자가 null인 경우
         */
        public Builder incoming(String stateId, Action incoming) {
            if (stateId == null || incoming == null) {
                throw new IllegalArgumentException("stateId and incoming action cannot be null");
            }
            this.incomingActions.put(stateId, incoming);
            return this;
        }

        /**
         * 경로 탐색 비용 설정.
         *
         * @param cost 비용 (0 이상, 유한값)
         * @return Builder
         * @throws IllegalArgumentException 음수, NaN, 무한대인 경우
         */
        public Builder cost(double cost) {
            if (cost < 0 || Double.isNaN(cost) || Double.isInfinite(cost)) {
                throw new IllegalArgumentException("cost must be a finite non-negative number (current: " + cost + ")");
            }
            this.cost = cost;
            return this;
        }

        public Builder visibility(VisibilityDirective visibility) {
            if (visibility == null) {
                throw new IllegalArgumentException("visibility cannot be null");
            }
            this.visibility = visibility;
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Transition build() {
            return new Transition(this);
        }
    }
}
