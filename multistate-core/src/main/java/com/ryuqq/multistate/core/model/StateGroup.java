package com.ryuqq.multistate.core.model;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 하나의 단위로 활성화/비활성화되는 State 묶음.
 *
 * <p><strong>원자성 불변식:</strong> 임의의 활성 구성 C에 대해
 * g ⊆ C 이거나 g ∩ C = ∅ 이어야 합니다.</p>
 *
 * <p>StateGroup은 소속 State를 변경하지 않습니다. State가 최대 하나의 그룹에만
 * 속한다는 규칙은 {@link StateRegistry#registerGroup(StateGroup)}에서 검증됩니다.</p>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public final class StateGroup {

    private final String id;
    private final String name;
    private final Set<State> states;
    private final Map<String, Object> metadata;

    private StateGroup(String id, String name, Collection<State> states, Map<String, Object> metadata) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("StateGroup id cannot be null or blank");
        }
        if (states == null) {
            throw new IllegalArgumentException("states cannot be null");
        }
        this.id = id;
        this.name = name == null ? id : name;
        this.states = Set.copyOf(states);
        this.metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * StateGroup 생성.
     *
     * @param id 식별자
     * @param name 이름
     * @param states 소속 State
     * @return StateGroup 인스턴스
     * @throws IllegalArgumentException id가 비어 있거나 states가 null인 경우
     */
    public static StateGroup of(String id, String name, Collection<State> states) {
        return new StateGroup(id, name, states, null);
    }

    /**
     * StateGroup 생성 (가변 인자).
     *
     * @param id 식별자
     * @param name 이름
     * @param states 소속 State
     * @return StateGroup 인스턴스
     */
    public static StateGroup of(String id, String name, State... states) {
        return new StateGroup(id, name, List.of(states), null);
    }

    /**
     * 메타데이터를 포함한 StateGroup 생성.
     *
     * @param id 식별자
     * @param name 이름
     * @param states 소속 State
     * @param metadata 부가 정보
     * @return StateGroup 인스턴스
     */
    public static StateGroup of(String id, String name, Collection<State> states, Map<String, Object> metadata) {
        return new StateGroup(id, name, states, metadata);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Set<State> getStates() {
        return states;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public int size() {
        return states.size();
    }

    public boolean contains(State state) {
        return states.contains(state);
    }

    public Set<String> stateIds() {
        return states.stream().map(State::getId).collect(Collectors.toUnmodifiableSet());
    }

    /**
     * 모든 소속 State가 활성화되어 있는지 확인 (g ⊆ C).
     *
     * @param active 활성 State 집합
     * @return 전부 활성화되어 있으면 true
     */
    public boolean isFullyActive(Set<State> active) {
        return active.containsAll(states);
    }

    /**
     * 소속 State가 하나도 활성화되어 있지 않은지 확인 (g ∩ C = ∅).
     *
     * @param active 활성 State 집합
     * @return 하나도 활성화되어 있지 않으면 true
     */
    public boolean isFullyInactive(Set<State> active) {
        for (State state : states) {
            if (active.contains(state)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 원자성 불변식 검증.
     *
     * @param active 활성 State 집합
     * @return 전부 활성이거나 전부 비활성이면 true
     */
    public boolean validateAtomicity(Set<State> active) {
        return isFullyActive(active) || isFullyInactive(active);
    }

    /**
     * 디버깅/로깅용 Map 변환.
     *
     * @return id, name, 소속 State id 목록
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("name", name);
        map.put("states", states.stream().map(State::getId).sorted().collect(Collectors.toList()));
        map.put("metadata", metadata);
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StateGroup that = (StateGroup) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "StateGroup{id='" + id + "', name='" + name + "', states=" + stateIds() + '}';
    }
}
