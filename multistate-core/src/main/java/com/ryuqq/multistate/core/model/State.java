package com.ryuqq.multistate.core.model;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 동시에 활성화될 수 있는 상태 하나.
 *
 * <p>State는 Element의 모음이며, 여러 State가 동시에 활성화될 수 있습니다
 * (겹치는 UI 패널, 동시 진행 중인 게임 목표 등).</p>
 *
 * <p><strong>식별성:</strong> equals/hashCode는 id만 사용합니다.
 * 나머지 필드는 식별성에 영향을 주지 않는 payload입니다.</p>
 *
 * <p><strong>불변성:</strong> {@link Builder#build()} 이후 변경 불가.
 * 그룹 소속은 State가 아니라 {@link StateRegistry}가 기록합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * State modal = State.builder("modal", "Modal Dialog")
 *     .blocking(true)
 *     .blocks("toolbar", "sidebar")
 *     .build();
 * </pre>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public final class State {

    private final String id;
    private final String name;
    private final Set<Element> elements;
    private final String groupId;
    private final double initialWeight;
    private final double searchCost;
    private final boolean blocking;
    private final Set<String> blockedIds;
    private final Map<String, Object> metadata;

    private State(Builder builder) {
        this.id = builder.id;
        this.name = builder.name;
        this.elements = Set.copyOf(builder.elements);
        this.groupId = builder.groupId;
        this.initialWeight = builder.initialWeight;
        this.searchCost = builder.searchCost;
        this.blocking = builder.blocking;
        this.blockedIds = Set.copyOf(builder.blockedIds);
        this.metadata = Map.copyOf(builder.metadata);
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
     * 기본값으로 State 생성.
     *
     * @param id 식별자
     * @param name 이름
     * @return State 인스턴스
     */
    public static State of(String id, String name) {
        return builder(id, name).build();
    }

    /**
     * id를 이름으로도 사용하는 State 생성.
     *
     * @param id 식별자 겸 이름
     * @return State 인스턴스
     */
    public static State of(String id) {
        return builder(id, id).build();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Set<Element> getElements() {
        return elements;
    }

    /**
     * 선언된 그룹 id 조회.
     *
     * @return 그룹 id (선언하지 않았으면 empty)
     */
    public Optional<String> getGroupId() {
        return Optional.ofNullable(groupId);
    }

    /**
     * 초기 상태 선택 시 사용하는 가중치.
     *
     * @return 가중치 (0 이상)
     */
    public double getInitialWeight() {
        return initialWeight;
    }

    /**
     * 탐색 비용.
     *
     * @return 비용 (0 이상)
     */
    public double getSearchCost() {
        return searchCost;
    }

    /**
     * 차단(blocking) 상태인지 확인.
     *
     * <p>차단 상태가 활성화되어 있는 동안에는 자신의 그룹에 합류하는 활성화를
     * 제외한 모든 활성화가 거부됩니다.</p>
     *
     * @return 차단 상태이면 true
     */
    public boolean isBlocking() {
        return blocking;
    }

    /**
     * 이 State가 차단하는 State id 집합.
     *
     * @return 차단 대상 id 집합 (불변)
     */
    public Set<String> getBlockedIds() {
        return blockedIds;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * Element 포함 여부 확인.
     *
     * @param element 확인할 Element
     * @return 포함하면 true
     */
    public boolean hasElement(Element element) {
        return elements.contains(element);
    }

    /**
     * 디버깅/로깅용 Map 변환.
     *
     * <p>바인딩된 스키마가 아니므로 영속화 용도로 사용하지 마십시오.</p>
     *
     * @return id, name, 비용, 플래그 등을 담은 Map
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("name", name);
        map.put("elements", elements.stream().map(Element::getId).sorted().collect(Collectors.toList()));
        map.put("group", groupId);
        map.put("initialWeight", initialWeight);
        map.put("searchCost", searchCost);
        map.put("blocking", blocking);
        map.put("blocks", blockedIds.stream().sorted().collect(Collectors.toList()));
        map.put("metadata", metadata);
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        State state = (State) o;
        return id.equals(state.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        String group = groupId != null ? ", group='" + groupId + "'" : "";
        return "State{id='" + id + "', name='" + name + "', elements=" + elements.size() + group + '}';
    }

    /**
     * State Builder.
     */
    public static final class Builder {

        private final String id;
        private final String name;
        private final Set<Element> elements = new LinkedHashSet<>();
        private String groupId;
        private double initialWeight = 1.0;
        private double searchCost = 1.0;
        private boolean blocking;
        private final Set<String> blockedIds = new LinkedHashSet<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(String id, String name) {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("State id cannot be null or blank");
            }
            this.id = id;
            this.name = name == null ? id : name;
        }

        public Builder element(Element element) {
            if (element == null) {
                throw new IllegalArgumentException("element cannot be null");
            }
            this.elements.add(element);
            return this;
        }

        public Builder elements(Element... elements) {
            for (Element element : elements) {
                element(element);
            }
            return this;
        }

        public Builder group(String groupId) {
            this.groupId = groupId;
            return this;
        }

        public Builder initialWeight(double initialWeight) {
            if (initialWeight < 0 || Double.isNaN(initialWeight)) {
                throw new IllegalArgumentException("initialWeight must be non-negative (current: " + initialWeight + ")");
            }
            this.initialWeight = initialWeight;
            return this;
        }

        public Builder searchCost(double searchCost) {
            if (searchCost < 0 || Double.isNaN(searchCost)) {
                throw new IllegalArgumentException("searchCost must be non-negative (current: " + searchCost + ")");
            }
            this.searchCost = searchCost;
            return this;
        }

        public Builder blocking(boolean blocking) {
            this.blocking = blocking;
            return this;
        }

        public Builder blocks(String... stateIds) {
            this.blockedIds.addAll(List.of(stateIds));
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public State build() {
            return new State(this);
        }
    }
}
