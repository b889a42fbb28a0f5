package com.ryuqq.multistate.core.pathfinding;

import com.ryuqq.multistate.core.model.State;
import com.ryuqq.multistate.core.transition.Transition;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 모든 목표 State를 방문하는 전이 경로.
 *
 * <p>statesSequence는 시작 구성을 포함하므로 항상 transitionsSequence보다 하나 깁니다.
 * 목표는 동시에 활성일 필요가 없으며, 경로 중 한 번이라도 활성이었으면 방문한 것으로 봅니다.</p>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public final class Path {

    private final List<Set<State>> statesSequence;
    private final List<Transition> transitionsSequence;
    private final Set<State> targets;
    private final double totalCost;

    /**
     * 생성자.
     *
     * @param statesSequence 구성 스냅샷 목록 (시작 구성 포함)
     * @param transitionsSequence 적용한 전이 목록
     * @param targets 목표 State 집합
     * @param totalCost 총 비용
     * @throws IllegalArgumentException 인자가 null이거나 길이가 맞지 않는 경우
     */
    public Path(List<Set<State>> statesSequence, List<Transition> transitionsSequence,
                Set<State> targets, double totalCost) {
        if (statesSequence == null || transitionsSequence == null || targets == null) {
            throw new IllegalArgumentException("path components cannot be null");
        }
        if (statesSequence.size() != transitionsSequence.size() + 1) {
            throw new IllegalArgumentException(
                "statesSequence must be one longer than transitionsSequence (states: "
                    + statesSequence.size() + ", transitions: " + transitionsSequence.size() + ")");
        }
        this.statesSequence = statesSequence.stream().map(Set::copyOf).collect(Collectors.toUnmodifiableList());
        this.transitionsSequence = List.copyOf(transitionsSequence);
        this.targets = Set.copyOf(targets);
        this.totalCost = totalCost;
    }

    /**
     * 이동 없이 이미 모든 목표가 활성인 경로.
     *
     * @param current 현재 구성
     * @param targets 목표 State 집합
     * @return 길이 0, 비용 0인 경로
     */
    public static Path zeroStep(Set<State> current, Set<State> targets) {
        return new Path(List.of(current), List.of(), targets, 0.0);
    }

    /**
     * 경로가 모든 목표를 방문하는지 확인.
     *
     * @return 방문한 State 합집합이 목표를 포함하면 true
     */
    public boolean isComplete() {
        Set<State> visited = new HashSet<>();
        for (Set<State> states : statesSequence) {
            visited.addAll(states);
        }
        return visited.containsAll(targets);
    }

    /**
     * 경로 길이 (전이 개수).
     *
     * @return 전이 개수
     */
    public int length() {
        return transitionsSequence.size();
    }

    public List<Set<State>> getStatesSequence() {
        return statesSequence;
    }

    public List<Transition> getTransitionsSequence() {
        return transitionsSequence;
    }

    public Set<State> getTargets() {
        return targets;
    }

    public double getTotalCost() {
        return totalCost;
    }

    /**
     * 마지막 구성.
     *
     * @return 경로 끝의 활성 State 집합
     */
    public Set<State> finalStates() {
        return statesSequence.get(statesSequence.size() - 1);
    }

    @Override
    public String toString() {
        String steps = statesSequence.stream()
            .map(states -> states.stream().map(State::getName).sorted().collect(Collectors.joining(", ", "[", "]")))
            .collect(Collectors.joining(" -> "));
        return "Path(" + length() + " steps, cost=" + totalCost + "): " + steps;
    }
}
