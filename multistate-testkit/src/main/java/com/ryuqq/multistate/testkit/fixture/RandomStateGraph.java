package com.ryuqq.multistate.testkit.fixture;

import com.ryuqq.multistate.core.model.State;
import com.ryuqq.multistate.core.transition.Transition;

import java.util.List;
import java.util.Set;

/**
 * 무작위로 생성된 State 그래프.
 *
 * @param states 선언된 State 목록
 * @param transitions 전이 목록
 * @param start 시작 구성
 * @param targets 목표 State 집합
 * @param seed 생성에 사용한 시드 (실패 재현용)
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public record RandomStateGraph(
    List<State> states,
    List<Transition> transitions,
    Set<State> start,
    Set<State> targets,
    long seed
) {

    public RandomStateGraph {
        states = List.copyOf(states);
        transitions = List.copyOf(transitions);
        start = Set.copyOf(start);
        targets = Set.copyOf(targets);
    }
}
