package com.ryuqq.multistate.testkit.fixture;

import com.ryuqq.multistate.core.model.State;
import com.ryuqq.multistate.core.transition.Transition;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * 테스트용 State 그래프 모음.
 *
 * <p><strong>제공 시나리오:</strong></p>
 * <ul>
 *   <li>{@link #lineGraph()}: A → B → C, 단위 비용</li>
 *   <li>{@link #workspaceGraph()}: Login → Menu → {Toolbar, Sidebar, Editor}, Login → Editor 지름길 (비용 10)</li>
 *   <li>{@link #modalScenario()}: 차단 상태 Modal + Main 활성, Toolbar만 활성화하는 전이</li>
 *   <li>{@link #randomGraph(long, int, int, int)}: 최적성 검증용 무작위 그래프</li>
 * </ul>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public final class StateGraphFixtures {

    private StateGraphFixtures() {
    }

    /**
     * A → B → C 직선 그래프.
     *
     * @return 시작 {A}, 목표 {C}
     */
    public static Fixture lineGraph() {
        State a = State.of("A");
        State b = State.of("B");
        State c = State.of("C");
        List<Transition> transitions = List.of(
            Transition.builder("A->B").from(a).activate(b).exit(a).build(),
            Transition.builder("B->C").from(b).activate(c).exit(b).build()
        );
        return new Fixture(List.of(a, b, c), transitions, Set.of(a), Set.of(c));
    }

    /**
     * 작업 공간 그래프.
     *
     * <pre>
     * login ─(1)─► menu ─(2)─► {toolbar, sidebar, editor}
     *   └──────────(10)──────► editor
     * </pre>
     *
     * @return 시작 {login}, 목표 {toolbar, sidebar, editor}
     */
    public static Fixture workspaceGraph() {
        State login = State.of("login", "Login");
        State menu = State.of("menu", "Menu");
        State toolbar = State.of("toolbar", "Toolbar");
        State sidebar = State.of("sidebar", "Sidebar");
        State editor = State.of("editor", "Editor");
        List<Transition> transitions = List.of(
            Transition.builder("login->menu").from(login).activate(menu).exit(login).cost(1).build(),
            Transition.builder("menu->workspace").from(menu).activate(toolbar, sidebar, editor).cost(2).build(),
            Transition.builder("login->editor").from(login).activate(editor).exit(login).cost(10).build()
        );
        return new Fixture(List.of(login, menu, toolbar, sidebar, editor), transitions,
            Set.of(login), Set.of(toolbar, sidebar, editor));
    }

    /**
     * 차단 상태 시나리오.
     *
     * <p>Modal(blocking, blocks=toolbar)과 Main이 활성이고, 전이 "show-toolbar"는 Toolbar만 활성화합니다.</p>
     *
     * @return 시작 {modal, main}, 목표 {toolbar}
     */
    public static Fixture modalScenario() {
        State modal = State.builder("modal", "Modal").blocking(true).blocks("toolbar").build();
        State main = State.of("main", "Main");
        State toolbar = State.of("toolbar", "Toolbar");
        List<Transition> transitions = List.of(
            Transition.builder("show-toolbar").from(main).activate(toolbar).build(),
            Transition.builder("close-modal").from(modal).exit(modal).build()
        );
        return new Fixture(List.of(modal, main, toolbar), transitions, Set.of(modal, main), Set.of(toolbar));
    }

    /**
     * 무작위 그래프 생성.
     *
     * <p>각 전이는 출발 State 1개(10% 확률로 와일드카드), 활성화 1~2개, 종료 0~2개를 가지며
     * 비용은 {0.25, 0.5, 1, 2, 3} 중 하나입니다. 시작 구성은 State 1개, 목표는 시작에 없는 State 중에서 고릅니다.</p>
     *
     * @param seed 시드
     * @param numStates State 수 (2 이상)
     * @param numTransitions 전이 수
     * @param maxTargets 최대 목표 수 (1 이상, numStates - 1 이하로 조정됨)
     * @return 무작위 그래프
     * @throws IllegalArgumentException numStates가 2 미만이거나 maxTargets가 1 미만인 경우
     */
    public static RandomStateGraph randomGraph(long seed, int numStates, int numTransitions, int maxTargets) {
        if (numStates < 2) {
            throw new IllegalArgumentException("numStates must be at least 2 (current: " + numStates + ")");
        }
        if (maxTargets < 1) {
            throw new IllegalArgumentException("maxTargets must be at least 1 (current: " + maxTargets + ")");
        }
        Random random = new Random(seed);
        List<State> states = new ArrayList<>();
        for (int i = 0; i < numStates; i++) {
            states.add(State.of("s" + i));
        }

        double[] costs = {0.25, 0.5, 1.0, 2.0, 3.0};
        List<Transition> transitions = new ArrayList<>();
        for (int i = 0; i < numTransitions; i++) {
            Transition.Builder builder = Transition.builder("t" + i).cost(costs[random.nextInt(costs.length)]);
            if (random.nextInt(10) != 0) {
                builder.from(pick(random, states));
            }
            int activations = 1 + random.nextInt(2);
            for (int j = 0; j < activations; j++) {
                builder.activate(pick(random, states));
            }
            int exits = random.nextInt(3);
            for (int j = 0; j < exits; j++) {
                builder.exit(pick(random, states));
            }
            transitions.add(builder.build());
        }

        State start = states.get(0);
        List<State> candidates = new ArrayList<>(states.subList(1, states.size()));
        int targetCount = 1 + random.nextInt(Math.min(maxTargets, candidates.size()));
        Set<State> targets = new HashSet<>();
        while (targets.size() < targetCount) {
            targets.add(candidates.get(random.nextInt(candidates.size())));
        }
        return new RandomStateGraph(states, transitions, Set.of(start), targets, seed);
    }

    private static State pick(Random random, List<State> states) {
        return states.get(random.nextInt(states.size()));
    }

    /**
     * 고정 시나리오.
     *
     * @param states 선언된 State 목록
     * @param transitions 전이 목록
     * @param start 시작 구성
     * @param targets 목표 State 집합
     */
    public record Fixture(List<State> states, List<Transition> transitions, Set<State> start, Set<State> targets) {

        /**
         * id로 State 조회.
         *
         * @param id State id
         * @return State
         * @throws IllegalArgumentException 없는 id인 경우
         */
        public State state(String id) {
            return states.stream()
                .filter(state -> state.getId().equals(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown state id: " + id));
        }

        /**
         * id로 전이 조회.
         *
         * @param id 전이 id
         * @return 전이
         * @throws IllegalArgumentException 없는 id인 경우
         */
        public Transition transition(String id) {
            return transitions.stream()
                .filter(transition -> transition.getId().equals(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown transition id: " + id));
        }
    }
}
