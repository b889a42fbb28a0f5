package com.ryuqq.multistate.testkit.oracle;

import com.ryuqq.multistate.core.model.State;
import com.ryuqq.multistate.core.transition.Transition;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 전수 탐색 기반 경로 검증기.
 *
 * <p>깊이 제한 안의 모든 전이 순서를 나열해, 모든 목표를 방문하는 경로의 최소 비용과
 * 최소 단계 수를 구합니다. 탐색기 구현과 독립적으로 {@link Transition#canFire(Set)},
 * {@link Transition#project(Set)}만 사용합니다.</p>
 *
 * <p>같은 경로 안에서 (구성, 방문 목표)가 반복되는 순서는 건너뜁니다. 반복 구간을 잘라낸 경로가
 * 비용과 단계 수 모두에서 같거나 더 좋기 때문입니다.</p>
 *
 * <p>깊이 제한보다 긴 경로는 보지 않으므로, 결과는 "길이 maxDepth 이하 경로 중 최적"입니다.</p>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public final class BruteForcePathOracle {

    private final List<Transition> transitions;
    private final int maxDepth;

    /**
     * 생성자.
     *
     * @param transitions 전이 목록
     * @param maxDepth 최대 경로 길이 (0 이상)
     * @throws IllegalArgumentException transitions가 null이거나 maxDepth가 음수인 경우
     */
    public BruteForcePathOracle(List<Transition> transitions, int maxDepth) {
        if (transitions == null) {
            throw new IllegalArgumentException("transitions cannot be null");
        }
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative (current: " + maxDepth + ")");
        }
        this.transitions = List.copyOf(transitions);
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * 최적 경로 값 계산.
     *
     * @param start 시작 구성
     * @param targets 목표 State 집합
     * @return 최소 비용, 최소 단계 수
     */
    public OracleResult solve(Set<State> start, Set<State> targets) {
        Enumeration enumeration = new Enumeration(Set.copyOf(targets));
        Set<State> reached = enumeration.reachedIn(start, Set.of());
        Set<Visit> onPath = new HashSet<>();
        onPath.add(new Visit(Set.copyOf(start), reached));
        enumeration.visit(Set.copyOf(start), reached, onPath, 0.0, 0);
        if (Double.isInfinite(enumeration.bestCost)) {
            return OracleResult.none(enumeration.paths);
        }
        return new OracleResult(true, enumeration.bestCost, enumeration.bestSteps, enumeration.paths);
    }

    private record Visit(Set<State> active, Set<State> reached) {
    }

    private final class Enumeration {

        private final Set<State> targets;
        private double bestCost = Double.POSITIVE_INFINITY;
        private int bestSteps = Integer.MAX_VALUE;
        private long paths;

        Enumeration(Set<State> targets) {
            this.targets = targets;
        }

        void visit(Set<State> active, Set<State> reached, Set<Visit> onPath, double cost, int depth) {
            paths++;
            if (reached.containsAll(targets)) {
                bestCost = Math.min(bestCost, cost);
                bestSteps = Math.min(bestSteps, depth);
                return;
            }
            if (depth == maxDepth) {
                return;
            }
            for (Transition transition : transitions) {
                if (!transition.canFire(active)) {
                    continue;
                }
                double nextCost = cost + transition.getCost();
                if (nextCost >= bestCost && depth + 1 >= bestSteps) {
                    continue;
                }
                Set<State> next = Set.copyOf(transition.project(active));
                Set<State> nextReached = reachedIn(next, reached);
                Visit visit = new Visit(next, nextReached);
                if (!onPath.add(visit)) {
                    continue;
                }
                visit(next, nextReached, onPath, nextCost, depth + 1);
                onPath.remove(visit);
            }
        }

        Set<State> reachedIn(Set<State> active, Set<State> reached) {
            Set<State> next = new HashSet<>(reached);
            for (State state : active) {
                if (targets.contains(state)) {
                    next.add(state);
                }
            }
            return Set.copyOf(next);
        }
    }
}
