package com.ryuqq.multistate.core.pathfinding;

import com.ryuqq.multistate.core.model.State;
import com.ryuqq.multistate.core.spi.CostProvider;
import com.ryuqq.multistate.core.spi.noop.NoOpCostProvider;
import com.ryuqq.multistate.core.transition.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 다중 목표 경로 탐색기.
 *
 * <p>시작 구성 S0와 목표 집합 T가 주어지면, 경로 중 방문한 구성의 합집합이 T를 포함하는
 * 최소 비용(BFS는 최소 단계) 전이 순서를 찾습니다. 목표는 동시에 활성일 필요가 없습니다.</p>
 *
 * <p><strong>탐색 상태:</strong> (활성 구성, 방문 목표 비트마스크).
 * 목표를 방문한 뒤 종료해도 방문 기록은 유지되어야 하므로 두 값을 따로 추적합니다.
 * 탐색 공간은 O(V × 2^k)입니다.</p>
 *
 * <p><strong>후속 노드:</strong> {@link Transition#canFire(Set)}와 {@link Transition#project(Set)}만 사용합니다.
 * 실행기의 단계나 어떤 동작도 실행하지 않습니다.</p>
 *
 * <p><strong>비용:</strong> 탐색 시작 시 {@link CostProvider}로 전이별 비용을 한 번 계산해 고정합니다.
 * 음수나 NaN이 반환되면 기본 비용을 사용합니다.</p>
 *
 * <p><strong>동시성:</strong> 탐색기는 탐색 간 상태를 공유하지 않으므로 여러 스레드에서 동시에 호출해도 안전합니다.
 * 다만 CostProvider는 스스로 동기화되어 있어야 합니다.</p>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public final class MultiTargetPathFinder {

    private static final Logger log = LoggerFactory.getLogger(MultiTargetPathFinder.class);

    static final int MAX_TARGETS = 63;

    private static final Comparator<Frontier> FRONTIER_ORDER =
        Comparator.comparingDouble(Frontier::priority).thenComparingLong(Frontier::sequence);

    private final List<Transition> transitions;
    private final PathFinderConfig config;
    private final CostProvider costProvider;

    private final Map<String, int[]> transitionsBySource;
    private final BitSet wildcardTransitions;

    /**
     * 기본 설정과 기본 비용으로 생성.
     *
     * @param transitions 탐색에 사용할 전이 목록
     */
    public MultiTargetPathFinder(List<Transition> transitions) {
        this(transitions, new PathFinderConfig(), new NoOpCostProvider());
    }

    /**
     * 생성자.
     *
     * @param transitions 탐색에 사용할 전이 목록 (순서가 동률 처리 순서를 결정)
     * @param config 탐색 예산 설정
     * @param costProvider 동적 비용 제공자
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public MultiTargetPathFinder(List<Transition> transitions, PathFinderConfig config, CostProvider costProvider) {
        if (transitions == null) {
            throw new IllegalArgumentException("transitions cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (costProvider == null) {
            throw new IllegalArgumentException("costProvider cannot be null");
        }
        this.transitions = List.copyOf(transitions);
        this.config = config;
        this.costProvider = costProvider;
        this.transitionsBySource = indexBySource(this.transitions);
        this.wildcardTransitions = new BitSet(this.transitions.size());
        for (int i = 0; i < this.transitions.size(); i++) {
            if (this.transitions.get(i).isWildcard()) {
                wildcardTransitions.set(i);
            }
        }
    }

    private static Map<String, int[]> indexBySource(List<Transition> transitions) {
        Map<String, List<Integer>> bySource = new HashMap<>();
        for (int i = 0; i < transitions.size(); i++) {
            for (State from : transitions.get(i).getFromStates()) {
                bySource.computeIfAbsent(from.getId(), key -> new ArrayList<>()).add(i);
            }
        }
        Map<String, int[]> index = new HashMap<>();
        bySource.forEach((stateId, indices) ->
            index.put(stateId, indices.stream().mapToInt(Integer::intValue).toArray()));
        return index;
    }

    public List<Transition> getTransitions() {
        return transitions;
    }

    public PathFinderConfig getConfig() {
        return config;
    }

    /**
     * 모든 목표를 방문하는 경로 탐색.
     *
     * <p>경로가 없거나 탐색이 중단되면 empty를 반환합니다. 두 경우를 구분하려면
     * {@link #search(Set, Set, SearchStrategy)}를 사용하세요.</p>
     *
     * @param current 시작 구성
     * @param targets 목표 State 집합
     * @param strategy 탐색 전략
     * @return 경로 (없으면 empty)
     */
    public Optional<Path> findPathToAll(Set<State> current, Set<State> targets, SearchStrategy strategy) {
        SearchOutcome outcome = search(current, targets, strategy);
        if (outcome instanceof PathFound found) {
            return Optional.of(found.path());
        }
        return Optional.empty();
    }

    /**
     * 모든 목표를 방문하는 경로 탐색 (구조화된 결과).
     *
     * <p>경로 없음과 탐색 중단은 예외가 아닌 결과로 반환됩니다.</p>
     *
     * @param current 시작 구성
     * @param targets 목표 State 집합
     * @param strategy 탐색 전략
     * @return 탐색 결과
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public SearchOutcome search(Set<State> current, Set<State> targets, SearchStrategy strategy) {
        if (current == null) {
            throw new IllegalArgumentException("current cannot be null");
        }
        if (targets == null) {
            throw new IllegalArgumentException("targets cannot be null");
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }

        long startedAt = System.nanoTime();
        if (targets.size() > MAX_TARGETS) {
            log.warn("Search aborted: {} targets exceed the supported maximum of {}", targets.size(), MAX_TARGETS);
            return new SearchAborted(AbortReason.TOO_MANY_TARGETS, new SearchStats(0, 0, System.nanoTime() - startedAt));
        }

        Search search = new Search(Set.copyOf(current), targets, strategy, startedAt);
        SearchOutcome outcome = search.run();
        logOutcome(outcome, strategy, targets.size());
        return outcome;
    }

    /**
     * 탐색 공간 크기 계산 (모니터링 전용).
     *
     * @param numStates 선언된 State 수
     * @param numTargets 목표 수
     * @return 보고서
     * @see ComplexityEstimator
     */
    public ComplexityReport estimateComplexity(int numStates, int numTargets) {
        return ComplexityEstimator.estimate(numStates, numTargets);
    }

    private static void logOutcome(SearchOutcome outcome, SearchStrategy strategy, int targetCount) {
        SearchStats stats = outcome.stats();
        if (outcome instanceof PathFound found) {
            log.info("Path found: strategy={}, targets={}, steps={}, cost={}, expanded={}, generated={}",
                strategy, targetCount, found.path().length(), found.path().getTotalCost(),
                stats.expandedNodes(), stats.generatedNodes());
        } else if (outcome instanceof SearchAborted aborted) {
            log.warn("Search aborted: strategy={}, targets={}, reason={}, expanded={}, elapsedMs={}",
                strategy, targetCount, aborted.reason(), stats.expandedNodes(), stats.elapsed().toMillis());
        } else {
            log.info("No path covers all targets: strategy={}, targets={}, expanded={}",
                strategy, targetCount, stats.expandedNodes());
        }
    }

    private double[] snapshotCosts() {
        double[] costs = new double[transitions.size()];
        for (int i = 0; i < costs.length; i++) {
            Transition transition = transitions.get(i);
            double base = transition.getCost();
            double dynamic;
            try {
                dynamic = costProvider.getDynamicCost(transition.getId(), base);
            } catch (RuntimeException e) {
                log.warn("Cost provider failed for transition {}, using base cost {}", transition.getId(), base, e);
                dynamic = base;
            }
            if (Double.isNaN(dynamic) || dynamic < 0) {
                log.warn("Cost provider returned {} for transition {}, using base cost {}",
                    dynamic, transition.getId(), base);
                dynamic = base;
            }
            costs[i] = dynamic;
        }
        return costs;
    }

    /**
     * 우선순위 큐 항목. 같은 우선순위는 먼저 넣은 항목이 먼저 나옵니다.
     */
    private record Frontier(double priority, int nodeIndex, long sequence) {
    }

    /**
     * 한 번의 탐색 호출 상태.
     */
    private final class Search {

        private final Set<State> start;
        private final Set<State> targetSet;
        private final Map<State, Integer> targetOrdinals = new HashMap<>();
        private final long goalMask;
        private final SearchStrategy strategy;
        private final long startedAt;
        private final long deadline;
        private final SearchArena arena = new SearchArena();

        private double[] costs;
        private long expanded;
        private long generated;

        Search(Set<State> start, Set<State> targets, SearchStrategy strategy, long startedAt) {
            this.start = start;
            this.targetSet = Set.copyOf(targets);
            List<State> ordered = targets.stream()
                .sorted(Comparator.comparing(State::getId))
                .collect(Collectors.toList());
            for (int i = 0; i < ordered.size(); i++) {
                targetOrdinals.put(ordered.get(i), i);
            }
            this.goalMask = ordered.isEmpty() ? 0L : (1L << ordered.size()) - 1;
            this.strategy = strategy;
            this.startedAt = startedAt;
            // toNanos saturates at Long.MAX_VALUE; the wrapped sum still compares correctly below
            this.deadline = startedAt + TimeUnit.MILLISECONDS.toNanos(config.maxSearchTimeMs());
        }

        SearchOutcome run() {
            long startReached = markReached(0L, start);
            if (startReached == goalMask) {
                return new PathFound(Path.zeroStep(start, targetSet), stats());
            }
            costs = snapshotCosts();
            int root = arena.add(start, startReached, SearchArena.NO_PARENT, -1, 0.0);
            generated++;
            if (strategy == SearchStrategy.BFS) {
                return breadthFirst(root);
            }
            return bestFirst(root, strategy == SearchStrategy.A_STAR ? heuristicUnit() : null);
        }

        private SearchOutcome breadthFirst(int root) {
            ArrayDeque<Integer> queue = new ArrayDeque<>();
            Set<SearchArena.Key> seen = new HashSet<>();
            seen.add(arena.get(root).key());
            queue.add(root);

            while (!queue.isEmpty()) {
                Optional<AbortReason> abort = checkBudget();
                if (abort.isPresent()) {
                    return new SearchAborted(abort.get(), stats());
                }
                int index = queue.poll();
                SearchArena.Node node = arena.get(index);
                expanded++;

                BitSet candidates = candidatesFor(node.active());
                for (int t = candidates.nextSetBit(0); t >= 0; t = candidates.nextSetBit(t + 1)) {
                    Transition transition = transitions.get(t);
                    Set<State> next = Set.copyOf(transition.project(node.active()));
                    long reached = markReached(node.reached(), next);
                    if (!seen.add(new SearchArena.Key(next, reached))) {
                        continue;
                    }
                    int child = arena.add(next, reached, index, t, node.cost() + costs[t]);
                    generated++;
                    if (reached == goalMask) {
                        return new PathFound(reconstruct(child), stats());
                    }
                    queue.add(child);
                }
            }
            return new PathAbsent(stats());
        }

        private SearchOutcome bestFirst(int root, HeuristicUnit heuristic) {
            PriorityQueue<Frontier> open = new PriorityQueue<>(FRONTIER_ORDER);
            Map<SearchArena.Key, Double> bestCost = new HashMap<>();
            Set<SearchArena.Key> closed = new HashSet<>();
            long sequence = 0;

            SearchArena.Node rootNode = arena.get(root);
            bestCost.put(rootNode.key(), 0.0);
            open.add(new Frontier(estimate(heuristic, rootNode.reached()), root, sequence++));

            while (!open.isEmpty()) {
                Optional<AbortReason> abort = checkBudget();
                if (abort.isPresent()) {
                    return new SearchAborted(abort.get(), stats());
                }
                Frontier entry = open.poll();
                SearchArena.Node node = arena.get(entry.nodeIndex());
                SearchArena.Key key = node.key();
                if (!closed.add(key)) {
                    continue;
                }
                if (node.reached() == goalMask) {
                    return new PathFound(reconstruct(entry.nodeIndex()), stats());
                }
                expanded++;

                BitSet candidates = candidatesFor(node.active());
                for (int t = candidates.nextSetBit(0); t >= 0; t = candidates.nextSetBit(t + 1)) {
                    Transition transition = transitions.get(t);
                    Set<State> next = Set.copyOf(transition.project(node.active()));
                    long reached = markReached(node.reached(), next);
                    SearchArena.Key nextKey = new SearchArena.Key(next, reached);
                    if (closed.contains(nextKey)) {
                        continue;
                    }
                    double cost = node.cost() + costs[t];
                    Double known = bestCost.get(nextKey);
                    if (known != null && cost >= known) {
                        continue;
                    }
                    bestCost.put(nextKey, cost);
                    int child = arena.add(next, reached, entry.nodeIndex(), t, cost);
                    generated++;
                    open.add(new Frontier(cost + estimate(heuristic, reached), child, sequence++));
                }
            }
            return new PathAbsent(stats());
        }

        private Optional<AbortReason> checkBudget() {
            if (Thread.currentThread().isInterrupted()) {
                return Optional.of(AbortReason.INTERRUPTED);
            }
            if (expanded >= config.maxExpandedNodes()) {
                return Optional.of(AbortReason.NODE_BUDGET_EXCEEDED);
            }
            if (config.hasTimeBudget() && System.nanoTime() - deadline > 0) {
                return Optional.of(AbortReason.TIME_BUDGET_EXCEEDED);
            }
            return Optional.empty();
        }

        private BitSet candidatesFor(Set<State> active) {
            BitSet candidates = (BitSet) wildcardTransitions.clone();
            for (State state : active) {
                int[] indices = transitionsBySource.get(state.getId());
                if (indices != null) {
                    for (int index : indices) {
                        candidates.set(index);
                    }
                }
            }
            return candidates;
        }

        private long markReached(long reached, Set<State> active) {
            long mask = reached;
            for (State state : active) {
                Integer ordinal = targetOrdinals.get(state);
                if (ordinal != null) {
                    mask |= 1L << ordinal;
                }
            }
            return mask;
        }

        /**
         * h(n) = ceil(남은 목표 수 / m) × 최소 비용.
         *
         * <p>m은 한 전이가 새로 방문할 수 있는 목표의 최대 개수입니다.
         * 각 전이는 최대 m개의 목표만 새로 방문하고 최소 비용 이상이 들므로 h는 허용 가능하고 일관적입니다.</p>
         */
        private HeuristicUnit heuristicUnit() {
            int maxTargetsPerStep = 0;
            double minCost = Double.POSITIVE_INFINITY;
            for (int i = 0; i < transitions.size(); i++) {
                int hits = 0;
                for (State state : transitions.get(i).statesToActivate()) {
                    if (targetOrdinals.containsKey(state)) {
                        hits++;
                    }
                }
                maxTargetsPerStep = Math.max(maxTargetsPerStep, hits);
                minCost = Math.min(minCost, costs[i]);
            }
            if (maxTargetsPerStep == 0 || Double.isInfinite(minCost)) {
                return new HeuristicUnit(1, 0.0);
            }
            return new HeuristicUnit(maxTargetsPerStep, minCost);
        }

        private double estimate(HeuristicUnit heuristic, long reached) {
            if (heuristic == null) {
                return 0.0;
            }
            int remaining = Long.bitCount(goalMask & ~reached);
            int steps = (remaining + heuristic.targetsPerStep() - 1) / heuristic.targetsPerStep();
            return steps * heuristic.minCost();
        }

        private Path reconstruct(int index) {
            List<SearchArena.Node> chain = arena.chainTo(index);
            List<Set<State>> states = new ArrayList<>(chain.size());
            List<Transition> taken = new ArrayList<>(chain.size() - 1);
            for (SearchArena.Node node : chain) {
                states.add(node.active());
                if (node.parent() != SearchArena.NO_PARENT) {
                    taken.add(transitions.get(node.transitionIndex()));
                }
            }
            return new Path(states, taken, targetSet, arena.get(index).cost());
        }

        private SearchStats stats() {
            return new SearchStats(expanded, generated, System.nanoTime() - startedAt);
        }
    }

    private record HeuristicUnit(int targetsPerStep, double minCost) {
    }
}
