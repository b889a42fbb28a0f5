package com.ryuqq.multistate.testkit.contract;

import com.ryuqq.multistate.core.pathfinding.MultiTargetPathFinder;
import com.ryuqq.multistate.core.pathfinding.Path;
import com.ryuqq.multistate.core.pathfinding.SearchStrategy;
import com.ryuqq.multistate.testkit.fixture.RandomStateGraph;
import com.ryuqq.multistate.testkit.fixture.StateGraphFixtures;
import com.ryuqq.multistate.testkit.oracle.BruteForcePathOracle;
import com.ryuqq.multistate.testkit.oracle.OracleResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

/**
 * Path Finder Optimality Contract Test.
 *
 * <p>무작위 그래프(8 State, 4 목표 이하)에서 탐색 결과를 전수 탐색과 비교합니다.</p>
 *
 * <ul>
 *   <li>BFS: 최소 단계 수</li>
 *   <li>DIJKSTRA / A_STAR: 최소 비용</li>
 *   <li>모든 경로는 Executor로 재생 가능하고 모든 목표를 방문함</li>
 * </ul>
 *
 * <p>전수 탐색은 길이 {@value #ORACLE_DEPTH} 이하만 보므로, 그보다 긴 최적 경로가 있는 경우
 * 탐색기 결과가 전수 탐색보다 나을 수 있습니다. 이 경우 "같거나 더 좋음"만 검증합니다.</p>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
@DisplayName("Path Finder Optimality Contract Test")
class PathFinderOptimalityContractTest extends AbstractMultiStateContractTest {

    private static final int SEEDS = 40;
    private static final int NUM_STATES = 8;
    private static final int NUM_TRANSITIONS = 7;
    private static final int MAX_TARGETS = 4;
    private static final int ORACLE_DEPTH = 5;
    private static final double EPSILON = 1e-9;

    @Test
    @DisplayName("BFS 는 최소 단계 수 경로를 반환한다")
    void bfs_최소_단계() {
        for (long seed = 0; seed < SEEDS; seed++) {
            RandomStateGraph graph = StateGraphFixtures.randomGraph(seed, NUM_STATES, NUM_TRANSITIONS, MAX_TARGETS);
            OracleResult oracle = new BruteForcePathOracle(graph.transitions(), ORACLE_DEPTH)
                .solve(graph.start(), graph.targets());

            Optional<Path> path = pathFinder(graph.transitions())
                .findPathToAll(graph.start(), graph.targets(), SearchStrategy.BFS);

            if (oracle.found()) {
                assertThat(path).as("seed %d", seed).isPresent();
                assertThat(path.get().length()).as("seed %d", seed).isEqualTo(oracle.minSteps());
            } else {
                path.ifPresent(found -> assertThat(found.length()).isGreaterThan(ORACLE_DEPTH));
            }
            path.ifPresent(found -> verifyPlayable(found, graph));
        }
    }

    @Test
    @DisplayName("DIJKSTRA 와 A_STAR 는 최소 비용 경로를 반환한다")
    void 가중치_전략_최소_비용() {
        for (long seed = 0; seed < SEEDS; seed++) {
            RandomStateGraph graph = StateGraphFixtures.randomGraph(seed, NUM_STATES, NUM_TRANSITIONS, MAX_TARGETS);
            OracleResult oracle = new BruteForcePathOracle(graph.transitions(), ORACLE_DEPTH)
                .solve(graph.start(), graph.targets());
            MultiTargetPathFinder finder = pathFinder(graph.transitions());

            Optional<Path> dijkstra = finder.findPathToAll(graph.start(), graph.targets(), SearchStrategy.DIJKSTRA);
            Optional<Path> astar = finder.findPathToAll(graph.start(), graph.targets(), SearchStrategy.A_STAR);

            assertThat(astar.isPresent()).as("seed %d", seed).isEqualTo(dijkstra.isPresent());
            if (oracle.found()) {
                assertThat(dijkstra).as("seed %d", seed).isPresent();
                assertThat(dijkstra.get().getTotalCost()).as("seed %d", seed)
                    .isLessThanOrEqualTo(oracle.minCost() + EPSILON);
            }
            if (dijkstra.isPresent()) {
                Path best = dijkstra.get();
                if (best.length() <= ORACLE_DEPTH) {
                    assertThat(best.getTotalCost()).as("seed %d", seed).isEqualTo(oracle.minCost(), offset(EPSILON));
                }
                assertThat(astar.get().getTotalCost()).as("seed %d", seed)
                    .isEqualTo(best.getTotalCost(), offset(EPSILON));
                verifyPlayable(best, graph);
                verifyPlayable(astar.get(), graph);
            }
        }
    }

    private void verifyPlayable(Path path, RandomStateGraph graph) {
        assertThat(path.isComplete()).as("seed %d", graph.seed()).isTrue();
        assertThat(path.getStatesSequence().get(0)).isEqualTo(graph.start());
        replay(path, graph.start());
    }
}
