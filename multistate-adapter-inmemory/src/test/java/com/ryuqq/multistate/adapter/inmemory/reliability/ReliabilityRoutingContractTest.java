package com.ryuqq.multistate.adapter.inmemory.reliability;

import com.ryuqq.multistate.core.executor.ExecutorConfig;
import com.ryuqq.multistate.core.executor.TransitionExecutor;
import com.ryuqq.multistate.core.model.State;
import com.ryuqq.multistate.core.pathfinding.Path;
import com.ryuqq.multistate.core.pathfinding.SearchStrategy;
import com.ryuqq.multistate.core.spi.CostProvider;
import com.ryuqq.multistate.core.transition.Transition;
import com.ryuqq.multistate.core.transition.TransitionResult;
import com.ryuqq.multistate.testkit.contract.AbstractMultiStateContractTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Contract test wiring {@link InMemoryReliabilityTracker} as both execution recorder
 * and cost provider.
 *
 * <p><strong>Graph:</strong></p>
 * <pre>
 * home ─(1.0, direct)──────────────► report
 * home ─(0.6)─► search ─(0.6)──────► report
 * </pre>
 *
 * @author MultiState Team
 * @since 1.0.0
 * @see AbstractMultiStateContractTest
 */
class ReliabilityRoutingContractTest extends AbstractMultiStateContractTest {

    private final AtomicBoolean directWorks = new AtomicBoolean(true);

    private InMemoryReliabilityTracker tracker;
    private TransitionExecutor trackedExecutor;
    private State home;
    private State search;
    private State report;
    private Transition direct;
    private List<Transition> transitions;

    @BeforeEach
    void setUp() {
        tracker = new InMemoryReliabilityTracker();
        trackedExecutor = new TransitionExecutor(new ExecutorConfig(), tracker, registry);

        home = State.of("home");
        search = State.of("search");
        report = State.of("report");
        direct = Transition.builder("home->report")
            .from(home).activate(report).exit(home).cost(1.0)
            .action(directWorks::get)
            .build();
        transitions = List.of(
            direct,
            Transition.builder("home->search").from(home).activate(search).exit(home).cost(0.6).build(),
            Transition.builder("search->report").from(search).activate(report).exit(search).cost(0.6).build()
        );
    }

    @Override
    protected CostProvider costProvider() {
        return tracker;
    }

    @Test
    @DisplayName("Without history the cheapest declared route is chosen")
    void noHistory_PrefersDirectRoute() {
        Path path = pathFinder(transitions)
            .findPathToAll(Set.of(home), Set.of(report), SearchStrategy.DIJKSTRA)
            .orElseThrow();

        assertThat(path.getTransitionsSequence()).containsExactly(direct);
        assertThat(path.getTotalCost()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("Failures recorded by the executor steer the search to another route")
    void recordedFailures_ReroutesSearch() {
        // given: the direct transition fails once through the executor
        directWorks.set(false);
        TransitionResult failed = trackedExecutor.execute(direct, Set.of(home));
        assertThat(failed.isSuccess()).isFalse();
        assertThat(tracker.getDynamicCost("home->report", 1.0)).isEqualTo(2.0);

        // when
        Path path = pathFinder(transitions)
            .findPathToAll(Set.of(home), Set.of(report), SearchStrategy.A_STAR)
            .orElseThrow();

        // then
        assertThat(path.getTransitionsSequence()).extracting(Transition::getId)
            .containsExactly("home->search", "search->report");
        assertThat(path.getTotalCost()).isCloseTo(1.2, within(1e-9));

        Set<State> finalStates = replay(path, Set.of(home));
        assertActive(finalStates, report);
        assertInactive(finalStates, home, search);
    }

    @Test
    @DisplayName("Successful executions keep the declared cost")
    void recordedSuccesses_KeepDirectRoute() {
        trackedExecutor.execute(direct, Set.of(home));
        trackedExecutor.execute(direct, Set.of(home));

        Path path = pathFinder(transitions)
            .findPathToAll(Set.of(home), Set.of(report), SearchStrategy.DIJKSTRA)
            .orElseThrow();

        assertThat(tracker.stats("home->report").orElseThrow().successCount()).isEqualTo(2);
        assertThat(path.getTransitionsSequence()).containsExactly(direct);
    }
}
