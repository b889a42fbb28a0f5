package com.ryuqq.multistate.application.session;

import com.ryuqq.multistate.core.model.State;
import com.ryuqq.multistate.core.pathfinding.Path;
import com.ryuqq.multistate.core.pathfinding.PathFound;
import com.ryuqq.multistate.core.pathfinding.SearchOutcome;
import com.ryuqq.multistate.core.transition.TransitionResult;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * {@link StateSession#navigateTo} 결과.
 *
 * <p><strong>상태별 내용:</strong></p>
 * <ul>
 *   <li>COMPLETED: 계획 경로 + 모든 전이 결과 (전부 성공)</li>
 *   <li>FAILED: 계획 경로 + 실패한 전이까지의 결과 (마지막이 실패)</li>
 *   <li>NO_PATH / ABORTED: 탐색 결과만 있고 실행 결과는 비어 있음</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 상태 변경 불가</p>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public final class NavigationResult {

    private final NavigationStatus status;
    private final SearchOutcome searchOutcome;
    private final List<TransitionResult> executedResults;
    private final Set<State> finalStates;

    private NavigationResult(NavigationStatus status, SearchOutcome searchOutcome,
                             List<TransitionResult> executedResults, Set<State> finalStates) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (searchOutcome == null) {
            throw new IllegalArgumentException("searchOutcome cannot be null");
        }
        this.status = status;
        this.searchOutcome = searchOutcome;
        this.executedResults = List.copyOf(executedResults);
        this.finalStates = Set.copyOf(finalStates);
    }

    static NavigationResult completed(PathFound found, List<TransitionResult> executed, Set<State> finalStates) {
        return new NavigationResult(NavigationStatus.COMPLETED, found, executed, finalStates);
    }

    static NavigationResult failed(PathFound found, List<TransitionResult> executed, Set<State> finalStates) {
        return new NavigationResult(NavigationStatus.FAILED, found, executed, finalStates);
    }

    static NavigationResult notPlanned(NavigationStatus status, SearchOutcome outcome, Set<State> finalStates) {
        return new NavigationResult(status, outcome, List.of(), finalStates);
    }

    public NavigationStatus getStatus() {
        return status;
    }

    public boolean isCompleted() {
        return status == NavigationStatus.COMPLETED;
    }

    public SearchOutcome getSearchOutcome() {
        return searchOutcome;
    }

    /**
     * 계획된 경로 조회.
     *
     * @return 경로 (NO_PATH / ABORTED이면 empty)
     */
    public Optional<Path> plannedPath() {
        if (searchOutcome instanceof PathFound found) {
            return Optional.of(found.path());
        }
        return Optional.empty();
    }

    /**
     * 실행한 전이 결과 목록 (실행 순서).
     *
     * @return 불변 리스트
     */
    public List<TransitionResult> getExecutedResults() {
        return executedResults;
    }

    /**
     * 실패한 전이 결과.
     *
     * @return FAILED이면 마지막 실행 결과, 그 외에는 empty
     */
    public Optional<TransitionResult> failedResult() {
        if (status != NavigationStatus.FAILED || executedResults.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(executedResults.get(executedResults.size() - 1));
    }

    /**
     * navigation 종료 시점의 활성 State 집합.
     *
     * @return 불변 Set
     */
    public Set<State> getFinalStates() {
        return finalStates;
    }

    @Override
    public String toString() {
        return "NavigationResult{status=" + status
            + ", executed=" + executedResults.size()
            + ", finalStates=" + finalStates.size() + '}';
    }
}
