package com.ryuqq.multistate.core.transition;

import com.ryuqq.multistate.core.model.State;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 전이 1회 실행의 구조화된 결과.
 *
 * <p>Executor는 호출자의 활성 집합을 직접 변경하지 않습니다. 대신 이 결과에
 * 활성화/종료된 State를 담아 반환하며, 실제 반영(commit)은 호출자의 책임입니다.
 * {@link #applyTo(Set)}를 사용하면 새 집합을 얻을 수 있습니다.</p>
 *
 * <p><strong>롤백:</strong> 실패한 결과는 반영하지 않는 것으로 롤백됩니다.
 * 별도의 undo 과정은 없습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * TransitionResult result = executor.execute(transition, active);
 * if (result.isSuccess()) {
 *     active = result.applyTo(active);
 * } else {
 *     log.warn("failed at {}", result.failedPhase().orElse(null));
 * }
 * </pre>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public final class TransitionResult {

    private final boolean success;
    private final List<PhaseResult> phaseResults;
    private final Set<State> activatedStates;
    private final Set<State> deactivatedStates;
    private final VisibilityUpdate visibility;
    private final Throwable error;
    private final Map<String, Object> metadata;

    private TransitionResult(Builder builder) {
        this.success = builder.success;
        this.phaseResults = List.copyOf(builder.phaseResults);
        this.activatedStates = Set.copyOf(builder.activatedStates);
        this.deactivatedStates = Set.copyOf(builder.deactivatedStates);
        this.visibility = builder.visibility;
        this.error = builder.error;
        this.metadata = Map.copyOf(builder.metadata);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * 단계별 결과 (실행 순서대로).
     *
     * @return 불변 리스트
     */
    public List<PhaseResult> getPhaseResults() {
        return phaseResults;
    }

    public Set<State> getActivatedStates() {
        return activatedStates;
    }

    public Set<State> getDeactivatedStates() {
        return deactivatedStates;
    }

    public VisibilityUpdate getVisibility() {
        return visibility;
    }

    /**
     * 실행 중 포착된 예기치 못한 오류.
     *
     * @return 오류 (없으면 empty)
     */
    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * 처음 실패한 단계 조회.
     *
     * @return 실패 단계 (모두 성공했으면 empty)
     */
    public Optional<TransitionPhase> failedPhase() {
        for (PhaseResult result : phaseResults) {
            if (!result.success()) {
                return Optional.of(result.phase());
            }
        }
        return Optional.empty();
    }

    /**
     * 특정 단계의 결과 조회.
     *
     * @param phase 조회할 단계
     * @return 해당 단계 결과 (실행되지 않았으면 empty)
     */
    public Optional<PhaseResult> phaseResult(TransitionPhase phase) {
        for (PhaseResult result : phaseResults) {
            if (result.phase() == phase) {
                return Optional.of(result);
            }
        }
        return Optional.empty();
    }

    /**
     * 결과를 활성 집합에 반영한 새 집합 반환.
     *
     * <p>입력 집합은 변경하지 않습니다. 실패한 결과라면 입력과 동일한 사본을 반환합니다.</p>
     *
     * @param active 현재 활성 State 집합
     * @return 성공 시 (active − deactivated) ∪ activated, 실패 시 active 사본
     */
    public Set<State> applyTo(Set<State> active) {
        Set<State> next = new HashSet<>(active);
        if (!success) {
            return next;
        }
        next.removeAll(deactivatedStates);
        next.addAll(activatedStates);
        return next;
    }

    @Override
    public String toString() {
        return "TransitionResult{success=" + success
            + ", phases=" + phaseResults.size()
            + ", failedPhase=" + failedPhase().map(Enum::name).orElse("none")
            + ", activated=" + activatedStates.size()
            + ", deactivated=" + deactivatedStates.size() + '}';
    }

    /**
     * TransitionResult Builder.
     *
     * <p>Executor 내부에서 단계별로 결과를 누적할 때 사용합니다.</p>
     */
    public static final class Builder {

        private boolean success;
        private final List<PhaseResult> phaseResults = new ArrayList<>();
        private Set<State> activatedStates = Set.of();
        private Set<State> deactivatedStates = Set.of();
        private VisibilityUpdate visibility = VisibilityUpdate.none();
        private Throwable error;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder success(boolean success) {
            this.success = success;
            return this;
        }

        public Builder phase(PhaseResult phaseResult) {
            this.phaseResults.add(phaseResult);
            return this;
        }

        public Builder activatedStates(Set<State> activatedStates) {
            this.activatedStates = activatedStates;
            return this;
        }

        public Builder deactivatedStates(Set<State> deactivatedStates) {
            this.deactivatedStates = deactivatedStates;
            return this;
        }

        public Builder visibility(VisibilityUpdate visibility) {
            this.visibility = visibility;
            return this;
        }

        public Builder error(Throwable error) {
            this.error = error;
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        /**
         * 현재까지 누적된 단계 중 실패가 있는지 확인.
         *
         * @return 실패 단계가 있으면 true
         */
        public boolean hasFailedPhase() {
            for (PhaseResult result : phaseResults) {
                if (!result.success()) {
                    return true;
                }
            }
            return false;
        }

        public TransitionResult build() {
            return new TransitionResult(this);
        }
    }
}
