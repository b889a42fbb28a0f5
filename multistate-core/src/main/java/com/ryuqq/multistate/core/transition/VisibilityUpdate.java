package com.ryuqq.multistate.core.transition;

import com.ryuqq.multistate.core.model.State;

import java.util.Set;

/**
 * VISIBILITY 단계가 계산한 권고 집합.
 *
 * <p>실제 화면 반영은 호출자의 몫입니다.</p>
 *
 * @param shown 계속 표시할 State
 * @param hidden 숨길 State
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public record VisibilityUpdate(Set<State> shown, Set<State> hidden) {

    private static final VisibilityUpdate NONE = new VisibilityUpdate(Set.of(), Set.of());

    public VisibilityUpdate {
        shown = shown == null ? Set.of() : Set.copyOf(shown);
        hidden = hidden == null ? Set.of() : Set.copyOf(hidden);
    }

    /**
     * 지시가 없는 경우의 빈 권고.
     *
     * @return shown, hidden 모두 비어 있는 인스턴스
     */
    public static VisibilityUpdate none() {
        return NONE;
    }

    public boolean isEmpty() {
        return shown.isEmpty() && hidden.isEmpty();
    }
}
