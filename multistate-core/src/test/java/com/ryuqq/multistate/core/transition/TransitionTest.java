package com.ryuqq.multistate.core.transition;

import com.ryuqq.multistate.core.model.State;
import com.ryuqq.multistate.core.model.StateGroup;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Transition 테스트.
 *
 * @author MultiState Team
 * @since 1.0.0
 */
@DisplayName("Transition 테스트")
class TransitionTest {

    private final State login = State.of("login");
    private final State main = State.of("main");
    private final State toolbar = State.of("toolbar");
    private final State sidebar = State.of("sidebar");
    private final StateGroup workspace = StateGroup.of("workspace", "Workspace", toolbar, sidebar);

    @Test
    @DisplayName("기본값: 비용 1.0, INHERIT, 와일드카드")
    void builder_기본값() {
        // when
        Transition transition = Transition.builder("noop").build();

        // then
        assertThat(transition.getName()).isEqualTo("noop");
        assertThat(transition.getCost()).isEqualTo(1.0);
        assertThat(transition.getVisibility()).isEqualTo(VisibilityDirective.INHERIT);
        assertThat(transition.isWildcard()).isTrue();
        assertThat(transition.getAction()).isEmpty();
    }

    @Test
    @DisplayName("statesToActivate / statesToExit 는 그룹 소속 State 를 포함한다")
    void 그룹_포함_파생_집합() {
        // when
        Transition transition = Transition.builder("open-workspace")
            .from(login)
            .activate(main)
            .activateGroup(workspace)
            .exit(login)
            .build();

        // then
        assertThat(transition.statesToActivate()).containsExactlyInAnyOrder(main, toolbar, sidebar);
        assertThat(transition.statesToExit()).containsExactly(login);
    }

    @Test
    @DisplayName("canFire: 와일드카드는 항상, 그 외에는 출발 State 중 하나라도 활성이어야 한다")
    void canFire_출발_조건() {
        // given
        Transition wildcard = Transition.builder("anywhere").activate(main).build();
        Transition fromLoginOrMain = Transition.builder("t").from(login, main).activate(toolbar).build();

        // then
        assertThat(wildcard.canFire(Set.of())).isTrue();
        assertThat(fromLoginOrMain.canFire(Set.of(main))).isTrue();
        assertThat(fromLoginOrMain.canFire(Set.of(sidebar))).isFalse();
        assertThat(fromLoginOrMain.canFire(Set.of())).isFalse();
    }

    @Test
    @DisplayName("project 는 (C − exit) ∪ activate 를 계산하고 입력을 변경하지 않는다")
    void project_순수_함수() {
        // given
        Transition transition = Transition.builder("login")
            .from(login)
            .activate(main, toolbar)
            .exit(login)
            .build();
        Set<State> active = new HashSet<>(Set.of(login, sidebar));

        // when
        Set<State> projected = transition.project(active);

        // then
        assertThat(projected).containsExactlyInAnyOrder(main, toolbar, sidebar);
        assertThat(active).containsExactlyInAnyOrder(login, sidebar);
    }

    @Test
    @DisplayName("종료와 활성화에 모두 포함된 State 는 활성으로 남는다")
    void project_종료와_활성화_중복() {
        // given
        Transition refresh = Transition.builder("refresh").from(main).activate(main).exit(main).build();

        // then
        assertThat(refresh.project(Set.of(main))).containsExactly(main);
    }

    @Test
    @DisplayName("음수 비용은 거부된다")
    void cost_음수_거부() {
        assertThatThrownBy(() -> Transition.builder("t").cost(-0.5))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cost must be a finite non-negative number");
        assertThatThrownBy(() -> Transition.builder("t").cost(Double.NaN))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("incomingActionFor 는 State id 로 인라인 동작을 찾는다")
    void incomingActionFor_조회() {
        // given
        Action onToolbar = () -> true;
        Transition transition = Transition.builder("t").activate(toolbar).incoming("toolbar", onToolbar).build();

        // then
        assertThat(transition.incomingActionFor(toolbar)).contains(onToolbar);
        assertThat(transition.incomingActionFor(sidebar)).isEmpty();
    }

    @Test
    @DisplayName("equals 는 id 만 비교한다")
    void equals_id_기준() {
        assertThat(Transition.builder("t").activate(main).build())
            .isEqualTo(Transition.builder("t", "Other").exit(main).cost(5).build());
    }

    @Test
    @DisplayName("toMap 은 디버깅용 필드를 정렬된 id 목록으로 담는다")
    void toMap_디버깅_필드() {
        // given
        Transition transition = Transition.builder("t", "Open")
            .from(login)
            .activate(toolbar, main)
            .cost(2.5)
            .visibility(VisibilityDirective.HIDE_SOURCE)
            .build();

        // when
        Map<String, Object> map = transition.toMap();

        // then
        assertThat(map)
            .containsEntry("id", "t")
            .containsEntry("name", "Open")
            .containsEntry("cost", 2.5)
            .containsEntry("visibility", "HIDE_SOURCE")
            .containsEntry("hasAction", false);
        assertThat(map.get("activateStates")).isEqualTo(List.of("main", "toolbar"));
    }
}
