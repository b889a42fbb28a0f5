package com.ryuqq.multistate.core.model;

import com.ryuqq.multistate.core.transition.Transition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * StateRegistry 테스트.
 *
 * <p>등록 시점의 구성 오류 검증:</p>
 * <ul>
 *   <li>id 중복</li>
 *   <li>State의 이중 그룹 소속</li>
 *   <li>선언된 groupId와 실제 그룹 불일치 (양방향)</li>
 *   <li>미등록 그룹을 참조하는 Transition</li>
 * </ul>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
@DisplayName("StateRegistry 테스트")
class StateRegistryTest {

    private StateRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new StateRegistry();
    }

    @Test
    @DisplayName("registerState 는 id 중복 시 ConfigurationException 을 던진다")
    void registerState_중복_id_거부() {
        // given
        registry.registerState(State.of("main"));

        // when & then
        assertThatThrownBy(() -> registry.registerState(State.of("main", "Other")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Duplicate state id: main");
    }

    @Test
    @DisplayName("registerGroup 은 소속 State 를 함께 등록하고 groupOf 로 조회된다")
    void registerGroup_소속_State_자동_등록() {
        // given
        State toolbar = State.of("toolbar");
        State sidebar = State.of("sidebar");

        // when
        StateGroup group = registry.registerGroup(StateGroup.of("workspace", "Workspace", toolbar, sidebar));

        // then
        assertThat(registry.state("toolbar")).contains(toolbar);
        assertThat(registry.groupOf(toolbar)).contains(group);
        assertThat(registry.groupOf(State.of("unknown"))).isEmpty();
        assertThat(registry.group("workspace")).contains(group);
    }

    @Test
    @DisplayName("이미 다른 그룹에 속한 State 는 두 번째 그룹에 들어갈 수 없다")
    void registerGroup_이중_소속_거부() {
        // given
        State toolbar = State.of("toolbar");
        registry.registerGroup(StateGroup.of("first", "First", toolbar));

        // when & then
        assertThatThrownBy(() -> registry.registerGroup(StateGroup.of("second", "Second", toolbar)))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("already belongs to group 'first'");
        assertThat(registry.group("second")).isEmpty();
    }

    @Test
    @DisplayName("선언된 groupId 와 다른 그룹에 등록하면 거부된다")
    void registerGroup_groupId_불일치_거부() {
        // given
        State toolbar = State.builder("toolbar", "Toolbar").group("panels").build();

        // when & then
        assertThatThrownBy(() -> registry.registerGroup(StateGroup.of("workspace", "Workspace", toolbar)))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("declares group 'panels'");
    }

    @Test
    @DisplayName("선언된 groupId 와 같은 그룹에는 등록된다")
    void registerGroup_groupId_일치_허용() {
        // given
        State toolbar = State.builder("toolbar", "Toolbar").group("workspace").build();

        // when
        registry.registerGroup(StateGroup.of("workspace", "Workspace", toolbar));

        // then
        assertThat(registry.groupOf(toolbar)).map(StateGroup::getId).contains("workspace");
    }

    @Test
    @DisplayName("groupId 를 선언한 등록된 State 가 빠진 같은 id 의 그룹은 거부된다")
    void registerGroup_선언한_State_누락_거부() {
        // given
        State toolbar = State.builder("toolbar", "Toolbar").group("workspace").build();
        State sidebar = State.of("sidebar");
        registry.registerState(toolbar);

        // when & then
        assertThatThrownBy(() -> registry.registerGroup(StateGroup.of("workspace", "Workspace", sidebar)))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("State 'toolbar' declares group 'workspace' but is not a member of it");
        assertThat(registry.group("workspace")).isEmpty();
        assertThat(registry.state("sidebar")).isEmpty();
    }

    @Test
    @DisplayName("이미 등록된 그룹을 선언했지만 포함되지 않은 State 는 등록할 수 없다")
    void registerState_선언한_그룹에_없으면_거부() {
        // given
        registry.registerGroup(StateGroup.of("workspace", "Workspace", State.of("sidebar")));
        State toolbar = State.builder("toolbar", "Toolbar").group("workspace").build();

        // when & then
        assertThatThrownBy(() -> registry.registerState(toolbar))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("State 'toolbar' declares group 'workspace' but is not a member of it");
        assertThat(registry.state("toolbar")).isEmpty();
    }

    @Test
    @DisplayName("같은 id 의 다른 State 인스턴스로 그룹을 등록하면 거부된다")
    void registerGroup_충돌하는_인스턴스_거부() {
        // given
        registry.registerState(State.of("toolbar"));

        // when & then
        assertThatThrownBy(() -> registry.registerGroup(StateGroup.of("g", "G", State.of("toolbar"))))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Conflicting state instance");
    }

    @Test
    @DisplayName("미등록 그룹을 참조하는 Transition 은 거부된다")
    void registerTransition_미등록_그룹_거부() {
        // given
        StateGroup group = StateGroup.of("workspace", "Workspace", State.of("toolbar"));
        Transition open = Transition.builder("open").activateGroup(group).build();

        // when & then
        assertThatThrownBy(() -> registry.registerTransition(open))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("unregistered group 'workspace'");
    }

    @Test
    @DisplayName("Transition id 중복은 거부되고 조회는 등록 순서를 따른다")
    void registerTransition_중복_거부와_순서_유지() {
        // given
        Transition first = Transition.builder("b-first").build();
        Transition second = Transition.builder("a-second").build();
        registry.registerTransition(first);
        registry.registerTransition(second);

        // when & then
        assertThatThrownBy(() -> registry.registerTransition(Transition.builder("b-first").build()))
            .isInstanceOf(ConfigurationException.class);
        assertThat(registry.transitions()).containsExactly(first, second);
        assertThat(registry.transition("a-second")).contains(second);
    }

    @Test
    @DisplayName("registerStates 는 여러 State 를 순서대로 등록한다")
    void registerStates_순서대로_등록() {
        // when
        registry.registerStates(List.of(State.of("z"), State.of("a")));

        // then
        assertThat(registry.states()).extracting(State::getId).containsExactly("z", "a");
    }
}
