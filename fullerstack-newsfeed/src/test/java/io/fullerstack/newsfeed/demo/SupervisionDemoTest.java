package io.fullerstack.newsfeed.demo;

import io.fullerstack.structured.dispatcher.VirtualTimeDispatcher;
import io.fullerstack.structured.scope.ScopeState;
import io.fullerstack.structured.scope.TaskState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SupervisionDemo")
class SupervisionDemoTest {

    private VirtualTimeDispatcher dispatcher;
    private List<String> printed;
    private SupervisionDemo demo;

    @BeforeEach
    void setUp() {
        dispatcher = VirtualTimeDispatcher.standard();
        printed = new ArrayList<>();
        demo = new SupervisionDemo(dispatcher, printed::add);
    }

    @Test
    @DisplayName("failing child ends at 500ms, sibling keeps running")
    void shouldFailOnlyTheFailingChild() {
        SupervisionDemo.Launched launched = demo.launch();

        dispatcher.advanceTimeBy(SupervisionDemo.FAILURE_AFTER);

        assertThat(launched.failing().state()).isEqualTo(TaskState.FAILED);
        assertThat(launched.failing().failure().orElseThrow().getCause())
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("child failed on purpose");
        assertThat(launched.survivor().state()).isEqualTo(TaskState.RUNNING);
        assertThat(printed).isEmpty();
    }

    @Test
    @DisplayName("sibling prints A at 4000ms despite the failure")
    void shouldLetSiblingFinishAfterFailure() {
        SupervisionDemo.Launched launched = demo.launch();

        dispatcher.advanceUntilIdle();

        assertThat(launched.survivor().state()).isEqualTo(TaskState.COMPLETED);
        assertThat(printed).containsExactly("A");
        assertThat(dispatcher.currentTime()).isEqualTo(4000);
        assertThat(demo.scope().children()).isEmpty();
        assertThat(demo.scope().state()).isEqualTo(ScopeState.ACTIVE);
    }

    @Test
    @DisplayName("teardown before 4000ms suppresses the output")
    void shouldNotPrintWhenTornDownEarly() {
        SupervisionDemo.Launched launched = demo.launch();
        dispatcher.advanceTimeBy(SupervisionDemo.FAILURE_AFTER);

        demo.scope().cancelAndJoin();
        dispatcher.advanceUntilIdle();

        assertThat(launched.survivor().state()).isEqualTo(TaskState.CANCELLED);
        assertThat(printed).isEmpty();
        assertThat(dispatcher.currentTime()).isEqualTo(500);
    }
}
