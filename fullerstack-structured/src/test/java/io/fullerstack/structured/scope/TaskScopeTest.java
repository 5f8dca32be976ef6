package io.fullerstack.structured.scope;

import io.fullerstack.structured.cell.ObservableCell;
import io.fullerstack.structured.dispatcher.ScheduledDispatcher;
import io.fullerstack.structured.dispatcher.VirtualTimeDispatcher;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class TaskScopeTest {

    private final VirtualTimeDispatcher dispatcher = VirtualTimeDispatcher.standard();
    private final TaskScope scope = new TaskScope("test", dispatcher);

    // =========================================================================
    // Launch
    // =========================================================================

    @Test
    void shouldReturnBeforeBodyRuns() {
        List<String> ran = new CopyOnWriteArrayList<>();

        Task<String> task = scope.launch("greet", context -> {
            ran.add("body");
            return CompletableFuture.completedFuture("hello");
        });

        assertThat(ran).isEmpty();
        assertThat(task.state()).isEqualTo(TaskState.RUNNING);
        assertThat(scope.children()).containsExactly(task);

        dispatcher.runCurrent();

        assertThat(ran).containsExactly("body");
        assertThat(task.state()).isEqualTo(TaskState.COMPLETED);
        assertThat(task.result()).contains("hello");
        assertThat(scope.children()).isEmpty();
    }

    @Test
    void shouldGenerateTaskNamesAndIds() {
        Task<Void> first = scope.launch(context -> CompletableFuture.completedFuture(null));
        Task<Void> second = scope.launch(context -> CompletableFuture.completedFuture(null));

        assertThat(first.name()).isEqualTo("task-" + first.id());
        assertThat(second.id()).isGreaterThan(first.id());
        assertThat(first.scope()).isSameAs(scope);
    }

    @Test
    void shouldRunChildrenConcurrently() {
        List<String> finished = new CopyOnWriteArrayList<>();

        scope.launch("slow", context -> context.delay(Duration.ofMillis(300))
            .thenRun(() -> finished.add("slow@" + dispatcher.currentTime())));
        scope.launch("fast", context -> context.delay(Duration.ofMillis(200))
            .thenRun(() -> finished.add("fast@" + dispatcher.currentTime())));

        dispatcher.advanceUntilIdle();

        assertThat(finished).containsExactly("fast@200", "slow@300");
        assertThat(dispatcher.currentTime()).isEqualTo(300);
    }

    @Test
    void shouldResumeAwaitOnDispatcher() {
        CompletableFuture<String> external = new CompletableFuture<>();
        AtomicReference<String> seen = new AtomicReference<>();

        scope.launch("await", context -> context.await(external).thenAccept(seen::set));
        dispatcher.runCurrent();

        external.complete("value");
        assertThat(seen.get()).isNull();

        dispatcher.runCurrent();
        assertThat(seen.get()).isEqualTo("value");
    }

    // =========================================================================
    // Supervision
    // =========================================================================

    @Test
    void shouldIsolateChildFailureFromSiblings() {
        ObservableCell<String> sibling = new ObservableCell<>("sibling");

        Task<Void> failing = scope.launch("failing", context -> context.delay(Duration.ofMillis(500))
            .thenRun(() -> {
                throw new IllegalStateException("boom");
            }));
        Task<Void> survivor = scope.launch("survivor", context -> context.delay(Duration.ofMillis(4000))
            .thenRun(() -> sibling.write("A")));

        dispatcher.advanceUntilIdle();

        assertThat(failing.state()).isEqualTo(TaskState.FAILED);
        assertThat(failing.failure()).hasValueSatisfying(failure ->
            assertThat(failure.getCause()).isInstanceOf(IllegalStateException.class).hasMessage("boom")
        );
        assertThat(survivor.state()).isEqualTo(TaskState.COMPLETED);
        assertThat(sibling.read()).contains("A");
        assertThat(scope.state()).isEqualTo(ScopeState.ACTIVE);
    }

    @Test
    void shouldRecordSynchronousBodyFailure() {
        Task<Void> task = scope.launch("throws", context -> {
            throw new java.io.IOException("disk unavailable");
        });

        dispatcher.runCurrent();

        assertThat(task.state()).isEqualTo(TaskState.FAILED);
        assertThat(task.failure().orElseThrow().getCause()).isInstanceOf(java.io.IOException.class);
    }

    @Test
    void shouldRecordErrorThrownByBody() {
        Task<Void> task = scope.launch("error", context -> {
            throw new AssertionError("boom");
        });

        assertThatCode(dispatcher::runCurrent).doesNotThrowAnyException();

        assertThat(task.state()).isEqualTo(TaskState.FAILED);
        assertThat(task.failure().orElseThrow().getCause())
            .isInstanceOf(AssertionError.class)
            .hasMessage("boom");
        assertThat(task.termination()).isCompletedWithValue(TaskState.FAILED);
        assertThat(scope.children()).isEmpty();
    }

    @Test
    void shouldNotRethrowBodyErrorToLauncherOnEagerDispatcher() {
        VirtualTimeDispatcher eager = VirtualTimeDispatcher.eager();
        TaskScope eagerScope = new TaskScope("eager", eager);
        AtomicReference<Task<Void>> failing = new AtomicReference<>();

        assertThatCode(() -> failing.set(eagerScope.launch("error", context -> {
            throw new AssertionError("boom");
        }))).doesNotThrowAnyException();
        Task<String> sibling = eagerScope.launch("sibling", context -> context.delay(Duration.ofMillis(10)).thenApply(ignored -> "done"));
        eager.advanceUntilIdle();

        assertThat(failing.get().state()).isEqualTo(TaskState.FAILED);
        assertThat(failing.get().join()).isEqualTo(TaskState.FAILED);
        assertThat(sibling.result()).contains("done");
    }

    @Test
    void shouldRecordNullBodyResultAsFailure() {
        Task<Void> task = scope.launch("null", context -> null);

        dispatcher.runCurrent();

        assertThat(task.state()).isEqualTo(TaskState.FAILED);
        assertThat(task.failure().orElseThrow().getCause()).isInstanceOf(NullPointerException.class);
    }

    // =========================================================================
    // Teardown
    // =========================================================================

    @Test
    void shouldCancelSuspendedChildrenAndJoin() {
        ObservableCell<String> cell = new ObservableCell<>("late");
        Task<Void> slow = scope.launch("slow", context -> context.delay(Duration.ofMillis(1000))
            .thenRun(() -> cell.write("too late")));
        dispatcher.runCurrent();

        scope.cancelAndJoin();

        assertThat(slow.state()).isEqualTo(TaskState.CANCELLED);
        assertThat(scope.state()).isEqualTo(ScopeState.TERMINATED);
        assertThat(scope.children()).isEmpty();

        dispatcher.advanceUntilIdle();
        assertThat(cell.read()).isEmpty();
    }

    @Test
    void shouldCancelChildrenThatNeverStarted() {
        Task<Void> pending = scope.launch("pending", context -> CompletableFuture.completedFuture(null));

        scope.cancelAndJoin();
        dispatcher.runCurrent();

        assertThat(pending.state()).isEqualTo(TaskState.CANCELLED);
    }

    @Test
    void shouldLeaveOperationThatNeverCompletesRunningUntilCancelled() {
        Task<Object> stuck = scope.launch("stuck", context -> context.await(new CompletableFuture<>()));

        dispatcher.advanceUntilIdle();
        assertThat(stuck.state()).isEqualTo(TaskState.RUNNING);

        scope.cancelAndJoin();
        assertThat(stuck.state()).isEqualTo(TaskState.CANCELLED);
    }

    @Test
    void shouldCancelAwaitedFuture() {
        CompletableFuture<String> external = new CompletableFuture<>();
        scope.launch("await", context -> context.await(external));
        dispatcher.runCurrent();

        scope.cancelAndJoin();

        assertThat(external).isCancelled();
    }

    @Test
    void shouldRefuseLaunchAfterTeardown() {
        scope.cancelAndJoin();

        assertThatThrownBy(() -> scope.launch(context -> CompletableFuture.completedFuture(null)))
            .isInstanceOf(ScopeClosedException.class)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("closed");
    }

    @Test
    void shouldAllowMultipleCancelAndJoin() {
        scope.launch(context -> context.delay(Duration.ofMillis(10)));

        scope.cancelAndJoin();
        scope.cancelAndJoin();

        assertThat(scope.state()).isEqualTo(ScopeState.TERMINATED);
    }

    @Test
    void shouldNotCancelCompletedChildren() {
        Task<String> done = scope.launch(context -> CompletableFuture.completedFuture("done"));
        dispatcher.runCurrent();

        scope.cancelAndJoin();

        assertThat(done.state()).isEqualTo(TaskState.COMPLETED);
        assertThat(done.result()).contains("done");
    }

    @Test
    void shouldRejectCancelAndJoinFromOwnTask() {
        AtomicReference<Throwable> failure = new AtomicReference<>();

        scope.launch("self", context -> {
            try {
                scope.cancelAndJoin();
            } catch (IllegalStateException e) {
                failure.set(e);
            }
            return CompletableFuture.completedFuture(null);
        });
        dispatcher.runCurrent();

        assertThat(failure.get()).hasMessageContaining("from within task 'self'");
        assertThat(scope.state()).isEqualTo(ScopeState.ACTIVE);
    }

    @Test
    void shouldWaitForRunningStepBeforeTeardownReturns() throws Exception {
        try (ScheduledDispatcher real = new ScheduledDispatcher()) {
            TaskScope realScope = new TaskScope("real", real);
            CountDownLatch stepStarted = new CountDownLatch(1);
            CountDownLatch releaseStep = new CountDownLatch(1);
            ObservableCell<String> cell = new ObservableCell<>("cell");

            Task<Void> task = realScope.launch("blocking", context -> {
                stepStarted.countDown();
                releaseStep.await(5, TimeUnit.SECONDS);
                cell.write("written in step");
                return context.delay(Duration.ofSeconds(30)).thenRun(() -> cell.write("after delay"));
            });
            assertThat(stepStarted.await(5, TimeUnit.SECONDS)).isTrue();

            CompletableFuture<Void> teardown = CompletableFuture.runAsync(realScope::cancelAndJoin);
            await().during(100, TimeUnit.MILLISECONDS).atMost(2, TimeUnit.SECONDS).until(() -> !teardown.isDone());
            assertThat(task.isActive()).isFalse();

            releaseStep.countDown();
            teardown.get(5, TimeUnit.SECONDS);

            assertThat(task.state()).isEqualTo(TaskState.CANCELLED);
            assertThat(cell.read()).contains("written in step");
        }
    }
}
