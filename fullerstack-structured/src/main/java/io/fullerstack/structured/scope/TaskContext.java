package io.fullerstack.structured.scope;

import io.fullerstack.structured.dispatcher.Dispatcher;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Handle a {@link TaskBody} uses to suspend and to check for cancellation.
 *
 * <p>Stages returned by {@link #await(CompletionStage)} complete on the task's dispatcher,
 * and only while the task is still running. After the task is cancelled they never
 * complete, so nothing chained on them runs.
 */
public final class TaskContext {
    private final Task<?> task;

    TaskContext(Task<?> task) {
        this.task = task;
    }

    /**
     * Suspends the task until {@code stage} completes.
     *
     * <p>Chain the continuation on the returned future with the non-async methods
     * ({@code thenApply}, {@code thenCompose}, {@code handle}, ...). The async variants hop
     * off the dispatcher and escape cancellation.
     *
     * @param stage the result to wait for
     * @param <V>   value type
     * @return a future resumed on the dispatcher with the stage's outcome
     */
    public <V> CompletableFuture<V> await(CompletionStage<V> stage) {
        return task.await(stage);
    }

    /**
     * Suspends the task for {@code duration} of dispatcher time.
     *
     * @param duration non-negative delay
     * @return a future resumed on the dispatcher once the delay elapses
     */
    public CompletableFuture<Void> delay(Duration duration) {
        return task.await(task.dispatcher().delay(duration));
    }

    /**
     * Checks whether the task is still running and no cancellation was requested.
     *
     * @return true while the task may keep going
     */
    public boolean isActive() {
        return task.isActive();
    }

    public Task<?> task() {
        return task;
    }

    public Dispatcher dispatcher() {
        return task.dispatcher();
    }
}
