package io.fullerstack.structured.scope;

import io.fullerstack.structured.dispatcher.Dispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;

/**
 * One unit of concurrent work owned by a {@link TaskScope}.
 *
 * <p>A task runs as a sequence of steps on its scope's {@link Dispatcher}: the first step
 * runs the body, and each {@link TaskContext#await} resumption is another step. Steps of
 * one task never overlap.
 *
 * <p><b>Cancellation is cooperative:</b>
 * <ul>
 *   <li>A suspended task is cancelled at once; its pending stages are abandoned (and
 *       cancelled when they are {@link CompletableFuture}s)</li>
 *   <li>A task cancelled mid-step becomes {@link TaskState#CANCELLED} when that step
 *       returns</li>
 *   <li>No step runs after the task is terminal</li>
 * </ul>
 *
 * @param <T> result type
 * @see TaskScope#launch(String, TaskBody)
 */
public final class Task<T> {

    private static final Logger logger = LoggerFactory.getLogger(Task.class);

    // Task whose step is running on the current thread
    private static final ThreadLocal<Task<?>> CURRENT = new ThreadLocal<>();

    private final long id;
    private final String name;
    private final TaskScope scope;
    private final Dispatcher dispatcher;
    private final TaskBody<T> body;
    private final TaskContext context;
    private final CompletableFuture<TaskState> termination = new CompletableFuture<>();

    private final Object lock = new Object();
    private final Set<CompletableFuture<?>> suspensions = new HashSet<>();
    private volatile TaskState state = TaskState.RUNNING;
    private boolean stepping = false;
    private boolean cancelRequested = false;
    private T result;
    private OperationFailureException failure;

    Task(long id, String name, TaskScope scope, Dispatcher dispatcher, TaskBody<T> body) {
        this.id = id;
        this.name = name;
        this.scope = scope;
        this.dispatcher = dispatcher;
        this.body = body;
        this.context = new TaskContext(this);
    }

    public long id() {
        return id;
    }

    public String name() {
        return name;
    }

    public TaskScope scope() {
        return scope;
    }

    public TaskState state() {
        return state;
    }

    /**
     * Checks whether the task is running with no cancellation requested.
     *
     * @return true while the task may run further steps
     */
    public boolean isActive() {
        synchronized (lock) {
            return state == TaskState.RUNNING && !cancelRequested;
        }
    }

    /**
     * Returns the value the body completed with.
     *
     * @return the result, or empty unless the task is {@link TaskState#COMPLETED} with a non-null value
     */
    public Optional<T> result() {
        synchronized (lock) {
            return Optional.ofNullable(result);
        }
    }

    /**
     * Returns the failure that ended the task.
     *
     * @return the failure, or empty unless the task is {@link TaskState#FAILED}
     */
    public Optional<OperationFailureException> failure() {
        synchronized (lock) {
            return Optional.ofNullable(failure);
        }
    }

    /**
     * Returns a future completed with the terminal state once the task finishes.
     *
     * @return a copy of the termination future
     */
    public CompletableFuture<TaskState> termination() {
        return termination.copy();
    }

    /**
     * Blocks until the task reaches a terminal state.
     *
     * <p>A step of a task running on the same dispatcher may only join a task that has
     * already terminated: blocking that step would stall the dispatcher the joined task
     * needs in order to finish.
     *
     * @return the terminal state
     * @throws IllegalStateException if called from one of this task's own steps, or from a
     *                               step on the same dispatcher while this task still runs
     * @throws CancellationException if the calling thread is interrupted while waiting
     */
    public TaskState join() {
        Task<?> caller = CURRENT.get();
        if (caller == this) {
            throw new IllegalStateException("Cannot join task '" + name + "' from within its own step");
        }
        if (caller != null && caller.dispatcher == dispatcher && !termination.isDone()) {
            throw new IllegalStateException(
                "Cannot join running task '" + name + "' from task '" + caller.name + "' on the same dispatcher"
            );
        }
        try {
            return termination.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Interrupted while joining task '" + name + "'");
            cancelled.initCause(e);
            throw cancelled;
        } catch (ExecutionException e) {
            // termination is only ever completed normally
            throw new IllegalStateException("Task '" + name + "' terminated abnormally", e.getCause());
        }
    }

    static Task<?> current() {
        return CURRENT.get();
    }

    Dispatcher dispatcher() {
        return dispatcher;
    }

    void start() {
        try {
            dispatcher.execute(() -> step(this::runBody));
        } catch (RejectedExecutionException e) {
            settle(null, e);
        }
    }

    void cancel() {
        Set<CompletableFuture<?>> abandoned;
        boolean cancelNow;
        synchronized (lock) {
            if (state.isTerminal() || cancelRequested) {
                return;
            }
            cancelRequested = true;
            cancelNow = !stepping;
            if (cancelNow) {
                state = TaskState.CANCELLED;
            }
            abandoned = new HashSet<>(suspensions);
            suspensions.clear();
        }
        logger.debug("Cancelling task '{}' in scope '{}'", name, scope.name());
        abandoned.forEach(pending -> pending.cancel(false));
        if (cancelNow) {
            terminated(TaskState.CANCELLED);
        }
    }

    <V> CompletableFuture<V> await(CompletionStage<V> stage) {
        Objects.requireNonNull(stage, "Stage cannot be null");
        CompletableFuture<V> resumed = new CompletableFuture<>();
        CompletableFuture<?> pending = stage instanceof CompletableFuture ? (CompletableFuture<?>) stage : null;
        synchronized (lock) {
            if (state.isTerminal() || cancelRequested) {
                return resumed;
            }
            if (pending != null) {
                suspensions.add(pending);
            }
        }
        stage.whenComplete((value, error) -> {
            if (state.isTerminal()) {
                return;
            }
            try {
                dispatcher.execute(() -> step(() -> {
                    synchronized (lock) {
                        suspensions.remove(pending);
                    }
                    if (error == null) {
                        resumed.complete(value);
                    } else {
                        resumed.completeExceptionally(unwrap(error));
                    }
                }));
            } catch (RejectedExecutionException e) {
                logger.warn("Dispatcher rejected resumption of task '{}', cancelling it", name, e);
                cancel();
            }
        });
        return resumed;
    }

    private void runBody() {
        CompletionStage<T> outcome;
        try {
            outcome = Objects.requireNonNull(body.run(context), "Task body returned null");
        } catch (Throwable e) {
            settle(null, e);
            return;
        }
        outcome.whenComplete(this::settle);
    }

    private void step(Runnable action) {
        synchronized (lock) {
            if (state.isTerminal()) {
                return;
            }
            stepping = true;
        }
        Task<?> previous = CURRENT.get();
        CURRENT.set(this);
        try {
            action.run();
        } catch (Throwable e) {
            // Errors thrown by a body end the task like any other failure
            settle(null, e);
        } finally {
            if (previous == null) {
                CURRENT.remove();
            } else {
                CURRENT.set(previous);
            }
            boolean cancelNow;
            synchronized (lock) {
                stepping = false;
                cancelNow = cancelRequested && !state.isTerminal();
                if (cancelNow) {
                    state = TaskState.CANCELLED;
                }
            }
            if (cancelNow) {
                terminated(TaskState.CANCELLED);
            }
        }
    }

    private void settle(T value, Throwable error) {
        TaskState outcome;
        synchronized (lock) {
            if (state.isTerminal()) {
                return;
            }
            if (error == null) {
                result = value;
                outcome = TaskState.COMPLETED;
            } else {
                Throwable cause = unwrap(error);
                if (cause instanceof CancellationException && cancelRequested) {
                    outcome = TaskState.CANCELLED;
                } else {
                    failure = cause instanceof OperationFailureException
                        ? (OperationFailureException) cause
                        : new OperationFailureException("Task '" + name + "' failed", cause);
                    outcome = TaskState.FAILED;
                }
            }
            state = outcome;
        }
        if (outcome == TaskState.FAILED) {
            logger.warn("Task '{}' in scope '{}' failed", name, scope.name(), failure.getCause());
        }
        terminated(outcome);
    }

    private void terminated(TaskState outcome) {
        logger.debug("Task '{}' in scope '{}' terminated {}", name, scope.name(), outcome);
        scope.release(this);
        termination.complete(outcome);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    @Override
    public String toString() {
        return "Task[id=" + id + ", name=" + name + ", state=" + state + "]";
    }
}
