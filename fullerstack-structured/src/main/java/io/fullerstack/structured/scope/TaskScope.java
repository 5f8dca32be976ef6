package io.fullerstack.structured.scope;

import io.fullerstack.structured.dispatcher.Dispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owner of a group of concurrently running {@link Task}s.
 *
 * <p><b>Supervisory policy:</b> a child that fails ends only itself. Siblings keep running
 * and the failure is never rethrown to the code that launched the child; it is recorded on
 * the task ({@link Task#failure()}) and logged.
 *
 * <p><b>Teardown:</b> {@link #cancelAndJoin()} cancels every child still running and blocks
 * until all of them are terminal. After it returns no code of any child runs again, and the
 * scope refuses new launches with {@link ScopeClosedException}.
 *
 * <p><b>Usage:</b>
 * <pre>
 * TaskScope scope = new TaskScope("feed", dispatcher);
 * scope.launch("load-user", context -&gt; context.await(users.getUser())
 *     .thenAccept(user -&gt; userName.write(user.name())));
 * ...
 * scope.cancelAndJoin();
 * </pre>
 *
 * <p>Children are kept in launch order and joined in that order. A child is dropped from
 * the scope as soon as it terminates.
 */
public class TaskScope {

    private static final Logger logger = LoggerFactory.getLogger(TaskScope.class);

    private final String name;
    private final Dispatcher dispatcher;
    private final AtomicLong taskIds = new AtomicLong();

    // Guarded by this
    private final Map<Long, Task<?>> children = new LinkedHashMap<>();
    private volatile ScopeState state = ScopeState.ACTIVE;

    /**
     * Creates an active scope whose tasks run on {@code dispatcher}.
     *
     * @param name       scope name
     * @param dispatcher execution context for every task step
     */
    public TaskScope(String name, Dispatcher dispatcher) {
        this.name = Objects.requireNonNull(name, "Scope name cannot be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "Dispatcher cannot be null");
    }

    /**
     * Launches a task with a generated name.
     *
     * @see #launch(String, TaskBody)
     */
    public <T> Task<T> launch(TaskBody<T> body) {
        return launch(null, body);
    }

    /**
     * Launches {@code body} as a new child task and returns without waiting for it.
     *
     * @param taskName name used in logs; {@code task-<id>} when null
     * @param body     the work to run
     * @param <T>      result type
     * @return the running task
     * @throws ScopeClosedException if teardown has begun
     */
    public <T> Task<T> launch(String taskName, TaskBody<T> body) {
        Objects.requireNonNull(body, "Task body cannot be null");
        Task<T> task;
        synchronized (this) {
            if (state != ScopeState.ACTIVE) {
                throw new ScopeClosedException("Scope '" + name + "' is closed");
            }
            long id = taskIds.incrementAndGet();
            task = new Task<>(id, taskName != null ? taskName : "task-" + id, this, dispatcher, body);
            children.put(id, task);
        }
        logger.debug("Launching task '{}' in scope '{}'", task.name(), name);
        task.start();
        return task;
    }

    /**
     * Cancels every running child and waits until all of them are terminal.
     *
     * <p>Idempotent and callable from any thread except a step of one of this scope's own
     * tasks, which would wait on itself.
     *
     * @throws IllegalStateException if called from within a task of this scope
     * @throws java.util.concurrent.CancellationException if interrupted while joining
     */
    public void cancelAndJoin() {
        Task<?> caller = Task.current();
        if (caller != null && caller.scope() == this) {
            throw new IllegalStateException(
                "Cannot call cancelAndJoin from within task '" + caller.name() + "' of scope '" + name + "'"
            );
        }

        List<Task<?>> snapshot;
        synchronized (this) {
            if (state == ScopeState.ACTIVE) {
                state = ScopeState.CANCELLING;
                logger.debug("Scope '{}' cancelling {} task(s)", name, children.size());
            }
            snapshot = new ArrayList<>(children.values());
        }

        snapshot.forEach(Task::cancel);
        snapshot.forEach(Task::join);

        synchronized (this) {
            if (state != ScopeState.TERMINATED) {
                state = ScopeState.TERMINATED;
                logger.debug("Scope '{}' terminated", name);
            }
        }
    }

    /**
     * Returns the children that have not terminated yet, in launch order.
     *
     * @return snapshot of live tasks
     */
    public synchronized List<Task<?>> children() {
        return new ArrayList<>(children.values());
    }

    public ScopeState state() {
        return state;
    }

    public String name() {
        return name;
    }

    public Dispatcher dispatcher() {
        return dispatcher;
    }

    synchronized void release(Task<?> task) {
        children.remove(task.id());
    }

    @Override
    public String toString() {
        return "TaskScope[name=" + name + ", state=" + state + "]";
    }
}
