package io.fullerstack.newsfeed.container;

import io.fullerstack.structured.dispatcher.Dispatcher;
import io.fullerstack.structured.scope.TaskScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Base class for components that publish state produced by background tasks.
 *
 * <p>A container owns exactly one {@link TaskScope}. Subclasses launch their work in it and
 * write the results into cells they own; {@link #stop()} cancels and joins everything the
 * scope still runs, after which no subclass code runs again.
 */
public abstract class StateContainer implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(StateContainer.class);

    private final TaskScope scope;

    /**
     * @param name       container name, also used as the scope name
     * @param dispatcher execution context for the container's tasks
     */
    protected StateContainer(String name, Dispatcher dispatcher) {
        Objects.requireNonNull(name, "Container name cannot be null");
        Objects.requireNonNull(dispatcher, "Dispatcher cannot be null");
        this.scope = new TaskScope(name, dispatcher);
    }

    /**
     * Returns the scope the container's tasks run in.
     *
     * @return the owned scope
     */
    public TaskScope scope() {
        return scope;
    }

    /**
     * Cancels all running tasks and waits for them to finish.
     *
     * <p>Idempotent. Once it returns, none of the container's cells changes anymore.
     */
    public void stop() {
        logger.info("Stopping container '{}'", scope.name());
        scope.cancelAndJoin();
    }

    @Override
    public void close() {
        stop();
    }
}
