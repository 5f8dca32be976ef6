package io.fullerstack.structured.dispatcher;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Execution context that task steps and cell writes run on.
 * <p>
 * Components receive a Dispatcher instead of reaching for a process-wide default, so a
 * container can be driven by a real thread in production and by a logical clock in tests.
 *
 * @see ScheduledDispatcher
 * @see VirtualTimeDispatcher
 */
public interface Dispatcher extends Executor {

    /**
     * Schedules a runnable to execute on this dispatcher.
     *
     * @param task the task to schedule
     */
    @Override
    void execute(Runnable task);

    /**
     * Returns a future that completes after {@code duration} has elapsed on this
     * dispatcher's clock.
     * <p>
     * Cancelling the returned future releases the pending timer.
     *
     * @param duration non-negative delay
     * @return future completed with {@code null} once the delay elapses
     */
    CompletableFuture<Void> delay(Duration duration);

    /**
     * Current time of this dispatcher's clock in milliseconds.
     *
     * @return clock reading in milliseconds
     */
    long currentTime();
}
