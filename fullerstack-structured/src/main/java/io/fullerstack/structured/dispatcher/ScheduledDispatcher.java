package io.fullerstack.structured.dispatcher;

import io.fullerstack.structured.config.HierarchicalConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Production {@link Dispatcher} backed by a single-threaded {@link ScheduledExecutorService}.
 *
 * <p>All submitted work runs on one named daemon thread, in submission order, which makes it
 * behave like a UI main loop: steps of different tasks interleave but never run in parallel.
 *
 * <p>Configuration (see {@link HierarchicalConfig}):
 * <ul>
 *   <li>{@code dispatcher.thread-name-prefix} - prefix of the worker thread name</li>
 *   <li>{@code dispatcher.shutdown-timeout-ms} - how long {@link #close()} waits for queued work</li>
 * </ul>
 */
public class ScheduledDispatcher implements Dispatcher, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ScheduledDispatcher.class);
    private static final AtomicInteger THREAD_IDS = new AtomicInteger(1);

    private final String name;
    private final ScheduledExecutorService scheduler;
    private final long shutdownTimeoutMs;
    private final long startNanos = System.nanoTime();
    private volatile boolean closed = false;

    /**
     * Creates a dispatcher configured from the global configuration.
     */
    public ScheduledDispatcher() {
        this(HierarchicalConfig.global());
    }

    /**
     * Creates a dispatcher configured from the given configuration.
     *
     * @param config source of thread name prefix and shutdown timeout
     */
    public ScheduledDispatcher(HierarchicalConfig config) {
        Objects.requireNonNull(config, "Config cannot be null");
        this.name = config.getString("dispatcher.thread-name-prefix", "dispatcher")
            + "-" + THREAD_IDS.getAndIncrement();
        this.shutdownTimeoutMs = config.getLong("dispatcher.shutdown-timeout-ms", 5000L);
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        });
        // Pending delays belong to tasks that are gone once the dispatcher closes
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor.setRemoveOnCancelPolicy(true);
        this.scheduler = executor;
    }

    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "Task cannot be null");
        checkClosed();
        scheduler.execute(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                logger.error("Error executing task on dispatcher '{}'", name, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> delay(Duration duration) {
        Objects.requireNonNull(duration, "Duration cannot be null");
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Duration cannot be negative: " + duration);
        }
        checkClosed();

        CompletableFuture<Void> future = new CompletableFuture<>();
        ScheduledFuture<?> timer = scheduler.schedule(
            () -> { future.complete(null); },
            duration.toNanos(),
            TimeUnit.NANOSECONDS
        );
        // Cancelling the delay releases the timer
        future.whenComplete((ignored, error) -> {
            if (future.isCancelled()) {
                timer.cancel(false);
            }
        });
        return future;
    }

    @Override
    public long currentTime() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    /**
     * Returns the worker thread name.
     *
     * @return the dispatcher name
     */
    public String name() {
        return name;
    }

    /**
     * Stops accepting work, drops pending delays and waits up to
     * {@code dispatcher.shutdown-timeout-ms} for already queued work to finish.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                logger.warn("Dispatcher '{}' did not drain within {}ms, forcing shutdown", name, shutdownTimeoutMs);
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
        logger.debug("Dispatcher '{}' closed", name);
    }

    private void checkClosed() {
        if (closed) {
            throw new RejectedExecutionException("Dispatcher '" + name + "' is closed");
        }
    }

    @Override
    public String toString() {
        return "ScheduledDispatcher[name=" + name + ", closed=" + closed + "]";
    }
}
