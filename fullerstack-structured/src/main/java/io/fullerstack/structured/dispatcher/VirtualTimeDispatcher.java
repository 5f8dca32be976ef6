package io.fullerstack.structured.dispatcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link Dispatcher} driven by a logical clock.
 *
 * <p>Nothing runs until the owner advances the clock, so tests can assert exact elapsed
 * times and interleavings without real delays. Events are ordered by due time and, for
 * equal due times, by submission order.
 *
 * <p><b>Flavours:</b>
 * <ul>
 *   <li>{@link #standard()} - {@link #execute(Runnable)} only queues; work runs on the next
 *       {@link #runCurrent()}, {@link #advanceTimeBy(Duration)} or {@link #advanceUntilIdle()}</li>
 *   <li>{@link #eager()} - work submitted from outside a drain runs immediately on the
 *       submitting thread, together with everything it schedules for the current instant</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>
 * VirtualTimeDispatcher dispatcher = VirtualTimeDispatcher.standard();
 * dispatcher.delay(Duration.ofMillis(300)).thenRun(() -&gt; done.set(true));
 * dispatcher.advanceUntilIdle();
 * dispatcher.currentTime(); // 300
 * </pre>
 *
 * <p>Events are drained on whichever thread calls an advance method. Submission is
 * thread-safe; draining from two threads at once is not supported.
 */
public class VirtualTimeDispatcher implements Dispatcher {

    private static final Logger logger = LoggerFactory.getLogger(VirtualTimeDispatcher.class);

    private final boolean eager;
    private final PriorityQueue<Event> events = new PriorityQueue<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Object lock = new Object();

    private long currentTime = 0L;
    private boolean draining = false;

    private VirtualTimeDispatcher(boolean eager) {
        this.eager = eager;
    }

    /**
     * Creates a dispatcher that queues all work until the clock is advanced.
     *
     * @return a new standard dispatcher at time 0
     */
    public static VirtualTimeDispatcher standard() {
        return new VirtualTimeDispatcher(false);
    }

    /**
     * Creates a dispatcher that starts submitted work immediately.
     *
     * @return a new eager dispatcher at time 0
     */
    public static VirtualTimeDispatcher eager() {
        return new VirtualTimeDispatcher(true);
    }

    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "Task cannot be null");
        boolean runNow;
        synchronized (lock) {
            enqueue(currentTime, task);
            runNow = eager && !draining;
        }
        if (runNow) {
            runCurrent();
        }
    }

    @Override
    public CompletableFuture<Void> delay(Duration duration) {
        Objects.requireNonNull(duration, "Duration cannot be null");
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Duration cannot be negative: " + duration);
        }

        CompletableFuture<Void> future = new CompletableFuture<>();
        Event timer;
        synchronized (lock) {
            timer = enqueue(currentTime + duration.toMillis(), () -> future.complete(null));
        }
        // An abandoned delay must not hold the clock back from going idle
        future.whenComplete((ignored, error) -> {
            if (future.isCancelled()) {
                synchronized (lock) {
                    events.remove(timer);
                }
            }
        });
        return future;
    }

    @Override
    public long currentTime() {
        synchronized (lock) {
            return currentTime;
        }
    }

    /**
     * Runs every event due at the current time, including events those events schedule
     * for the same instant. The clock does not move.
     */
    public void runCurrent() {
        drain(currentTime());
    }

    /**
     * Runs every event due at or before {@code now + duration} in due-time order and
     * leaves the clock at {@code now + duration}.
     *
     * @param duration non-negative amount of logical time to advance
     */
    public void advanceTimeBy(Duration duration) {
        Objects.requireNonNull(duration, "Duration cannot be null");
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Duration cannot be negative: " + duration);
        }
        long target;
        synchronized (lock) {
            target = currentTime + duration.toMillis();
        }
        drain(target);
        synchronized (lock) {
            currentTime = Math.max(currentTime, target);
        }
    }

    /**
     * Runs events until none are left, moving the clock to each event's due time.
     */
    public void advanceUntilIdle() {
        drain(Long.MAX_VALUE);
    }

    /**
     * Checks whether any event is still pending.
     *
     * @return true if no events are queued
     */
    public boolean isIdle() {
        synchronized (lock) {
            return events.isEmpty();
        }
    }

    private void drain(long until) {
        synchronized (lock) {
            if (draining) {
                throw new IllegalStateException("Cannot advance a VirtualTimeDispatcher from one of its own events");
            }
            draining = true;
        }
        try {
            while (true) {
                Event next;
                synchronized (lock) {
                    next = events.peek();
                    if (next == null || next.dueTime > until) {
                        return;
                    }
                    events.poll();
                    currentTime = Math.max(currentTime, next.dueTime);
                }
                try {
                    next.task.run();
                } catch (RuntimeException e) {
                    logger.error("Error executing event due at {}ms", next.dueTime, e);
                }
            }
        } finally {
            synchronized (lock) {
                draining = false;
            }
        }
    }

    private Event enqueue(long dueTime, Runnable task) {
        Event event = new Event(dueTime, sequence.getAndIncrement(), task);
        events.add(event);
        return event;
    }

    @Override
    public String toString() {
        synchronized (lock) {
            return "VirtualTimeDispatcher[time=" + currentTime + ", pending=" + events.size() + ", eager=" + eager + "]";
        }
    }

    private static final class Event implements Comparable<Event> {
        final long dueTime;
        final long sequence;
        final Runnable task;

        Event(long dueTime, long sequence, Runnable task) {
            this.dueTime = dueTime;
            this.sequence = sequence;
            this.task = task;
        }

        @Override
        public int compareTo(Event other) {
            int byTime = Long.compare(dueTime, other.dueTime);
            return byTime != 0 ? byTime : Long.compare(sequence, other.sequence);
        }
    }
}
