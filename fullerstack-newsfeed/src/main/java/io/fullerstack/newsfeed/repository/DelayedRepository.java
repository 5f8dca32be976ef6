package io.fullerstack.newsfeed.repository;

import io.fullerstack.structured.dispatcher.Dispatcher;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Base for in-memory repositories that answer after a fixed latency on a {@link Dispatcher}.
 *
 * <p>Cancelling a returned future cancels its pending delay, so an abandoned request does
 * not keep a timer alive.
 */
abstract class DelayedRepository<T> {
    private final Dispatcher dispatcher;
    private final Duration latency;
    private final T response;
    private final RuntimeException failure;
    private final AtomicInteger calls = new AtomicInteger();

    DelayedRepository(Dispatcher dispatcher, Duration latency, T response, RuntimeException failure) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "Dispatcher cannot be null");
        this.latency = Objects.requireNonNull(latency, "Latency cannot be null");
        this.response = response;
        this.failure = failure;
    }

    /**
     * Number of requests made so far.
     *
     * @return request count
     */
    public int calls() {
        return calls.get();
    }

    public Duration latency() {
        return latency;
    }

    CompletableFuture<T> respond() {
        calls.incrementAndGet();
        CompletableFuture<Void> delay = dispatcher.delay(latency);
        CompletableFuture<T> answer = delay.thenApply(ignored -> {
            if (failure != null) {
                throw failure;
            }
            return response;
        });
        answer.whenComplete((value, error) -> {
            if (answer.isCancelled()) {
                delay.cancel(false);
            }
        });
        return answer;
    }
}
