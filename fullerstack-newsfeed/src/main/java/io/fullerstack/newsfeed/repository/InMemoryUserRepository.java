package io.fullerstack.newsfeed.repository;

import io.fullerstack.newsfeed.model.UserData;
import io.fullerstack.structured.dispatcher.Dispatcher;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletionStage;

/**
 * {@link UserRepository} that returns a fixed user, or a fixed failure, after a latency.
 */
public class InMemoryUserRepository extends DelayedRepository<UserData> implements UserRepository {

    private InMemoryUserRepository(Dispatcher dispatcher, Duration latency, UserData user, RuntimeException failure) {
        super(dispatcher, latency, user, failure);
    }

    public static InMemoryUserRepository returning(String name, Duration latency, Dispatcher dispatcher) {
        return new InMemoryUserRepository(dispatcher, latency, new UserData(name), null);
    }

    public static InMemoryUserRepository failing(RuntimeException failure, Duration latency, Dispatcher dispatcher) {
        return new InMemoryUserRepository(dispatcher, latency, null, Objects.requireNonNull(failure, "failure cannot be null"));
    }

    @Override
    public CompletionStage<UserData> getUser() {
        return respond();
    }
}
