package io.fullerstack.newsfeed.repository;

import io.fullerstack.newsfeed.model.NewsItem;
import io.fullerstack.structured.dispatcher.Dispatcher;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionStage;

/**
 * {@link NewsRepository} that returns a fixed list, in the given order, after a latency.
 */
public class InMemoryNewsRepository extends DelayedRepository<List<NewsItem>> implements NewsRepository {

    private InMemoryNewsRepository(Dispatcher dispatcher, Duration latency, List<NewsItem> news, RuntimeException failure) {
        super(dispatcher, latency, news, failure);
    }

    public static InMemoryNewsRepository returning(List<NewsItem> news, Duration latency, Dispatcher dispatcher) {
        return new InMemoryNewsRepository(dispatcher, latency, List.copyOf(news), null);
    }

    public static InMemoryNewsRepository failing(RuntimeException failure, Duration latency, Dispatcher dispatcher) {
        return new InMemoryNewsRepository(dispatcher, latency, null, Objects.requireNonNull(failure, "failure cannot be null"));
    }

    @Override
    public CompletionStage<List<NewsItem>> getNews() {
        return respond();
    }
}
