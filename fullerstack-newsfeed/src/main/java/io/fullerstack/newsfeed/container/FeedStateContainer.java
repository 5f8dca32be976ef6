package io.fullerstack.newsfeed.container;

import io.fullerstack.newsfeed.model.NewsItem;
import io.fullerstack.newsfeed.repository.NewsRepository;
import io.fullerstack.newsfeed.repository.UserRepository;
import io.fullerstack.structured.cell.ObservableCell;
import io.fullerstack.structured.cell.ReadableCell;
import io.fullerstack.structured.config.HierarchicalConfig;
import io.fullerstack.structured.dispatcher.Dispatcher;
import io.fullerstack.structured.scope.Task;
import io.fullerstack.structured.scope.TaskContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * State behind a news feed screen: the user's name, the news sorted newest first, and
 * whether the news is still loading.
 *
 * <p>{@link #start()} loads the user and the news in two independent tasks. Neither waits
 * for the other, and a failure of one leaves the other's cells updating normally.
 *
 * <p><b>Cells:</b>
 * <ul>
 *   <li>{@code userName} - written once the user fetch succeeds; untouched on failure</li>
 *   <li>{@code newsList} - written with the fetched items sorted by {@code publishedAt}
 *       descending (ties keep fetch order)</li>
 *   <li>{@code progressVisible} - {@code true} while the news fetch is in flight,
 *       {@code false} after it succeeded and, unless
 *       {@code feed.clear-progress-on-failure=false}, after it failed</li>
 * </ul>
 */
public class FeedStateContainer extends StateContainer {

    private static final Logger logger = LoggerFactory.getLogger(FeedStateContainer.class);

    static final String SCOPE_NAME = "feed";
    static final String CLEAR_PROGRESS_ON_FAILURE = "feed.clear-progress-on-failure";

    private final UserRepository users;
    private final NewsRepository news;
    private final boolean clearProgressOnFailure;

    private final ObservableCell<String> userName = new ObservableCell<>("userName");
    private final ObservableCell<List<NewsItem>> newsList = new ObservableCell<>("newsList");
    private final ObservableCell<Boolean> progressVisible = new ObservableCell<>("progressVisible");

    /**
     * Creates a container configured from the {@code feed} scope configuration.
     */
    public FeedStateContainer(UserRepository users, NewsRepository news, Dispatcher dispatcher) {
        this(users, news, dispatcher, HierarchicalConfig.forScope(SCOPE_NAME));
    }

    public FeedStateContainer(UserRepository users, NewsRepository news, Dispatcher dispatcher, HierarchicalConfig config) {
        this(users, news, dispatcher, config.getBoolean(CLEAR_PROGRESS_ON_FAILURE, true));
    }

    /**
     * @param clearProgressOnFailure whether a failed news fetch resets {@code progressVisible}
     */
    public FeedStateContainer(UserRepository users, NewsRepository news, Dispatcher dispatcher, boolean clearProgressOnFailure) {
        super(SCOPE_NAME, dispatcher);
        this.users = Objects.requireNonNull(users, "UserRepository cannot be null");
        this.news = Objects.requireNonNull(news, "NewsRepository cannot be null");
        this.clearProgressOnFailure = clearProgressOnFailure;
    }

    /**
     * Launches the user and news loads.
     *
     * <p>Not guarded against repeated calls: each call launches another pair of tasks
     * writing the same cells.
     *
     * @return the two launched tasks
     * @throws io.fullerstack.structured.scope.ScopeClosedException if the container was stopped
     */
    public StartedTasks start() {
        logger.info("Starting container '{}'", scope().name());
        Task<Void> userTask = scope().launch("load-user", this::loadUser);
        Task<Void> newsTask = scope().launch("load-news", this::loadNews);
        return new StartedTasks(userTask, newsTask);
    }

    public ReadableCell<String> userName() {
        return userName;
    }

    public ReadableCell<List<NewsItem>> newsList() {
        return newsList;
    }

    public ReadableCell<Boolean> progressVisible() {
        return progressVisible;
    }

    private CompletionStage<Void> loadUser(TaskContext context) {
        return context.await(request(users::getUser))
            .thenAccept(user -> userName.write(user.name()));
    }

    private CompletionStage<Void> loadNews(TaskContext context) {
        progressVisible.write(true);
        return context.await(request(news::getNews))
            .thenAccept(items -> {
                newsList.write(newestFirst(items));
                progressVisible.write(false);
            })
            .whenComplete((ignored, error) -> {
                if (error != null && clearProgressOnFailure) {
                    progressVisible.write(false);
                }
            });
    }

    static List<NewsItem> newestFirst(List<NewsItem> items) {
        List<NewsItem> sorted = new ArrayList<>(items);
        // List.sort is stable, so equal timestamps keep their fetch order
        sorted.sort(NewsItem.NEWEST_FIRST);
        return List.copyOf(sorted);
    }

    // A repository that throws instead of returning a failed stage fails the same way
    private static <T> CompletionStage<T> request(Supplier<CompletionStage<T>> request) {
        try {
            return request.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Tasks launched by one {@link #start()} call.
     *
     * @param user task loading {@code userName}
     * @param news task loading {@code newsList} and driving {@code progressVisible}
     */
    public record StartedTasks(Task<Void> user, Task<Void> news) {
    }
}
