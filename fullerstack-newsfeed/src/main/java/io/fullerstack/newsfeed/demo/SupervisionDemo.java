package io.fullerstack.newsfeed.demo;

import io.fullerstack.structured.dispatcher.Dispatcher;
import io.fullerstack.structured.dispatcher.ScheduledDispatcher;
import io.fullerstack.structured.scope.Task;
import io.fullerstack.structured.scope.TaskScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Demo of supervisory cancellation: one child of a scope fails, its sibling is unaffected.
 * <p>
 * This demonstrates:
 * - A child failing after 500ms ends only itself
 * - A sibling finishing after 4000ms still completes and prints "A"
 * - The failure is recorded on the failed task, not thrown at the launcher
 * </p>
 */
public class SupervisionDemo {
    private static final Logger logger = LoggerFactory.getLogger(SupervisionDemo.class);

    static final Duration FAILURE_AFTER = Duration.ofMillis(500);
    static final Duration SURVIVOR_AFTER = Duration.ofMillis(4000);

    private final TaskScope scope;
    private final Consumer<String> out;

    public SupervisionDemo(Dispatcher dispatcher, Consumer<String> out) {
        this.scope = new TaskScope("supervision-demo", dispatcher);
        this.out = Objects.requireNonNull(out, "Output cannot be null");
    }

    /**
     * Launches the failing child and its surviving sibling.
     *
     * @return both tasks
     */
    public Launched launch() {
        Task<Void> failing = scope.launch("failing", context -> context.delay(FAILURE_AFTER)
            .thenRun(() -> {
                throw new IllegalStateException("child failed on purpose");
            }));
        Task<Void> survivor = scope.launch("survivor", context -> context.delay(SURVIVOR_AFTER)
            .thenRun(() -> out.accept("A")));
        return new Launched(failing, survivor);
    }

    public TaskScope scope() {
        return scope;
    }

    public static void main(String[] args) {
        logger.info("Starting supervision demo");
        try (ScheduledDispatcher dispatcher = new ScheduledDispatcher()) {
            SupervisionDemo demo = new SupervisionDemo(dispatcher, System.out::println);
            Launched launched = demo.launch();

            launched.survivor().join();

            logger.info("failing child: {}, survivor: {}", launched.failing().join(), launched.survivor().state());
            demo.scope().cancelAndJoin();
        }
    }

    /**
     * @param failing  child that fails after {@link #FAILURE_AFTER}
     * @param survivor sibling that completes after {@link #SURVIVOR_AFTER}
     */
    public record Launched(Task<Void> failing, Task<Void> survivor) {
    }
}
