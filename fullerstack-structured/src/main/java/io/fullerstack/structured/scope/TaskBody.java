package io.fullerstack.structured.scope;

import java.util.concurrent.CompletionStage;

/**
 * Work launched in a {@link TaskScope}.
 *
 * <p>The body runs on the scope's dispatcher. It suspends only through
 * {@link TaskContext#await(CompletionStage)}; code chained on an awaited stage runs as the
 * next step of the same task. The returned stage decides the task's outcome: normal
 * completion ends it {@link TaskState#COMPLETED}, exceptional completion (or a thrown
 * exception) ends it {@link TaskState#FAILED}.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface TaskBody<T> {

    CompletionStage<T> run(TaskContext context) throws Exception;
}
