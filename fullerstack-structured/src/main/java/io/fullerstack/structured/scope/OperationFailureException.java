package io.fullerstack.structured.scope;

/**
 * Failure of the work a task was running, recorded as that task's terminal outcome.
 *
 * <p>The original error is available as {@link #getCause()}.
 */
public class OperationFailureException extends RuntimeException {

    public OperationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
