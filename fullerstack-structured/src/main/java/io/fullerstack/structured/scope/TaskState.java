package io.fullerstack.structured.scope;

/**
 * Lifecycle of a {@link Task}.
 *
 * <p>{@code RUNNING} moves to exactly one terminal state and never changes again.
 */
public enum TaskState {
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
