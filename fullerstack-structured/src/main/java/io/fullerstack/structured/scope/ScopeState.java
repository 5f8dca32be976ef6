package io.fullerstack.structured.scope;

/**
 * Lifecycle of a {@link TaskScope}: {@code ACTIVE -> CANCELLING -> TERMINATED}.
 */
public enum ScopeState {
    /** Accepting launches. */
    ACTIVE,
    /** Teardown started; children are being cancelled and joined. */
    CANCELLING,
    /** Every child observed terminal. */
    TERMINATED
}
