package io.fullerstack.structured.scope;

/**
 * Thrown by {@link TaskScope#launch} once the scope has begun teardown.
 */
public class ScopeClosedException extends IllegalStateException {

    public ScopeClosedException(String message) {
        super(message);
    }
}
