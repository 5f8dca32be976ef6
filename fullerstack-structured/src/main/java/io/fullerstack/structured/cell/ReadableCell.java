package io.fullerstack.structured.cell;

import java.util.Optional;

/**
 * Read-only view of a single-slot value holder.
 *
 * <p>This is what a container hands to its consumers; only the owner keeps the writable
 * {@link ObservableCell}.
 *
 * @param <T> the value type
 */
public interface ReadableCell<T> {

    /**
     * Returns the most recently written value. Never blocks.
     *
     * @return the latest value, or empty if nothing has been written yet
     */
    Optional<T> read();

    /**
     * Returns the cell name.
     *
     * @return the name given at construction
     */
    String name();

    /**
     * Checks whether the cell has ever been written.
     *
     * @return true if no value has been written
     */
    default boolean isEmpty() {
        return read().isEmpty();
    }
}
