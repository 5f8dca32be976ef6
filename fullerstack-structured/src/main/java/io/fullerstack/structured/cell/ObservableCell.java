package io.fullerstack.structured.cell;

import java.util.Objects;
import java.util.Optional;

/**
 * Single-slot holder of the latest value of one piece of state.
 *
 * <p><b>Single-writer discipline:</b> exactly one producer writes a cell. The slot is
 * volatile, so a write happens-before every later {@link #read()} on any thread, and a
 * reader never observes a partially written value.
 *
 * <p>Cells keep no history and notify nobody; consumers poll {@link #read()}.
 *
 * @param <T> the value type
 */
public class ObservableCell<T> implements ReadableCell<T> {
    private final String name;
    private volatile T value;

    /**
     * Creates an empty cell.
     *
     * @param name cell name (used for logging)
     */
    public ObservableCell(String name) {
        this.name = Objects.requireNonNull(name, "Cell name cannot be null");
    }

    @Override
    public Optional<T> read() {
        return Optional.ofNullable(value);
    }

    /**
     * Replaces the current value.
     *
     * @param value the new value
     * @throws NullPointerException if value is null
     */
    public void write(T value) {
        this.value = Objects.requireNonNull(value, "Cell value cannot be null");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return "ObservableCell[name=" + name + ", value=" + value + "]";
    }
}
