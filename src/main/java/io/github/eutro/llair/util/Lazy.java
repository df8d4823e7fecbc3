package io.github.eutro.llair.util;

import java.util.function.Supplier;

/**
 * A value computed on first access, then remembered.
 * <p>
 * Not thread-safe: a lazy value is forced by whoever owns it.
 *
 * @param <T> The type of the value.
 */
public class Lazy<T> implements Supplier<T> {
    private Supplier<T> thunk;
    private T value;

    public Lazy(Supplier<T> thunk) {
        this.thunk = thunk;
    }

    public static <T> Lazy<T> lazy(Supplier<T> thunk) {
        return new Lazy<>(thunk);
    }

    /**
     * Create a lazy value that is already forced.
     *
     * @param value The value.
     * @param <T>   The type of the value.
     * @return The lazy value.
     */
    public static <T> Lazy<T> of(T value) {
        Lazy<T> lazy = new Lazy<>(null);
        lazy.value = value;
        return lazy;
    }

    @Override
    public T get() {
        if (thunk != null) {
            value = thunk.get();
            thunk = null;
        }
        return value;
    }

    public boolean isForced() {
        return thunk == null;
    }

    // for filling in a placeholder
    public void set(T value) {
        this.thunk = null;
        this.value = value;
    }

    @Override
    public String toString() {
        return isForced() ? String.valueOf(value) : "<lazy>";
    }
}
