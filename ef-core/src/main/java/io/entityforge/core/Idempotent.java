package io.entityforge.core;

import java.util.NoSuchElementException;

/**
 * Outcome of an idempotent mutation: either it executed (and pushed its event) or it
 * was skipped because the same effect is already in the history.
 */
public final class Idempotent<T> {

    private final boolean executed;
    private final T value;

    private Idempotent(boolean executed, T value) {
        this.executed = executed;
        this.value = value;
    }

    public static <T> Idempotent<T> executed(T value) {
        return new Idempotent<>(true, value);
    }

    public static Idempotent<Void> executed() {
        return new Idempotent<>(true, null);
    }

    public static <T> Idempotent<T> alreadyApplied() {
        return new Idempotent<>(false, null);
    }

    public boolean didExecute() {
        return executed;
    }

    public boolean wasAlreadyApplied() {
        return !executed;
    }

    public T unwrap() {
        return expect("Idempotent::AlreadyApplied");
    }

    public T expect(String message) {
        if (!executed) throw new NoSuchElementException(message);
        return value;
    }

    @Override
    public String toString() {
        return executed ? "Executed(" + value + ")" : "AlreadyApplied";
    }
}
