package io.entityforge.core;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * History scan used by mutation methods before they push an event.
 *
 * <pre>{@code
 * if (events.guard()
 *         .ignoreIf(e -> e instanceof NameUpdated n && n.name().equals(name))
 *         .until(e -> e instanceof NameUpdated)
 *         .alreadyApplied()) {
 *     return Idempotent.alreadyApplied();
 * }
 * }</pre>
 *
 * Events are visited newest first. An idempotency key found in the current
 * {@link EventContext} is matched against the context of every persisted event regardless
 * of the boundary; pending events of the same request never match it. Otherwise the first event matching {@code ignoreIf} marks the call as
 * already applied, unless an event matching {@code until} is reached first. Nothing
 * here touches the database.
 */
public final class IdempotencyGuard<E extends EsEvent> {

    /** One visited event, the context it was recorded with and whether it is already stored. */
    public record Entry<E>(E event, ContextData context, boolean persisted) {}

    private final List<Entry<E>> newestFirst;
    private Predicate<? super E> duplicate = e -> false;
    private Predicate<? super E> boundary;
    private String idempotencyKey;
    private boolean explicitKey;

    IdempotencyGuard(List<Entry<E>> newestFirst) {
        this.newestFirst = newestFirst;
    }

    /** Events that mean this mutation already happened. */
    public IdempotencyGuard<E> ignoreIf(Predicate<? super E> duplicate) {
        this.duplicate = Objects.requireNonNull(duplicate);
        return this;
    }

    /** Stop scanning at the latest prior application of this kind of mutation. */
    public IdempotencyGuard<E> until(Predicate<? super E> boundary) {
        this.boundary = Objects.requireNonNull(boundary);
        return this;
    }

    /** Uses {@code key} instead of the key carried by the current event context. */
    public IdempotencyGuard<E> idempotencyKey(String key) {
        this.idempotencyKey = key;
        this.explicitKey = true;
        return this;
    }

    public boolean alreadyApplied() {
        var key = explicitKey ? Optional.ofNullable(idempotencyKey) : EventContext.current().idempotencyKey();
        if (key.isPresent()) {
            for (var entry : newestFirst) {
                if (entry.persisted() && entry.context().idempotencyKey().filter(key.get()::equals).isPresent()) {
                    return true;
                }
            }
        }
        for (var entry : newestFirst) {
            if (duplicate.test(entry.event())) return true;
            if (boundary != null && boundary.test(entry.event())) return false;
        }
        return false;
    }

    public boolean shouldExecute() {
        return !alreadyApplied();
    }
}
