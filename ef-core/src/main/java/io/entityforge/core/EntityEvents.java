package io.entityforge.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.stream.Stream;

/**
 * Ordered event stream of one entity: durable events followed by pending ones.
 *
 * Pending events get sequence numbers only when they are persisted, always
 * continuing contiguously after the last persisted sequence.
 */
public final class EntityEvents<ID extends EntityId, E extends EsEvent> {

    private final ID entityId;
    private final List<PersistedEvent<E>> persisted;
    private final List<PendingEvent<E>> pending = new ArrayList<>();

    private EntityEvents(ID entityId, List<PersistedEvent<E>> persisted) {
        this.entityId = Objects.requireNonNull(entityId);
        this.persisted = persisted;
    }

    /** Stream for a new entity; every initial event is pending. */
    public static <ID extends EntityId, E extends EsEvent> EntityEvents<ID, E> init(ID id, Iterable<? extends E> initial) {
        var events = new EntityEvents<ID, E>(id, new ArrayList<>());
        initial.forEach(events::push);
        return events;
    }

    /**
     * Stream rebuilt from storage. Sequences must run 1..n without gaps.
     *
     * @throws EntityHydrationException on a gap or an empty history
     */
    public static <ID extends EntityId, E extends EsEvent> EntityEvents<ID, E> loadPersisted(
            ID id, List<PersistedEvent<E>> persisted) {
        if (persisted.isEmpty()) throw EntityHydrationException.emptyHistory(id);
        for (int i = 0; i < persisted.size(); i++) {
            int actual = persisted.get(i).sequence();
            if (actual != i + 1) throw EntityHydrationException.sequenceGap(id, i + 1, actual);
        }
        return new EntityEvents<>(id, new ArrayList<>(persisted));
    }

    public ID entityId() {
        return entityId;
    }

    /** Appends an event in memory, capturing the current {@link EventContext}. */
    public void push(E event) {
        pending.add(new PendingEvent<>(event, EventContext.current()));
    }

    public boolean anyNew() {
        return !pending.isEmpty();
    }

    public boolean isEmpty() {
        return persisted.isEmpty() && pending.isEmpty();
    }

    public int lenPersisted() {
        return persisted.size();
    }

    public int len() {
        return persisted.size() + pending.size();
    }

    /** Sequence the first pending event will be written at. */
    public int nextSequence() {
        return persisted.size() + 1;
    }

    public List<PersistedEvent<E>> persisted() {
        return Collections.unmodifiableList(persisted);
    }

    public List<PendingEvent<E>> pending() {
        return Collections.unmodifiableList(pending);
    }

    /** All events, oldest first. */
    public Stream<E> stream() {
        return Stream.concat(persisted.stream().map(PersistedEvent::event), pending.stream().map(PendingEvent::event));
    }

    public List<E> all() {
        return stream().toList();
    }

    public <S> S fold(S initial, BiFunction<S, ? super E, S> step) {
        S state = initial;
        for (var event : all()) {
            state = step.apply(state, event);
        }
        return state;
    }

    /** Guard over every loaded event, newest first. */
    public IdempotencyGuard<E> guard() {
        var entries = new ArrayList<IdempotencyGuard.Entry<E>>(len());
        for (int i = pending.size() - 1; i >= 0; i--) {
            var p = pending.get(i);
            entries.add(new IdempotencyGuard.Entry<>(p.event(), p.context(), false));
        }
        for (int i = persisted.size() - 1; i >= 0; i--) {
            var p = persisted.get(i);
            entries.add(new IdempotencyGuard.Entry<>(p.event(), p.context(), true));
        }
        return new IdempotencyGuard<>(entries);
    }

    /**
     * Moves all pending events to the persisted list at the next sequences.
     *
     * @return the newly persisted events
     */
    public List<PersistedEvent<E>> markNewEventsPersistedAt(Instant recordedAt) {
        var marked = new ArrayList<PersistedEvent<E>>(pending.size());
        int sequence = nextSequence();
        for (var p : pending) {
            marked.add(new PersistedEvent<>(p.event(), sequence++, recordedAt, p.context()));
        }
        persisted.addAll(marked);
        pending.clear();
        return marked;
    }

    /** The last {@code n} persisted events, oldest first. */
    public List<PersistedEvent<E>> lastPersisted(int n) {
        int from = Math.max(0, persisted.size() - n);
        return Collections.unmodifiableList(persisted.subList(from, persisted.size()));
    }

    public Optional<Instant> entityFirstPersistedAt() {
        return persisted.isEmpty() ? Optional.empty() : Optional.of(persisted.get(0).recordedAt());
    }

    public Optional<Instant> entityLastModifiedAt() {
        return persisted.isEmpty() ? Optional.empty() : Optional.of(persisted.get(persisted.size() - 1).recordedAt());
    }

    @Override
    public String toString() {
        return "EntityEvents{" + entityId + ", persisted=" + persisted.size() + ", pending=" + pending.size() + "}";
    }
}
