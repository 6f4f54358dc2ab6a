package io.entityforge.core;

/** A not-yet-persisted entity that knows its initial events. */
public interface IntoEvents<ID extends EntityId, E extends EsEvent> {

    ID id();

    EntityEvents<ID, E> intoEvents();
}
