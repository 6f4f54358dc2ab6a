package io.entityforge.core;

/**
 * An entity reconstructed from its event stream.
 * State changes happen only by pushing events onto {@link #events()}.
 */
public interface EsEntity<ID extends EntityId, E extends EsEvent> {

    EntityEvents<ID, E> events();

    default ID id() {
        return events().entityId();
    }
}
