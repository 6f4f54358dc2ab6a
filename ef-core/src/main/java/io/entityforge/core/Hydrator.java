package io.entityforge.core;

/**
 * Rebuilds an entity from its complete, sequence-ordered event stream.
 *
 * Must be a pure function of the events: equal histories give equal entities.
 * Implementations usually {@link EntityEvents#fold fold} the events into a state
 * object and finish with {@link Hydration#require} checks.
 *
 * @throws EntityHydrationException when the history cannot produce a valid entity
 */
@FunctionalInterface
public interface Hydrator<ID extends EntityId, E extends EsEvent, T extends EsEntity<ID, E>> {
    T hydrate(EntityEvents<ID, E> events);
}
