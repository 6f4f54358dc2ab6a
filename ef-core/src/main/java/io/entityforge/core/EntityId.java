package io.entityforge.core;

import java.util.UUID;

/**
 * Identity of one event-sourced entity.
 *
 * Implementations are single-component records over a {@link UUID}; the value is
 * assigned once, on the entity's first event, and never changes.
 */
public interface EntityId {
    UUID value();
}
