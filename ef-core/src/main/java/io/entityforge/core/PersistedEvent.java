package io.entityforge.core;

import java.time.Instant;
import java.util.Objects;

/** An event that is already durable, with its position in the entity's stream. */
public record PersistedEvent<E extends EsEvent>(
        E event,
        int sequence,
        Instant recordedAt,
        ContextData context
) {
    public PersistedEvent {
        Objects.requireNonNull(event);
        Objects.requireNonNull(recordedAt);
        if (sequence < 1) throw new IllegalArgumentException("sequence must be positive: " + sequence);
        if (context == null) context = ContextData.empty();
    }
}
