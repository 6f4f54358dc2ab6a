package io.entityforge.core;

import java.util.Objects;

/** An event appended in memory, together with the context that was active when it was pushed. */
public record PendingEvent<E extends EsEvent>(E event, ContextData context) {
    public PendingEvent {
        Objects.requireNonNull(event);
        if (context == null) context = ContextData.empty();
    }
}
