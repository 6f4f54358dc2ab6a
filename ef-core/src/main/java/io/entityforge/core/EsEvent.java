package io.entityforge.core;

/**
 * Marker for event types.
 *
 * Each entity type declares one sealed interface extending this, annotated with
 * {@code @JsonTypeInfo(use = NAME, property = "type")}; the type name becomes the
 * {@code event_type} column.
 */
public interface EsEvent {
}
