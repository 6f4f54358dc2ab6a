package io.entityforge.core;

/** Validation helpers for {@link Hydrator} implementations. */
public final class Hydration {

    private Hydration() {}

    public static <T> T require(T value, String field) {
        if (value == null) throw EntityHydrationException.uninitializedField(field);
        return value;
    }

    public static void requireNotEmpty(EntityEvents<?, ?> events) {
        if (events.isEmpty()) throw EntityHydrationException.emptyHistory(events.entityId());
    }
}
