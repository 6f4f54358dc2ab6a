package io.entityforge.core;

/** Raised when an event history cannot be replayed into an entity. */
public class EntityHydrationException extends RuntimeException {

    public enum Reason { UNINITIALIZED_FIELD, EMPTY_HISTORY, SEQUENCE_GAP, EVENT_DESERIALIZATION }

    private final Reason reason;

    public EntityHydrationException(Reason reason, String message, Throwable cause) {
        super("EntityHydrationException - " + reason + ": " + message, cause);
        this.reason = reason;
    }

    public static EntityHydrationException uninitializedField(String field) {
        return new EntityHydrationException(Reason.UNINITIALIZED_FIELD, "field '" + field + "' was never set", null);
    }

    public static EntityHydrationException emptyHistory(EntityId id) {
        return new EntityHydrationException(Reason.EMPTY_HISTORY, "no events for " + id, null);
    }

    public static EntityHydrationException sequenceGap(EntityId id, int expected, int actual) {
        return new EntityHydrationException(Reason.SEQUENCE_GAP,
                "entity " + id + " expected sequence " + expected + " but found " + actual, null);
    }

    public static EntityHydrationException deserialization(String eventType, Throwable cause) {
        return new EntityHydrationException(Reason.EVENT_DESERIALIZATION,
                "could not read event '" + eventType + "'", cause);
    }

    public Reason reason() {
        return reason;
    }
}
