package io.entityforge.store.fixtures;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.entityforge.core.EntityId;

import java.util.UUID;

public record OrderItemId(UUID value) implements EntityId {

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static OrderItemId of(UUID value) {
        return new OrderItemId(value);
    }

    public static OrderItemId random() {
        return new OrderItemId(UUID.randomUUID());
    }

    @JsonValue
    @Override
    public UUID value() {
        return value;
    }
}
