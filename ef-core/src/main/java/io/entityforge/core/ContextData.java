package io.entityforge.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of event context metadata (request ids, actors, idempotency keys).
 * Safe to hand to other threads; see {@link EventContext#seed(ContextData)}.
 */
public record ContextData(Map<String, Object> values) {

    /** Key whose value takes part in idempotency checks, see {@link IdempotencyGuard}. */
    public static final String IDEMPOTENCY_KEY = "idempotency_key";

    private static final ContextData EMPTY = new ContextData(Map.of());

    public ContextData {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(values)));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ContextData of(Map<String, Object> values) {
        return values == null || values.isEmpty() ? EMPTY : new ContextData(values);
    }

    public static ContextData empty() {
        return EMPTY;
    }

    @JsonValue
    @Override
    public Map<String, Object> values() {
        return values;
    }

    public ContextData with(String key, Object value) {
        Objects.requireNonNull(key);
        Objects.requireNonNull(value, () -> "context value for " + key);
        var next = new LinkedHashMap<>(values);
        next.put(key, value);
        return new ContextData(next);
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public Optional<String> idempotencyKey() {
        return get(IDEMPOTENCY_KEY).map(String::valueOf);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
