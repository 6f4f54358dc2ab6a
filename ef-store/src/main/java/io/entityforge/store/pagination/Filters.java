package io.entityforge.store.pagination;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Optional equality filters for list queries. A column given a {@code null} value takes
 * part in the query but matches every row.
 */
public final class Filters {

    private static final Filters NONE = new Filters(Map.of());

    private final Map<String, Object> values;

    private Filters(Map<String, Object> values) {
        this.values = values;
    }

    public static Filters none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Every column named, including those without a value. */
    public Map<String, Object> all() {
        return values;
    }

    /** Only the columns that actually restrict the result. */
    public Map<String, Object> active() {
        var active = new LinkedHashMap<String, Object>();
        values.forEach((k, v) -> {
            if (v != null) active.put(k, v);
        });
        return active;
    }

    public int activeCount() {
        return (int) values.values().stream().filter(Objects::nonNull).count();
    }

    @Override
    public String toString() {
        return "Filters" + values;
    }

    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {}

        public Builder eq(String column, Object value) {
            values.put(Objects.requireNonNull(column), value);
            return this;
        }

        public Filters build() {
            return values.isEmpty() ? NONE : new Filters(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }
}
