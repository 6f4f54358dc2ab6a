package io.entityforge.store.pagination;

import java.util.Objects;
import java.util.UUID;

/**
 * Position of the last row of a page: the sort column, its value on that row
 * and the row's id as tie breaker. {@code value} is in bind form
 * (ids as {@link UUID}, enums as names).
 */
public record EntityCursor(String sortBy, Object value, UUID id) {
    public EntityCursor {
        Objects.requireNonNull(sortBy);
        Objects.requireNonNull(id);
    }
}
