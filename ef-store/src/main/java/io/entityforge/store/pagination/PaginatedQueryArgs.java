package io.entityforge.store.pagination;

import java.util.Optional;

/** Page request: at most {@code first} entities strictly after {@code after}. */
public record PaginatedQueryArgs(int first, EntityCursor after) {
    public PaginatedQueryArgs {
        if (first < 1) throw new IllegalArgumentException("first must be positive: " + first);
    }

    public static PaginatedQueryArgs first(int first) {
        return new PaginatedQueryArgs(first, null);
    }

    public PaginatedQueryArgs after(EntityCursor cursor) {
        return new PaginatedQueryArgs(first, cursor);
    }

    public Optional<EntityCursor> cursor() {
        return Optional.ofNullable(after);
    }
}
