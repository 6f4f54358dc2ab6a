package io.entityforge.store.pagination;

import java.util.List;
import java.util.Optional;

public record PaginatedQueryRet<T>(List<T> entities, boolean hasNextPage, EntityCursor endCursor) {
    public PaginatedQueryRet {
        entities = List.copyOf(entities);
    }

    /** Arguments for the following page, if there is one. */
    public Optional<PaginatedQueryArgs> nextArgs(int first) {
        if (!hasNextPage || endCursor == null) return Optional.empty();
        return Optional.of(PaginatedQueryArgs.first(first).after(endCursor));
    }
}
