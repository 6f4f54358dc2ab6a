package io.entityforge.store;

import io.entityforge.core.EntityId;
import io.entityforge.core.EsEntity;
import io.entityforge.core.EsEvent;
import io.entityforge.core.IntoEvents;

import java.util.Objects;
import java.util.function.Function;

/**
 * Declares a child collection of an aggregate root.
 *
 * @param name       label used in {@link NestedEntityException}
 * @param accessor   the root's container for this collection
 * @param repository repository of the children; its schema must have a parent column
 */
public record NestedCollection<P, CID extends EntityId, CE extends EsEvent, C extends EsEntity<CID, CE>, CN extends IntoEvents<CID, CE>>(
        String name,
        Function<? super P, Nested<CID, C, CN>> accessor,
        EsRepository<CID, CE, C, CN> repository
) {
    public NestedCollection {
        Objects.requireNonNull(name);
        Objects.requireNonNull(accessor);
        if (repository.schema().parentColumn().isEmpty()) {
            throw new IllegalArgumentException("repository for '" + name + "' has no parent column");
        }
    }
}
