package io.entityforge.store;

import io.entityforge.core.EntityId;
import io.entityforge.core.EsEntity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Children owned by an aggregate root: the loaded ones by id plus new ones waiting for
 * the root's next update. Children keep only their parent's id, never a reference.
 */
public final class Nested<ID extends EntityId, T extends EsEntity<ID, ?>, N> {

    private final Map<ID, T> persisted = new LinkedHashMap<>();
    private final List<N> newEntities = new ArrayList<>();

    public void addNew(N newEntity) {
        newEntities.add(newEntity);
    }

    public int lenNew() {
        return newEntities.size();
    }

    public List<N> newEntities() {
        return Collections.unmodifiableList(newEntities);
    }

    public Optional<N> findNew(Predicate<? super N> filter) {
        return newEntities.stream().filter(filter).findFirst();
    }

    public Optional<T> getPersisted(ID id) {
        return Optional.ofNullable(persisted.get(id));
    }

    public Optional<T> findPersisted(Predicate<? super T> filter) {
        return persisted.values().stream().filter(filter).findFirst();
    }

    public Collection<T> iterPersisted() {
        return Collections.unmodifiableCollection(persisted.values());
    }

    public int lenPersisted() {
        return persisted.size();
    }

    void load(Collection<? extends T> children) {
        persisted.clear();
        children.forEach(c -> persisted.put(c.id(), c));
    }

    void addPersisted(T child) {
        persisted.put(child.id(), child);
    }

    List<N> takeNew() {
        var taken = List.copyOf(newEntities);
        newEntities.clear();
        return taken;
    }
}
