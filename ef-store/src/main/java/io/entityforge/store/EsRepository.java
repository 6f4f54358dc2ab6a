package io.entityforge.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.entityforge.core.EntityId;
import io.entityforge.core.EsEntity;
import io.entityforge.core.EsEvent;
import io.entityforge.core.IntoEvents;
import io.entityforge.core.PersistedEvent;
import io.entityforge.store.pagination.CursorCodec;
import io.entityforge.store.pagination.CursorDestructureException;
import io.entityforge.store.pagination.EntityCursor;
import io.entityforge.store.pagination.Filters;
import io.entityforge.store.pagination.ListDirection;
import io.entityforge.store.pagination.ListQueries;
import io.entityforge.store.pagination.PaginatedQueryArgs;
import io.entityforge.store.pagination.PaginatedQueryRet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcOperations;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Event-sourced repository for one entity type.
 *
 * Subclasses pass an {@link EntitySchema} and usually add typed finders on top of the
 * generic column based ones:
 *
 * <pre>{@code
 * public User findByName(String name) {
 *     return findBy("name", name);
 * }
 * }</pre>
 *
 * Every write has an {@code ...InOp} variant joining a caller supplied transaction; the
 * plain variant runs in its own. After a failed write the entities involved must be
 * reloaded.
 */
public abstract class EsRepository<ID extends EntityId, E extends EsEvent, T extends EsEntity<ID, E>, N extends IntoEvents<ID, E>> {
    private static final Logger log = LoggerFactory.getLogger(EsRepository.class);

    private final DbOps ops;
    private final EntitySchema<ID, E, T, N> schema;
    private final EntityStatements sql;
    private final EventPersister<ID, E, T, N> persister;
    private final EntityLoader<ID, E, T, N> loader;
    private final CursorCodec cursors;
    private final List<NestedCollection<T, ?, ?, ?, ?>> nested = new ArrayList<>();

    protected EsRepository(DbOps ops, ObjectMapper json, EntitySchema<ID, E, T, N> schema) {
        this.ops = Objects.requireNonNull(ops);
        this.schema = Objects.requireNonNull(schema);
        this.sql = new EntityStatements(schema);
        this.persister = new EventPersister<>(schema, sql, json);
        this.loader = new EntityLoader<>(schema, json);
        var cursorTypes = new LinkedHashMap<String, Class<?>>();
        schema.columns().values().stream()
                .filter(Column::isListBy)
                .forEach(c -> cursorTypes.put(c.name(), c.cursorType()));
        this.cursors = new CursorCodec(json, cursorTypes);
    }

    /** Registers a child collection, loaded and persisted together with this root. */
    protected final void nest(NestedCollection<T, ?, ?, ?, ?> collection) {
        nested.add(collection);
    }

    public EntitySchema<ID, E, T, N> schema() {
        return schema;
    }

    public DbOps ops() {
        return ops;
    }

    /** Token codec for cursors of this repository's sortable columns. */
    public CursorCodec cursorCodec() {
        return cursors;
    }

    /**
     * Called inside the transaction after events of {@code entity} were written.
     */
    protected void afterPersist(AtomicOperation op, T entity, List<PersistedEvent<E>> newEvents) {
    }

    public T create(N newEntity) {
        return inOp(op -> createInOp(op, newEntity));
    }

    public T createInOp(AtomicOperation op, N newEntity) {
        return translate(() -> {
            var events = newEntity.intoEvents();
            if (!events.anyNew()) throw new IllegalArgumentException("new entity produced no events: " + newEntity.id());
            var args = new ArrayList<Object>();
            args.add(newEntity.id().value());
            args.add(Timestamp.from(op.now()));
            for (var name : sql.createColumns()) {
                args.add(createParam(schema.column(name), newEntity));
            }
            writeIndex(op, sql.insertIndex(), args);

            var persisted = persister.persist(op, events);
            var entity = schema.hydrator().hydrate(events);
            afterPersist(op, entity, persisted);
            return entity;
        });
    }

    public List<T> createAll(List<N> newEntities) {
        return inOp(op -> createAllInOp(op, newEntities));
    }

    public List<T> createAllInOp(AtomicOperation op, List<N> newEntities) {
        var created = new ArrayList<T>(newEntities.size());
        for (var n : newEntities) {
            created.add(createInOp(op, n));
        }
        return created;
    }

    /**
     * Persists pending events of {@code entity} and its child collections.
     *
     * @return number of root events written; 0 means nothing was written for the root
     */
    public int update(T entity) {
        if (!hasChanges(entity)) return 0;
        return inOp(op -> updateInOp(op, entity));
    }

    public int updateInOp(AtomicOperation op, T entity) {
        return translate(() -> {
            int written = 0;
            if (entity.events().anyNew()) {
                var persisted = persister.persist(op, entity.events());
                if (sql.updateIndex() != null) {
                    writeIndex(op, sql.updateIndex(), updateArgs(entity));
                }
                afterPersist(op, entity, persisted);
                written = persisted.size();
            }
            for (var collection : nested) {
                persistNested(op, entity, collection);
            }
            return written;
        });
    }

    public int updateAll(List<T> entities) {
        if (entities.stream().noneMatch(this::hasChanges)) return 0;
        return inOp(op -> updateAllInOp(op, entities));
    }

    public int updateAllInOp(AtomicOperation op, List<T> entities) {
        int written = 0;
        for (var entity : entities) {
            written += updateInOp(op, entity);
        }
        return written;
    }

    private boolean hasChanges(T entity) {
        if (entity.events().anyNew()) return true;
        for (var collection : nested) {
            if (nestedHasChanges(entity, collection)) return true;
        }
        return false;
    }

    private <CID extends EntityId, CE extends EsEvent, C extends EsEntity<CID, CE>, CN extends IntoEvents<CID, CE>>
    boolean nestedHasChanges(T entity, NestedCollection<T, CID, CE, C, CN> collection) {
        var children = collection.accessor().apply(entity);
        return children.lenNew() > 0 || collection.repository().updateAllNeeded(children.iterPersisted());
    }

    boolean updateAllNeeded(Collection<T> entities) {
        return entities.stream().anyMatch(this::hasChanges);
    }

    private <CID extends EntityId, CE extends EsEvent, C extends EsEntity<CID, CE>, CN extends IntoEvents<CID, CE>>
    void persistNested(AtomicOperation op, T entity, NestedCollection<T, CID, CE, C, CN> collection) {
        var children = collection.accessor().apply(entity);
        var repo = collection.repository();
        try {
            for (var child : List.copyOf(children.iterPersisted())) {
                repo.updateInOp(op, child);
            }
            for (var created : repo.createAllInOp(op, children.takeNew())) {
                children.addPersisted(created);
            }
        } catch (EsRepoException e) {
            throw new NestedEntityException(collection.name(), e);
        }
    }

    /**
     * Flags the index row as deleted and writes pending events, which should include
     * the entity's terminal event.
     */
    public void delete(T entity) {
        inOp(op -> {
            deleteInOp(op, entity);
            return null;
        });
    }

    public void deleteInOp(AtomicOperation op, T entity) {
        if (!schema.softDelete()) throw new UnsupportedOperationException(schema.table() + " has no soft delete");
        translate(() -> {
            writeIndex(op, sql.softDelete(), updateArgs(entity));
            var persisted = persister.persist(op, entity.events());
            if (!persisted.isEmpty()) afterPersist(op, entity, persisted);
            log.debug("soft deleted {} {}", schema.table(), entity.id());
            return null;
        });
    }

    /**
     * Erases the forgettable payloads of {@code entity}. Event rows stay untouched.
     *
     * @return the entity hydrated from its now forgotten history
     */
    public T forget(T entity) {
        return inOp(op -> forgetInOp(op, entity));
    }

    public T forgetInOp(AtomicOperation op, T entity) {
        if (!schema.forgettable()) throw new UnsupportedOperationException(schema.table() + " has no forgettable payloads");
        return translate(() -> {
            int removed = op.jdbc().update(sql.deleteForgettable(), entity.id().value());
            log.debug("forgot {} payload(s) of {} {}", removed, schema.table(), entity.id());
            return loadOne(op.jdbc(), EntitySchema.ID, entity.id(), true)
                    .orElseThrow(() -> new EntityNotFoundException(schema.table(), EntitySchema.ID, entity.id()));
        });
    }

    public T findById(ID id) {
        return findBy(EntitySchema.ID, id);
    }

    public Optional<T> maybeFindById(ID id) {
        return maybeFindBy(EntitySchema.ID, id);
    }

    public T findByIdInOp(AtomicOperation op, ID id) {
        return maybeFindByIdInOp(op, id)
                .orElseThrow(() -> new EntityNotFoundException(schema.table(), EntitySchema.ID, id));
    }

    public Optional<T> maybeFindByIdInOp(AtomicOperation op, ID id) {
        return translate(() -> loadOne(op.jdbc(), EntitySchema.ID, id, false));
    }

    public T findByIdIncludeDeleted(ID id) {
        return findByIncludeDeleted(EntitySchema.ID, id);
    }

    /** Looks up a single entity by a {@code findBy} column. */
    public T findBy(String column, Object value) {
        return maybeFindBy(column, value)
                .orElseThrow(() -> new EntityNotFoundException(schema.table(), column, value));
    }

    public Optional<T> maybeFindBy(String column, Object value) {
        return read(jdbc -> loadOne(jdbc, column, value, false));
    }

    public T findByIncludeDeleted(String column, Object value) {
        return maybeFindByIncludeDeleted(column, value)
                .orElseThrow(() -> new EntityNotFoundException(schema.table(), column, value));
    }

    public Optional<T> maybeFindByIncludeDeleted(String column, Object value) {
        return read(jdbc -> loadOne(jdbc, column, value, true));
    }

    /** Entities for the given ids; missing ids are absent from the result. */
    public Map<ID, T> findAllByIds(Collection<ID> ids) {
        if (ids.isEmpty()) return Map.of();
        return read(jdbc -> {
            var query = sql.load("id IN (" + EntityStatements.placeholders(ids.size()) + ")", false, null,
                    ListDirection.ASCENDING, false);
            var found = loadWithChildren(jdbc, query, ids.stream().map(EntityId::value).toArray());
            var byId = new HashMap<ID, T>();
            found.forEach(e -> byId.put(e.id(), e));
            return byId;
        });
    }

    /**
     * Entities whose index row matches {@code where}, a predicate over this repository's
     * table, oldest first. Arguments bind like column values; soft-deleted rows are skipped.
     *
     * <pre>{@code
     * public List<User> findByNamePrefix(String prefix) {
     *     return query("name LIKE ?", prefix + "%");
     * }
     * }</pre>
     */
    protected List<T> query(String where, Object... args) {
        return read(jdbc -> runQuery(jdbc, where, false, args));
    }

    protected List<T> queryIncludeDeleted(String where, Object... args) {
        return read(jdbc -> runQuery(jdbc, where, true, args));
    }

    protected List<T> queryInOp(AtomicOperation op, String where, Object... args) {
        return translate(() -> runQuery(op.jdbc(), where, false, args));
    }

    private List<T> runQuery(JdbcOperations jdbc, String where, boolean includeDeleted, Object[] args) {
        var query = sql.load(where, includeDeleted, EntitySchema.CREATED_AT, ListDirection.ASCENDING, false);
        var params = new Object[args.length];
        for (int i = 0; i < args.length; i++) {
            params[i] = Column.bindValue(args[i]);
        }
        return loadWithChildren(jdbc, query, params);
    }

    private Optional<T> loadOne(JdbcOperations jdbc, String column, Object value, boolean includeDeleted) {
        var c = schema.column(column);
        if (!c.isFindBy()) throw new IllegalArgumentException(schema.table() + "." + column + " is not a findBy column");
        var query = sql.load(column + " = ?", includeDeleted, null, ListDirection.ASCENDING, false);
        var found = loadWithChildren(jdbc, query, c.param(value));
        return found.stream().findFirst();
    }

    public PaginatedQueryRet<T> listBy(String sortColumn, PaginatedQueryArgs args, ListDirection direction) {
        return list(Map.of(), sortColumn, args, direction, false, false);
    }

    public PaginatedQueryRet<T> listByIncludeDeleted(String sortColumn, PaginatedQueryArgs args, ListDirection direction) {
        return list(Map.of(), sortColumn, args, direction, false, true);
    }

    /** Lists entities whose {@code filterColumn} equals {@code value}, sorted by {@code sortColumn}. */
    public PaginatedQueryRet<T> listForBy(String filterColumn, Object value, String sortColumn,
                                          PaginatedQueryArgs args, ListDirection direction) {
        var filter = new LinkedHashMap<String, Object>();
        filter.put(filterColumn, Objects.requireNonNull(value, "filter value"));
        return list(filter, sortColumn, args, direction, false, false);
    }

    public PaginatedQueryRet<T> listForFilters(Filters filters, String sortColumn,
                                               PaginatedQueryArgs args, ListDirection direction) {
        return listForFilters(filters, sortColumn, args, direction, false);
    }

    public PaginatedQueryRet<T> listForFiltersIncludeDeleted(Filters filters, String sortColumn,
                                                             PaginatedQueryArgs args, ListDirection direction) {
        return listForFilters(filters, sortColumn, args, direction, true);
    }

    private PaginatedQueryRet<T> listForFilters(Filters filters, String sortColumn, PaginatedQueryArgs args,
                                                ListDirection direction, boolean includeDeleted) {
        filters.all().keySet().forEach(this::requireListFor);
        var path = ListQueries.pathFor(filters);
        log.debug("{} list query via {} for {}", schema.table(), path, filters);
        return switch (path) {
            case PLAIN_SORT -> list(Map.of(), sortColumn, args, direction, false, includeDeleted);
            case SINGLE_FILTER -> list(filters.active(), sortColumn, args, direction, false, includeDeleted);
            case NULLABLE_FILTERS -> list(filters.all(), sortColumn, args, direction, true, includeDeleted);
        };
    }

    private PaginatedQueryRet<T> list(Map<String, Object> filters, String sortColumn, PaginatedQueryArgs args,
                                      ListDirection direction, boolean nullable, boolean includeDeleted) {
        var sort = schema.column(sortColumn);
        if (!sort.isListBy()) throw new IllegalArgumentException(schema.table() + "." + sortColumn + " is not a listBy column");

        var conditions = new ArrayList<String>();
        var params = new ArrayList<Object>();
        filters.forEach((name, value) -> {
            var c = requireListFor(name);
            if (nullable) {
                conditions.add(ListQueries.nullableEq(name, c.sqlType()));
                params.add(c.param(value));
                params.add(c.param(value));
            } else {
                conditions.add(name + " = ?");
                params.add(c.param(value));
            }
        });

        var after = args.cursor().orElse(null);
        if (after != null) {
            if (!after.sortBy().equals(sortColumn)) throw CursorDestructureException.mismatch(sortColumn, after.sortBy());
            conditions.add(ListQueries.afterCursor(sortColumn, direction));
            if (!sortColumn.equals(EntitySchema.ID)) {
                params.add(Column.bindValue(after.value()));
                params.add(Column.bindValue(after.value()));
            }
            params.add(after.id());
        }
        params.add(args.first() == Integer.MAX_VALUE ? Integer.MAX_VALUE : args.first() + 1);

        var query = sql.load(String.join(" AND ", conditions), includeDeleted, sortColumn, direction, true);
        var found = read(jdbc -> loadWithChildren(jdbc, query, params.toArray()));

        boolean hasNextPage = found.size() > args.first();
        var page = hasNextPage ? found.subList(0, args.first()) : found;
        EntityCursor endCursor = null;
        if (!page.isEmpty()) {
            var last = page.get(page.size() - 1);
            endCursor = new EntityCursor(sortColumn, Column.cursorValue(sort.entityValue(last)), last.id().value());
        }
        return new PaginatedQueryRet<>(page, hasNextPage, endCursor);
    }

    private Column<? super T, ? super N, ?> requireListFor(String name) {
        var c = schema.column(name);
        if (!c.isListFor()) throw new IllegalArgumentException(schema.table() + "." + name + " is not a listFor column");
        return c;
    }

    private List<T> loadWithChildren(JdbcOperations jdbc, String query, Object... args) {
        var entities = loader.load(jdbc, query, args);
        if (!entities.isEmpty()) {
            for (var collection : nested) {
                loadNested(jdbc, entities, collection);
            }
        }
        return entities;
    }

    private <CID extends EntityId, CE extends EsEvent, C extends EsEntity<CID, CE>, CN extends IntoEvents<CID, CE>>
    void loadNested(JdbcOperations jdbc, List<T> parents, NestedCollection<T, CID, CE, C, CN> collection) {
        var repo = collection.repository();
        var parentColumn = repo.schema().parentColumn().orElseThrow();
        var parentIds = parents.stream().map(p -> p.id().value()).toList();

        var byParent = new HashMap<Object, List<C>>();
        for (var child : repo.findAllForParents(jdbc, parentIds)) {
            var key = Column.cursorValue(parentColumn.entityValue(child));
            byParent.computeIfAbsent(key, k -> new ArrayList<>()).add(child);
        }
        for (var parent : parents) {
            collection.accessor().apply(parent).load(byParent.getOrDefault(parent.id().value(), List.of()));
        }
    }

    List<T> findAllForParents(JdbcOperations jdbc, List<UUID> parentIds) {
        var parentColumn = schema.parentColumn().orElseThrow();
        var query = sql.load(parentColumn.name() + " IN (" + EntityStatements.placeholders(parentIds.size()) + ")",
                false, EntitySchema.CREATED_AT, ListDirection.ASCENDING, false);
        return loadWithChildren(jdbc, query, parentIds.toArray());
    }

    /** Pooled access for plain repositories; one read transaction when children are involved. */
    private <R> R read(Function<JdbcOperations, R> body) {
        if (nested.isEmpty()) return translate(() -> body.apply(ops.pool()));
        return inOp(op -> body.apply(op.jdbc()));
    }

    private Object createParam(Column<? super T, ? super N, ?> column, N newEntity) {
        return column.param(column.newValue(newEntity));
    }

    private List<Object> updateArgs(T entity) {
        var args = new ArrayList<Object>();
        for (var name : sql.updateColumns()) {
            var c = schema.column(name);
            args.add(c.param(c.entityValue(entity)));
        }
        args.add(entity.id().value());
        return args;
    }

    private void writeIndex(AtomicOperation op, String statement, List<Object> args) {
        try {
            op.jdbc().update(statement, args.toArray());
        } catch (DuplicateKeyException e) {
            throw ConstraintViolations.translate(schema.table(), schema.constraints(), e);
        }
    }

    private <R> R inOp(Function<DbOp, R> body) {
        return translate(() -> ops.inTransaction(body));
    }

    private <R> R translate(Supplier<R> body) {
        try {
            return body.get();
        } catch (DataAccessException e) {
            throw new EsRepoException(schema.table() + ": " + e.getMessage(), e);
        }
    }
}
