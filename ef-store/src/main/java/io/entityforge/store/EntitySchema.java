package io.entityforge.store;

import io.entityforge.core.EntityId;
import io.entityforge.core.EsEntity;
import io.entityforge.core.EsEvent;
import io.entityforge.core.Hydrator;
import io.entityforge.core.IntoEvents;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Storage layout of one entity type: index table, events table, indexed columns and
 * optional features. Built once and handed to an {@link EsRepository}.
 *
 * <pre>{@code
 * EntitySchema.builder("users", UserEvent.class, UserId::new, User::hydrate)
 *         .column(Column.of("name", String.class, User::name).onCreate(NewUser::name).findBy().listBy())
 *         .softDelete()
 *         .build();
 * }</pre>
 */
public final class EntitySchema<ID extends EntityId, E extends EsEvent, T extends EsEntity<ID, E>, N extends IntoEvents<ID, E>> {

    public static final String ID = "id";
    public static final String CREATED_AT = "created_at";

    private final String table;
    private final String eventsTable;
    private final Class<E> eventType;
    private final Function<UUID, ID> idFactory;
    private final Hydrator<ID, E, T> hydrator;
    private final Map<String, Column<? super T, ? super N, ?>> columns;
    private final boolean softDelete;
    private final boolean eventContext;
    private final String forgettableTable;
    private final List<String> forgettableFields;

    private EntitySchema(Builder<ID, E, T, N> b) {
        this.table = b.table;
        this.eventsTable = b.eventsTable != null ? b.eventsTable : defaultEventsTable(b.table);
        this.eventType = b.eventType;
        this.idFactory = b.idFactory;
        this.hydrator = b.hydrator;
        var all = new LinkedHashMap<String, Column<? super T, ? super N, ?>>();
        all.put(ID, Column.of(ID, EntityId.class, (EsEntity<?, ?> e) -> e.id()).immutable().findBy().listBy());
        all.put(CREATED_AT, Column.of(CREATED_AT, Instant.class,
                (EsEntity<?, ?> e) -> e.events().entityFirstPersistedAt().orElseThrow()).immutable().listBy());
        for (var c : b.columns) {
            if (all.putIfAbsent(c.name(), c) != null) throw new IllegalArgumentException("duplicate column " + c.name());
        }
        this.columns = Collections.unmodifiableMap(all);
        this.softDelete = b.softDelete;
        this.eventContext = b.eventContext;
        this.forgettableTable = b.forgettableTable;
        this.forgettableFields = List.copyOf(b.forgettableFields);
        if (columns.values().stream().filter(Column::isParent).count() > 1) {
            throw new IllegalArgumentException(table + ": only one parent column is supported");
        }
    }

    private static String defaultEventsTable(String table) {
        var singular = table.endsWith("s") ? table.substring(0, table.length() - 1) : table;
        return singular + "_events";
    }

    public static <ID extends EntityId, E extends EsEvent, T extends EsEntity<ID, E>, N extends IntoEvents<ID, E>>
    Builder<ID, E, T, N> builder(String table, Class<E> eventType, Function<UUID, ID> idFactory, Hydrator<ID, E, T> hydrator) {
        return new Builder<>(table, eventType, idFactory, hydrator);
    }

    public String table() {
        return table;
    }

    public String eventsTable() {
        return eventsTable;
    }

    public Class<E> eventType() {
        return eventType;
    }

    public ID id(UUID raw) {
        return idFactory.apply(raw);
    }

    public Hydrator<ID, E, T> hydrator() {
        return hydrator;
    }

    /** Every column including the implicit {@code id} and {@code created_at}. */
    public Map<String, Column<? super T, ? super N, ?>> columns() {
        return columns;
    }

    /** Configured columns only. */
    public List<Column<? super T, ? super N, ?>> indexColumns() {
        return columns.values().stream()
                .filter(c -> !c.name().equals(ID) && !c.name().equals(CREATED_AT))
                .toList();
    }

    public Column<? super T, ? super N, ?> column(String name) {
        var c = columns.get(name);
        if (c == null) throw new IllegalArgumentException(table + " has no column '" + name + "'");
        return c;
    }

    public Optional<Column<? super T, ? super N, ?>> parentColumn() {
        return columns.values().stream().filter(Column::isParent).findFirst();
    }

    /** Unique constraint names mapped to their column. */
    public Map<String, String> constraints() {
        var byName = new LinkedHashMap<String, String>();
        byName.put(table + "_pkey", ID);
        for (var c : indexColumns()) {
            byName.put(c.constraintName(table), c.name());
        }
        return byName;
    }

    public boolean softDelete() {
        return softDelete;
    }

    public boolean eventContext() {
        return eventContext;
    }

    public boolean forgettable() {
        return forgettableTable != null;
    }

    public String forgettableTable() {
        return forgettableTable;
    }

    public List<String> forgettableFields() {
        return forgettableFields;
    }

    public static final class Builder<ID extends EntityId, E extends EsEvent, T extends EsEntity<ID, E>, N extends IntoEvents<ID, E>> {
        private final String table;
        private final Class<E> eventType;
        private final Function<UUID, ID> idFactory;
        private final Hydrator<ID, E, T> hydrator;
        private final List<Column<? super T, ? super N, ?>> columns = new ArrayList<>();
        private final List<String> forgettableFields = new ArrayList<>();
        private String eventsTable;
        private boolean softDelete;
        private boolean eventContext;
        private String forgettableTable;

        private Builder(String table, Class<E> eventType, Function<UUID, ID> idFactory, Hydrator<ID, E, T> hydrator) {
            this.table = Objects.requireNonNull(table);
            this.eventType = Objects.requireNonNull(eventType);
            this.idFactory = Objects.requireNonNull(idFactory);
            this.hydrator = Objects.requireNonNull(hydrator);
        }

        public Builder<ID, E, T, N> eventsTable(String eventsTable) {
            this.eventsTable = eventsTable;
            return this;
        }

        public Builder<ID, E, T, N> column(Column<? super T, ? super N, ?> column) {
            columns.add(Objects.requireNonNull(column));
            return this;
        }

        /** Index table has a {@code deleted} flag; lookups skip flagged rows by default. */
        public Builder<ID, E, T, N> softDelete() {
            this.softDelete = true;
            return this;
        }

        /** Events table has a {@code context} column holding each event's context data. */
        public Builder<ID, E, T, N> eventContext() {
            this.eventContext = true;
            return this;
        }

        /** Values of {@code fields} are kept in {@code table} so they can be erased later. */
        public Builder<ID, E, T, N> forgettable(String table, String... fields) {
            if (fields.length == 0) throw new IllegalArgumentException("no forgettable fields given");
            this.forgettableTable = Objects.requireNonNull(table);
            this.forgettableFields.addAll(List.of(fields));
            return this;
        }

        public EntitySchema<ID, E, T, N> build() {
            return new EntitySchema<>(this);
        }
    }
}
