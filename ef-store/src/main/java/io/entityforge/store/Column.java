package io.entityforge.store;

import io.entityforge.core.EntityId;
import org.springframework.jdbc.core.SqlParameterValue;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;

/**
 * One denormalized column of an entity's index table.
 *
 * <pre>{@code
 * Column.of("name", String.class, User::name)
 *       .onCreate(NewUser::name)
 *       .findBy().listBy().listFor()
 *       .constraint("users_name_key")
 * }</pre>
 *
 * Columns are written on create (when {@link #onCreate} is given) and on every update,
 * unless marked {@link #immutable()} or {@link #parent()}.
 *
 * @param <T> entity type the value is read from
 * @param <N> new-entity type the value is read from on create
 * @param <V> Java type of the value
 */
public final class Column<T, N, V> {

    private final String name;
    private final Class<V> type;
    private final Function<? super T, ? extends V> entityValue;
    private final Function<? super N, ? extends V> newValue;
    private final boolean update;
    private final boolean findBy;
    private final boolean listBy;
    private final boolean listFor;
    private final boolean parent;
    private final String constraint;

    private Column(String name, Class<V> type, Function<? super T, ? extends V> entityValue,
                   Function<? super N, ? extends V> newValue, boolean update, boolean findBy,
                   boolean listBy, boolean listFor, boolean parent, String constraint) {
        this.name = name;
        this.type = type;
        this.entityValue = entityValue;
        this.newValue = newValue;
        this.update = update;
        this.findBy = findBy;
        this.listBy = listBy;
        this.listFor = listFor;
        this.parent = parent;
        this.constraint = constraint;
    }

    public static <T, V> Column<T, Object, V> of(String name, Class<V> type, Function<? super T, ? extends V> entityValue) {
        if (!name.matches("[a-z_][a-z0-9_]*")) throw new IllegalArgumentException("invalid column name: " + name);
        sqlType(type);
        return new Column<>(name, type, Objects.requireNonNull(entityValue), null,
                true, false, false, false, false, null);
    }

    /** Value written by {@code create}, read from the new entity. */
    public <M> Column<T, M, V> onCreate(Function<? super M, ? extends V> newValue) {
        return new Column<>(name, type, entityValue, Objects.requireNonNull(newValue),
                update, findBy, listBy, listFor, parent, constraint);
    }

    /** Never part of an index UPDATE. */
    public Column<T, N, V> immutable() {
        return new Column<>(name, type, entityValue, newValue, false, findBy, listBy, listFor, parent, constraint);
    }

    public Column<T, N, V> findBy() {
        return new Column<>(name, type, entityValue, newValue, update, true, listBy, listFor, parent, constraint);
    }

    public Column<T, N, V> listBy() {
        return new Column<>(name, type, entityValue, newValue, update, findBy, true, listFor, parent, constraint);
    }

    public Column<T, N, V> listFor() {
        return new Column<>(name, type, entityValue, newValue, update, findBy, listBy, true, parent, constraint);
    }

    /** Id of the owning aggregate root. Written once, on create. */
    public Column<T, N, V> parent() {
        return new Column<>(name, type, entityValue, newValue, false, findBy, listBy, listFor, true, constraint);
    }

    public Column<T, N, V> constraint(String constraintName) {
        return new Column<>(name, type, entityValue, newValue, update, findBy, listBy, listFor, parent,
                Objects.requireNonNull(constraintName));
    }

    public String name() {
        return name;
    }

    public Class<V> type() {
        return type;
    }

    public boolean persistOnCreate() {
        return newValue != null;
    }

    public boolean persistOnUpdate() {
        return update && !parent;
    }

    public boolean isFindBy() {
        return findBy;
    }

    public boolean isListBy() {
        return listBy;
    }

    public boolean isListFor() {
        return listFor;
    }

    public boolean isParent() {
        return parent;
    }

    /** Unique constraint name, {@code <table>_<column>_key} unless configured. */
    public String constraintName(String table) {
        return constraint != null ? constraint : table + "_" + name + "_key";
    }

    public V entityValue(T entity) {
        return entityValue.apply(entity);
    }

    public V newValue(N newEntity) {
        if (newValue == null) throw new IllegalStateException("column '" + name + "' is not written on create");
        return newValue.apply(newEntity);
    }

    /** SQL type used in casts. */
    public String sqlType() {
        return sqlType(type);
    }

    /** Type of {@link #cursorValue} results, used to decode cursor tokens. */
    public Class<?> cursorType() {
        if (EntityId.class.isAssignableFrom(type)) return UUID.class;
        if (type.isEnum()) return String.class;
        return type;
    }

    /** Value as stored in a cursor: ids unwrapped, enums by name. */
    public static Object cursorValue(Object value) {
        if (value instanceof EntityId id) return id.value();
        if (value instanceof Enum<?> e) return e.name();
        return value;
    }

    /** Value as bound to a JDBC parameter. */
    public static Object bindValue(Object value) {
        var v = cursorValue(value);
        if (v instanceof Instant i) return Timestamp.from(i);
        return v;
    }

    /** JDBC argument for {@code value}; nulls carry their SQL type. */
    Object param(Object value) {
        var v = bindValue(value);
        return v == null ? new SqlParameterValue(jdbcType(), null) : v;
    }

    int jdbcType() {
        return switch (sqlType()) {
            case "VARCHAR" -> Types.VARCHAR;
            case "INTEGER" -> Types.INTEGER;
            case "BIGINT" -> Types.BIGINT;
            case "BOOLEAN" -> Types.BOOLEAN;
            case "NUMERIC" -> Types.NUMERIC;
            case "TIMESTAMP WITH TIME ZONE" -> Types.TIMESTAMP_WITH_TIMEZONE;
            default -> Types.OTHER;
        };
    }

    static String sqlType(Class<?> type) {
        if (type == String.class || type.isEnum()) return "VARCHAR";
        if (type == UUID.class || EntityId.class.isAssignableFrom(type)) return "UUID";
        if (type == Integer.class) return "INTEGER";
        if (type == Long.class) return "BIGINT";
        if (type == Boolean.class) return "BOOLEAN";
        if (type == BigDecimal.class) return "NUMERIC";
        if (type == Instant.class) return "TIMESTAMP WITH TIME ZONE";
        throw new IllegalArgumentException("unsupported column type: " + type.getName());
    }

    @Override
    public String toString() {
        return "Column[" + name + " " + sqlType() + "]";
    }
}
