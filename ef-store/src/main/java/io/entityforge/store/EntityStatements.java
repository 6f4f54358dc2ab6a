package io.entityforge.store;

import io.entityforge.store.pagination.ListDirection;
import io.entityforge.store.pagination.ListQueries;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/** SQL text for one {@link EntitySchema}, built once at repository construction. */
final class EntityStatements {

    private final EntitySchema<?, ?, ?, ?> schema;
    private final List<String> createColumns;
    private final List<String> updateColumns;
    private final String insertIndex;
    private final String updateIndex;
    private final String softDelete;
    private final String insertEvent;
    private final String insertForgettable;
    private final String deleteForgettable;
    private final String selectEvents;
    private final String joinEvents;

    EntityStatements(EntitySchema<?, ?, ?, ?> schema) {
        this.schema = schema;
        var table = schema.table();

        this.createColumns = schema.indexColumns().stream().filter(Column::persistOnCreate).map(Column::name).toList();
        this.updateColumns = schema.indexColumns().stream().filter(Column::persistOnUpdate).map(Column::name).toList();

        var insertCols = new ArrayList<String>(List.of(EntitySchema.ID, EntitySchema.CREATED_AT));
        insertCols.addAll(createColumns);
        this.insertIndex = "INSERT INTO " + table + " (" + String.join(", ", insertCols) + ") VALUES ("
                + placeholders(insertCols.size()) + ")";

        var sets = updateColumns.stream().map(c -> c + " = ?").collect(Collectors.joining(", "));
        this.updateIndex = updateColumns.isEmpty() ? null : "UPDATE " + table + " SET " + sets + " WHERE id = ?";
        this.softDelete = !schema.softDelete() ? null
                : "UPDATE " + table + " SET " + (sets.isEmpty() ? "" : sets + ", ") + "deleted = TRUE WHERE id = ?";

        var eventCols = new ArrayList<String>(List.of("id", "sequence", "event_type", "event_payload"));
        if (schema.eventContext()) eventCols.add("context");
        eventCols.add("recorded_at");
        this.insertEvent = "INSERT INTO " + schema.eventsTable() + " (" + String.join(", ", eventCols) + ") VALUES ("
                + placeholders(eventCols.size()) + ")";

        if (schema.forgettable()) {
            this.insertForgettable = "INSERT INTO " + schema.forgettableTable()
                    + " (entity_id, sequence, payload) VALUES (?, ?, ?)";
            this.deleteForgettable = "DELETE FROM " + schema.forgettableTable() + " WHERE entity_id = ?";
        } else {
            this.insertForgettable = null;
            this.deleteForgettable = null;
        }

        var select = new StringBuilder("SELECT i.id AS entity_id, e.sequence, e.event_type, e.event_payload, e.recorded_at");
        select.append(schema.eventContext() ? ", e.context" : ", NULL AS context");
        select.append(schema.forgettable() ? ", f.payload AS forgotten_payload" : ", NULL AS forgotten_payload");
        this.selectEvents = select.toString();

        var join = new StringBuilder(" JOIN ").append(schema.eventsTable()).append(" e ON e.id = i.id");
        if (schema.forgettable()) {
            join.append(" LEFT JOIN ").append(schema.forgettableTable())
                    .append(" f ON f.entity_id = e.id AND f.sequence = e.sequence");
        }
        this.joinEvents = join.toString();
    }

    static String placeholders(int n) {
        return String.join(", ", Collections.nCopies(n, "?"));
    }

    List<String> createColumns() {
        return createColumns;
    }

    List<String> updateColumns() {
        return updateColumns;
    }

    String insertIndex() {
        return insertIndex;
    }

    /** {@code null} when no column is written on update. */
    String updateIndex() {
        return updateIndex;
    }

    String softDelete() {
        return softDelete;
    }

    String insertEvent() {
        return insertEvent;
    }

    String insertForgettable() {
        return insertForgettable;
    }

    String deleteForgettable() {
        return deleteForgettable;
    }

    /**
     * Loads every event of the index rows matching {@code where}, grouped per entity in
     * index order.
     *
     * @param where         predicate over the index table, without {@code WHERE}
     * @param sortColumn    index column to order by, or {@code null} for no ordering
     * @param limited       appends a {@code LIMIT ?} to the index selection
     */
    String load(String where, boolean includeDeleted, String sortColumn, ListDirection direction, boolean limited) {
        var conditions = new ArrayList<String>();
        if (where != null && !where.isBlank()) conditions.add(where);
        if (schema.softDelete() && !includeDeleted) conditions.add("deleted = FALSE");

        var indexCols = sortColumn == null || sortColumn.equals(EntitySchema.ID) ? "id" : "id, " + sortColumn;
        var inner = new StringBuilder("SELECT ").append(indexCols).append(" FROM ").append(schema.table());
        if (!conditions.isEmpty()) inner.append(" WHERE ").append(String.join(" AND ", conditions));
        if (sortColumn != null) inner.append(" ORDER BY ").append(ListQueries.orderBy(null, sortColumn, direction));
        if (limited) inner.append(" LIMIT ?");

        var outerOrder = sortColumn == null ? "i.id" : ListQueries.orderBy("i", sortColumn, direction);
        return selectEvents + " FROM (" + inner + ") i" + joinEvents + " ORDER BY " + outerOrder + ", e.sequence";
    }
}
