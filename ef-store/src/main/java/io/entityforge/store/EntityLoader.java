package io.entityforge.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.entityforge.core.ContextData;
import io.entityforge.core.EntityEvents;
import io.entityforge.core.EntityHydrationException;
import io.entityforge.core.EntityId;
import io.entityforge.core.EsEntity;
import io.entityforge.core.EsEvent;
import io.entityforge.core.IntoEvents;
import io.entityforge.core.PersistedEvent;
import org.springframework.jdbc.core.JdbcOperations;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Runs event load queries and hydrates one entity per distinct id, in row order. */
final class EntityLoader<ID extends EntityId, E extends EsEvent, T extends EsEntity<ID, E>, N extends IntoEvents<ID, E>> {

    private record EventRow(UUID entityId, int sequence, String eventType, String payload,
                            String context, Instant recordedAt, String forgotten) {}

    private final EntitySchema<ID, E, T, N> schema;
    private final ObjectMapper json;

    EntityLoader(EntitySchema<ID, E, T, N> schema, ObjectMapper json) {
        this.schema = schema;
        this.json = json;
    }

    List<T> load(JdbcOperations jdbc, String sql, Object... args) {
        var rows = jdbc.query(sql, (rs, n) -> row(rs), args);
        var byEntity = new LinkedHashMap<UUID, List<EventRow>>();
        for (var row : rows) {
            byEntity.computeIfAbsent(row.entityId(), k -> new ArrayList<>()).add(row);
        }
        var entities = new ArrayList<T>(byEntity.size());
        for (Map.Entry<UUID, List<EventRow>> e : byEntity.entrySet()) {
            entities.add(hydrate(schema.id(e.getKey()), e.getValue()));
        }
        return entities;
    }

    private EventRow row(ResultSet rs) throws SQLException {
        return new EventRow(
                UUID.fromString(rs.getString("entity_id")),
                rs.getInt("sequence"),
                rs.getString("event_type"),
                rs.getString("event_payload"),
                rs.getString("context"),
                rs.getTimestamp("recorded_at").toInstant(),
                rs.getString("forgotten_payload"));
    }

    private T hydrate(ID id, List<EventRow> rows) {
        var persisted = new ArrayList<PersistedEvent<E>>(rows.size());
        for (var row : rows) {
            persisted.add(new PersistedEvent<>(readEvent(row), row.sequence(), row.recordedAt(), readContext(row)));
        }
        return schema.hydrator().hydrate(EntityEvents.loadPersisted(id, persisted));
    }

    private E readEvent(EventRow row) {
        try {
            var node = (ObjectNode) json.readTree(row.payload());
            if (row.forgotten() != null) {
                node.setAll((ObjectNode) json.readTree(row.forgotten()));
            }
            return json.treeToValue(node, schema.eventType());
        } catch (Exception e) {
            throw EntityHydrationException.deserialization(row.eventType(), e);
        }
    }

    private ContextData readContext(EventRow row) {
        if (row.context() == null) return ContextData.empty();
        try { return json.readValue(row.context(), ContextData.class); }
        catch (Exception e) { throw EntityHydrationException.deserialization(row.eventType() + " context", e); }
    }
}
