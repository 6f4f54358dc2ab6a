package io.entityforge.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.entityforge.core.EntityEvents;
import io.entityforge.core.EntityId;
import io.entityforge.core.EsEntity;
import io.entityforge.core.EsEvent;
import io.entityforge.core.IntoEvents;
import io.entityforge.core.PendingEvent;
import io.entityforge.core.PersistedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/** Appends pending events to the events table at the next contiguous sequences. */
final class EventPersister<ID extends EntityId, E extends EsEvent, T extends EsEntity<ID, E>, N extends IntoEvents<ID, E>> {
    private static final Logger log = LoggerFactory.getLogger(EventPersister.class);

    private final EntitySchema<ID, E, T, N> schema;
    private final EntityStatements sql;
    private final ObjectMapper json;

    EventPersister(EntitySchema<ID, E, T, N> schema, EntityStatements sql, ObjectMapper json) {
        this.schema = schema;
        this.sql = sql;
        this.json = json;
    }

    /**
     * Writes every pending event of {@code events} and marks them persisted.
     *
     * @throws ConcurrentModificationException when another transaction took one of the sequences
     */
    List<PersistedEvent<E>> persist(AtomicOperation op, EntityEvents<ID, E> events) {
        if (!events.anyNew()) return List.of();
        var jdbc = op.jdbc();
        var recordedAt = Timestamp.from(op.now());
        var id = events.entityId().value();
        int sequence = events.nextSequence();

        for (PendingEvent<E> pending : events.pending()) {
            var payload = toTree(pending.event());
            var eventType = payload.path("type").asText(pending.event().getClass().getSimpleName());
            var forgotten = schema.forgettable() ? extractForgettable(payload) : null;

            var args = new ArrayList<Object>(List.of(id, sequence, eventType, toJson(payload)));
            if (schema.eventContext()) args.add(pending.context().isEmpty() ? null : toJson(pending.context()));
            args.add(recordedAt);
            try {
                jdbc.update(sql.insertEvent(), args.toArray());
            } catch (DuplicateKeyException e) {
                throw new ConcurrentModificationException(schema.table(), events.entityId(), e);
            }
            if (forgotten != null) {
                jdbc.update(sql.insertForgettable(), id, sequence, toJson(forgotten));
            }
            sequence++;
        }

        var persisted = events.markNewEventsPersistedAt(op.now());
        log.debug("persisted {} event(s) for {} {}", persisted.size(), schema.table(), id);
        return persisted;
    }

    /** Moves non-null forgettable fields out of {@code payload}; returns them, or null if none. */
    private ObjectNode extractForgettable(ObjectNode payload) {
        ObjectNode side = null;
        for (var field : schema.forgettableFields()) {
            var value = payload.get(field);
            if (value == null || value.isNull()) continue;
            if (side == null) side = json.createObjectNode();
            side.set(field, value);
            payload.putNull(field);
        }
        return side;
    }

    private ObjectNode toTree(E event) {
        try {
            var text = json.writerFor(schema.eventType()).writeValueAsString(event);
            return (ObjectNode) json.readTree(text);
        } catch (JsonProcessingException | ClassCastException e) {
            throw new EsRepoException("could not serialize " + event.getClass().getSimpleName(), e);
        }
    }

    private String toJson(Object value) {
        try { return json.writeValueAsString(value); }
        catch (JsonProcessingException e) { throw new EsRepoException("could not serialize " + value.getClass().getSimpleName(), e); }
    }
}
