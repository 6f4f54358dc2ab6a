package io.entityforge.store.pagination;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Turns {@link EntityCursor}s into opaque URL-safe tokens and back.
 * The token is Base64 over {@code {"sort_by":..,"value":..,"id":..}}.
 */
public final class CursorCodec {

    private final ObjectMapper json;
    private final Map<String, Class<?>> valueTypes;

    /**
     * @param valueTypes bind type of each sortable column's cursor value
     */
    public CursorCodec(ObjectMapper json, Map<String, Class<?>> valueTypes) {
        this.json = json.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.valueTypes = Map.copyOf(valueTypes);
    }

    public String encode(EntityCursor cursor) {
        var node = json.createObjectNode();
        node.put("sort_by", cursor.sortBy());
        node.set("value", json.valueToTree(cursor.value()));
        node.put("id", cursor.id().toString());
        try {
            return Base64.getUrlEncoder().withoutPadding().encodeToString(json.writeValueAsBytes(node));
        } catch (Exception e) {
            throw new IllegalStateException("could not encode cursor " + cursor, e);
        }
    }

    public EntityCursor decode(String token) {
        Objects.requireNonNull(token);
        try {
            var node = json.readTree(Base64.getUrlDecoder().decode(token.getBytes(StandardCharsets.US_ASCII)));
            var sortBy = node.path("sort_by").asText(null);
            var type = sortBy == null ? null : valueTypes.get(sortBy);
            if (type == null) throw new CursorDestructureException("unknown sort column in cursor: " + sortBy);
            var id = UUID.fromString(node.path("id").asText());
            var value = json.treeToValue(node.get("value"), type);
            return new EntityCursor(sortBy, value, id);
        } catch (CursorDestructureException e) {
            throw e;
        } catch (Exception e) {
            throw new CursorDestructureException("malformed cursor", e);
        }
    }

    /** Decodes and checks the cursor belongs to {@code sortBy}. */
    public EntityCursor decode(String token, String sortBy) {
        var cursor = decode(token);
        if (!cursor.sortBy().equals(sortBy)) throw CursorDestructureException.mismatch(sortBy, cursor.sortBy());
        return cursor;
    }
}
