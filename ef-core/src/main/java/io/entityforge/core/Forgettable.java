package io.entityforge.core;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.BeanProperty;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.deser.ContextualDeserializer;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Event field whose value can be erased later without touching the event row.
 * Serializes as the plain value; a forgotten value reads back from {@code null}.
 */
@JsonSerialize(using = Forgettable.Serializer.class)
@JsonDeserialize(using = Forgettable.Deserializer.class)
public final class Forgettable<T> {

    private final T value;

    private Forgettable(T value) {
        this.value = value;
    }

    public static <T> Forgettable<T> of(T value) {
        return new Forgettable<>(Objects.requireNonNull(value, "use Forgettable.forgotten() for no value"));
    }

    public static <T> Forgettable<T> forgotten() {
        return new Forgettable<>(null);
    }

    public boolean isSet() {
        return value != null;
    }

    public boolean isForgotten() {
        return value == null;
    }

    public T value() {
        if (value == null) throw new NoSuchElementException("value has been forgotten");
        return value;
    }

    public T orElse(T fallback) {
        return value == null ? fallback : value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Forgettable<?> other && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return value == null ? "Forgotten" : "Forgettable[***]";
    }

    public static final class Serializer extends StdSerializer<Forgettable<?>> {

        public Serializer() {
            super(Forgettable.class, false);
        }

        @Override
        public void serialize(Forgettable<?> f, JsonGenerator gen, SerializerProvider provider) throws IOException {
            if (f.isForgotten()) {
                gen.writeNull();
            } else {
                provider.defaultSerializeValue(f.value, gen);
            }
        }
    }

    public static final class Deserializer extends JsonDeserializer<Forgettable<?>> implements ContextualDeserializer {

        private final JavaType valueType;

        public Deserializer() {
            this(null);
        }

        private Deserializer(JavaType valueType) {
            this.valueType = valueType;
        }

        @Override
        public JsonDeserializer<?> createContextual(DeserializationContext ctx, BeanProperty property) {
            JavaType wrapper = property != null ? property.getType() : ctx.getContextualType();
            JavaType inner = wrapper != null && wrapper.containedTypeCount() > 0
                    ? wrapper.containedType(0)
                    : ctx.getTypeFactory().constructType(Object.class);
            return new Deserializer(inner);
        }

        @Override
        public Forgettable<?> deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
            JavaType type = valueType != null ? valueType : ctx.getTypeFactory().constructType(Object.class);
            Object v = ctx.readValue(p, type);
            return v == null ? forgotten() : of(v);
        }

        @Override
        public Forgettable<?> getNullValue(DeserializationContext ctx) {
            return forgotten();
        }

        @Override
        public Object getAbsentValue(DeserializationContext ctx) {
            return forgotten();
        }
    }
}
