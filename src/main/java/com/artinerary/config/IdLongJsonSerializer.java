package com.artinerary.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.BeanProperty;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.ContextualSerializer;

import java.io.IOException;
import java.util.Locale;

/**
 * Writes id-like long fields as JSON strings; snowflake ids exceed the 2^53 range of a JS number.
 *
 * <p>A field counts as an id when its name is {@code id}, ends with {@code Id}
 * (e.g. {@code hostId}), or ends with {@code By} (e.g. {@code decidedBy}).
 * Counters such as {@code unreadCount} stay numbers.</p>
 */
public class IdLongJsonSerializer extends JsonSerializer<Long> implements ContextualSerializer {

    private final boolean asString;

    public IdLongJsonSerializer() {
        this(false);
    }

    private IdLongJsonSerializer(boolean asString) {
        this.asString = asString;
    }

    @Override
    public void serialize(Long value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value == null) {
            gen.writeNull();
            return;
        }
        if (asString) {
            gen.writeString(Long.toString(value));
            return;
        }
        gen.writeNumber(value);
    }

    @Override
    public JsonSerializer<?> createContextual(SerializerProvider prov, BeanProperty property) throws JsonMappingException {
        if (property == null) {
            return this;
        }
        return new IdLongJsonSerializer(isIdFieldName(property.getName()));
    }

    static boolean isIdFieldName(String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        if ("id".equals(lower) || lower.endsWith("id")) {
            return true;
        }
        return lower.endsWith("by");
    }
}
