package com.rbdesugar.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.rbdesugar.names.Name;

import java.io.IOException;

/**
 * Serializer for the value of a literal. JSON has no NaN or infinity, so a float literal
 * that was rejected during lowering is written as null.
 */
public class LiteralValueSerializer extends JsonSerializer<Object> {
    @Override
    public void serialize(Object value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value == null) {
            gen.writeNull();
        } else if (value instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) {
                gen.writeNull();
            } else {
                gen.writeNumber(d);
            }
        } else if (value instanceof Long l) {
            gen.writeNumber(l);
        } else if (value instanceof Name name) {
            gen.writeString(name.show());
        } else {
            gen.writeObject(value);
        }
    }
}
