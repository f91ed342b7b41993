package com.rbdesugar.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.rbdesugar.names.Name;

import java.io.IOException;

/**
 * Writes a name as its display text, so synthetic names read {@code "<assignTemp>$2"}.
 */
public class NameSerializer extends StdSerializer<Name> {

    public NameSerializer() {
        super(Name.class);
    }

    @Override
    public void serialize(Name value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeString(value.show());
    }
}
