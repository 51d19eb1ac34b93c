package org.mides.pooling.converter;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import org.mides.pooling.util.Utils;

import java.io.IOException;

/** Renders a primitive seconds value the same way {@link DurationSerializer} renders a Duration. */
public class SecondsSerializer extends JsonSerializer<Long> {

    @Override
    public void serialize(Long seconds, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        gen.writeString(Utils.formatClockTime(seconds));
    }
}
