package org.mides.pooling.converter;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import org.mides.pooling.util.Utils;

import java.io.IOException;
import java.time.Duration;

/** Accepts either [-]HH:mm:ss or a plain number of seconds. */
public class DurationDeserializer extends JsonDeserializer<Duration> {

    @Override
    public Duration deserialize(JsonParser p, DeserializationContext context) throws IOException {
        if (p.currentToken() == JsonToken.VALUE_NUMBER_INT)
            return Duration.ofSeconds(p.getLongValue());

        String durationStr = p.getText();
        try {
            return Duration.ofSeconds(Utils.parseClockTime(durationStr));
        } catch (IllegalArgumentException e) {
            throw new IOException("Failed to parse Duration", e);
        }
    }
}
