package org.mides.pooling.converter;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import org.mides.pooling.model.InsertionMethod;

import java.io.IOException;

/** Also understands the short names IA and IB and dashed lowercase names. */
public class InsertionMethodDeserializer extends JsonDeserializer<InsertionMethod> {

    @Override
    public InsertionMethod deserialize(JsonParser p, DeserializationContext context) throws IOException {
        String method = p.getText().trim().toUpperCase().replace('-', '_');
        switch (method) {
            case "IA":
                return InsertionMethod.EXHAUSTIVE;
            case "IB":
                return InsertionMethod.RANDOMIZED_RESTRICTED;
            default:
                try {
                    return InsertionMethod.valueOf(method);
                } catch (IllegalArgumentException e) {
                    throw new IOException("Unknown insertion method " + p.getText(), e);
                }
        }
    }
}
