package org.mides.pooling.converter;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import org.mides.pooling.model.StopType;

import java.io.IOException;

public class StopTypeSerializer extends JsonSerializer<StopType> {

    @Override
    public void serialize(StopType stopType, JsonGenerator gen, SerializerProvider serializer) throws IOException {
        gen.writeString(stopType.toString().toLowerCase());
    }
}
