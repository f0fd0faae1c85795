package com.gt.studyplanner.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.studyplanner.model.WireNamed;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class WireNameSerializer extends JsonSerializer<WireNamed> {
    @Override
    public void serialize(WireNamed value, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeString(value.getWireName());
    }
}
