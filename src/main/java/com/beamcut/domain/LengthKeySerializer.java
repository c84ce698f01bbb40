package com.beamcut.domain;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/**
 * Writes length map keys the way the cut list was entered, e.g. {@code "50"} and {@code "12.5"}.
 */
public class LengthKeySerializer extends JsonSerializer<Double> {

    @Override
    public void serialize(Double length, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        gen.writeFieldName(Lengths.format(length));
    }
}
