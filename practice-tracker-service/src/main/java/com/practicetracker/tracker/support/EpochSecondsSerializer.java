package com.practicetracker.tracker.support;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.time.Instant;

/**
 * Writes an {@link Instant} as whole Unix epoch seconds.
 */
public class EpochSecondsSerializer extends StdSerializer<Instant> {

    public EpochSecondsSerializer() {
        super(Instant.class);
    }

    @Override
    public void serialize(Instant value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeNumber(value.getEpochSecond());
    }
}
