package io.pairledger.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.time.Instant;

public final class LenientInstantDeserializer extends StdDeserializer<Instant> {
    public LenientInstantDeserializer() {
        super(Instant.class);
    }

    @Override
    public Instant deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
        String raw = parser.getValueAsString();
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return Timestamps.parse(raw)
                .orElseThrow(() -> ctxt.weirdStringException(raw, Instant.class, "not an ISO-8601 timestamp"));
    }
}
