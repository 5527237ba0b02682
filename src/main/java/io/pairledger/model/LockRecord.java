package io.pairledger.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.pairledger.util.LenientInstantDeserializer;

import java.time.Instant;

public record LockRecord(
        @JsonProperty("agent_id") String agentId,
        @JsonDeserialize(using = LenientInstantDeserializer.class) Instant timestamp
) {
}
