package io.pairledger.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.pairledger.util.LenientInstantDeserializer;

import java.time.Instant;

@JsonPropertyOrder({"timestamp", "event", "agent_id", "details"})
public record HistoryEvent(
        @JsonDeserialize(using = LenientInstantDeserializer.class) Instant timestamp,
        EventKind event,
        @JsonProperty("agent_id") String agentId,
        String details
) {
    public static HistoryEvent of(Instant timestamp, EventKind event, String agentId, String details) {
        return new HistoryEvent(timestamp, event, agentId, details == null ? "" : details);
    }
}
