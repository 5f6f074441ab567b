package io.parley.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Participant ids used in stored transcripts for the agent and the (simulated) user.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IngestionConfig(String agentId, String userId) {

    public IngestionConfig {
        agentId = agentId == null || agentId.isBlank() ? "agent" : agentId;
        userId = userId == null || userId.isBlank() ? "simulator" : userId;
    }

    public static IngestionConfig defaults() {
        return new IngestionConfig("agent", "simulator");
    }
}
