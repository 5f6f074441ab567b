package io.parley.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ParleyConfig(
    DetectionConfig detection,
    IngestionConfig ingestion
) {

    public static ParleyConfig defaults() {
        return new ParleyConfig(
            DetectionConfig.defaults(),
            IngestionConfig.defaults()
        );
    }
}
