package com.anomalywatch.scoring.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

@Value
public class StatusResponse {

    String status;

    @JsonProperty("models_loaded")
    List<String> modelsLoaded;
}
