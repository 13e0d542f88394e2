package com.air.normaliser.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

import java.time.Instant;

/**
 * One counterfactual prediction: a single row of a single trial.
 */
@Value
@JsonPropertyOrder({"n_sample", "date", "se", "value_predict"})
public class PredictionRecord {

    @JsonProperty("n_sample")
    int trialId;

    Instant date;

    @JsonProperty("value_predict")
    double value;

    @JsonProperty("se")
    Double standardError; // null unless standard errors were requested
}
