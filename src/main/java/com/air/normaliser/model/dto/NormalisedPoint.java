package com.air.normaliser.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

import java.time.Instant;

/**
 * One date of a normalised series: the mean over every trial's prediction for that date.
 */
@Value
@JsonPropertyOrder({"date", "se", "value_predict"})
public class NormalisedPoint {

    Instant date;

    @JsonProperty("value_predict")
    double value; // NaN when every prediction for the date was missing

    @JsonProperty("se")
    Double standardError;
}
