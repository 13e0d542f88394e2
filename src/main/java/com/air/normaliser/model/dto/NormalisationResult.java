package com.air.normaliser.model.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.List;

/**
 * Output of one normalisation call: either the normalised series or the raw ensemble.
 * Serialises to a JSON array of rows.
 */
public final class NormalisationResult {

    private final boolean aggregated;
    private final boolean standardErrors;
    private final List<NormalisedPoint> series;
    private final List<PredictionRecord> ensemble;

    private NormalisationResult(boolean aggregated, boolean standardErrors,
                                List<NormalisedPoint> series, List<PredictionRecord> ensemble) {
        this.aggregated = aggregated;
        this.standardErrors = standardErrors;
        this.series = series;
        this.ensemble = ensemble;
    }

    public static NormalisationResult aggregated(List<NormalisedPoint> series, boolean standardErrors) {
        return new NormalisationResult(true, standardErrors, Collections.unmodifiableList(series), null);
    }

    public static NormalisationResult ensemble(List<PredictionRecord> ensemble, boolean standardErrors) {
        return new NormalisationResult(false, standardErrors, null, Collections.unmodifiableList(ensemble));
    }

    public boolean isAggregated() {
        return aggregated;
    }

    public boolean hasStandardErrors() {
        return standardErrors;
    }

    public int getRowCount() {
        return aggregated ? series.size() : ensemble.size();
    }

    /**
     * @throws IllegalStateException when the result holds the raw ensemble
     */
    public List<NormalisedPoint> getSeries() {
        if (!aggregated) {
            throw new IllegalStateException("Result holds the raw ensemble; normalise with aggregate=true");
        }
        return series;
    }

    /**
     * @throws IllegalStateException when the result holds the aggregated series
     */
    public List<PredictionRecord> getEnsemble() {
        if (aggregated) {
            throw new IllegalStateException("Result holds the aggregated series; normalise with aggregate=false");
        }
        return ensemble;
    }

    @JsonValue
    public List<?> rows() {
        return aggregated ? series : ensemble;
    }

    @Override
    public String toString() {
        return "NormalisationResult{aggregated=" + aggregated + ", standardErrors=" + standardErrors
                + ", rows=" + getRowCount() + '}';
    }
}
