package com.air.normaliser.model.dto;

import java.util.Objects;

/**
 * Predictions for one dataset, optionally paired with standard errors.
 */
public final class PredictionResult {

    private final double[] values;
    private final double[] standardErrors; // null when not estimated

    private PredictionResult(double[] values, double[] standardErrors) {
        this.values = values;
        this.standardErrors = standardErrors;
    }

    public static PredictionResult of(double[] values) {
        return new PredictionResult(Objects.requireNonNull(values, "values").clone(), null);
    }

    public static PredictionResult withStandardErrors(double[] values, double[] standardErrors) {
        Objects.requireNonNull(values, "values");
        Objects.requireNonNull(standardErrors, "standardErrors");
        if (values.length != standardErrors.length) {
            throw new IllegalArgumentException(String.format(
                    "%d predictions but %d standard errors", values.length, standardErrors.length));
        }
        return new PredictionResult(values.clone(), standardErrors.clone());
    }

    public int size() {
        return values.length;
    }

    public boolean hasStandardErrors() {
        return standardErrors != null;
    }

    public double value(int row) {
        return values[row];
    }

    /**
     * @return the standard error of row {@code row}, or null when standard errors were not estimated
     */
    public Double standardError(int row) {
        return standardErrors == null ? null : standardErrors[row];
    }

    public double[] getValues() {
        return values.clone();
    }
}
