package com.air.normaliser.model;

import com.air.normaliser.model.dto.PredictionResult;

/**
 * A model that can also estimate the standard error of its predictions.
 * Expect this to be much slower than {@link #predict(FeatureMatrix, int)}.
 */
public interface VarianceAwareModel extends TrainedModel {

    /**
     * @return predictions paired with their standard errors, one of each per row
     */
    PredictionResult predictWithStandardErrors(FeatureMatrix features, int threads);
}
