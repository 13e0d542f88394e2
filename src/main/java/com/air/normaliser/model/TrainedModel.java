package com.air.normaliser.model;

import java.util.List;

/**
 * A trained predictive surrogate. Implementations must be safe to call from several threads at once.
 */
public interface TrainedModel {

    /**
     * Names of the features the model was trained on, in the order rows are presented to it.
     */
    List<String> getFeatureNames();

    /**
     * Predicts one value per row.
     *
     * @param features the rows to predict, projected onto {@link #getFeatureNames()}
     * @param threads  how many threads the model may use internally
     * @return one prediction per row of {@code features}
     */
    double[] predict(FeatureMatrix features, int threads);
}
