package com.air.normaliser.service.prediction;

import com.air.normaliser.common.exception.InvalidModelException;
import com.air.normaliser.common.exception.UnsupportedModelOperationException;
import com.air.normaliser.model.FeatureMatrix;
import com.air.normaliser.model.PreparedDataset;
import com.air.normaliser.model.TrainedModel;
import com.air.normaliser.model.VarianceAwareModel;
import com.air.normaliser.model.dto.PredictionResult;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Calls a trained model on a dataset, with or without standard errors.
 */
@Component
public class PredictorAdapter {

    /**
     * @param model          the surrogate to call
     * @param dataset        rows to predict; columns the model does not declare are ignored
     * @param standardErrors whether to estimate standard errors as well
     * @param threads        parallelism hint forwarded to the model
     * @return one prediction per dataset row, with standard errors when requested
     * @throws InvalidModelException              if the model cannot predict or answers with the wrong shape
     * @throws UnsupportedModelOperationException if standard errors are requested but not supported
     */
    public PredictionResult predict(TrainedModel model, PreparedDataset dataset, boolean standardErrors,
                                    int threads) {
        requireCapability(model, standardErrors);
        FeatureMatrix features = FeatureMatrix.of(dataset, model.getFeatureNames());

        PredictionResult result;
        if (standardErrors) {
            result = ((VarianceAwareModel) model).predictWithStandardErrors(features, threads);
            if (result != null && !result.hasStandardErrors()) {
                throw new InvalidModelException("Model returned predictions without standard errors");
            }
        } else {
            double[] values = model.predict(features, threads);
            result = values == null ? null : PredictionResult.of(values);
        }

        if (result == null) {
            throw new InvalidModelException("Model returned no predictions");
        }
        if (result.size() != dataset.getRowCount()) {
            throw new InvalidModelException(String.format(
                    "Model returned %d predictions for %d rows", result.size(), dataset.getRowCount()));
        }
        return result;
    }

    /**
     * Checks that {@code model} can serve a prediction call, without making one.
     */
    public void requireCapability(TrainedModel model, boolean standardErrors) {
        if (model == null) {
            throw new InvalidModelException("No trained model supplied");
        }
        List<String> features = model.getFeatureNames();
        if (features == null || features.isEmpty()) {
            throw new InvalidModelException("Model " + model.getClass().getSimpleName() + " declares no features");
        }
        if (standardErrors && !(model instanceof VarianceAwareModel)) {
            throw new UnsupportedModelOperationException(
                    "Model " + model.getClass().getSimpleName() + " cannot estimate standard errors");
        }
    }
}
