package com.air.normaliser.service;

import com.air.normaliser.common.exception.InvalidInputException;
import com.air.normaliser.common.exception.NormaliserException;
import com.air.normaliser.config.NormaliserProperties;
import com.air.normaliser.core.GuardedProgressReporter;
import com.air.normaliser.core.ProgressReporter;
import com.air.normaliser.model.PreparedDataset;
import com.air.normaliser.model.TrainedModel;
import com.air.normaliser.model.dto.NormalisationResult;
import com.air.normaliser.model.dto.NormaliseRequest;
import com.air.normaliser.model.dto.PredictionRecord;
import com.air.normaliser.model.dto.TrialPlan;
import com.air.normaliser.service.aggregation.EnsembleAggregator;
import com.air.normaliser.service.prediction.PredictorAdapter;
import com.air.normaliser.service.trial.TrialOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Normalises a pollutant series for average meteorological conditions.
 * <p>
 * The covariates of the prepared dataset are resampled many times while the trend term stays in place,
 * the trained model predicts on every resample, and the predictions are averaged per date. What is left
 * reflects time rather than weather.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NormalisationService {

    private final NormaliserProperties properties;
    private final PreparedDatasetValidator validator;
    private final PredictorAdapter predictor;
    private final TrialOrchestrator orchestrator;
    private final EnsembleAggregator aggregator;
    private final ProgressReporter defaultReporter;

    public NormalisationResult normalise(TrainedModel model, PreparedDataset dataset) {
        return normalise(model, dataset, new NormaliseRequest());
    }

    /**
     * @param model   trained surrogate; must declare its features
     * @param dataset prepared observations, read-only for the duration of the call
     * @param request per-call options; unset fields use {@link NormaliserProperties}
     * @return one row per distinct date, or every trial's rows when aggregation is off
     */
    public NormalisationResult normalise(TrainedModel model, PreparedDataset dataset, NormaliseRequest request) {
        try {
            return doNormalise(model, dataset, request == null ? new NormaliseRequest() : request);
        } catch (NormaliserException e) {
            log.warn("Normalisation failed: [{}] {}", e.getErrorCode(), e.getMessage());
            throw e;
        }
    }

    private NormalisationResult doNormalise(TrainedModel model, PreparedDataset dataset, NormaliseRequest request) {
        boolean standardErrors = orDefault(request.getStandardErrors(), properties.isStandardErrors());
        boolean aggregate = orDefault(request.getAggregate(), properties.isAggregate());
        predictor.requireCapability(model, standardErrors);

        int sampleCount = request.getSampleCount() != null ? request.getSampleCount() : properties.getSampleCount();
        if (sampleCount < 1) {
            throw new InvalidInputException("Sample count must be positive, got " + sampleCount);
        }
        int coreCount = properties.resolveCoreCount(request.getCoreCount());

        String trendColumn = properties.getTrendColumn();
        List<String> variables = resolveVariables(request.getVariables(), model.getFeatureNames(), trendColumn);
        validator.validate(dataset, model.getFeatureNames(), variables, trendColumn);

        ProgressReporter reporter = ProgressReporter.NONE;
        if (orDefault(request.getVerbose(), properties.isVerbose())) {
            reporter = GuardedProgressReporter.guard(
                    request.getProgressReporter() != null ? request.getProgressReporter() : defaultReporter);
        }

        TrialPlan plan = TrialPlan.builder()
                .variables(variables)
                .sampleCount(sampleCount)
                .replace(orDefault(request.getReplace(), properties.isReplace()))
                .standardErrors(standardErrors)
                .coreCount(coreCount)
                .predictionThreads(Math.max(1, coreCount / Math.min(coreCount, sampleCount)))
                .seed(request.getSeed() != null ? request.getSeed() : ThreadLocalRandom.current().nextLong())
                .progressReporter(reporter)
                .build();

        log.info("Normalising {} rows: {} trials over {} workers, resampling {}",
                dataset.getRowCount(), sampleCount, coreCount, variables);
        reporter.report("Sampling and predicting " + sampleCount + " times...");
        List<PredictionRecord> ensemble = orchestrator.run(model, dataset, plan);

        if (!aggregate) {
            return NormalisationResult.ensemble(ensemble, standardErrors);
        }
        reporter.report("Aggregating predictions...");
        return NormalisationResult.aggregated(aggregator.aggregate(ensemble, standardErrors), standardErrors);
    }

    /**
     * Variables to resample: the requested ones, or every model feature except the trend term.
     */
    static List<String> resolveVariables(List<String> requested, List<String> modelFeatures, String trendColumn) {
        if (requested != null && !requested.isEmpty()) {
            return List.copyOf(requested);
        }
        List<String> variables = new ArrayList<>(modelFeatures);
        variables.remove(trendColumn);
        return List.copyOf(variables);
    }

    private static boolean orDefault(Boolean value, boolean fallback) {
        return value != null ? value : fallback;
    }
}
