package com.air.normaliser.service.trial;

import com.air.normaliser.common.exception.WorkerFailureException;
import com.air.normaliser.config.NormaliserProperties;
import com.air.normaliser.core.GuardedProgressReporter;
import com.air.normaliser.core.ProgressReporter;
import com.air.normaliser.model.PreparedDataset;
import com.air.normaliser.model.TrainedModel;
import com.air.normaliser.model.dto.PredictionRecord;
import com.air.normaliser.model.dto.PredictionResult;
import com.air.normaliser.model.dto.SampleDraw;
import com.air.normaliser.model.dto.TrialPlan;
import com.air.normaliser.service.prediction.PredictorAdapter;
import com.air.normaliser.service.sampling.CovariateSampler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.SplittableRandom;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs independent resample-and-predict trials on a bounded worker pool.
 * <p>
 * Fail-fast: the first failing trial aborts the batch, remaining trials are cancelled and no partial
 * ensemble is returned.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrialOrchestrator {

    private static final int PROGRESS_EVERY = 5;

    private final CovariateSampler sampler;
    private final PredictorAdapter predictor;
    private final NormaliserProperties properties;

    /**
     * @return every trial's records, concatenated in completion order
     * @throws WorkerFailureException if any trial fails or the calling thread is interrupted
     */
    public List<PredictionRecord> run(TrainedModel model, PreparedDataset dataset, TrialPlan plan) {
        int trials = plan.getSampleCount();

        // Split on this thread, in trial order, so no generator is shared across workers.
        SplittableRandom root = new SplittableRandom(plan.getSeed());
        SplittableRandom[] randoms = new SplittableRandom[trials];
        for (int i = 0; i < trials; i++) {
            randoms[i] = root.split();
        }

        ExecutorService pool = Executors.newFixedThreadPool(plan.getCoreCount(),
                new CustomizableThreadFactory(properties.getThreadNamePrefix()));
        CompletionService<List<PredictionRecord>> completion = new ExecutorCompletionService<>(pool);
        ProgressReporter reporter = GuardedProgressReporter.guard(plan.getProgressReporter());
        List<PredictionRecord> ensemble = new ArrayList<>();

        try {
            for (int i = 0; i < trials; i++) {
                int trialId = i + 1;
                SplittableRandom random = randoms[i];
                completion.submit(() -> runTrial(trialId, model, dataset, plan, reporter, random));
            }

            for (int i = 0; i < trials; i++) {
                Future<List<PredictionRecord>> done = completion.take();
                try {
                    ensemble.addAll(done.get());
                } catch (ExecutionException e) {
                    throw asWorkerFailure(e.getCause());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerFailureException("Normalisation interrupted", e);
        } finally {
            pool.shutdownNow();
        }

        log.debug("Collected {} predictions from {} trials", ensemble.size(), trials);
        return ensemble;
    }

    private List<PredictionRecord> runTrial(int trialId, TrainedModel model, PreparedDataset dataset,
                                            TrialPlan plan, ProgressReporter reporter, SplittableRandom random) {
        if (trialId % PROGRESS_EVERY == 0) {
            reporter.report(progressMessage(trialId, plan.getSampleCount()));
        }

        try {
            SampleDraw draw = sampler.sample(dataset, plan.getVariables(), plan.isReplace(), random);
            PredictionResult prediction = predictor.predict(model, draw.getDataset(), plan.isStandardErrors(),
                    plan.getPredictionThreads());

            List<Instant> dates = dataset.getDates();
            List<PredictionRecord> records = new ArrayList<>(dates.size());
            for (int row = 0; row < dates.size(); row++) {
                records.add(new PredictionRecord(trialId, dates.get(row), prediction.value(row),
                        prediction.standardError(row)));
            }
            return records;
        } catch (RuntimeException e) {
            log.debug("Trial {} failed", trialId, e);
            throw new WorkerFailureException(trialId, e);
        }
    }

    private static WorkerFailureException asWorkerFailure(Throwable cause) {
        if (cause instanceof WorkerFailureException) {
            return (WorkerFailureException) cause;
        }
        return new WorkerFailureException("Trial failed: " + cause, cause);
    }

    /**
     * Formats the periodic status line, e.g. {@code "Predicting 5 of 300 times (1.67 %)..."}.
     */
    public static String progressMessage(int trialId, int trials) {
        double percent = trialId * 100.0 / trials;
        return String.format(Locale.ROOT, "Predicting %d of %d times (%.2f %%)...", trialId, trials, percent);
    }
}
