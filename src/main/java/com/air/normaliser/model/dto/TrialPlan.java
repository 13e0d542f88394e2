package com.air.normaliser.model.dto;

import com.air.normaliser.core.ProgressReporter;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Fully resolved settings for one batch of trials.
 */
@Value
@Builder
public class TrialPlan {
    List<String> variables;
    int sampleCount;
    boolean replace;
    boolean standardErrors;
    int coreCount;
    int predictionThreads;
    long seed;
    @Builder.Default
    ProgressReporter progressReporter = ProgressReporter.NONE;
}
