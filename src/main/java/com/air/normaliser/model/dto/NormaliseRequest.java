package com.air.normaliser.model.dto;

import com.air.normaliser.core.ProgressReporter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Per-call options. Every field is optional; unset fields fall back to the configured defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NormaliseRequest {

    private List<String> variables;     // covariates to resample; default = model features minus trend
    private Integer sampleCount;        // number of trials
    private Boolean replace;            // sample with replacement
    private Boolean standardErrors;     // estimate standard errors (slow)
    private Boolean aggregate;          // reduce to one row per date
    private Integer coreCount;          // worker pool size
    private Boolean verbose;            // emit progress messages
    private Long seed;                  // root seed; fresh when unset
    private ProgressReporter progressReporter; // used when verbose; defaults to the log
}
