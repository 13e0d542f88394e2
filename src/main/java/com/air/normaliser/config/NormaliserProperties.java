package com.air.normaliser.config;

import com.air.normaliser.common.exception.InvalidInputException;
import com.air.normaliser.model.PreparedDataset;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Defaults for every normalisation option. Per-call values in a
 * {@link com.air.normaliser.model.dto.NormaliseRequest} take precedence.
 */
@Getter
@Setter
@Component
@ConfigurationProperties("normaliser")
public class NormaliserProperties {

    private int sampleCount = 300;
    private boolean replace = true;
    private boolean standardErrors = false;
    private boolean aggregate = true;
    /**
     * Worker pool size. When unset, all available processors but one, and never fewer than one.
     */
    private Integer coreCount;
    private boolean verbose = false;
    private String trendColumn = PreparedDataset.TREND_COLUMN;
    private String threadNamePrefix = "Normalise-";

    /**
     * Picks the worker count for a call: the requested one, else the configured one, else the default.
     */
    public int resolveCoreCount(Integer requested) {
        Integer cores = requested != null ? requested : coreCount;
        if (cores == null) {
            return defaultCoreCount();
        }
        if (cores < 1) {
            throw new InvalidInputException("Core count must be positive, got " + cores);
        }
        return cores;
    }

    public static int defaultCoreCount() {
        return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
    }
}
