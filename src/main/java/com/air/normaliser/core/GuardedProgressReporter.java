package com.air.normaliser.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Wraps a reporter so that its failures are logged and dropped instead of reaching the caller.
 */
@Slf4j
@RequiredArgsConstructor
public final class GuardedProgressReporter implements ProgressReporter {

    private final ProgressReporter delegate;

    public static ProgressReporter guard(ProgressReporter reporter) {
        if (reporter == null || reporter == NONE) return NONE;
        if (reporter instanceof GuardedProgressReporter) return reporter;
        return new GuardedProgressReporter(reporter);
    }

    @Override
    public void report(String message) {
        try {
            delegate.report(message);
        } catch (RuntimeException e) {
            log.warn("Progress reporter failed on '{}': {}", message, e.getMessage());
        }
    }
}
