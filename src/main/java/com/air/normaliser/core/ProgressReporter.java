package com.air.normaliser.core;

/**
 * Receives human-readable progress messages from a running normalisation.
 * Reporting never influences the numeric result.
 *
 * Contracts:
 *  - May be called concurrently from worker threads.
 *  - Message order and cadence are advisory only.
 */
@FunctionalInterface
public interface ProgressReporter {

    ProgressReporter NONE = message -> {
    };

    void report(String message);
}
