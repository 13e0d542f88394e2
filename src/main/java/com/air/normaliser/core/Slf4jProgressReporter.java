package com.air.normaliser.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default reporter: writes progress messages to the application log.
 */
@Slf4j
@Component
public class Slf4jProgressReporter implements ProgressReporter {

    @Override
    public void report(String message) {
        log.info(message);
    }
}
