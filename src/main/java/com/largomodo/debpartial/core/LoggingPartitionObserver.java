package com.largomodo.debpartial.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports recoverable partitioning conditions as warnings.
 */
public class LoggingPartitionObserver implements PartitionObserver {

    private static final Logger log = LoggerFactory.getLogger(LoggingPartitionObserver.class);

    @Override
    public void onMissingSource(String binary) {
        log.warn("Source of {} not found", binary);
    }

    @Override
    public void onOversizedSkipped(String packageName, PartitionTooSmallException cause) {
        log.warn("Ignoring package '{}': {}", packageName, cause.getMessage());
    }

    @Override
    public void onUnknownPackage(String packageName) {
        log.warn("No such package: {}", packageName);
    }
}
