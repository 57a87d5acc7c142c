package com.purchasingpower.codegraph.model;

import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Tracks one call against an external resource (graph store, file system) with a short call id,
 * timing and key/value details logged at debug level.
 *
 * @see com.purchasingpower.codegraph.util.ExternalCallLogger
 */
public class CallContext {

    private final String callId;
    private final ServiceType service;
    private final String operation;
    private final Instant startTime;
    private final Logger logger;

    public CallContext(ServiceType service, String operation, Logger logger) {
        this.callId = UUID.randomUUID().toString().substring(0, 8);
        this.service = service;
        this.operation = operation;
        this.startTime = Instant.now();
        this.logger = logger;
    }

    public void logRequest(String summary, Object... details) {
        logger.info("{} {} → {} [{}]", service.getEmoji(), service.getName(), operation, callId);
        logSummary("Request", summary, details);
    }

    public void logResponse(String summary, Object... details) {
        logger.info("{} {} ← {} [{}] ({}ms)",
                service.getEmoji(), service.getName(), operation, callId, getElapsedMs());
        logSummary("Response", summary, details);
    }

    public void logError(String errorMessage, Throwable ex) {
        logger.error("{} {} ✖ {} [{}] ({}ms) - {}",
                service.getEmoji(), service.getName(), operation, callId, getElapsedMs(), errorMessage);
        if (ex != null) {
            logger.debug("  Error details:", ex);
        }
    }

    public long getElapsedMs() {
        return Duration.between(startTime, Instant.now()).toMillis();
    }

    private void logSummary(String label, String summary, Object... details) {
        if (summary != null && !summary.isEmpty()) {
            logger.debug("  {}: {}", label, summary);
        }
        if (details != null) {
            for (int i = 0; i + 1 < details.length; i += 2) {
                logger.debug("  {}: {}", details[i], details[i + 1]);
            }
        }
    }
}
