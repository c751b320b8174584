package com.bbthechange.watchtracker.util;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Times tracking-store calls into the dynamodb.query.duration timer and flags
 * the slow ones in the log.
 */
@Component
public class QueryPerformanceTracker {

    private static final Logger logger = LoggerFactory.getLogger(QueryPerformanceTracker.class);
    private static final long SLOW_QUERY_THRESHOLD_MS = 500L;

    private final MeterRegistry meterRegistry;

    @Autowired
    public QueryPerformanceTracker(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Run a store call under the operation's timer.
     *
     * @param operation metric tag and log label, e.g. "upsertEpisodes"
     * @param table table the call targets
     * @param storeCall the call itself; its exceptions propagate unchanged
     */
    public <T> T trackQuery(String operation, String table, Supplier<T> storeCall) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startNanos = System.nanoTime();
        String outcome = "success";
        try {
            return storeCall.get();
        } catch (RuntimeException e) {
            outcome = "error";
            logger.error("Tracking store call failed: operation={}, table={}, error={}",
                    operation, table, e.getMessage());
            throw e;
        } finally {
            long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000L;
            if (elapsedMs > SLOW_QUERY_THRESHOLD_MS) {
                logger.warn("Slow tracking store call: operation={}, table={}, duration={}ms",
                        operation, table, elapsedMs);
            } else {
                logger.debug("Tracking store call: operation={}, table={}, duration={}ms, outcome={}",
                        operation, table, elapsedMs, outcome);
            }
            sample.stop(Timer.builder("dynamodb.query.duration")
                    .tag("operation", operation)
                    .tag("table", table)
                    .tag("outcome", outcome)
                    .register(meterRegistry));
        }
    }
}
