package io.eventlog.spi;

/**
 * Observability hook for exporting event store counters and timings to a metrics backend.
 *
 * <p>Every method takes the aggregate name so one exporter can serve many stores.
 * The {@link #NOOP} instance discards everything.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Counts events committed by {@code persist}.
     */
    void incrementEventsPersisted(String aggregate, int count);

    /**
     * Counts {@code persist} calls that lost an optimistic-concurrency race.
     */
    void incrementConflicts(String aggregate);

    /**
     * Counts {@code persist} calls vetoed by a transactional handler.
     */
    void incrementHandlerRejections(String aggregate);

    /**
     * Counts individual post-commit handler and event bus failures.
     */
    void incrementPostCommitFailures(String aggregate, int count);

    /**
     * Counts events read back for replay.
     */
    default void incrementEventsLoaded(String aggregate, int count) {
    }

    /**
     * Records the time from opening the write transaction to its commit.
     *
     * @param latencyMs latency in milliseconds (always non-negative)
     */
    default void recordPersistLatencyMs(String aggregate, long latencyMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEventsPersisted(String aggregate, int count) {
        }

        @Override
        public void incrementConflicts(String aggregate) {
        }

        @Override
        public void incrementHandlerRejections(String aggregate) {
        }

        @Override
        public void incrementPostCommitFailures(String aggregate, int count) {
        }
    }
}
