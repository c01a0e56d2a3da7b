package io.eventlog.micrometer;

import io.eventlog.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers meters with a {@link MeterRegistry} for export to Prometheus, Grafana,
 * Datadog and other monitoring backends. Every meter carries an {@code aggregate} tag;
 * meters of an aggregate are registered the first time that aggregate reports.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code eventlog.events.persisted} - events committed</li>
 *   <li>{@code eventlog.conflicts} - writes that lost an optimistic-concurrency race</li>
 *   <li>{@code eventlog.handler.rejected} - writes vetoed by a transactional handler</li>
 *   <li>{@code eventlog.postcommit.failures} - failed post-commit handlers and event buses</li>
 *   <li>{@code eventlog.events.loaded} - events read back for replay</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code eventlog.persist.latency} - write transaction duration up to commit</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  public static final String DEFAULT_PREFIX = "eventlog";
  public static final String AGGREGATE_TAG = "aggregate";

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Map<String, AggregateMeters> meters = new ConcurrentHashMap<>();
  private boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "eventlog"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.eventlog"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;
    this.namePrefix = namePrefix;
  }

  @Override
  public void incrementEventsPersisted(String aggregate, int count) {
    AggregateMeters m = metersFor(aggregate);
    if (m != null) {
      m.eventsPersisted.increment(count);
    }
  }

  @Override
  public void incrementConflicts(String aggregate) {
    AggregateMeters m = metersFor(aggregate);
    if (m != null) {
      m.conflicts.increment();
    }
  }

  @Override
  public void incrementHandlerRejections(String aggregate) {
    AggregateMeters m = metersFor(aggregate);
    if (m != null) {
      m.handlerRejected.increment();
    }
  }

  @Override
  public void incrementPostCommitFailures(String aggregate, int count) {
    AggregateMeters m = metersFor(aggregate);
    if (m != null) {
      m.postCommitFailures.increment(count);
    }
  }

  @Override
  public void incrementEventsLoaded(String aggregate, int count) {
    AggregateMeters m = metersFor(aggregate);
    if (m != null) {
      m.eventsLoaded.increment(count);
    }
  }

  @Override
  public void recordPersistLatencyMs(String aggregate, long latencyMs) {
    AggregateMeters m = metersFor(aggregate);
    if (m != null) {
      m.persistLatency.record(latencyMs, TimeUnit.MILLISECONDS);
    }
  }

  /**
   * Removes all meters registered by this exporter from the registry. Later calls
   * record nothing and register no meters.
   */
  @Override
  public void close() {
    List<AggregateMeters> registered;
    synchronized (this) {
      closed = true;
      registered = new ArrayList<>(meters.values());
      meters.clear();
    }
    RuntimeException first = null;
    for (AggregateMeters aggregateMeters : registered) {
      for (Meter meter : aggregateMeters.all()) {
        try {
          registry.remove(meter);
        } catch (RuntimeException e) {
          if (first == null) first = e; else first.addSuppressed(e);
        }
      }
    }
    if (first != null) throw first;
  }

  // Registration and close() are serialized so a closed exporter never registers again
  private AggregateMeters metersFor(String aggregate) {
    AggregateMeters existing = meters.get(aggregate);
    if (existing != null) {
      return existing;
    }
    synchronized (this) {
      if (closed) {
        return null;
      }
      return meters.computeIfAbsent(aggregate, AggregateMeters::new);
    }
  }

  private final class AggregateMeters {
    final Counter eventsPersisted;
    final Counter conflicts;
    final Counter handlerRejected;
    final Counter postCommitFailures;
    final Counter eventsLoaded;
    final Timer persistLatency;

    AggregateMeters(String aggregate) {
      eventsPersisted = counter(".events.persisted", "Events committed", aggregate);
      conflicts = counter(".conflicts", "Writes rejected by a concurrent writer", aggregate);
      handlerRejected = counter(".handler.rejected", "Writes vetoed by a transactional handler", aggregate);
      postCommitFailures = counter(".postcommit.failures", "Failed post-commit handlers and event buses", aggregate);
      eventsLoaded = counter(".events.loaded", "Events read back for replay", aggregate);
      persistLatency = Timer.builder(namePrefix + ".persist.latency")
          .description("Write transaction duration up to commit")
          .tag(AGGREGATE_TAG, aggregate)
          .register(registry);
    }

    private Counter counter(String suffix, String description, String aggregate) {
      return Counter.builder(namePrefix + suffix)
          .description(description)
          .tag(AGGREGATE_TAG, aggregate)
          .register(registry);
    }

    List<Meter> all() {
      List<Meter> all = new ArrayList<>();
      all.add(eventsPersisted);
      all.add(conflicts);
      all.add(handlerRejected);
      all.add(postCommitFailures);
      all.add(eventsLoaded);
      all.add(persistLatency);
      return all;
    }
  }
}
