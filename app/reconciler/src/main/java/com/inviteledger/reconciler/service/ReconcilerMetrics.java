/*
 * Where: reconciler service layer
 * What: Micrometer meters for lifecycle steps, directory sync and expiry notifications
 * Why: partial failures are only visible in aggregate through these counters
 */
package com.inviteledger.reconciler.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class ReconcilerMetrics {

  private static final String METRIC_LIFECYCLE_STEP_TOTAL = "reconciler.lifecycle.step.total";
  private static final String METRIC_SYNC_TOTAL = "reconciler.directory.sync.total";
  private static final String METRIC_CACHE_SIZE = "reconciler.directory.cache.size";
  private static final String METRIC_NOTIFICATION_TOTAL = "reconciler.expiry.notification.total";
  private static final String METRIC_TASK_DURATION = "reconciler.task.duration";

  private final MeterRegistry meterRegistry;
  private final AtomicLong cacheSize = new AtomicLong(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> timers = new ConcurrentHashMap<>();

  public ReconcilerMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_CACHE_SIZE, cacheSize, AtomicLong::get)
        .description("Directory entries held in the local cache after the last sync")
        .register(meterRegistry);
  }

  public void recordLifecycleStep(String operation, StepOutcome outcome) {
    counter(
            METRIC_LIFECYCLE_STEP_TOTAL,
            "Lifecycle sub-action outcomes",
            Tags.of(
                "operation", operation,
                "step", outcome.step(),
                "status", lower(outcome.status().name())))
        .increment();
  }

  public void recordSync(String result) {
    counter(METRIC_SYNC_TOTAL, "Directory sync pass outcomes", Tags.of("result", result))
        .increment();
  }

  public void updateCacheSize(long size) {
    cacheSize.set(Math.max(size, 0));
  }

  public void recordNotification(String result) {
    counter(METRIC_NOTIFICATION_TOTAL, "Expiry notification outcomes", Tags.of("result", result))
        .increment();
  }

  public void recordTaskDuration(String task, Duration duration) {
    timers
        .computeIfAbsent(
            task,
            ignored ->
                Timer.builder(METRIC_TASK_DURATION)
                    .description("Wall time of periodic reconciler passes")
                    .tags(Tags.of("task", task))
                    .register(meterRegistry))
        .record(duration);
  }

  private Counter counter(String name, String description, Tags tags) {
    final String key =
        tags.stream()
            .map(tag -> tag.getKey() + "=" + tag.getValue())
            .collect(Collectors.joining(",", name + "{", "}"));
    return counters.computeIfAbsent(
        key,
        ignored -> Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }

  private static String lower(String value) {
    return value.toLowerCase(Locale.ROOT);
  }
}
