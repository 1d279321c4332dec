/*
 * どこで: fan-out サービス層
 * 何を: 作成/配信/状態 upsert/一覧遅延/掃除のメトリクスを記録する
 * なぜ: DB を読まずに fan-out の健全性を観測できるようにするため
 */
package com.example.fanout.service;

import com.example.fanout.model.AudienceMode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class NotificationMetrics {

  static final String METRIC_CREATED_TOTAL = "fanout.notification.created.total";
  static final String METRIC_PUBLISH_TOTAL = "fanout.publish.total";
  static final String METRIC_STATE_UPSERT_FAILURE_TOTAL = "fanout.state.upsert.failure.total";
  static final String METRIC_MAINTENANCE_DELETED_TOTAL = "fanout.maintenance.deleted.total";
  static final String METRIC_LIST_DURATION = "fanout.list.duration";

  public static final String PUBLISH_SENT = "sent";
  public static final String PUBLISH_FAILED = "failed";
  public static final String PUBLISH_REJECTED = "rejected";
  public static final String PUBLISH_SKIPPED = "skipped";

  public static final String DELETED_ORPHAN = "orphan";
  public static final String DELETED_EXPIRED = "expired";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<AudienceMode, Counter> createdCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> publishCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> deletedCounters = new ConcurrentHashMap<>();
  private final Counter upsertFailureCounter;
  private final Timer listTimer;

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.upsertFailureCounter =
        Counter.builder(METRIC_STATE_UPSERT_FAILURE_TOTAL)
            .description("List items that fell back to the default state after an upsert failure")
            .register(meterRegistry);
    this.listTimer =
        Timer.builder(METRIC_LIST_DURATION)
            .description("Time to build one merged notification page")
            .register(meterRegistry);
  }

  public void recordCreated(AudienceMode mode) {
    createdCounters
        .computeIfAbsent(
            mode,
            ignored ->
                Counter.builder(METRIC_CREATED_TOTAL)
                    .description("Notifications persisted by audience mode")
                    .tags(Tags.of("mode", mode.value()))
                    .register(meterRegistry))
        .increment();
  }

  public void recordPublishResult(String result) {
    publishCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_PUBLISH_TOTAL)
                    .description("Real-time publish outcomes per notification")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordStateUpsertFailure() {
    upsertFailureCounter.increment();
  }

  public void recordDeleted(String kind, int count) {
    if (count <= 0) {
      return;
    }
    deletedCounters
        .computeIfAbsent(
            kind,
            ignored ->
                Counter.builder(METRIC_MAINTENANCE_DELETED_TOTAL)
                    .description("Rows removed by maintenance jobs")
                    .tags(Tags.of("kind", kind))
                    .register(meterRegistry))
        .increment(count);
  }

  public void recordListDuration(Duration duration) {
    if (duration == null || duration.isNegative()) {
      return;
    }
    listTimer.record(duration);
  }
}
