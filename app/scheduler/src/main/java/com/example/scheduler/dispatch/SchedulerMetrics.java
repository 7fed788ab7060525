/*
 * どこで: Scheduler 発火処理
 * 何を: 配信結果/発火遅延/backlog/claim/宛先解決失敗のメトリクスを記録する
 * なぜ: 非同期の配信失敗を呼び出し元を止めずに Prometheus から観測できるようにするため
 */
package com.example.scheduler.dispatch;

import com.example.scheduler.model.DeliveryStatus;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class SchedulerMetrics {

  private static final String METRIC_DELIVERY_TOTAL = "scheduler.delivery.total";
  private static final String METRIC_DISPATCH_LAG = "scheduler.dispatch.lag";
  private static final String METRIC_BACKLOG_CURRENT = "scheduler.backlog.current";
  private static final String METRIC_CLAIM_TOTAL = "scheduler.claim.total";
  private static final String METRIC_RESOLUTION_FAILURE_TOTAL = "scheduler.resolution.failure.total";
  private static final String METRIC_LOCK_LOST_TOTAL = "scheduler.lock.lost.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger backlogCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final Counter claimCounter;
  private final Counter resolutionFailureCounter;
  private final Counter lockLostCounter;
  private final Timer dispatchLagTimer;

  public SchedulerMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_BACKLOG_CURRENT, backlogCurrent, AtomicInteger::get)
        .description("Current number of due scheduled notifications not yet claimed")
        .register(meterRegistry);
    this.claimCounter =
        Counter.builder(METRIC_CLAIM_TOTAL)
            .description("Total number of scheduled notification occurrences claimed")
            .register(meterRegistry);
    this.resolutionFailureCounter =
        Counter.builder(METRIC_RESOLUTION_FAILURE_TOTAL)
            .description("Total number of claims released because recipients could not be resolved")
            .register(meterRegistry);
    this.lockLostCounter =
        Counter.builder(METRIC_LOCK_LOST_TOTAL)
            .description("Total number of fires whose claim was lost before persisting")
            .register(meterRegistry);
    this.dispatchLagTimer =
        Timer.builder(METRIC_DISPATCH_LAG)
            .description("Delay from the scheduled occurrence to the fire")
            .register(meterRegistry);
  }

  public void recordDelivery(String channel, DeliveryStatus status) {
    final String result = status.name().toLowerCase(Locale.ROOT);
    deliveryCounters
        .computeIfAbsent(
            channel + ":" + result,
            ignored ->
                Counter.builder(METRIC_DELIVERY_TOTAL)
                    .description("Scheduled notification delivery outcomes")
                    .tags(Tags.of("channel", channel, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDispatchLag(Instant occurrenceAt, Instant firedAt) {
    if (occurrenceAt == null || firedAt == null || firedAt.isBefore(occurrenceAt)) {
      return;
    }
    dispatchLagTimer.record(Duration.between(occurrenceAt, firedAt));
  }

  public void recordClaimed(int count) {
    claimCounter.increment(count);
  }

  public void recordResolutionFailure() {
    resolutionFailureCounter.increment();
  }

  public void recordLockLost() {
    lockLostCounter.increment();
  }

  public void updateBacklogCurrent(int backlogCount) {
    backlogCurrent.set(Math.max(backlogCount, 0));
  }
}
