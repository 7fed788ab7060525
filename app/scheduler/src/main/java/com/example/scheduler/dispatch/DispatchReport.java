/*
 * どこで: Scheduler 発火処理
 * 何を: 1 ティック分の処理結果の要約
 * なぜ: 運用エンドポイントとログで同じ集計を返すため
 */
package com.example.scheduler.dispatch;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DispatchReport(
    Instant tickAt,
    List<UUID> claimed,
    int fired,
    int released,
    int lockLost,
    int errored,
    int deliveries,
    List<DeliveryFailure> failures) {

  public DispatchReport {
    claimed = List.copyOf(claimed);
    failures = List.copyOf(failures);
  }

  static DispatchReport aggregate(Instant tickAt, List<RecordDispatchResult> results) {
    int fired = 0;
    int released = 0;
    int lockLost = 0;
    int errored = 0;
    int deliveries = 0;
    final List<UUID> claimed = new ArrayList<>(results.size());
    final List<DeliveryFailure> failures = new ArrayList<>();
    for (RecordDispatchResult result : results) {
      claimed.add(result.notificationId());
      deliveries += result.deliveries();
      failures.addAll(result.failures());
      switch (result.outcome()) {
        case FIRED -> fired++;
        case RELEASED -> released++;
        case LOCK_LOST -> lockLost++;
        case ERRORED -> errored++;
        default -> throw new IllegalStateException("unexpected outcome: " + result.outcome());
      }
    }
    return new DispatchReport(tickAt, claimed, fired, released, lockLost, errored, deliveries, failures);
  }
}
