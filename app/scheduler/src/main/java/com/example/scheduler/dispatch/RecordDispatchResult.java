/*
 * どこで: Scheduler 発火処理
 * 何を: claim した 1 レコードの処理結果
 * なぜ: レコード単位の並列処理結果をティックのレポートへ集約するため
 */
package com.example.scheduler.dispatch;

import com.example.scheduler.model.ScheduledNotificationStatus;
import java.util.List;
import java.util.UUID;

record RecordDispatchResult(
    UUID notificationId,
    Outcome outcome,
    ScheduledNotificationStatus status,
    int deliveries,
    List<DeliveryFailure> failures) {

  enum Outcome {
    FIRED,
    RELEASED,
    LOCK_LOST,
    ERRORED
  }

  RecordDispatchResult {
    failures = List.copyOf(failures);
  }

  static RecordDispatchResult withoutDelivery(UUID notificationId, Outcome outcome) {
    return new RecordDispatchResult(notificationId, outcome, null, 0, List.of());
  }
}
