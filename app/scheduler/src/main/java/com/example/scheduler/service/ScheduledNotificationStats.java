/*
 * どこで: Scheduler サービス層
 * 何を: 状態別件数と配信結果別件数の集計
 * なぜ: 非同期の配信失敗を呼び出し元を止めずに運用者へ見せるため
 */
package com.example.scheduler.service;

import com.example.scheduler.model.DeliveryStatus;
import com.example.scheduler.model.ScheduledNotificationStatus;
import java.util.Map;

public record ScheduledNotificationStats(
    Map<ScheduledNotificationStatus, Long> byStatus,
    long total,
    long due,
    Map<DeliveryStatus, Long> deliveries) {

  public ScheduledNotificationStats {
    byStatus = Map.copyOf(byStatus);
    deliveries = Map.copyOf(deliveries);
  }
}
