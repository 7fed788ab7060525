/*
 * どこで: Scheduler API
 * 何を: 状態別件数と配信結果別件数の集計レスポンス
 * なぜ: 非同期の配信失敗を一覧を辿らずに把握できるようにするため
 */
package com.example.scheduler.api;

import com.example.scheduler.model.DeliveryStatus;
import com.example.scheduler.model.ScheduledNotificationStatus;
import com.example.scheduler.service.ScheduledNotificationStats;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScheduledNotificationStatsResponse(
    long total,
    long due,
    Map<ScheduledNotificationStatus, Long> byStatus,
    Map<DeliveryStatus, Long> deliveries) {

  static ScheduledNotificationStatsResponse from(ScheduledNotificationStats stats) {
    return new ScheduledNotificationStatsResponse(
        stats.total(), stats.due(), stats.byStatus(), stats.deliveries());
  }
}
