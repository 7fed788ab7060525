/*
 * どこで: Scheduler API
 * 何を: 宛先×チャネル単位の配信結果の要素
 * なぜ: 部分失敗の内容を運用者が確認できるようにするため
 */
package com.example.scheduler.api;

import com.example.scheduler.model.DeliveryAttemptRecord;
import com.example.scheduler.model.DeliveryStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeliveryAttemptSummary(
    int occurrenceNumber,
    Instant occurrenceAt,
    String userId,
    String channel,
    DeliveryStatus status,
    String errorMessage,
    Instant attemptedAt) {

  static DeliveryAttemptSummary from(DeliveryAttemptRecord record) {
    return new DeliveryAttemptSummary(
        record.occurrenceNumber(),
        record.occurrenceAt(),
        record.userId(),
        record.channel(),
        record.status(),
        record.errorMessage(),
        record.attemptedAt());
  }
}
