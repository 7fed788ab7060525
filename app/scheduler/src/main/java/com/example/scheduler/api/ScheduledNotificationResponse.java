/*
 * どこで: Scheduler API
 * 何を: 予約通知 1 件のレスポンス
 * なぜ: 保存形式の列をそのまま出さず、作成時と同じ JSON 形で返すため
 */
package com.example.scheduler.api;

import com.example.scheduler.model.RecipientDocument;
import com.example.scheduler.model.ScheduleDocument;
import com.example.scheduler.model.ScheduledNotificationRecord;
import com.example.scheduler.model.ScheduledNotificationStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScheduledNotificationResponse(
    UUID notificationId,
    String name,
    String type,
    List<String> channels,
    List<RecipientDocument> recipients,
    JsonNode payload,
    ScheduleDocument schedule,
    ScheduledNotificationStatus status,
    Instant nextOccurrenceAt,
    int occurrenceCount,
    int attemptCount,
    Instant nextRetryAt,
    String lastError,
    String createdBy,
    Instant createdAt,
    Instant updatedAt,
    Instant sentAt,
    Instant cancelledAt) {

  static ScheduledNotificationResponse from(ScheduledNotificationRecord record, JsonNode payload) {
    return new ScheduledNotificationResponse(
        record.notificationId(),
        record.name(),
        record.type(),
        record.channels().stream().sorted().toList(),
        record.recipients().stream().map(RecipientDocument::from).toList(),
        payload,
        ScheduleDocument.from(record.schedule()),
        record.status(),
        record.nextOccurrenceAt(),
        record.occurrenceCount(),
        record.attemptCount(),
        record.nextRetryAt(),
        record.lastError(),
        record.createdBy(),
        record.createdAt(),
        record.updatedAt(),
        record.sentAt(),
        record.cancelledAt());
  }
}
