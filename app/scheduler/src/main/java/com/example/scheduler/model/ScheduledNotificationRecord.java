/*
 * どこで: Scheduler ドメインモデル
 * 何を: scheduled_notifications テーブルのスナップショット
 * なぜ: 配信処理と API で同じ形を共有するため
 */
package com.example.scheduler.model;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

public record ScheduledNotificationRecord(
    UUID notificationId,
    String name,
    String type,
    Set<String> channels,
    List<RecipientDescriptor> recipients,
    String payloadJson,
    ScheduleDescriptor schedule,
    ScheduledNotificationStatus status,
    Instant nextOccurrenceAt,
    int occurrenceCount,
    String lockedBy,
    Instant lockedAt,
    Instant leaseUntil,
    int attemptCount,
    Instant nextRetryAt,
    String lastError,
    String createdBy,
    Instant createdAt,
    Instant updatedAt,
    Instant sentAt,
    Instant cancelledAt) {

  public ScheduledNotificationRecord {
    // SpotBugs の EI_EXPOSE_REP 対応: コレクションは不変コピーで保持する
    channels = channels == null ? Set.of() : Set.copyOf(channels);
    recipients = recipients == null ? List.of() : List.copyOf(recipients);
  }

  /** 新規作成直後の PENDING レコードを組み立てる。 */
  public static ScheduledNotificationRecord newPending(
      UUID notificationId,
      NotificationDraft draft,
      Instant nextOccurrenceAt,
      String createdBy,
      Instant now) {
    return new ScheduledNotificationRecord(
        notificationId,
        draft.name(),
        draft.type(),
        draft.channels(),
        draft.recipients(),
        draft.payloadJson(),
        draft.schedule(),
        ScheduledNotificationStatus.PENDING,
        nextOccurrenceAt,
        0,
        null,
        null,
        null,
        0,
        null,
        null,
        createdBy,
        now,
        now,
        null,
        null);
  }
}
