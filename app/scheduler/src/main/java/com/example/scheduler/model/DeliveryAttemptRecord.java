/*
 * どこで: Scheduler ドメインモデル
 * 何を: scheduled_notification_deliveries の 1 行 (宛先×チャネル単位の配信結果)
 * なぜ: 部分失敗を発火単位とは別に追跡し、一覧/統計から見えるようにするため
 */
package com.example.scheduler.model;

import java.time.Instant;
import java.util.UUID;

public record DeliveryAttemptRecord(
    UUID deliveryId,
    UUID notificationId,
    int occurrenceNumber,
    Instant occurrenceAt,
    String userId,
    String channel,
    DeliveryStatus status,
    String errorMessage,
    Instant attemptedAt) {}
