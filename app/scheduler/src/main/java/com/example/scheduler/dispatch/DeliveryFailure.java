/*
 * どこで: Scheduler 発火処理
 * 何を: 発火レポートに載せる個別配信の失敗
 * なぜ: アダプタ層での再送判断に必要な宛先/チャネル/理由を返すため
 */
package com.example.scheduler.dispatch;

import com.example.scheduler.model.DeliveryStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeliveryFailure(
    UUID notificationId,
    int occurrenceNumber,
    String userId,
    String channel,
    DeliveryStatus status,
    String errorMessage) {}
