/*
 * どこで: Scheduler API
 * 何を: 予約通知ごとの配信結果一覧
 * なぜ: 検索レスポンスを簡潔に保つため
 */
package com.example.scheduler.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeliveryAttemptsResponse(UUID notificationId, List<DeliveryAttemptSummary> items) {}
