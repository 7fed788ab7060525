/*
 * どこで: Scheduler API
 * 何を: 予約通知一覧のレスポンス
 * なぜ: ページング条件と結果をまとめて返すため
 */
package com.example.scheduler.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScheduledNotificationsResponse(
    List<ScheduledNotificationResponse> items, int limit, int offset) {}
