/*
 * どこで: Scheduler API
 * 何を: 予約通知の作成/更新リクエストの入力を保持する
 * なぜ: JSON からのバインドと検証を明確にするため
 */
package com.example.scheduler.api;

import com.example.scheduler.model.NotificationDraft;
import com.example.scheduler.model.RecipientDocument;
import com.example.scheduler.model.ScheduleDocument;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScheduledNotificationRequest(
    @NotBlank(message = "name is required") String name,
    @NotBlank(message = "type is required") String type,
    @NotEmpty(message = "channels must not be empty") List<String> channels,
    @NotEmpty(message = "recipients must not be empty") List<RecipientDocument> recipients,
    JsonNode payload,
    @NotNull(message = "schedule is required") ScheduleDocument schedule) {

  /**
   * 検証済みの編集項目へ変換する。
   *
   * @throws IllegalArgumentException スケジュールや宛先の形が不正な場合
   */
  public NotificationDraft toDraft(Instant now) {
    final Set<String> channelSet = new LinkedHashSet<>();
    for (String channel : channels) {
      if (channel == null || channel.isBlank()) {
        throw new IllegalArgumentException("channels must not contain blank values");
      }
      channelSet.add(channel.trim());
    }
    return new NotificationDraft(
        name,
        type,
        channelSet,
        recipients.stream().map(RecipientDocument::toDescriptor).toList(),
        payload == null || payload.isNull() ? null : payload.toString(),
        schedule.toDescriptor(now));
  }
}
