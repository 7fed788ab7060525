/*
 * どこで: Scheduler ドメインモデル
 * 何を: 作成/更新で受け取る予約通知の編集可能項目
 * なぜ: create と update で同じ入力を共有し、検証箇所を一つにするため
 */
package com.example.scheduler.model;

import java.util.List;
import java.util.Set;

public record NotificationDraft(
    String name,
    String type,
    Set<String> channels,
    List<RecipientDescriptor> recipients,
    String payloadJson,
    ScheduleDescriptor schedule) {

  public NotificationDraft {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("name is required");
    }
    if (type == null || type.isBlank()) {
      throw new IllegalArgumentException("type is required");
    }
    if (channels == null || channels.isEmpty()) {
      throw new IllegalArgumentException("channels must not be empty");
    }
    if (recipients == null || recipients.isEmpty()) {
      throw new IllegalArgumentException("recipients must not be empty");
    }
    if (schedule == null) {
      throw new IllegalArgumentException("schedule is required");
    }
    channels = Set.copyOf(channels);
    recipients = List.copyOf(recipients);
    payloadJson = payloadJson == null || payloadJson.isBlank() ? "{}" : payloadJson;
  }
}
