/*
 * どこで: Scheduler チャネル配信
 * 何を: NATS へ publish する配信メッセージの JSON 形式
 * なぜ: 下流の各チャネル送信サービスと形式を固定するため
 */
package com.example.scheduler.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ChannelDeliveryMessage(
    UUID notificationId,
    int occurrenceNumber,
    Instant occurrenceAt,
    String type,
    String name,
    String userId,
    String channel,
    JsonNode payload) {}
