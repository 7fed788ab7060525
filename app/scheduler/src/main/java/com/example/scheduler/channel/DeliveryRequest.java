/*
 * どこで: Scheduler チャネル配信
 * 何を: 1 宛先×1 チャネルへの配信依頼
 * なぜ: チャネルアダプタへ渡す情報を発火単位の状態から切り離すため
 */
package com.example.scheduler.channel;

import java.time.Instant;
import java.util.UUID;

public record DeliveryRequest(
    UUID notificationId,
    int occurrenceNumber,
    Instant occurrenceAt,
    String notificationType,
    String name,
    String userId,
    String channel,
    String payloadJson) {

  /** ブローカ側の重複排除に使う、発火×宛先×チャネルで一意なキー。 */
  public String deliveryKey() {
    return notificationId + ":" + occurrenceNumber + ":" + userId + ":" + channel;
  }
}
