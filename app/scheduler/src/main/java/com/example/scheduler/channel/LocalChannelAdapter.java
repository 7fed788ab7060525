/*
 * どこで: Scheduler チャネル配信
 * 何を: チャネル配信を模擬する実装
 * なぜ: 外部送信を伴わずに発火と状態遷移を確認するため
 */
package com.example.scheduler.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "scheduler.channels.transport",
    havingValue = "local",
    matchIfMissing = true)
public class LocalChannelAdapter implements ChannelAdapter {

  private static final Logger logger = LoggerFactory.getLogger(LocalChannelAdapter.class);

  @Override
  public void send(DeliveryRequest request) {
    // 実送信は行わず、ログに残すだけとする
    logger.info(
        "scheduled notification simulated send id={} occurrence={} userId={} channel={}",
        request.notificationId(),
        request.occurrenceNumber(),
        request.userId(),
        request.channel());
  }
}
