/*
 * どこで: Scheduler チャネル配信
 * 何を: CI/Test 専用で配信失敗を注入する Adapter
 * なぜ: 実コード経路を汚さずに部分失敗時の発火と失敗記録を再現するため
 */
package com.example.scheduler.channel;

import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Primary
@RequiredArgsConstructor
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "scheduler.channels.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingChannelAdapter implements ChannelAdapter {

  private final LocalChannelAdapter delegate;

  @Value("${scheduler.channels.failure-injection.user-id-prefix:}")
  private String userIdPrefix;

  @Value("${scheduler.channels.failure-injection.channel:}")
  private String channel;

  @Override
  public void send(DeliveryRequest request) {
    if (shouldInjectFailure(request)) {
      throw new ChannelDeliveryException(
          "delivery failure injection matched userId="
              + request.userId()
              + " channel="
              + request.channel());
    }
    delegate.send(request);
  }

  private boolean shouldInjectFailure(DeliveryRequest request) {
    if (userIdPrefix == null || userIdPrefix.isBlank()) {
      return false;
    }
    if (channel != null && !channel.isBlank() && !channel.equals(request.channel())) {
      return false;
    }
    return request.userId().startsWith(userIdPrefix);
  }
}
