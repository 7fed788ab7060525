/*
 * どこで: Scheduler チャネル配信
 * 何を: 配信依頼をチャネル別 subject へ JetStream publish する
 * なぜ: メール/SMS/プッシュの実送信を下流サービスへ委ね、puback で受け渡し完了を確認するため
 */
package com.example.scheduler.channel;

import com.example.scheduler.config.SchedulerChannelProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "scheduler.channels.transport", havingValue = "nats")
public class NatsChannelAdapter implements ChannelAdapter {

  private static final String HEADER_MESSAGE_ID = "Nats-Msg-Id";
  private static final String HEADER_NOTIFICATION_TYPE = "notification_type";
  private static final String HEADER_OCCURRENCE_AT = "occurrence_at";

  private final JetStream jetStream;
  private final SchedulerChannelProperties properties;
  private final ObjectMapper objectMapper;

  @Override
  public void send(DeliveryRequest request) {
    final byte[] body = serialize(request);
    final Headers headers = new Headers();
    // 再配信時にブローカ側で重複排除できるよう発火×宛先×チャネルのキーを載せる
    headers.add(HEADER_MESSAGE_ID, request.deliveryKey());
    headers.add(HEADER_NOTIFICATION_TYPE, request.notificationType());
    headers.add(HEADER_OCCURRENCE_AT, request.occurrenceAt().toString());
    try {
      // puback を受け取れた場合のみ配信成功とみなす
      final PublishAck ack = jetStream.publish(subjectFor(request.channel()), headers, body);
      if (ack == null) {
        throw new ChannelDeliveryException("puback is missing");
      }
    } catch (IOException | JetStreamApiException ex) {
      throw new ChannelDeliveryException("nats publish failed channel=" + request.channel(), ex);
    }
  }

  String subjectFor(String channel) {
    return properties.subjectPrefix() + "." + channel;
  }

  private byte[] serialize(DeliveryRequest request) {
    try {
      final ChannelDeliveryMessage message =
          new ChannelDeliveryMessage(
              request.notificationId(),
              request.occurrenceNumber(),
              request.occurrenceAt(),
              request.notificationType(),
              request.name(),
              request.userId(),
              request.channel(),
              objectMapper.readTree(request.payloadJson()));
      return objectMapper.writeValueAsBytes(message);
    } catch (JsonProcessingException ex) {
      throw new ChannelDeliveryException("delivery payload serialization failed", ex);
    }
  }
}
