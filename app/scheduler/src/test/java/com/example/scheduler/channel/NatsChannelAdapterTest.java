/*
 * どこで: Scheduler チャネル配信のユニットテスト
 * 何を: JetStream publish の subject/ヘッダ/失敗変換を検証する
 * なぜ: ブローカ側の重複排除キーと puback 無しの扱いを固定するため
 */
package com.example.scheduler.channel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.scheduler.config.SchedulerChannelProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.nats.client.JetStream;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NatsChannelAdapterTest {

  @Mock private JetStream jetStream;

  private final ObjectMapper objectMapper =
      new ObjectMapper()
          .findAndRegisterModules()
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  private NatsChannelAdapter adapter;

  @BeforeEach
  void setUp() {
    final SchedulerChannelProperties properties =
        new SchedulerChannelProperties("nats", Set.of("mail", "sms"), "scheduler.delivery");
    adapter = new NatsChannelAdapter(jetStream, properties, objectMapper);
  }

  @Test
  void publishesToChannelSubjectWithDedupeHeader() throws Exception {
    final DeliveryRequest request = request();
    when(jetStream.publish(eq("scheduler.delivery.mail"), any(Headers.class), any(byte[].class)))
        .thenReturn(mock(PublishAck.class));

    adapter.send(request);

    final ArgumentCaptor<Headers> headers = ArgumentCaptor.forClass(Headers.class);
    final ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
    verify(jetStream).publish(eq("scheduler.delivery.mail"), headers.capture(), body.capture());
    assertThat(headers.getValue().getFirst("Nats-Msg-Id")).isEqualTo(request.deliveryKey());
    final JsonNode json = objectMapper.readTree(body.getValue());
    assertThat(json.get("user_id").asText()).isEqualTo("u_9");
    assertThat(json.get("payload").get("room").asText()).isEqualTo("B-201");
  }

  @Test
  void missingPubAckIsDeliveryFailure() throws Exception {
    when(jetStream.publish(any(String.class), any(Headers.class), any(byte[].class)))
        .thenReturn(null);

    assertThatThrownBy(() -> adapter.send(request()))
        .isInstanceOf(ChannelDeliveryException.class)
        .hasMessageContaining("puback");
  }

  @Test
  void publishIoErrorIsDeliveryFailure() throws Exception {
    when(jetStream.publish(any(String.class), any(Headers.class), any(byte[].class)))
        .thenThrow(new IOException("timeout"));

    assertThatThrownBy(() -> adapter.send(request()))
        .isInstanceOf(ChannelDeliveryException.class)
        .hasCauseInstanceOf(IOException.class);
  }

  private DeliveryRequest request() {
    return new DeliveryRequest(
        UUID.fromString("00000000-0000-0000-0000-000000000001"),
        3,
        Instant.parse("2025-01-10T09:00:00Z"),
        "exam_reminder",
        "math exam",
        "u_9",
        "mail",
        "{\"room\":\"B-201\"}");
  }
}
