/*
 * どこで: Scheduler アプリのインフラ設定
 * 何を: チャネル配信に使う NATS 接続と JetStream コンテキストを Bean 化する
 * なぜ: 配信スレッドごとに接続を張らず、一つの接続から publish するため
 */
package com.example.scheduler.config;

import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true")
public class NatsConfig {

  private static final Logger logger = LoggerFactory.getLogger(NatsConfig.class);

  @Bean(destroyMethod = "close")
  public Connection schedulerNatsConnection(NatsProperties properties)
      throws IOException, InterruptedException {
    final Options options =
        new Options.Builder()
            .server(properties.url())
            .connectionName(properties.connectionName())
            .connectionTimeout(properties.connectionTimeout())
            .maxReconnects(-1)
            .build();
    final Connection connection = Nats.connect(options);
    logger.info(
        "scheduler nats connected url={} name={}", properties.url(), properties.connectionName());
    return connection;
  }

  @Bean
  public JetStream schedulerJetStream(Connection schedulerNatsConnection) throws IOException {
    return schedulerNatsConnection.jetStream();
  }
}
