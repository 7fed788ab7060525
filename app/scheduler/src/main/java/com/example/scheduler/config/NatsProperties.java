/*
 * どこで: Scheduler アプリの設定バインド
 * 何を: チャネル配信用 NATS 接続の接続先/タイムアウト/接続名を保持する
 * なぜ: transport=nats のときだけ、環境ごとの接続先を切り替えられるようにするため
 */
package com.example.scheduler.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(
    boolean enabled, String url, Duration connectionTimeout, String connectionName) {

  public NatsProperties {
    connectionTimeout = connectionTimeout == null ? Duration.ofSeconds(2) : connectionTimeout;
    connectionName = connectionName == null || connectionName.isBlank() ? "scheduler" : connectionName;
  }
}
