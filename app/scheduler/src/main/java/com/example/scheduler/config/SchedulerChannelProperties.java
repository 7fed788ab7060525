/*
 * どこで: Scheduler アプリの設定バインド
 * 何を: 受け付けるチャネル ID と配信トランスポートの設定を保持する
 * なぜ: チャネル追加や NATS への切り替えを設定だけで行うため
 */
package com.example.scheduler.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "scheduler.channels")
public record SchedulerChannelProperties(
    @NotBlank String transport, @NotEmpty Set<String> supported, @NotBlank String subjectPrefix) {

  public SchedulerChannelProperties {
    supported = supported == null ? Set.of() : Set.copyOf(supported);
  }
}
