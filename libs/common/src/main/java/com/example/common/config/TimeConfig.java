/*
 * どこで: Common 共通設定
 * 何を: ミリ秒単位で進む UTC の Clock を DI 可能にする
 * なぜ: timestamptz (マイクロ秒精度) へ書いた時刻を読み戻しても同じ Instant として比較できるようにするため
 */
package com.example.common.config;

import java.time.Clock;
import java.time.ZoneOffset;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.tickMillis(ZoneOffset.UTC);
  }
}
