/*
 * どこで: Scheduler アプリの設定バインド
 * 何を: 発火処理のポーリング/並列度/タイムアウト/リトライ設定を保持する
 * なぜ: 運用パラメータを外部化し、claim が生きている間に配信が終わらない組み合わせを起動時に弾くため
 */
package com.example.scheduler.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "scheduler.dispatch")
public record SchedulerDispatchProperties(
    boolean enabled,
    Duration pollInterval,
    int batchSize,
    Duration lease,
    int recordParallelism,
    int deliveryParallelism,
    Duration deliveryTimeout,
    Duration backoffBase,
    Duration backoffMax,
    double backoffExponentBase,
    double backoffJitterMin,
    double backoffJitterMax,
    Duration backoffMin,
    int errorMessageMaxLength) {

  public SchedulerDispatchProperties {
    if (lease == null || deliveryTimeout == null) {
      throw new IllegalArgumentException(
          "scheduler.dispatch.lease and scheduler.dispatch.delivery-timeout are required");
    }
    // 送信開始の締切後に始まった最後の配信と結果の書き込みが lease 内に収まる必要がある
    if (lease.compareTo(deliveryTimeout.multipliedBy(2)) <= 0) {
      throw new IllegalArgumentException(
          "scheduler.dispatch.lease must be longer than twice scheduler.dispatch.delivery-timeout");
    }
  }

  /**
   * claim からこの時間が過ぎた後は新しい配信を始めない。最後の配信のタイムアウトと、結果を書き込む余裕として配信タイムアウト
   * 1 回分を lease から残す。
   */
  public Duration deliveryStartWindow() {
    return lease.minus(deliveryTimeout.multipliedBy(2));
  }
}
