/*
 * どこで: Scheduler 保持期間ワーカー
 * 何を: cleanup-interval ごとに終端レコードの削除と滞留 claim の検出を起動する
 * なぜ: 発火履歴と配信記録が際限なく溜まらないよう、運用者の手作業なしに掃除を回すため
 */
package com.example.scheduler.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** scheduler.retention.enabled=true のときだけ登録される。 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "scheduler.retention.enabled", havingValue = "true")
public class ScheduledNotificationRetentionWorker {

  private final ScheduledNotificationRetentionService retentionService;

  @Scheduled(
      initialDelayString = "${scheduler.retention.cleanup-interval}",
      fixedDelayString = "${scheduler.retention.cleanup-interval}")
  public void sweepFinishedSchedules() {
    retentionService.cleanup();
  }
}
