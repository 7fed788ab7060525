/*
 * どこで: Scheduler 発火ワーカー
 * 何を: 一定間隔で期限到来レコードの発火処理を起動する
 * なぜ: 外部トリガなしに予約通知を時刻どおり発火させるため
 */
package com.example.scheduler.dispatch;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "scheduler.dispatch.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class DispatchWorker {

  private final DispatchService dispatchService;

  @Scheduled(fixedDelayString = "${scheduler.dispatch.poll-interval}")
  public void run() {
    dispatchService.processDue();
  }
}
