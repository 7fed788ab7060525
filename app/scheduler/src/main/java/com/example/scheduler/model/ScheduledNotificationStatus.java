/*
 * どこで: Scheduler ドメインモデル
 * 何を: 予約通知の状態を表す列挙
 * なぜ: DB の status 列と状態遷移ロジックを一致させるため
 */
package com.example.scheduler.model;

public enum ScheduledNotificationStatus {
  PENDING,
  PROCESSING,
  SENT,
  EXHAUSTED,
  CANCELLED;

  public boolean terminal() {
    return this == SENT || this == EXHAUSTED || this == CANCELLED;
  }
}
