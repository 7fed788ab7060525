/*
 * どこで: Scheduler サービス層
 * 何を: 見つからない、または呼び出し元から見えない予約通知 (404) を表す例外
 * なぜ: 他ユーザの予約の有無を漏らさないため
 */
package com.example.scheduler.service;

import java.util.UUID;

public class ScheduledNotificationNotFoundException extends RuntimeException {

  public ScheduledNotificationNotFoundException(UUID notificationId) {
    super("scheduled notification not found id=" + notificationId);
  }
}
