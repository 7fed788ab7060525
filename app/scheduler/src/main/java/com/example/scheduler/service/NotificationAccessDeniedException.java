/*
 * どこで: Scheduler サービス層
 * 何を: 認可ゲートに拒否された操作 (403) を表す例外
 * なぜ: 入力エラーや状態競合と区別して応答するため
 */
package com.example.scheduler.service;

public class NotificationAccessDeniedException extends RuntimeException {

  public NotificationAccessDeniedException(String message) {
    super(message);
  }
}
