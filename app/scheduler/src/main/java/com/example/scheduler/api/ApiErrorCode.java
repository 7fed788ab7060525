/*
 * どこで: Scheduler API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.scheduler.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  FORBIDDEN,
  NOT_FOUND,
  SCHEDULE_STATE_CONFLICT,
  NOT_CANCELLABLE
}
