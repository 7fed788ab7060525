/*
 * どこで: Scheduler ドメインモデル
 * 何を: 予約通知一覧の絞り込み条件
 * なぜ: API の検索条件をリポジトリまで型付きで渡すため
 */
package com.example.scheduler.model;

import java.time.Instant;

/**
 * null の項目は条件に含めない。期間 (from/to) は次回発火時刻、発火済みなら最終送信時刻に対して適用する。
 */
public record ScheduledNotificationFilter(
    ScheduledNotificationStatus status,
    String type,
    Instant from,
    Instant to,
    String createdBy,
    int limit,
    int offset) {

  public ScheduledNotificationFilter {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be >= 1");
    }
    if (offset < 0) {
      throw new IllegalArgumentException("offset must be >= 0");
    }
    if (from != null && to != null && from.isAfter(to)) {
      throw new IllegalArgumentException("start_date must not be after end_date");
    }
  }

  /** 作成者条件だけを差し替えたコピーを返す。 */
  public ScheduledNotificationFilter withCreatedBy(String newCreatedBy) {
    return new ScheduledNotificationFilter(status, type, from, to, newCreatedBy, limit, offset);
  }
}
