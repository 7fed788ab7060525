/*
 * どこで: 共通ユーティリティ
 * 何を: 予約通知の発火 1 回ごとのトレース ID を発行する
 * なぜ: lease 切れで再 claim された同じ発火のログを同じ ID で串刺しに追えるようにするため
 */
package com.example.common;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  /** 通知 ID と発火番号から決まる名前ベース UUID を返す。同じ入力には常に同じ値になる。 */
  public static String forOccurrence(UUID notificationId, int occurrenceNumber) {
    final String name = notificationId + "#" + occurrenceNumber;
    return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
  }
}
