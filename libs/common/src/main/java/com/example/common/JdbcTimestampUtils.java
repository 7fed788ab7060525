/*
 * どこで: 共通ユーティリティ
 * 何を: Instant と JDBC Timestamp の相互変換 (null 透過)
 * なぜ: timestamptz 列のバインドと読み出しを各リポジトリで同じ規則にそろえるため
 */
package com.example.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // PostgreSQL JDBC は Instant を直接バインドできないため Timestamp で明示型にする
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  /** NULL 許容列の読み出し用。 */
  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
