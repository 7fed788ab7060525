/*
 * どこで: Scheduler ドメインモデル
 * 何を: スケジュール種別を表す列挙
 * なぜ: 保存形式/API の type 文字列とドメインの分岐を一致させるため
 */
package com.example.scheduler.model;

import java.util.Locale;

public enum ScheduleType {
  ONCE,
  DAILY,
  WEEKLY,
  MONTHLY,
  CUSTOM;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean recurring() {
    return this != ONCE;
  }

  public static ScheduleType fromWireName(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("schedule.type is required");
    }
    for (ScheduleType type : values()) {
      if (type.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
        return type;
      }
    }
    throw new IllegalArgumentException("unsupported schedule.type: " + value);
  }
}
