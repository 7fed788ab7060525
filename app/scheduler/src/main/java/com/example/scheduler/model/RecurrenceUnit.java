/*
 * どこで: Scheduler ドメインモデル
 * 何を: custom スケジュールの間隔単位
 * なぜ: minute..month を ChronoUnit に一意に対応させるため
 */
package com.example.scheduler.model;

import java.time.temporal.ChronoUnit;
import java.util.Locale;

public enum RecurrenceUnit {
  MINUTE(ChronoUnit.MINUTES),
  HOUR(ChronoUnit.HOURS),
  DAY(ChronoUnit.DAYS),
  WEEK(ChronoUnit.WEEKS),
  MONTH(ChronoUnit.MONTHS);

  private final ChronoUnit chronoUnit;

  RecurrenceUnit(ChronoUnit chronoUnit) {
    this.chronoUnit = chronoUnit;
  }

  public ChronoUnit chronoUnit() {
    return chronoUnit;
  }

  /** 経過時間が暦に依存しない単位か。 */
  public boolean fixedLength() {
    return this == MINUTE || this == HOUR;
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static RecurrenceUnit fromWireName(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("schedule.unit is required for custom schedules");
    }
    for (RecurrenceUnit unit : values()) {
      if (unit.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
        return unit;
      }
    }
    throw new IllegalArgumentException("unsupported schedule.unit: " + value);
  }
}
