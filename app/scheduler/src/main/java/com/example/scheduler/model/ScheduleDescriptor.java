/*
 * どこで: Scheduler ドメインモデル
 * 何を: 通知の繰り返し規則 (type ごとのタグ付きバリアント)
 * なぜ: type ごとに必須項目が異なる規則を生成時点で検証し、不正な形を持ち込まないため
 */
package com.example.scheduler.model;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;

public sealed interface ScheduleDescriptor
    permits ScheduleDescriptor.Once, ScheduleDescriptor.Periodic, ScheduleDescriptor.Custom {

  ScheduleType type();

  /** 初回 (once の場合は唯一の) 発火時刻。zone で解釈する壁時計時刻。 */
  LocalDateTime anchor();

  ZoneId zone();

  EndCondition endCondition();

  default Instant anchorInstant() {
    return anchor().atZone(zone()).toInstant();
  }

  /** 一回の発火で進める量。once は呼ばれない。 */
  long stepAmount();

  ChronoUnit stepUnit();

  record Once(LocalDateTime anchor, ZoneId zone) implements ScheduleDescriptor {
    public Once {
      requirePresent(anchor, "schedule.datetime is required for once schedules");
      requirePresent(zone, "schedule.timezone is required");
    }

    @Override
    public ScheduleType type() {
      return ScheduleType.ONCE;
    }

    @Override
    public EndCondition endCondition() {
      // once は常に一回で尽きるため終了条件を持たない
      return EndCondition.never();
    }

    @Override
    public long stepAmount() {
      throw new UnsupportedOperationException("once schedules do not recur");
    }

    @Override
    public ChronoUnit stepUnit() {
      throw new UnsupportedOperationException("once schedules do not recur");
    }
  }

  record Periodic(ScheduleType type, LocalDateTime anchor, ZoneId zone, EndCondition endCondition)
      implements ScheduleDescriptor {
    public Periodic {
      requirePresent(type, "schedule.type is required");
      if (type != ScheduleType.DAILY && type != ScheduleType.WEEKLY && type != ScheduleType.MONTHLY) {
        throw new IllegalArgumentException("periodic schedule must be daily, weekly or monthly: " + type);
      }
      requirePresent(anchor, "schedule.datetime is required");
      requirePresent(zone, "schedule.timezone is required");
      endCondition = endCondition == null ? EndCondition.never() : endCondition;
      requireEndAfterAnchor(endCondition, anchor, zone);
    }

    @Override
    public long stepAmount() {
      return 1;
    }

    @Override
    public ChronoUnit stepUnit() {
      return switch (type) {
        case DAILY -> ChronoUnit.DAYS;
        case WEEKLY -> ChronoUnit.WEEKS;
        case MONTHLY -> ChronoUnit.MONTHS;
        default -> throw new IllegalStateException("unexpected periodic type: " + type);
      };
    }
  }

  record Custom(
      LocalDateTime anchor,
      ZoneId zone,
      int interval,
      RecurrenceUnit unit,
      EndCondition endCondition)
      implements ScheduleDescriptor {
    public Custom {
      requirePresent(anchor, "schedule.datetime is required");
      requirePresent(zone, "schedule.timezone is required");
      if (interval < 1) {
        throw new IllegalArgumentException("schedule.interval must be >= 1 for custom schedules");
      }
      requirePresent(unit, "schedule.unit is required for custom schedules");
      endCondition = endCondition == null ? EndCondition.never() : endCondition;
      requireEndAfterAnchor(endCondition, anchor, zone);
    }

    @Override
    public ScheduleType type() {
      return ScheduleType.CUSTOM;
    }

    @Override
    public long stepAmount() {
      return interval;
    }

    @Override
    public ChronoUnit stepUnit() {
      return unit.chronoUnit();
    }
  }

  private static void requirePresent(Object value, String message) {
    if (value == null) {
      throw new IllegalArgumentException(message);
    }
  }

  private static void requireEndAfterAnchor(
      EndCondition endCondition, LocalDateTime anchor, ZoneId zone) {
    if (endCondition instanceof EndCondition.OnDate onDate
        && onDate.endDate().isBefore(anchor.atZone(zone).toInstant())) {
      throw new IllegalArgumentException("end_condition.end_date must not be before schedule.datetime");
    }
  }
}
