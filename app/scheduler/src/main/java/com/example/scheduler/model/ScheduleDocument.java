/*
 * どこで: Scheduler の入出力/保存形式
 * 何を: スケジュール規則のフラットな JSON 表現とドメイン型との変換
 * なぜ: API と jsonb 列で同じ形を使い、type ごとの必須項目をここで一括検証するため
 */
package com.example.scheduler.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScheduleDocument(
    String type,
    LocalDateTime datetime,
    String timezone,
    Integer interval,
    String unit,
    EndConditionDocument endCondition) {

  private static final ZoneId DEFAULT_ZONE = ZoneOffset.UTC;

  /**
   * ドメイン型へ変換する。繰り返し規則で datetime が無い場合は now から 1 周期後を起点にする。
   *
   * @throws IllegalArgumentException 形が type の要件を満たさない場合
   */
  public ScheduleDescriptor toDescriptor(Instant now) {
    final ScheduleType scheduleType = ScheduleType.fromWireName(type);
    final ZoneId zone = resolveZone();
    if (scheduleType == ScheduleType.ONCE) {
      if (datetime == null) {
        throw new IllegalArgumentException("schedule.datetime is required for once schedules");
      }
      return new ScheduleDescriptor.Once(datetime, zone);
    }
    final EndCondition end = endCondition == null ? EndCondition.never() : endCondition.toEndCondition();
    if (scheduleType == ScheduleType.CUSTOM) {
      if (interval == null) {
        throw new IllegalArgumentException("schedule.interval is required for custom schedules");
      }
      final RecurrenceUnit recurrenceUnit = RecurrenceUnit.fromWireName(unit);
      final LocalDateTime anchor =
          datetime != null
              ? datetime
              : LocalDateTime.ofInstant(now, zone).plus(interval, recurrenceUnit.chronoUnit());
      return new ScheduleDescriptor.Custom(anchor, zone, interval, recurrenceUnit, end);
    }
    final LocalDateTime anchor =
        datetime != null ? datetime : LocalDateTime.ofInstant(now, zone).plus(1, periodUnit(scheduleType));
    return new ScheduleDescriptor.Periodic(scheduleType, anchor, zone, end);
  }

  public static ScheduleDocument from(ScheduleDescriptor descriptor) {
    final String zoneId = descriptor.zone().getId();
    if (descriptor instanceof ScheduleDescriptor.Custom custom) {
      return new ScheduleDocument(
          custom.type().wireName(),
          custom.anchor(),
          zoneId,
          custom.interval(),
          custom.unit().wireName(),
          EndConditionDocument.from(custom.endCondition()));
    }
    if (descriptor instanceof ScheduleDescriptor.Periodic periodic) {
      return new ScheduleDocument(
          periodic.type().wireName(),
          periodic.anchor(),
          zoneId,
          null,
          null,
          EndConditionDocument.from(periodic.endCondition()));
    }
    return new ScheduleDocument(
        descriptor.type().wireName(), descriptor.anchor(), zoneId, null, null, null);
  }

  private static ChronoUnit periodUnit(ScheduleType scheduleType) {
    return switch (scheduleType) {
      case DAILY -> ChronoUnit.DAYS;
      case WEEKLY -> ChronoUnit.WEEKS;
      case MONTHLY -> ChronoUnit.MONTHS;
      default -> throw new IllegalArgumentException("unsupported periodic type: " + scheduleType);
    };
  }

  private ZoneId resolveZone() {
    if (timezone == null || timezone.isBlank()) {
      return DEFAULT_ZONE;
    }
    try {
      return ZoneId.of(timezone.trim());
    } catch (DateTimeException ex) {
      throw new IllegalArgumentException("schedule.timezone is invalid: " + timezone, ex);
    }
  }
}
