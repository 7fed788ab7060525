/*
 * どこで: Scheduler 状態遷移
 * 何を: 予約通知の状態機械 (作成時の初回時刻/更新・取消の可否/発火後の次状態) を定義する
 * なぜ: 永続化の仕組みと切り離して遷移規則を検証できるようにするため
 */
package com.example.scheduler.schedule;

import com.example.scheduler.model.ScheduleDescriptor;
import com.example.scheduler.model.ScheduledNotificationRecord;
import com.example.scheduler.model.ScheduledNotificationStatus;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ScheduledNotificationLifecycle {

  private final RecurrenceCalculator calculator;

  /**
   * 作成/更新時の初回発火時刻を求める。
   *
   * @throws IllegalArgumentException 規則に now より後の発火が一つも無い場合
   */
  public Instant initialOccurrence(ScheduleDescriptor schedule, Instant now) {
    return calculator
        .nextOccurrence(schedule, 0, now)
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    schedule instanceof ScheduleDescriptor.Once
                        ? "scheduled time must be in the future for one-time notifications"
                        : "schedule has no occurrence after now"));
  }

  /**
   * 更新後の規則で次回発火時刻を求め直す。発火済み回数は引き継ぎ、回数上限に届いた規則では再武装しない。
   *
   * @throws IllegalArgumentException 未発火のレコードで、規則に now より後の発火が無い場合
   * @throws InvalidScheduleTransitionException 発火済み回数だけで新しい規則が尽きている場合
   */
  public Instant rearmOccurrence(
      ScheduledNotificationRecord current, ScheduleDescriptor schedule, Instant now) {
    final int occurrenceCount = current.occurrenceCount();
    if (occurrenceCount == 0) {
      return initialOccurrence(schedule, now);
    }
    return calculator
        .nextOccurrence(schedule, occurrenceCount, now)
        .orElseThrow(
            () ->
                new InvalidScheduleTransitionException(
                    current.notificationId(),
                    current.status(),
                    "updated schedule has no occurrence left after "
                        + occurrenceCount
                        + " fired occurrences"));
  }

  /** 更新は PENDING の間だけ許す。 */
  public void requireEditable(ScheduledNotificationRecord record) {
    if (record.status() != ScheduledNotificationStatus.PENDING) {
      throw new InvalidScheduleTransitionException(
          record.notificationId(),
          record.status(),
          "only pending scheduled notifications can be updated status=" + record.status());
    }
  }

  /** 削除は終端状態だけを許す (PENDING/PROCESSING は不可)。 */
  public void requireDeletable(ScheduledNotificationRecord record) {
    if (!record.status().terminal()) {
      throw new InvalidScheduleTransitionException(
          record.notificationId(),
          record.status(),
          "active scheduled notifications cannot be deleted status=" + record.status());
    }
  }

  /**
   * 発火後の次状態を求める。配信結果に関わらず回数を一つ進め、進めた回数で次回時刻を再計算する。
   *
   * @param firedAt 発火処理の時刻。claim した発火時刻より前にはならない
   */
  public FireOutcome fire(ScheduledNotificationRecord record, Instant firedAt) {
    if (record.status() != ScheduledNotificationStatus.PROCESSING) {
      throw new InvalidScheduleTransitionException(
          record.notificationId(),
          record.status(),
          "only claimed scheduled notifications can fire status=" + record.status());
    }
    final int occurrenceCount = record.occurrenceCount() + 1;
    Instant reference = firedAt;
    if (record.nextOccurrenceAt() != null && record.nextOccurrenceAt().isAfter(firedAt)) {
      reference = record.nextOccurrenceAt();
    }
    final ScheduleDescriptor schedule = record.schedule();
    return calculator
        .nextOccurrence(schedule, occurrenceCount, reference)
        .map(next -> new FireOutcome(ScheduledNotificationStatus.PENDING, next, occurrenceCount))
        .orElseGet(
            () ->
                new FireOutcome(
                    schedule.type().recurring()
                        ? ScheduledNotificationStatus.EXHAUSTED
                        : ScheduledNotificationStatus.SENT,
                    null,
                    occurrenceCount));
  }
}
