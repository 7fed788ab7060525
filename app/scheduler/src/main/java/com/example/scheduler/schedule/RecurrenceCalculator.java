/*
 * どこで: Scheduler スケジュール計算
 * 何を: 規則・発火済み回数・基準時刻から次の発火時刻を求める
 * なぜ: 作成/更新/発火後の再計算をすべて同じ純関数に寄せ、再実行しても同じ結果にするため
 */
package com.example.scheduler.schedule;

import com.example.scheduler.model.ScheduleDescriptor;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * 次回発火時刻の計算器。I/O を持たず、同じ入力には常に同じ結果を返す。
 *
 * <p>繰り返し規則は {@code anchor + k * step} の最小の k で基準時刻より真に後ろになるものを返す。
 * 暦単位 (day/week/month) は規則のタイムゾーンで壁時計時刻を保ったまま加算する。月加算で日が存在しない場合は
 * その月の末日に丸めるが、丸めは毎回 anchor から計算するため累積しない (1/31 → 2/28 → 3/31)。
 */
@Component
public class RecurrenceCalculator {

  /**
   * @param occurrenceCount 既に発火した回数
   * @param referenceInstant この時刻より真に後ろの発火時刻だけを返す
   * @return 次の発火時刻。規則が尽きた場合は empty
   */
  public Optional<Instant> nextOccurrence(
      ScheduleDescriptor schedule, int occurrenceCount, Instant referenceInstant) {
    Objects.requireNonNull(schedule, "schedule");
    Objects.requireNonNull(referenceInstant, "referenceInstant");
    if (occurrenceCount < 0) {
      throw new IllegalArgumentException("occurrenceCount must be >= 0");
    }
    if (schedule instanceof ScheduleDescriptor.Once once) {
      final Instant anchor = once.anchorInstant();
      if (occurrenceCount == 0 && anchor.isAfter(referenceInstant)) {
        return Optional.of(anchor);
      }
      return Optional.empty();
    }
    final Instant candidate = firstSlotAfter(schedule, referenceInstant);
    if (schedule.endCondition().exhausts(candidate, occurrenceCount)) {
      return Optional.empty();
    }
    return Optional.of(candidate);
  }

  private Instant firstSlotAfter(ScheduleDescriptor schedule, Instant referenceInstant) {
    final ZonedDateTime anchor = schedule.anchor().atZone(schedule.zone());
    if (anchor.toInstant().isAfter(referenceInstant)) {
      return anchor.toInstant();
    }
    final long step = schedule.stepAmount();
    final ChronoUnit unit = schedule.stepUnit();
    if (unit == ChronoUnit.MINUTES || unit == ChronoUnit.HOURS) {
      // 固定長の単位は暦に依存しないため割り算で直接求める
      final Duration period = Duration.of(step, unit);
      final Duration elapsed = Duration.between(anchor.toInstant(), referenceInstant);
      final long periods = elapsed.dividedBy(period) + 1;
      return anchor.toInstant().plus(period.multipliedBy(periods));
    }
    final ZonedDateTime reference = referenceInstant.atZone(schedule.zone());
    // 経過周期数の見積もりから一つ手前を起点にし、残りは前進ループで詰める
    long k = Math.max(0, unit.between(anchor, reference) / step - 1);
    Instant candidate = slot(anchor, k, step, unit);
    while (!candidate.isAfter(referenceInstant)) {
      k++;
      candidate = slot(anchor, k, step, unit);
    }
    return candidate;
  }

  private Instant slot(ZonedDateTime anchor, long k, long step, ChronoUnit unit) {
    return anchor.plus(Math.multiplyExact(k, step), unit).toInstant();
  }
}
