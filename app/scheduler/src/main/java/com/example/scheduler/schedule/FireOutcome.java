/*
 * どこで: Scheduler 状態遷移
 * 何を: 一回の発火後に書き込む次状態
 * なぜ: 状態/次回時刻/回数の組を一括で扱い、不変条件を一箇所で保つため
 */
package com.example.scheduler.schedule;

import com.example.scheduler.model.ScheduledNotificationStatus;
import java.time.Instant;

public record FireOutcome(
    ScheduledNotificationStatus status, Instant nextOccurrenceAt, int occurrenceCount) {

  public FireOutcome {
    if ((status == ScheduledNotificationStatus.PENDING) != (nextOccurrenceAt != null)) {
      throw new IllegalArgumentException("next_occurrence_at must be present iff status is PENDING");
    }
  }
}
