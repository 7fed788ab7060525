/*
 * どこで: Scheduler 状態遷移のユニットテスト
 * 何を: 作成時の初回時刻、更新/削除の可否、発火後の次状態を検証する
 * なぜ: 永続化と切り離した状態機械の規則を固定するため
 */
package com.example.scheduler.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.scheduler.model.EndCondition;
import com.example.scheduler.model.NotificationDraft;
import com.example.scheduler.model.RecipientDescriptor;
import com.example.scheduler.model.RecurrenceUnit;
import com.example.scheduler.model.ScheduleDescriptor;
import com.example.scheduler.model.ScheduleType;
import com.example.scheduler.model.ScheduledNotificationRecord;
import com.example.scheduler.model.ScheduledNotificationStatus;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ScheduledNotificationLifecycleTest {

  private static final Instant CREATED_AT = Instant.parse("2025-01-01T00:00:00Z");

  private final ScheduledNotificationLifecycle lifecycle =
      new ScheduledNotificationLifecycle(new RecurrenceCalculator());

  @Test
  void onceFiresIntoSentWithCountOne() {
    final ScheduleDescriptor once =
        new ScheduleDescriptor.Once(LocalDateTime.parse("2025-01-10T09:00:00"), ZoneOffset.UTC);
    final Instant next = lifecycle.initialOccurrence(once, CREATED_AT);
    assertThat(next).isEqualTo(Instant.parse("2025-01-10T09:00:00Z"));

    final FireOutcome outcome = lifecycle.fire(claimed(once, next, 0), next);

    assertThat(outcome.status()).isEqualTo(ScheduledNotificationStatus.SENT);
    assertThat(outcome.occurrenceCount()).isEqualTo(1);
    assertThat(outcome.nextOccurrenceAt()).isNull();
  }

  @Test
  void recurringStaysPendingUntilEndConditionThenExhausts() {
    final ScheduleDescriptor daily =
        new ScheduleDescriptor.Periodic(
            ScheduleType.DAILY,
            LocalDateTime.parse("2025-01-02T08:00:00"),
            ZoneOffset.UTC,
            new EndCondition.AfterOccurrences(2));
    final Instant first = lifecycle.initialOccurrence(daily, CREATED_AT);

    final FireOutcome afterFirst = lifecycle.fire(claimed(daily, first, 0), first);
    assertThat(afterFirst.status()).isEqualTo(ScheduledNotificationStatus.PENDING);
    assertThat(afterFirst.nextOccurrenceAt()).isEqualTo(Instant.parse("2025-01-03T08:00:00Z"));

    final FireOutcome afterSecond =
        lifecycle.fire(
            claimed(daily, afterFirst.nextOccurrenceAt(), 1), afterFirst.nextOccurrenceAt());
    assertThat(afterSecond.status()).isEqualTo(ScheduledNotificationStatus.EXHAUSTED);
    assertThat(afterSecond.occurrenceCount()).isEqualTo(2);
  }

  @Test
  void lateFireSkipsMissedSlotsInsteadOfReplayingThem() {
    final ScheduleDescriptor daily =
        new ScheduleDescriptor.Periodic(
            ScheduleType.DAILY, LocalDateTime.parse("2025-01-02T08:00:00"), ZoneOffset.UTC, null);
    final Instant claimedOccurrence = Instant.parse("2025-01-02T08:00:00Z");

    // 3 日遅れで発火した場合、次回は発火時刻より後の枠になる
    final FireOutcome outcome =
        lifecycle.fire(
            claimed(daily, claimedOccurrence, 0), Instant.parse("2025-01-05T09:00:00Z"));

    assertThat(outcome.nextOccurrenceAt()).isEqualTo(Instant.parse("2025-01-06T08:00:00Z"));
    assertThat(outcome.occurrenceCount()).isEqualTo(1);
  }

  @Test
  void initialOccurrenceRejectsPastOnceSchedule() {
    final ScheduleDescriptor once =
        new ScheduleDescriptor.Once(LocalDateTime.parse("2024-12-31T09:00:00"), ZoneOffset.UTC);

    assertThatThrownBy(() -> lifecycle.initialOccurrence(once, CREATED_AT))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("future");
  }

  @Test
  void rearmCarriesFiredCountIntoUpdatedSchedule() {
    final Instant now = Instant.parse("2025-01-15T12:00:00Z");
    final ScheduledNotificationRecord firedTwice =
        claimed(
            new ScheduleDescriptor.Custom(
                LocalDateTime.parse("2025-01-01T00:00:00"),
                ZoneOffset.UTC,
                1,
                RecurrenceUnit.WEEK,
                EndCondition.never()),
            Instant.parse("2025-01-22T00:00:00Z"),
            2);
    final ScheduleDescriptor twoTimes =
        new ScheduleDescriptor.Custom(
            LocalDateTime.parse("2025-01-01T00:00:00"),
            ZoneOffset.UTC,
            1,
            RecurrenceUnit.WEEK,
            new EndCondition.AfterOccurrences(2));
    final ScheduleDescriptor threeTimes =
        new ScheduleDescriptor.Custom(
            LocalDateTime.parse("2025-01-01T00:00:00"),
            ZoneOffset.UTC,
            1,
            RecurrenceUnit.WEEK,
            new EndCondition.AfterOccurrences(3));

    // 既に 2 回発火した規則を「2 回まで」に変えても再武装しない
    assertThatThrownBy(() -> lifecycle.rearmOccurrence(firedTwice, twoTimes, now))
        .isInstanceOf(InvalidScheduleTransitionException.class)
        .hasMessageContaining("2 fired occurrences");
    assertThat(lifecycle.rearmOccurrence(firedTwice, threeTimes, now))
        .isEqualTo(Instant.parse("2025-01-22T00:00:00Z"));
  }

  @Test
  void fireRejectsRecordThatIsNotClaimed() {
    final ScheduleDescriptor once =
        new ScheduleDescriptor.Once(LocalDateTime.parse("2025-01-10T09:00:00"), ZoneOffset.UTC);
    final ScheduledNotificationRecord pending =
        ScheduledNotificationRecord.newPending(
            UUID.randomUUID(), draft(once), Instant.parse("2025-01-10T09:00:00Z"), "u_1", CREATED_AT);

    assertThatThrownBy(() -> lifecycle.fire(pending, CREATED_AT))
        .isInstanceOf(InvalidScheduleTransitionException.class)
        .satisfies(
            ex ->
                assertThat(((InvalidScheduleTransitionException) ex).actualStatus())
                    .isEqualTo(ScheduledNotificationStatus.PENDING));
  }

  @Test
  void onlyPendingIsEditableAndOnlyTerminalIsDeletable() {
    final ScheduleDescriptor once =
        new ScheduleDescriptor.Once(LocalDateTime.parse("2025-01-10T09:00:00"), ZoneOffset.UTC);
    final ScheduledNotificationRecord processing =
        claimed(once, Instant.parse("2025-01-10T09:00:00Z"), 0);

    assertThatThrownBy(() -> lifecycle.requireEditable(processing))
        .isInstanceOf(InvalidScheduleTransitionException.class);
    assertThatThrownBy(() -> lifecycle.requireDeletable(processing))
        .isInstanceOf(InvalidScheduleTransitionException.class);
  }

  private ScheduledNotificationRecord claimed(
      ScheduleDescriptor schedule, Instant nextOccurrenceAt, int occurrenceCount) {
    return new ScheduledNotificationRecord(
        UUID.randomUUID(),
        "weekly digest",
        "announcement",
        Set.of("mail"),
        List.of(RecipientDescriptor.everyone()),
        "{}",
        schedule,
        ScheduledNotificationStatus.PROCESSING,
        nextOccurrenceAt,
        occurrenceCount,
        "worker-1",
        nextOccurrenceAt,
        nextOccurrenceAt.plusSeconds(300),
        0,
        null,
        null,
        "u_1",
        CREATED_AT,
        CREATED_AT,
        null,
        null);
  }

  private NotificationDraft draft(ScheduleDescriptor schedule) {
    return new NotificationDraft(
        "weekly digest",
        "announcement",
        Set.of("mail"),
        List.of(RecipientDescriptor.everyone()),
        null,
        schedule);
  }
}
