/*
 * どこで: Scheduler データアクセスの結合テスト
 * 何を: jsonb 列の往復、検索条件、claim/advance/release/cancel の条件付き更新を検証する
 * なぜ: 状態遷移の競合判定を SQL の WHERE 条件に任せているため、実 DB で勝者と敗者を確かめる
 */
package com.example.scheduler.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.scheduler.AbstractPostgresContainerTest;
import com.example.scheduler.model.EndCondition;
import com.example.scheduler.model.NotificationDraft;
import com.example.scheduler.model.RecipientDescriptor;
import com.example.scheduler.model.RecurrenceUnit;
import com.example.scheduler.model.ScheduleDescriptor;
import com.example.scheduler.model.ScheduleType;
import com.example.scheduler.model.ScheduledNotificationFilter;
import com.example.scheduler.model.ScheduledNotificationRecord;
import com.example.scheduler.model.ScheduledNotificationStatus;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class ScheduledNotificationRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
  private static final ZoneId TOKYO = ZoneId.of("Asia/Tokyo");

  @Autowired private ScheduledNotificationRepository repository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM scheduled_notifications", new MapSqlParameterSource());
  }

  @Test
  void insertAndFindByIdRestoresJsonColumns() {
    final ScheduleDescriptor custom =
        new ScheduleDescriptor.Custom(
            LocalDateTime.parse("2025-03-03T08:30:00"),
            TOKYO,
            2,
            RecurrenceUnit.WEEK,
            new EndCondition.AfterOccurrences(5));
    final NotificationDraft draft =
        new NotificationDraft(
            "club meeting",
            "event",
            Set.of("mail", "push"),
            List.of(RecipientDescriptor.group("4c"), RecipientDescriptor.user("u-9")),
            "{\"room\":\"gym\"}",
            custom);
    final UUID id =
        repository.insert(
            ScheduledNotificationRecord.newPending(
                UUID.randomUUID(), draft, Instant.parse("2025-03-02T23:30:00Z"), "teacher-1", NOW));

    final ScheduledNotificationRecord found = repository.findById(id).orElseThrow();

    assertThat(found.name()).isEqualTo("club meeting");
    assertThat(found.channels()).containsExactlyInAnyOrder("mail", "push");
    assertThat(found.recipients())
        .containsExactly(RecipientDescriptor.group("4c"), RecipientDescriptor.user("u-9"));
    assertThat(found.schedule()).isEqualTo(custom);
    assertThat(found.payloadJson()).contains("\"room\"").contains("\"gym\"");
    assertThat(found.status()).isEqualTo(ScheduledNotificationStatus.PENDING);
    assertThat(found.nextOccurrenceAt()).isEqualTo(Instant.parse("2025-03-02T23:30:00Z"));
    assertThat(found.createdBy()).isEqualTo("teacher-1");
    assertThat(found.createdAt()).isEqualTo(NOW);
    assertThat(repository.findById(UUID.randomUUID())).isEmpty();
  }

  @Test
  void claimDueTakesDueRecordsAndSkipsFutureAndBackedOff() {
    final UUID due = insertPending(NOW.minusSeconds(60), "teacher-1");
    final UUID future = insertPending(NOW.plusSeconds(60), "teacher-1");
    final UUID backedOff = insertPending(NOW.minusSeconds(120), "teacher-1");
    jdbcTemplate.update(
        "UPDATE scheduled_notifications SET next_retry_at = now() + interval '1 day' WHERE notification_id = :id",
        new MapSqlParameterSource().addValue("id", backedOff));

    final List<ScheduledNotificationRecord> claimed =
        repository.claimDue(10, NOW, NOW.plus(Duration.ofMinutes(5)), "worker-a");

    assertThat(claimed).extracting(ScheduledNotificationRecord::notificationId).containsExactly(due);
    final ScheduledNotificationRecord record = claimed.get(0);
    assertThat(record.status()).isEqualTo(ScheduledNotificationStatus.PROCESSING);
    assertThat(record.lockedBy()).isEqualTo("worker-a");
    assertThat(record.leaseUntil()).isEqualTo(NOW.plus(Duration.ofMinutes(5)));
    // 発火対象の時刻は claim 後も残る
    assertThat(record.nextOccurrenceAt()).isEqualTo(NOW.minusSeconds(60));
    assertThat(repository.findById(future).orElseThrow().status())
        .isEqualTo(ScheduledNotificationStatus.PENDING);
    assertThat(repository.countDue(NOW)).isEqualTo(1);
  }

  @Test
  void expiredLeaseIsReclaimedAndOldOwnerCannotAdvance() {
    final UUID id = insertPending(NOW.minusSeconds(60), "teacher-1");
    repository.claimDue(10, NOW, NOW.plusSeconds(30), "worker-a");

    // lease 内は再 claim されない
    assertThat(repository.claimDue(10, NOW.plusSeconds(10), NOW.plusSeconds(300), "worker-b"))
        .isEmpty();

    final List<ScheduledNotificationRecord> reclaimed =
        repository.claimDue(10, NOW.plusSeconds(31), NOW.plusSeconds(331), "worker-b");
    assertThat(reclaimed).extracting(ScheduledNotificationRecord::lockedBy).containsExactly("worker-b");

    final int staleAdvance =
        repository.advance(
            id, "worker-a", ScheduledNotificationStatus.SENT, null, 1, NOW, null, NOW.plusSeconds(40));
    assertThat(staleAdvance).isZero();

    final int ownerAdvance =
        repository.advance(
            id, "worker-b", ScheduledNotificationStatus.SENT, null, 1, NOW, null, NOW.plusSeconds(40));
    assertThat(ownerAdvance).isEqualTo(1);

    final ScheduledNotificationRecord sent = repository.findById(id).orElseThrow();
    assertThat(sent.status()).isEqualTo(ScheduledNotificationStatus.SENT);
    assertThat(sent.occurrenceCount()).isEqualTo(1);
    assertThat(sent.nextOccurrenceAt()).isNull();
    assertThat(sent.lockedBy()).isNull();
    assertThat(sent.sentAt()).isEqualTo(NOW);
  }

  @Test
  void releaseReturnsToPendingWithRetryTime() {
    final UUID id = insertPending(NOW.minusSeconds(60), "teacher-1");
    repository.claimDue(10, NOW, NOW.plusSeconds(300), "worker-a");

    assertThat(repository.release(id, "worker-x", 1, NOW.plusSeconds(30), "boom", NOW)).isZero();
    assertThat(repository.release(id, "worker-a", 1, NOW.plusSeconds(30), "directory down", NOW))
        .isEqualTo(1);

    final ScheduledNotificationRecord released = repository.findById(id).orElseThrow();
    assertThat(released.status()).isEqualTo(ScheduledNotificationStatus.PENDING);
    assertThat(released.attemptCount()).isEqualTo(1);
    assertThat(released.nextRetryAt()).isEqualTo(NOW.plusSeconds(30));
    assertThat(released.lastError()).isEqualTo("directory down");
    assertThat(released.occurrenceCount()).isZero();
    // backoff 中は claim されず、経過後に再び claim される
    assertThat(repository.claimDue(10, NOW.plusSeconds(10), NOW.plusSeconds(310), "worker-b"))
        .isEmpty();
    assertThat(repository.claimDue(10, NOW.plusSeconds(30), NOW.plusSeconds(330), "worker-b"))
        .hasSize(1);
  }

  @Test
  void cancelAndUpdateOnlyApplyToPending() {
    final UUID pending = insertPending(NOW.plusSeconds(3600), "teacher-1");
    final UUID processing = insertPending(NOW.minusSeconds(60), "teacher-1");
    repository.claimDue(10, NOW, NOW.plusSeconds(300), "worker-a");

    assertThat(repository.cancelIfPending(processing, NOW)).isZero();
    assertThat(repository.cancelIfPending(pending, NOW)).isEqualTo(1);
    assertThat(repository.cancelIfPending(pending, NOW)).isZero();

    final ScheduledNotificationRecord cancelled = repository.findById(pending).orElseThrow();
    assertThat(cancelled.status()).isEqualTo(ScheduledNotificationStatus.CANCELLED);
    assertThat(cancelled.nextOccurrenceAt()).isNull();
    assertThat(cancelled.cancelledAt()).isEqualTo(NOW);

    final NotificationDraft renamed = draft("renamed", onceAt("2025-04-01T09:00:00"));
    assertThat(repository.updateIfPending(pending, renamed, NOW.plusSeconds(7200), 0, NOW)).isZero();
    assertThat(repository.updateIfPending(processing, renamed, NOW.plusSeconds(7200), 0, NOW)).isZero();
  }

  @Test
  void updateIfPendingReplacesDefinitionAndClearsRetryState() {
    final UUID id = insertPending(NOW.minusSeconds(60), "teacher-1");
    repository.claimDue(10, NOW, NOW.plusSeconds(300), "worker-a");
    repository.release(id, "worker-a", 2, NOW.plusSeconds(60), "directory down", NOW);

    final NotificationDraft renamed = draft("renamed", onceAt("2025-04-01T09:00:00"));
    assertThat(
            repository.updateIfPending(id, renamed, Instant.parse("2025-04-01T00:00:00Z"), 0, NOW))
        .isEqualTo(1);

    final ScheduledNotificationRecord updated = repository.findById(id).orElseThrow();
    assertThat(updated.name()).isEqualTo("renamed");
    assertThat(updated.schedule()).isEqualTo(onceAt("2025-04-01T09:00:00"));
    assertThat(updated.nextOccurrenceAt()).isEqualTo(Instant.parse("2025-04-01T00:00:00Z"));
    assertThat(updated.attemptCount()).isZero();
    assertThat(updated.nextRetryAt()).isNull();
    assertThat(updated.lastError()).isNull();
  }

  @Test
  void updateIfPendingIsRejectedWhenAFireAdvancedTheOccurrenceCount() {
    final UUID id = insertPending(NOW.minusSeconds(60), "teacher-1");
    // 読み込み時点では未発火だったが、更新前に一回発火して PENDING に戻った
    repository.claimDue(10, NOW, NOW.plusSeconds(300), "worker-a");
    repository.advance(
        id,
        "worker-a",
        ScheduledNotificationStatus.PENDING,
        NOW.plusSeconds(86_400),
        1,
        NOW,
        null,
        NOW);

    final NotificationDraft renamed = draft("renamed", onceAt("2025-04-01T09:00:00"));
    assertThat(
            repository.updateIfPending(id, renamed, Instant.parse("2025-04-01T00:00:00Z"), 0, NOW))
        .isZero();

    final ScheduledNotificationRecord unchanged = repository.findById(id).orElseThrow();
    assertThat(unchanged.name()).isEqualTo("reminder");
    assertThat(unchanged.occurrenceCount()).isEqualTo(1);
    assertThat(unchanged.nextOccurrenceAt()).isEqualTo(NOW.plusSeconds(86_400));

    assertThat(
            repository.updateIfPending(
                id, renamed, Instant.parse("2025-04-01T00:00:00Z"), 1, NOW.plusSeconds(10)))
        .isEqualTo(1);
    assertThat(repository.findById(id).orElseThrow().occurrenceCount()).isEqualTo(1);
  }

  @Test
  void searchFiltersByCreatorStatusAndOccurrenceRange() {
    final UUID early = insertPending(Instant.parse("2025-03-05T00:00:00Z"), "teacher-1");
    final UUID late = insertPending(Instant.parse("2025-03-20T00:00:00Z"), "teacher-1");
    insertPending(Instant.parse("2025-03-06T00:00:00Z"), "teacher-2");
    repository.cancelIfPending(late, NOW);

    final List<ScheduledNotificationRecord> own =
        repository.search(new ScheduledNotificationFilter(null, null, null, null, "teacher-1", 10, 0));
    assertThat(own).extracting(ScheduledNotificationRecord::notificationId)
        .containsExactlyInAnyOrder(early, late);

    final List<ScheduledNotificationRecord> pendingInRange =
        repository.search(
            new ScheduledNotificationFilter(
                ScheduledNotificationStatus.PENDING,
                "event",
                Instant.parse("2025-03-01T00:00:00Z"),
                Instant.parse("2025-03-10T00:00:00Z"),
                null,
                10,
                0));
    assertThat(pendingInRange).hasSize(2);

    final List<ScheduledNotificationRecord> paged =
        repository.search(new ScheduledNotificationFilter(null, null, null, null, null, 1, 1));
    assertThat(paged).hasSize(1);
  }

  @Test
  void findUpcomingOrdersByNextOccurrenceWithinScope() {
    final UUID later = insertPending(NOW.plusSeconds(7200), "teacher-1");
    final UUID sooner = insertPending(NOW.plusSeconds(3600), "teacher-1");
    insertPending(NOW.plusSeconds(60), "teacher-2");

    assertThat(repository.findUpcoming(10, "teacher-1"))
        .extracting(ScheduledNotificationRecord::notificationId)
        .containsExactly(sooner, later);
    assertThat(repository.findUpcoming(2, null)).hasSize(2);
  }

  @Test
  void countByStatusReportsEveryStatus() {
    insertPending(NOW.plusSeconds(60), "teacher-1");
    final UUID cancelled = insertPending(NOW.plusSeconds(60), "teacher-1");
    repository.cancelIfPending(cancelled, NOW);

    assertThat(repository.countByStatus())
        .containsEntry(ScheduledNotificationStatus.PENDING, 1L)
        .containsEntry(ScheduledNotificationStatus.CANCELLED, 1L)
        .containsEntry(ScheduledNotificationStatus.SENT, 0L)
        .hasSize(ScheduledNotificationStatus.values().length);
  }

  @Test
  void deleteIfInactiveKeepsActiveRecords() {
    final UUID pending = insertPending(NOW.plusSeconds(60), "teacher-1");
    final UUID cancelled = insertPending(NOW.plusSeconds(60), "teacher-1");
    repository.cancelIfPending(cancelled, NOW);

    assertThat(repository.deleteIfInactive(pending)).isZero();
    assertThat(repository.deleteIfInactive(cancelled)).isEqualTo(1);
    assertThat(repository.findById(cancelled)).isEmpty();
  }

  private UUID insertPending(Instant nextOccurrenceAt, String createdBy) {
    final NotificationDraft draft =
        draft(
            "reminder",
            new ScheduleDescriptor.Periodic(
                ScheduleType.DAILY,
                LocalDateTime.parse("2025-01-01T09:00:00"),
                TOKYO,
                EndCondition.never()));
    return repository.insert(
        ScheduledNotificationRecord.newPending(
            UUID.randomUUID(), draft, nextOccurrenceAt, createdBy, NOW.minusSeconds(3600)));
  }

  private NotificationDraft draft(String name, ScheduleDescriptor schedule) {
    return new NotificationDraft(
        name, "event", Set.of("mail"), List.of(RecipientDescriptor.user("u-1")), "{}", schedule);
  }

  private ScheduleDescriptor onceAt(String localDateTime) {
    return new ScheduleDescriptor.Once(LocalDateTime.parse(localDateTime), TOKYO);
  }
}
