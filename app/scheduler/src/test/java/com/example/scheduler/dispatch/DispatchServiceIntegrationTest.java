/*
 * どこで: Scheduler 発火処理の結合テスト
 * 何を: 実 DB 上で宛先展開から配信記録/次状態の書き込みまで、並行ティックと取消競合を検証する
 * なぜ: 1 発火 1 回の claim と「取消か発火のどちらか一方だけ」を SKIP LOCKED と条件付き UPDATE で保証しているため
 */
package com.example.scheduler.dispatch;

import static com.example.common.JdbcTimestampUtils.toTimestamp;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.groups.Tuple.tuple;

import com.example.scheduler.AbstractPostgresContainerTest;
import com.example.scheduler.model.DeliveryAttemptRecord;
import com.example.scheduler.model.DeliveryStatus;
import com.example.scheduler.model.EndCondition;
import com.example.scheduler.model.NotificationDraft;
import com.example.scheduler.model.RecipientDescriptor;
import com.example.scheduler.model.ScheduleDescriptor;
import com.example.scheduler.model.ScheduleType;
import com.example.scheduler.model.ScheduledNotificationRecord;
import com.example.scheduler.model.ScheduledNotificationStatus;
import com.example.scheduler.repository.DeliveryAttemptRepository;
import com.example.scheduler.repository.ScheduledNotificationRepository;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest(
    properties = {
      "scheduler.channels.failure-injection.enabled=true",
      "scheduler.channels.failure-injection.user-id-prefix=fail-",
      "scheduler.channels.failure-injection.channel=sms"
    })
@ActiveProfiles("test")
class DispatchServiceIntegrationTest extends AbstractPostgresContainerTest {

  @Autowired private DispatchService dispatchService;

  @Autowired private ScheduledNotificationRepository notificationRepository;

  @Autowired private DeliveryAttemptRepository deliveryAttemptRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(4);
    final MapSqlParameterSource empty = new MapSqlParameterSource();
    jdbcTemplate.update("DELETE FROM scheduled_notifications", empty);
    jdbcTemplate.update("DELETE FROM notification_preferences", empty);
    jdbcTemplate.update("DELETE FROM directory_users", empty);

    insertUser("u-1", null);
    insertUser("u-2", null);
    insertUser("fail-3", null);
    insertUser("u-4", Instant.parse("2020-01-01T00:00:00Z"));
    for (String userId : List.of("u-1", "u-2", "fail-3", "u-4")) {
      jdbcTemplate.update(
          "INSERT INTO directory_group_members (group_id, user_id) VALUES ('4c', :userId)",
          new MapSqlParameterSource().addValue("userId", userId));
    }
    jdbcTemplate.update(
        """
        INSERT INTO notification_preferences (user_id, notification_type, channel, enabled)
        VALUES ('u-2', 'event', 'sms', FALSE)
        """,
        empty);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void dueOnceNotificationFiresWithPartialFailureRecorded() {
    final Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
    final UUID id =
        insert(
            onceAt(now.minusSeconds(60)),
            Set.of("mail", "sms"),
            List.of(RecipientDescriptor.group("4c")),
            now.minusSeconds(60));

    final DispatchReport report = dispatchService.processDue(now, 10);

    assertThat(report.claimed()).containsExactly(id);
    assertThat(report.fired()).isEqualTo(1);
    assertThat(report.deliveries()).isEqualTo(5);
    assertThat(report.failures())
        .extracting(DeliveryFailure::userId, DeliveryFailure::channel)
        .containsExactly(tuple("fail-3", "sms"));

    final ScheduledNotificationRecord sent = notificationRepository.findById(id).orElseThrow();
    assertThat(sent.status()).isEqualTo(ScheduledNotificationStatus.SENT);
    assertThat(sent.occurrenceCount()).isEqualTo(1);
    assertThat(sent.nextOccurrenceAt()).isNull();
    assertThat(sent.sentAt()).isNotNull();
    assertThat(sent.lastError()).isEqualTo("1 of 5 deliveries failed");
    assertThat(sent.lockedBy()).isNull();

    final List<DeliveryAttemptRecord> attempts =
        deliveryAttemptRepository.findByNotificationId(id, 100);
    assertThat(attempts).hasSize(5).allMatch(attempt -> attempt.occurrenceNumber() == 1);
    assertThat(attempts)
        .filteredOn(attempt -> attempt.status() == DeliveryStatus.FAILED)
        .singleElement()
        .satisfies(
            attempt -> {
              assertThat(attempt.userId()).isEqualTo("fail-3");
              assertThat(attempt.channel()).isEqualTo("sms");
            });
    // 配信を止めたチャネルと無効化済みユーザには送らない
    assertThat(attempts)
        .noneMatch(attempt -> attempt.userId().equals("u-2") && attempt.channel().equals("sms"))
        .noneMatch(attempt -> attempt.userId().equals("u-4"));

    // 発火済みは次のティックで再 claim されない
    assertThat(dispatchService.processDue(now.plusSeconds(60), 10).claimed()).isEmpty();
  }

  @Test
  void recurringNotificationAdvancesToNextOccurrence() {
    final Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
    final LocalDateTime anchor =
        LocalDateTime.ofInstant(now.minus(25, ChronoUnit.HOURS), ZoneOffset.UTC);
    final ScheduleDescriptor daily =
        new ScheduleDescriptor.Periodic(
            ScheduleType.DAILY, anchor, ZoneOffset.UTC, new EndCondition.AfterOccurrences(2));
    final UUID id =
        insert(
            daily,
            Set.of("mail"),
            List.of(RecipientDescriptor.user("u-1")),
            now.minus(25, ChronoUnit.HOURS));

    // 遅れて発火しても過ぎた枠は飛ばし、次の枠へ進む
    dispatchService.processDue(now, 10);

    final ScheduledNotificationRecord afterFirst = notificationRepository.findById(id).orElseThrow();
    assertThat(afterFirst.status()).isEqualTo(ScheduledNotificationStatus.PENDING);
    assertThat(afterFirst.occurrenceCount()).isEqualTo(1);
    assertThat(afterFirst.nextOccurrenceAt()).isEqualTo(now.plus(23, ChronoUnit.HOURS));

    dispatchService.processDue(afterFirst.nextOccurrenceAt(), 10);

    final ScheduledNotificationRecord exhausted = notificationRepository.findById(id).orElseThrow();
    assertThat(exhausted.status()).isEqualTo(ScheduledNotificationStatus.EXHAUSTED);
    assertThat(exhausted.occurrenceCount()).isEqualTo(2);
    assertThat(exhausted.nextOccurrenceAt()).isNull();
    assertThat(deliveryAttemptRepository.findByNotificationId(id, 100))
        .extracting(DeliveryAttemptRecord::occurrenceNumber)
        .containsExactly(2, 1);
  }

  @Test
  void concurrentTicksFireEachRecordExactlyOnce() throws Exception {
    final Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
    final List<UUID> ids = new ArrayList<>();
    for (int i = 0; i < 20; i++) {
      ids.add(
          insert(
              onceAt(now.minusSeconds(60)),
              Set.of("mail"),
              List.of(RecipientDescriptor.user("u-1")),
              now.minusSeconds(60)));
    }

    final CountDownLatch start = new CountDownLatch(1);
    final List<Future<DispatchReport>> ticks = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      ticks.add(
          executor.submit(
              () -> {
                start.await();
                return dispatchService.processDue(now, 20);
              }));
    }
    start.countDown();

    final List<UUID> claimed = new ArrayList<>();
    int fired = 0;
    for (Future<DispatchReport> tick : ticks) {
      final DispatchReport report = tick.get(30, TimeUnit.SECONDS);
      claimed.addAll(report.claimed());
      fired += report.fired();
    }

    assertThat(claimed).containsExactlyInAnyOrderElementsOf(ids);
    assertThat(fired).isEqualTo(20);
    for (UUID id : ids) {
      assertThat(notificationRepository.findById(id).orElseThrow().status())
          .isEqualTo(ScheduledNotificationStatus.SENT);
      assertThat(deliveryAttemptRepository.findByNotificationId(id, 100)).hasSize(1);
    }
  }

  @Test
  void cancelRacingClaimHasExactlyOneWinner() throws Exception {
    for (int round = 0; round < 10; round++) {
      final Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
      final UUID id =
          insert(
              onceAt(now.minusSeconds(60)),
              Set.of("mail"),
              List.of(RecipientDescriptor.user("u-1")),
              now.minusSeconds(60));

      final CountDownLatch start = new CountDownLatch(1);
      final Future<Integer> cancel =
          executor.submit(
              () -> {
                start.await();
                return notificationRepository.cancelIfPending(id, now);
              });
      final Future<DispatchReport> tick =
          executor.submit(
              () -> {
                start.await();
                return dispatchService.processDue(now, 10);
              });
      start.countDown();

      final boolean cancelled = cancel.get(30, TimeUnit.SECONDS) == 1;
      final DispatchReport report = tick.get(30, TimeUnit.SECONDS);
      final ScheduledNotificationRecord record = notificationRepository.findById(id).orElseThrow();
      final List<DeliveryAttemptRecord> attempts =
          deliveryAttemptRepository.findByNotificationId(id, 100);

      if (cancelled) {
        assertThat(record.status()).isEqualTo(ScheduledNotificationStatus.CANCELLED);
        assertThat(report.claimed()).doesNotContain(id);
        assertThat(attempts).isEmpty();
      } else {
        assertThat(record.status()).isEqualTo(ScheduledNotificationStatus.SENT);
        assertThat(report.claimed()).contains(id);
        assertThat(attempts).hasSize(1);
      }
    }
  }

  private UUID insert(
      ScheduleDescriptor schedule,
      Set<String> channels,
      List<RecipientDescriptor> recipients,
      Instant nextOccurrenceAt) {
    final NotificationDraft draft =
        new NotificationDraft("assembly", "event", channels, recipients, "{}", schedule);
    return notificationRepository.insert(
        ScheduledNotificationRecord.newPending(
            UUID.randomUUID(), draft, nextOccurrenceAt, "teacher-1", nextOccurrenceAt.minusSeconds(3600)));
  }

  private ScheduleDescriptor onceAt(Instant at) {
    return new ScheduleDescriptor.Once(LocalDateTime.ofInstant(at, ZoneOffset.UTC), ZoneOffset.UTC);
  }

  private void insertUser(String userId, Instant deactivatedAt) {
    jdbcTemplate.update(
        "INSERT INTO directory_users (user_id, deactivated_at) VALUES (:userId, :deactivatedAt)",
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("deactivatedAt", toTimestamp(deactivatedAt)));
  }
}
