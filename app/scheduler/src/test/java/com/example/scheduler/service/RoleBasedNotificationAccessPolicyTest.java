/*
 * どこで: Scheduler 認可ゲートのユニットテスト
 * 何を: admin と作成者本人の判定を検証する
 * なぜ: 他ユーザの予約が見えない/集計は admin 限定であることを固定するため
 */
package com.example.scheduler.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.scheduler.model.NotificationDraft;
import com.example.scheduler.model.RecipientDescriptor;
import com.example.scheduler.model.ScheduleDescriptor;
import com.example.scheduler.model.ScheduledNotificationRecord;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class RoleBasedNotificationAccessPolicyTest {

  private final RoleBasedNotificationAccessPolicy policy = new RoleBasedNotificationAccessPolicy();

  @Test
  void adminSeesEverythingAndStats() {
    final CallerContext admin = new CallerContext("root", Set.of("Admin"));

    assertThat(policy.canAccess(admin, recordOwnedBy("teacher-1"))).isTrue();
    assertThat(policy.canViewStats(admin)).isTrue();
    assertThat(policy.listScope(admin)).isEmpty();
  }

  @Test
  void otherUsersOnlySeeTheirOwnRecords() {
    final CallerContext teacher = new CallerContext("teacher-1", Set.of("teacher"));

    assertThat(policy.canCreate(teacher)).isTrue();
    assertThat(policy.canAccess(teacher, recordOwnedBy("teacher-1"))).isTrue();
    assertThat(policy.canAccess(teacher, recordOwnedBy("teacher-2"))).isFalse();
    assertThat(policy.canViewStats(teacher)).isFalse();
    assertThat(policy.listScope(teacher)).contains("teacher-1");
  }

  private ScheduledNotificationRecord recordOwnedBy(String createdBy) {
    final NotificationDraft draft =
        new NotificationDraft(
            "parents meeting",
            "event",
            Set.of("mail"),
            List.of(RecipientDescriptor.role("parent")),
            null,
            new ScheduleDescriptor.Once(
                LocalDateTime.parse("2025-03-01T18:00:00"), ZoneOffset.UTC));
    final Instant now = Instant.parse("2025-02-01T00:00:00Z");
    return ScheduledNotificationRecord.newPending(
        UUID.randomUUID(), draft, Instant.parse("2025-03-01T18:00:00Z"), createdBy, now);
  }
}
