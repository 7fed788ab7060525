/*
 * どこで: Scheduler サービス層
 * 何を: admin ロールと作成者本人かで操作可否を判定する既定の認可ゲート
 * なぜ: 管理者は全件、その他のユーザは自分の予約だけを扱える運用に合わせるため
 */
package com.example.scheduler.service;

import com.example.scheduler.model.ScheduledNotificationRecord;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class RoleBasedNotificationAccessPolicy implements NotificationAccessPolicy {

  @Override
  public boolean canCreate(CallerContext caller) {
    return true;
  }

  @Override
  public boolean canAccess(CallerContext caller, ScheduledNotificationRecord record) {
    return caller.isAdmin() || caller.userId().equals(record.createdBy());
  }

  @Override
  public boolean canViewStats(CallerContext caller) {
    return caller.isAdmin();
  }

  @Override
  public Optional<String> listScope(CallerContext caller) {
    return caller.isAdmin() ? Optional.empty() : Optional.of(caller.userId());
  }
}
