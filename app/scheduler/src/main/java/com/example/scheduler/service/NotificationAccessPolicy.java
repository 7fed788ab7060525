/*
 * どこで: Scheduler サービス層
 * 何を: 予約通知の操作可否を判定する認可ゲート
 * なぜ: 操作ごとに散らばるロール判定を一箇所にまとめ、状態機械から切り離すため
 */
package com.example.scheduler.service;

import com.example.scheduler.model.ScheduledNotificationRecord;
import java.util.Optional;

/** サービスは 1 操作につき 1 回だけ問い合わせる。 */
public interface NotificationAccessPolicy {

  boolean canCreate(CallerContext caller);

  /** 参照/更新/取消/削除の対象として見えるか。見えないレコードは存在しないものとして扱う。 */
  boolean canAccess(CallerContext caller, ScheduledNotificationRecord record);

  boolean canViewStats(CallerContext caller);

  /** 一覧を作成者で絞る必要がある場合、その作成者 ID を返す。 */
  Optional<String> listScope(CallerContext caller);
}
