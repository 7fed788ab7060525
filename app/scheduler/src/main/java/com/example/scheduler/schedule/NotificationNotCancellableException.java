/*
 * どこで: Scheduler 状態遷移
 * 何を: PENDING 以外 (claim 競合に負けた場合を含む) への取消を表す例外
 * なぜ: 取消済みとの黙った成功ではなく「取消不可」を呼び出し側に区別させるため
 */
package com.example.scheduler.schedule;

import com.example.scheduler.model.ScheduledNotificationStatus;
import java.util.UUID;

public class NotificationNotCancellableException extends InvalidScheduleTransitionException {

  public NotificationNotCancellableException(
      UUID notificationId, ScheduledNotificationStatus actualStatus) {
    super(
        notificationId,
        actualStatus,
        "scheduled notification is not cancellable status=" + actualStatus);
  }
}
