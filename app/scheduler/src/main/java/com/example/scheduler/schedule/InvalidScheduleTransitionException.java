/*
 * どこで: Scheduler 状態遷移
 * 何を: 期待した状態でないレコードへの操作 (409) を表す例外
 * なぜ: 呼び出し側が再試行するか人に見せるかを判断できるよう、検証エラーと区別するため
 */
package com.example.scheduler.schedule;

import com.example.scheduler.model.ScheduledNotificationStatus;
import java.util.UUID;

public class InvalidScheduleTransitionException extends RuntimeException {

  private final UUID notificationId;
  private final ScheduledNotificationStatus actualStatus;

  public InvalidScheduleTransitionException(
      UUID notificationId, ScheduledNotificationStatus actualStatus, String message) {
    super(message);
    this.notificationId = notificationId;
    this.actualStatus = actualStatus;
  }

  public UUID notificationId() {
    return notificationId;
  }

  /** 判定時点の状態。競合で消えていた場合は null。 */
  public ScheduledNotificationStatus actualStatus() {
    return actualStatus;
  }
}
