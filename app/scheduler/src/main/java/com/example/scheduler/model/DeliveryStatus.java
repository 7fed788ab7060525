package com.example.scheduler.model;

public enum DeliveryStatus {
  SUCCEEDED,
  FAILED,
  TIMED_OUT,
  /** claim の配信可能時間内に送信を開始できず、送らずに打ち切った。 */
  NOT_ATTEMPTED
}
