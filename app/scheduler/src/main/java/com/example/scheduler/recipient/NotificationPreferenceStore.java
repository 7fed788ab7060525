/*
 * どこで: Scheduler 宛先解決
 * 何を: ユーザごと・通知種別ごとの受信許可チャネルを答えるストアの境界
 * なぜ: オプトアウト設定の保存方式を宛先解決ロジックから切り離すため
 */
package com.example.scheduler.recipient;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

public interface NotificationPreferenceStore {

  /**
   * requestedChannels のうち各ユーザが notificationType で受け取りを許可しているチャネルを返す。
   * 結果に含まれないユーザは許可チャネル無しとして扱う。
   */
  Map<String, Set<String>> allowedChannels(
      Collection<String> userIds, String notificationType, Set<String> requestedChannels);
}
