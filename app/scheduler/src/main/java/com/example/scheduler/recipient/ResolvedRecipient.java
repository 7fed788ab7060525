/*
 * どこで: Scheduler 宛先解決
 * 何を: 展開済みの宛先 (ユーザと送信可能チャネル)
 * なぜ: 配信ファンアウトの単位を明確にするため
 */
package com.example.scheduler.recipient;

import java.util.Set;

public record ResolvedRecipient(String userId, Set<String> channels) {
  public ResolvedRecipient {
    channels = Set.copyOf(channels);
  }
}
