/*
 * どこで: Scheduler 宛先解決
 * 何を: 宛先リストを重複なしのユーザ集合へ展開し、チャネル設定で絞り込む
 * なぜ: リトライで何度呼ばれても同じ結果になる読み取り専用の解決を一箇所にまとめるため
 */
package com.example.scheduler.recipient;

import com.example.scheduler.model.RecipientDescriptor;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RecipientResolver {

  private static final Logger logger = LoggerFactory.getLogger(RecipientResolver.class);

  private final RecipientDirectory directory;
  private final NotificationPreferenceStore preferenceStore;

  /**
   * @return ユーザ ID 単位で重複を除いた宛先。許可チャネルが残らないユーザは含まない
   * @throws RecipientResolutionException ディレクトリまたは設定ストアが失敗した場合
   */
  public List<ResolvedRecipient> resolve(
      List<RecipientDescriptor> recipients,
      Set<String> requestedChannels,
      String notificationType,
      Instant asOf) {
    final Set<String> userIds = new LinkedHashSet<>();
    final Map<String, Set<String>> allowed;
    try {
      for (RecipientDescriptor descriptor : recipients) {
        userIds.addAll(directory.expand(descriptor, asOf));
      }
      if (userIds.isEmpty()) {
        return List.of();
      }
      allowed = preferenceStore.allowedChannels(userIds, notificationType, requestedChannels);
    } catch (RuntimeException ex) {
      throw new RecipientResolutionException("recipient resolution failed", ex);
    }
    final List<ResolvedRecipient> resolved = new ArrayList<>(userIds.size());
    for (String userId : userIds) {
      final Set<String> channels = new LinkedHashSet<>(allowed.getOrDefault(userId, Set.of()));
      channels.retainAll(requestedChannels);
      if (channels.isEmpty()) {
        logger.debug(
            "recipient skipped because all channels are opted out userId={} type={}",
            userId,
            notificationType);
        continue;
      }
      resolved.add(new ResolvedRecipient(userId, channels));
    }
    return resolved;
  }
}
