/*
 * どこで: Scheduler 宛先解決
 * 何を: notification_preferences からユーザごとの受信許可チャネルを求める
 * なぜ: 行が無いチャネルは既定で許可とし、明示的に無効化された組だけ除外するため
 */
package com.example.scheduler.recipient;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcNotificationPreferenceStore implements NotificationPreferenceStore {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public Map<String, Set<String>> allowedChannels(
      Collection<String> userIds, String notificationType, Set<String> requestedChannels) {
    final Map<String, Set<String>> disabled = new HashMap<>();
    if (!userIds.isEmpty() && !requestedChannels.isEmpty()) {
      final String sql =
          """
          SELECT user_id, channel
          FROM notification_preferences
          WHERE notification_type = :type
            AND enabled = FALSE
            AND user_id IN (:userIds)
            AND channel IN (:channels)
          """;
      final MapSqlParameterSource params =
          new MapSqlParameterSource()
              .addValue("type", notificationType)
              .addValue("userIds", userIds)
              .addValue("channels", requestedChannels);
      jdbcTemplate.query(
          sql,
          params,
          rs -> {
            disabled
                .computeIfAbsent(rs.getString("user_id"), ignored -> new HashSet<>())
                .add(rs.getString("channel"));
          });
    }
    final Map<String, Set<String>> allowed = new HashMap<>();
    for (String userId : userIds) {
      final Set<String> channels = new LinkedHashSet<>(requestedChannels);
      channels.removeAll(disabled.getOrDefault(userId, Set.of()));
      allowed.put(userId, channels);
    }
    return allowed;
  }
}
