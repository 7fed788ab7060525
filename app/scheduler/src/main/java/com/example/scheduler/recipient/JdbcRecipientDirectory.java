/*
 * どこで: Scheduler 宛先解決
 * 何を: directory_* テーブルから宛先をユーザ ID へ展開する
 * なぜ: 本体アプリが同期する読み取り専用のディレクトリを SQL で直接引くため
 */
package com.example.scheduler.recipient;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.scheduler.model.RecipientDescriptor;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcRecipientDirectory implements RecipientDirectory {

  // asOf 時点で無効化されていないユーザだけを対象にする
  private static final String ACTIVE_USER =
      "(u.deactivated_at IS NULL OR u.deactivated_at > :asOf)";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public Set<String> expand(RecipientDescriptor descriptor, Instant asOf) {
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("asOf", toTimestamp(asOf));
    final String sql;
    if (descriptor instanceof RecipientDescriptor.User user) {
      sql = "SELECT u.user_id FROM directory_users u WHERE u.user_id = :id AND " + ACTIVE_USER;
      params.addValue("id", user.userId());
    } else if (descriptor instanceof RecipientDescriptor.Role role) {
      sql =
          """
          SELECT u.user_id
          FROM directory_user_roles r
          JOIN directory_users u ON u.user_id = r.user_id
          WHERE r.role_id = :id AND
          """
              + ACTIVE_USER
              + " ORDER BY u.user_id";
      params.addValue("id", role.roleId());
    } else if (descriptor instanceof RecipientDescriptor.Group group) {
      sql =
          """
          SELECT u.user_id
          FROM directory_group_members g
          JOIN directory_users u ON u.user_id = g.user_id
          WHERE g.group_id = :id AND
          """
              + ACTIVE_USER
              + " ORDER BY u.user_id";
      params.addValue("id", group.groupId());
    } else {
      sql = "SELECT u.user_id FROM directory_users u WHERE " + ACTIVE_USER + " ORDER BY u.user_id";
    }
    return new LinkedHashSet<>(jdbcTemplate.queryForList(sql, params, String.class));
  }
}
