/*
 * どこで: Scheduler データアクセス
 * 何を: scheduled_notification_deliveries の登録/取得/集計を担う
 * なぜ: 宛先×チャネル単位の失敗を発火の成否と分けて残し、運用者が確認できるようにするため
 */
package com.example.scheduler.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.scheduler.model.DeliveryAttemptRecord;
import com.example.scheduler.model.DeliveryStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DeliveryAttemptRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int insertAll(List<DeliveryAttemptRecord> attempts) {
    if (attempts.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        INSERT INTO scheduled_notification_deliveries (
          delivery_id,
          notification_id,
          occurrence_number,
          occurrence_at,
          user_id,
          channel,
          status,
          error_message,
          attempted_at
        ) VALUES (
          :deliveryId,
          :notificationId,
          :occurrenceNumber,
          :occurrenceAt,
          :userId,
          :channel,
          :status,
          :errorMessage,
          :attemptedAt
        )
        """;
    final MapSqlParameterSource[] batch =
        attempts.stream()
            .map(
                attempt ->
                    new MapSqlParameterSource()
                        .addValue("deliveryId", attempt.deliveryId())
                        .addValue("notificationId", attempt.notificationId())
                        .addValue("occurrenceNumber", attempt.occurrenceNumber())
                        .addValue("occurrenceAt", toTimestamp(attempt.occurrenceAt()))
                        .addValue("userId", attempt.userId())
                        .addValue("channel", attempt.channel())
                        .addValue("status", attempt.status().name())
                        .addValue("errorMessage", attempt.errorMessage())
                        .addValue("attemptedAt", toTimestamp(attempt.attemptedAt())))
            .toArray(MapSqlParameterSource[]::new);
    return jdbcTemplate.batchUpdate(sql, batch).length;
  }

  public List<DeliveryAttemptRecord> findByNotificationId(UUID notificationId, int limit) {
    final String sql =
        """
        SELECT delivery_id, notification_id, occurrence_number, occurrence_at, user_id, channel,
               status, error_message, attempted_at
        FROM scheduled_notification_deliveries
        WHERE notification_id = :notificationId
        ORDER BY occurrence_number DESC, attempted_at DESC, delivery_id
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", notificationId)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Map<DeliveryStatus, Long> countByStatus() {
    final String sql =
        "SELECT status, COUNT(*) AS cnt FROM scheduled_notification_deliveries GROUP BY status";
    final Map<DeliveryStatus, Long> counts = new EnumMap<>(DeliveryStatus.class);
    for (DeliveryStatus status : DeliveryStatus.values()) {
      counts.put(status, 0L);
    }
    jdbcTemplate.query(
        sql,
        new MapSqlParameterSource(),
        rs -> {
          counts.put(DeliveryStatus.valueOf(rs.getString("status")), rs.getLong("cnt"));
        });
    return counts;
  }

  private DeliveryAttemptRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new DeliveryAttemptRecord(
        UUID.fromString(rs.getString("delivery_id")),
        UUID.fromString(rs.getString("notification_id")),
        rs.getInt("occurrence_number"),
        toInstant(rs.getTimestamp("occurrence_at")),
        rs.getString("user_id"),
        rs.getString("channel"),
        DeliveryStatus.valueOf(rs.getString("status")),
        rs.getString("error_message"),
        toInstant(rs.getTimestamp("attempted_at")));
  }
}
