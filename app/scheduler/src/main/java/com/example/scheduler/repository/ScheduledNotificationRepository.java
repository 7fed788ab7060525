/*
 * どこで: Scheduler データアクセス
 * 何を: scheduled_notifications の登録/取得と条件付き状態遷移を担う
 * なぜ: claim/cancel/update/advance をすべて「状態が期待どおりなら」の単一 SQL にし、競合の勝者を DB に決めさせるため
 */
package com.example.scheduler.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.scheduler.model.NotificationDraft;
import com.example.scheduler.model.ScheduledNotificationFilter;
import com.example.scheduler.model.ScheduledNotificationRecord;
import com.example.scheduler.model.ScheduledNotificationStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ScheduledNotificationRepository {

  private static final String COLUMNS =
      """
      notification_id, name, type, channels::text AS channels_text, recipients::text AS recipients_text,
      payload_json::text AS payload_json_text, schedule::text AS schedule_text, status,
      next_occurrence_at, occurrence_count, locked_by, locked_at, lease_until,
      attempt_count, next_retry_at, last_error, created_by, created_at, updated_at, sent_at, cancelled_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ScheduledNotificationJsonCodec codec;

  public UUID insert(ScheduledNotificationRecord record) {
    final String sql =
        """
        INSERT INTO scheduled_notifications (
          notification_id,
          name,
          type,
          channels,
          recipients,
          payload_json,
          schedule,
          schedule_type,
          status,
          next_occurrence_at,
          occurrence_count,
          locked_by,
          locked_at,
          lease_until,
          attempt_count,
          next_retry_at,
          last_error,
          created_by,
          created_at,
          updated_at,
          sent_at,
          cancelled_at
        ) VALUES (
          :notificationId,
          :name,
          :type,
          :channels::jsonb,
          :recipients::jsonb,
          :payloadJson::jsonb,
          :schedule::jsonb,
          :scheduleType,
          :status,
          :nextOccurrenceAt,
          :occurrenceCount,
          :lockedBy,
          :lockedAt,
          :leaseUntil,
          :attemptCount,
          :nextRetryAt,
          :lastError,
          :createdBy,
          :createdAt,
          :updatedAt,
          :sentAt,
          :cancelledAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", record.notificationId())
            .addValue("name", record.name())
            .addValue("type", record.type())
            .addValue("channels", codec.writeChannels(record.channels()))
            .addValue("recipients", codec.writeRecipients(record.recipients()))
            .addValue("payloadJson", record.payloadJson())
            .addValue("schedule", codec.writeSchedule(record.schedule()))
            .addValue("scheduleType", record.schedule().type().name())
            .addValue("status", record.status().name())
            .addValue("nextOccurrenceAt", toTimestamp(record.nextOccurrenceAt()))
            .addValue("occurrenceCount", record.occurrenceCount())
            .addValue("lockedBy", record.lockedBy())
            .addValue("lockedAt", toTimestamp(record.lockedAt()))
            .addValue("leaseUntil", toTimestamp(record.leaseUntil()))
            .addValue("attemptCount", record.attemptCount())
            .addValue("nextRetryAt", toTimestamp(record.nextRetryAt()))
            .addValue("lastError", record.lastError())
            .addValue("createdBy", record.createdBy())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("updatedAt", toTimestamp(record.updatedAt()))
            .addValue("sentAt", toTimestamp(record.sentAt()))
            .addValue("cancelledAt", toTimestamp(record.cancelledAt()));
    jdbcTemplate.update(sql, params);
    return record.notificationId();
  }

  public Optional<ScheduledNotificationRecord> findById(UUID notificationId) {
    final String sql =
        "SELECT " + COLUMNS + " FROM scheduled_notifications WHERE notification_id = :notificationId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("notificationId", notificationId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<ScheduledNotificationRecord> search(ScheduledNotificationFilter filter) {
    final StringBuilder sql =
        new StringBuilder("SELECT ").append(COLUMNS).append(" FROM scheduled_notifications WHERE 1 = 1");
    final MapSqlParameterSource params = new MapSqlParameterSource();
    if (filter.status() != null) {
      sql.append(" AND status = :status");
      params.addValue("status", filter.status().name());
    }
    if (filter.type() != null) {
      sql.append(" AND type = :type");
      params.addValue("type", filter.type());
    }
    if (filter.createdBy() != null) {
      sql.append(" AND created_by = :createdBy");
      params.addValue("createdBy", filter.createdBy());
    }
    // 期間は次回発火時刻、発火済みなら最終送信時刻で判定する
    if (filter.from() != null) {
      sql.append(" AND COALESCE(next_occurrence_at, sent_at) >= :from");
      params.addValue("from", toTimestamp(filter.from()));
    }
    if (filter.to() != null) {
      sql.append(" AND COALESCE(next_occurrence_at, sent_at) <= :to");
      params.addValue("to", toTimestamp(filter.to()));
    }
    sql.append(
        " ORDER BY COALESCE(next_occurrence_at, sent_at, created_at) DESC, notification_id"
            + " LIMIT :limit OFFSET :offset");
    params.addValue("limit", filter.limit()).addValue("offset", filter.offset());
    return jdbcTemplate.query(sql.toString(), params, this::mapRow);
  }

  public List<ScheduledNotificationRecord> findUpcoming(int limit, String createdBy) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
             FROM scheduled_notifications
            WHERE status = 'PENDING'
              AND (CAST(:createdBy AS VARCHAR) IS NULL OR created_by = :createdBy)
            ORDER BY next_occurrence_at
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("limit", limit).addValue("createdBy", createdBy);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int updateIfPending(
      UUID notificationId,
      NotificationDraft draft,
      Instant nextOccurrenceAt,
      int expectedOccurrenceCount,
      Instant now) {
    // 次回時刻は読み込み時の発火済み回数から計算しているため、回数が進んでいたら適用しない
    final String sql =
        """
        UPDATE scheduled_notifications
        SET name = :name,
            type = :type,
            channels = :channels::jsonb,
            recipients = :recipients::jsonb,
            payload_json = :payloadJson::jsonb,
            schedule = :schedule::jsonb,
            schedule_type = :scheduleType,
            next_occurrence_at = :nextOccurrenceAt,
            attempt_count = 0,
            next_retry_at = NULL,
            last_error = NULL,
            updated_at = :now
        WHERE notification_id = :notificationId
          AND status = 'PENDING'
          AND occurrence_count = :expectedOccurrenceCount
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("name", draft.name())
            .addValue("type", draft.type())
            .addValue("channels", codec.writeChannels(draft.channels()))
            .addValue("recipients", codec.writeRecipients(draft.recipients()))
            .addValue("payloadJson", draft.payloadJson())
            .addValue("schedule", codec.writeSchedule(draft.schedule()))
            .addValue("scheduleType", draft.schedule().type().name())
            .addValue("nextOccurrenceAt", toTimestamp(nextOccurrenceAt))
            .addValue("expectedOccurrenceCount", expectedOccurrenceCount)
            .addValue("now", toTimestamp(now))
            .addValue("notificationId", notificationId);
    return jdbcTemplate.update(sql, params);
  }

  public int cancelIfPending(UUID notificationId, Instant now) {
    // claim と同じ「PENDING なら」の条件で競合させ、負けた側は 0 件更新になる
    final String sql =
        """
        UPDATE scheduled_notifications
        SET status = 'CANCELLED',
            next_occurrence_at = NULL,
            next_retry_at = NULL,
            cancelled_at = :now,
            updated_at = :now
        WHERE notification_id = :notificationId
          AND status = 'PENDING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("notificationId", notificationId);
    return jdbcTemplate.update(sql, params);
  }

  public List<ScheduledNotificationRecord> claimDue(
      int limit, Instant now, Instant leaseUntil, String lockedBy) {
    // 期限到来の PENDING と lease 切れの PROCESSING をまとめて claim し、競合を避ける
    final String sql =
        """
        WITH cte AS (
          SELECT notification_id
          FROM scheduled_notifications
          WHERE (
            status = 'PENDING'
            AND next_occurrence_at <= :now
            AND (next_retry_at IS NULL OR next_retry_at <= :now)
          )
          OR (
            status = 'PROCESSING'
            AND (lease_until IS NULL OR lease_until <= :now)
          )
          ORDER BY next_occurrence_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE scheduled_notifications n
        SET status = 'PROCESSING',
            locked_by = :lockedBy,
            locked_at = :now,
            lease_until = :leaseUntil,
            updated_at = :now
        FROM cte
        WHERE n.notification_id = cte.notification_id
        RETURNING n.notification_id, n.name, n.type, n.channels::text AS channels_text,
                  n.recipients::text AS recipients_text, n.payload_json::text AS payload_json_text,
                  n.schedule::text AS schedule_text, n.status, n.next_occurrence_at, n.occurrence_count,
                  n.locked_by, n.locked_at, n.lease_until, n.attempt_count, n.next_retry_at,
                  n.last_error, n.created_by, n.created_at, n.updated_at, n.sent_at, n.cancelled_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /**
   * 発火後の状態へ進める。lock を保持している PROCESSING のときだけ更新する。
   *
   * @param sentAt 成功した配信があった場合の送信時刻。null なら既存値を保つ
   */
  public int advance(
      UUID notificationId,
      String lockedBy,
      ScheduledNotificationStatus status,
      Instant nextOccurrenceAt,
      int occurrenceCount,
      Instant sentAt,
      String lastError,
      Instant now) {
    final String sql =
        """
        UPDATE scheduled_notifications
        SET status = :status,
            next_occurrence_at = :nextOccurrenceAt,
            occurrence_count = :occurrenceCount,
            sent_at = COALESCE(:sentAt, sent_at),
            last_error = :lastError,
            attempt_count = 0,
            next_retry_at = NULL,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL,
            updated_at = :now
        WHERE notification_id = :notificationId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
          AND occurrence_count < :occurrenceCount
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", status.name())
            .addValue("nextOccurrenceAt", toTimestamp(nextOccurrenceAt))
            .addValue("occurrenceCount", occurrenceCount)
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("lastError", lastError)
            .addValue("now", toTimestamp(now))
            .addValue("notificationId", notificationId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  /** 発火を中断して PENDING へ戻す。next_occurrence_at は変えずに次回リトライ時刻だけを設定する。 */
  public int release(
      UUID notificationId,
      String lockedBy,
      int attemptCount,
      Instant nextRetryAt,
      String lastError,
      Instant now) {
    final String sql =
        """
        UPDATE scheduled_notifications
        SET status = 'PENDING',
            attempt_count = :attemptCount,
            next_retry_at = :nextRetryAt,
            last_error = :lastError,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL,
            updated_at = :now
        WHERE notification_id = :notificationId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("attemptCount", attemptCount)
            .addValue("nextRetryAt", toTimestamp(nextRetryAt))
            .addValue("lastError", lastError)
            .addValue("now", toTimestamp(now))
            .addValue("notificationId", notificationId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int deleteIfInactive(UUID notificationId) {
    final String sql =
        """
        DELETE FROM scheduled_notifications
        WHERE notification_id = :notificationId
          AND status IN ('SENT', 'EXHAUSTED', 'CANCELLED')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("notificationId", notificationId);
    return jdbcTemplate.update(sql, params);
  }

  public Map<ScheduledNotificationStatus, Long> countByStatus() {
    final String sql = "SELECT status, COUNT(*) AS cnt FROM scheduled_notifications GROUP BY status";
    final Map<ScheduledNotificationStatus, Long> counts =
        new EnumMap<>(ScheduledNotificationStatus.class);
    for (ScheduledNotificationStatus status : ScheduledNotificationStatus.values()) {
      counts.put(status, 0L);
    }
    jdbcTemplate.query(
        sql,
        new MapSqlParameterSource(),
        rs -> {
          counts.put(ScheduledNotificationStatus.valueOf(rs.getString("status")), rs.getLong("cnt"));
        });
    return counts;
  }

  public int countDue(Instant now) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM scheduled_notifications
        WHERE status = 'PENDING'
          AND next_occurrence_at <= :now
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("now", toTimestamp(now));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  public int deleteTerminalOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM scheduled_notifications
        WHERE updated_at < :threshold
          AND status IN ('SENT', 'EXHAUSTED', 'CANCELLED')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  public int countStaleProcessing(Instant threshold) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM scheduled_notifications
        WHERE status = 'PROCESSING'
          AND lease_until < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private ScheduledNotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final Instant createdAt = toInstant(rs.getTimestamp("created_at"));
    return new ScheduledNotificationRecord(
        UUID.fromString(rs.getString("notification_id")),
        rs.getString("name"),
        rs.getString("type"),
        codec.readChannels(rs.getString("channels_text")),
        codec.readRecipients(rs.getString("recipients_text")),
        rs.getString("payload_json_text"),
        codec.readSchedule(rs.getString("schedule_text"), createdAt),
        ScheduledNotificationStatus.valueOf(rs.getString("status")),
        toInstant(rs.getTimestamp("next_occurrence_at")),
        rs.getInt("occurrence_count"),
        rs.getString("locked_by"),
        toInstant(rs.getTimestamp("locked_at")),
        toInstant(rs.getTimestamp("lease_until")),
        rs.getInt("attempt_count"),
        toInstant(rs.getTimestamp("next_retry_at")),
        rs.getString("last_error"),
        rs.getString("created_by"),
        createdAt,
        toInstant(rs.getTimestamp("updated_at")),
        toInstant(rs.getTimestamp("sent_at")),
        toInstant(rs.getTimestamp("cancelled_at")));
  }
}
