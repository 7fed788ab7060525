/*
 * どこで: Scheduler サービス層
 * 何を: 予約通知の作成/更新/取消/参照/集計を担う
 * なぜ: 認可ゲートと状態機械を通した上で、状態遷移を条件付き SQL に任せるため
 */
package com.example.scheduler.service;

import com.example.scheduler.api.ScheduledNotificationRequest;
import com.example.scheduler.config.SchedulerChannelProperties;
import com.example.scheduler.model.DeliveryAttemptRecord;
import com.example.scheduler.model.DeliveryStatus;
import com.example.scheduler.model.NotificationDraft;
import com.example.scheduler.model.ScheduledNotificationFilter;
import com.example.scheduler.model.ScheduledNotificationRecord;
import com.example.scheduler.model.ScheduledNotificationStatus;
import com.example.scheduler.repository.DeliveryAttemptRepository;
import com.example.scheduler.repository.ScheduledNotificationRepository;
import com.example.scheduler.schedule.InvalidScheduleTransitionException;
import com.example.scheduler.schedule.NotificationNotCancellableException;
import com.example.scheduler.schedule.ScheduledNotificationLifecycle;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ScheduledNotificationService {

  private static final Logger logger = LoggerFactory.getLogger(ScheduledNotificationService.class);

  private final ScheduledNotificationRepository notificationRepository;
  private final DeliveryAttemptRepository deliveryAttemptRepository;
  private final ScheduledNotificationLifecycle lifecycle;
  private final NotificationAccessPolicy accessPolicy;
  private final SchedulerChannelProperties channelProperties;
  private final Clock clock;

  public ScheduledNotificationRecord create(
      CallerContext caller, ScheduledNotificationRequest request) {
    if (!accessPolicy.canCreate(caller)) {
      throw new NotificationAccessDeniedException("caller may not create scheduled notifications");
    }
    final Instant now = Instant.now(clock);
    final NotificationDraft draft = toValidatedDraft(request, now);
    final Instant next = lifecycle.initialOccurrence(draft.schedule(), now);
    final ScheduledNotificationRecord record =
        ScheduledNotificationRecord.newPending(UUID.randomUUID(), draft, next, caller.userId(), now);
    notificationRepository.insert(record);
    logger.info(
        "scheduled notification created id={} type={} scheduleType={} next={} createdBy={}",
        record.notificationId(),
        record.type(),
        record.schedule().type(),
        next,
        caller.userId());
    return record;
  }

  public ScheduledNotificationRecord update(
      CallerContext caller, UUID notificationId, ScheduledNotificationRequest request) {
    final ScheduledNotificationRecord current = load(caller, notificationId);
    lifecycle.requireEditable(current);
    final Instant now = Instant.now(clock);
    final NotificationDraft draft = toValidatedDraft(request, now);
    final Instant next = lifecycle.rearmOccurrence(current, draft.schedule(), now);
    final int updated =
        notificationRepository.updateIfPending(
            notificationId, draft, next, current.occurrenceCount(), now);
    if (updated == 0) {
      // 読み込み後に発火/取消で PENDING を外れたか、発火が挟まり回数が進んだ
      final ScheduledNotificationStatus status = currentStatus(notificationId);
      throw new InvalidScheduleTransitionException(
          notificationId,
          status,
          status == ScheduledNotificationStatus.PENDING
              ? "scheduled notification fired while being updated; reload and retry"
              : "only pending scheduled notifications can be updated status=" + status);
    }
    logger.info("scheduled notification updated id={} next={}", notificationId, next);
    return reload(notificationId);
  }

  /**
   * PENDING の予約を取り消す。発火処理に先に claim された場合も含め、PENDING 以外は取消不可として拒否する。
   *
   * @throws NotificationNotCancellableException PENDING でない場合
   */
  public ScheduledNotificationRecord cancel(CallerContext caller, UUID notificationId) {
    final ScheduledNotificationRecord current = load(caller, notificationId);
    if (current.status() != ScheduledNotificationStatus.PENDING) {
      throw new NotificationNotCancellableException(notificationId, current.status());
    }
    final int updated = notificationRepository.cancelIfPending(notificationId, Instant.now(clock));
    if (updated == 0) {
      throw new NotificationNotCancellableException(notificationId, currentStatus(notificationId));
    }
    logger.info("scheduled notification cancelled id={} by={}", notificationId, caller.userId());
    return reload(notificationId);
  }

  public ScheduledNotificationRecord get(CallerContext caller, UUID notificationId) {
    return load(caller, notificationId);
  }

  public List<ScheduledNotificationRecord> list(
      CallerContext caller, ScheduledNotificationFilter filter) {
    return notificationRepository.search(scoped(caller, filter));
  }

  public List<ScheduledNotificationRecord> upcoming(CallerContext caller, int limit) {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be >= 1");
    }
    final Optional<String> scope = accessPolicy.listScope(caller);
    return notificationRepository.findUpcoming(limit, scope.orElse(null));
  }

  public List<DeliveryAttemptRecord> deliveries(
      CallerContext caller, UUID notificationId, int limit) {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be >= 1");
    }
    load(caller, notificationId);
    return deliveryAttemptRepository.findByNotificationId(notificationId, limit);
  }

  public ScheduledNotificationStats stats(CallerContext caller) {
    if (!accessPolicy.canViewStats(caller)) {
      throw new NotificationAccessDeniedException("only admins can view scheduled notification stats");
    }
    final Map<ScheduledNotificationStatus, Long> byStatus = notificationRepository.countByStatus();
    final long total = byStatus.values().stream().mapToLong(Long::longValue).sum();
    final long due = notificationRepository.countDue(Instant.now(clock));
    final Map<DeliveryStatus, Long> deliveries = deliveryAttemptRepository.countByStatus();
    return new ScheduledNotificationStats(byStatus, total, due, deliveries);
  }

  /** 終端状態のレコードだけを削除する。配信履歴も一緒に消える。 */
  public void delete(CallerContext caller, UUID notificationId) {
    final ScheduledNotificationRecord current = load(caller, notificationId);
    lifecycle.requireDeletable(current);
    final int deleted = notificationRepository.deleteIfInactive(notificationId);
    if (deleted == 0) {
      final ScheduledNotificationStatus status = currentStatus(notificationId);
      if (status == null) {
        throw new ScheduledNotificationNotFoundException(notificationId);
      }
      throw new InvalidScheduleTransitionException(
          notificationId,
          status,
          "active scheduled notifications cannot be deleted status=" + status);
    }
    logger.info("scheduled notification deleted id={} by={}", notificationId, caller.userId());
  }

  private ScheduledNotificationFilter scoped(
      CallerContext caller, ScheduledNotificationFilter filter) {
    final Optional<String> scope = accessPolicy.listScope(caller);
    if (scope.isEmpty()) {
      return filter;
    }
    if (filter.createdBy() != null && !filter.createdBy().equals(scope.get())) {
      throw new NotificationAccessDeniedException(
          "caller may only list their own scheduled notifications");
    }
    return filter.withCreatedBy(scope.get());
  }

  private NotificationDraft toValidatedDraft(ScheduledNotificationRequest request, Instant now) {
    final NotificationDraft draft = request.toDraft(now);
    for (String channel : draft.channels()) {
      if (!channelProperties.supported().contains(channel)) {
        throw new IllegalArgumentException("unsupported channel: " + channel);
      }
    }
    return draft;
  }

  private ScheduledNotificationRecord load(CallerContext caller, UUID notificationId) {
    final ScheduledNotificationRecord record =
        notificationRepository
            .findById(notificationId)
            .orElseThrow(() -> new ScheduledNotificationNotFoundException(notificationId));
    if (!accessPolicy.canAccess(caller, record)) {
      throw new ScheduledNotificationNotFoundException(notificationId);
    }
    return record;
  }

  private ScheduledNotificationRecord reload(UUID notificationId) {
    return notificationRepository
        .findById(notificationId)
        .orElseThrow(() -> new ScheduledNotificationNotFoundException(notificationId));
  }

  private ScheduledNotificationStatus currentStatus(UUID notificationId) {
    return notificationRepository
        .findById(notificationId)
        .map(ScheduledNotificationRecord::status)
        .orElse(null);
  }
}
