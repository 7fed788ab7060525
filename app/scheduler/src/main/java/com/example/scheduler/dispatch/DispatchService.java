/*
 * どこで: Scheduler 発火処理
 * 何を: 期限到来レコードを claim し、宛先解決/チャネル配信/次回発火への前進を行う
 * なぜ: 発火ごとの claim を一度だけに保ちつつ、遅い配信が他レコードを止めないよう並列に処理するため
 */
package com.example.scheduler.dispatch;

import com.example.common.TraceIds;
import com.example.scheduler.channel.ChannelAdapter;
import com.example.scheduler.channel.DeliveryRequest;
import com.example.scheduler.config.DispatchExecutorConfig;
import com.example.scheduler.config.SchedulerDispatchProperties;
import com.example.scheduler.model.DeliveryAttemptRecord;
import com.example.scheduler.model.DeliveryStatus;
import com.example.scheduler.model.ScheduledNotificationRecord;
import com.example.scheduler.model.ScheduledNotificationStatus;
import com.example.scheduler.recipient.RecipientResolutionException;
import com.example.scheduler.recipient.RecipientResolver;
import com.example.scheduler.recipient.ResolvedRecipient;
import com.example.scheduler.repository.DeliveryAttemptRepository;
import com.example.scheduler.repository.ScheduledNotificationRepository;
import com.example.scheduler.schedule.FireOutcome;
import com.example.scheduler.schedule.ScheduledNotificationLifecycle;
import com.google.common.annotations.VisibleForTesting;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class DispatchService {

  private static final Logger logger = LoggerFactory.getLogger(DispatchService.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";
  private static final String MDC_NOTIFICATION_ID = "notification_id";
  private static final String MDC_TRACE_ID = "trace_id";

  private final ScheduledNotificationRepository notificationRepository;
  private final DeliveryAttemptRepository deliveryAttemptRepository;
  private final RecipientResolver recipientResolver;
  private final ChannelAdapter channelAdapter;
  private final ScheduledNotificationLifecycle lifecycle;
  private final SchedulerDispatchProperties properties;
  private final SchedulerMetrics metrics;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;
  private final AsyncTaskExecutor recordExecutor;
  private final AsyncTaskExecutor deliveryExecutor;

  public DispatchService(
      ScheduledNotificationRepository notificationRepository,
      DeliveryAttemptRepository deliveryAttemptRepository,
      RecipientResolver recipientResolver,
      ChannelAdapter channelAdapter,
      ScheduledNotificationLifecycle lifecycle,
      SchedulerDispatchProperties properties,
      SchedulerMetrics metrics,
      Clock clock,
      PlatformTransactionManager transactionManager,
      @Qualifier(DispatchExecutorConfig.RECORD_EXECUTOR) AsyncTaskExecutor recordExecutor,
      @Qualifier(DispatchExecutorConfig.DELIVERY_EXECUTOR) AsyncTaskExecutor deliveryExecutor) {
    this.notificationRepository = notificationRepository;
    this.deliveryAttemptRepository = deliveryAttemptRepository;
    this.recipientResolver = recipientResolver;
    this.channelAdapter = channelAdapter;
    this.lifecycle = lifecycle;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
    this.transactionManager = transactionManager;
    this.recordExecutor = recordExecutor;
    this.deliveryExecutor = deliveryExecutor;
  }

  public DispatchReport processDue() {
    return processDue(Instant.now(clock), properties.batchSize());
  }

  /**
   * now 時点で期限到来のレコードを最大 limit 件 claim して処理する。
   *
   * <p>claim はティックごとに一意な lock 所有者で行うため、同一ホストの並行ティックや lease 切れ後の再 claim
   * があっても、発火を書き込めるのは最後に claim した側だけになる。
   */
  public DispatchReport processDue(Instant now, int limit) {
    final String lockedBy = resolveLockedBy() + "/" + UUID.randomUUID();
    final Instant leaseUntil = now.plus(properties.lease());
    // 送信を始めてよいのはこの時刻まで。以降に始まる配信は lease 内に結果を書き込めない
    final long startDeadlineNanos = System.nanoTime() + properties.deliveryStartWindow().toNanos();
    // claim を単一 SQL で行い、配信 IO をトランザクションやレコードロックに載せない
    final List<ScheduledNotificationRecord> claimed =
        notificationRepository.claimDue(limit, now, leaseUntil, lockedBy);
    metrics.recordClaimed(claimed.size());
    final List<Future<RecordDispatchResult>> futures = new ArrayList<>(claimed.size());
    for (ScheduledNotificationRecord record : claimed) {
      futures.add(
          recordExecutor.submit(
              () -> processClaimed(record, now, lockedBy, startDeadlineNanos)));
    }
    final List<RecordDispatchResult> results = new ArrayList<>(claimed.size());
    for (int i = 0; i < futures.size(); i++) {
      results.add(await(futures.get(i), claimed.get(i)));
    }
    metrics.updateBacklogCurrent(notificationRepository.countDue(now));
    final DispatchReport report = DispatchReport.aggregate(now, results);
    if (!claimed.isEmpty()) {
      logger.info(
          "scheduled notification tick finished claimed={} fired={} released={} lockLost={} failedDeliveries={}",
          report.claimed().size(),
          report.fired(),
          report.released(),
          report.lockLost(),
          report.failures().size());
    }
    return report;
  }

  @VisibleForTesting
  RecordDispatchResult processClaimed(
      ScheduledNotificationRecord record, Instant now, String lockedBy, long startDeadlineNanos) {
    MDC.put(MDC_NOTIFICATION_ID, record.notificationId().toString());
    MDC.put(
        MDC_TRACE_ID,
        TraceIds.forOccurrence(record.notificationId(), record.occurrenceCount() + 1));
    try {
      if (System.nanoTime() - startDeadlineNanos > 0) {
        // レコードプールの待ちで送信開始期限を過ぎた。一件も送らずに claim を返す
        return release(
            record,
            new IllegalStateException("delivery window elapsed before dispatch started"),
            now,
            lockedBy);
      }
      final List<ResolvedRecipient> recipients;
      try {
        recipients =
            recipientResolver.resolve(record.recipients(), record.channels(), record.type(), now);
      } catch (RecipientResolutionException ex) {
        metrics.recordResolutionFailure();
        return release(record, ex, now, lockedBy);
      }
      final int occurrenceNumber = record.occurrenceCount() + 1;
      final List<DeliveryAttemptRecord> attempts =
          deliver(record, occurrenceNumber, recipients, startDeadlineNanos);
      if (!attempts.isEmpty()
          && attempts.stream().allMatch(a -> a.status() == DeliveryStatus.NOT_ATTEMPTED)) {
        // 一件も送っていないので発火を消費せず、次のティックに回す
        return release(
            record,
            new IllegalStateException("delivery window elapsed before any send started"),
            now,
            lockedBy);
      }
      return fire(record, attempts, lockedBy);
    } catch (DataAccessException ex) {
      // 永続化に失敗した claim は lease 切れ後に再 claim される
      logger.error("scheduled notification dispatch failed id={}", record.notificationId(), ex);
      return RecordDispatchResult.withoutDelivery(
          record.notificationId(), RecordDispatchResult.Outcome.ERRORED);
    } finally {
      MDC.remove(MDC_NOTIFICATION_ID);
      MDC.remove(MDC_TRACE_ID);
    }
  }

  private List<DeliveryAttemptRecord> deliver(
      ScheduledNotificationRecord record,
      int occurrenceNumber,
      List<ResolvedRecipient> recipients,
      long startDeadlineNanos) {
    final List<DeliveryTask> tasks = new ArrayList<>();
    for (ResolvedRecipient recipient : recipients) {
      for (String channel : recipient.channels()) {
        final DeliveryRequest request =
            new DeliveryRequest(
                record.notificationId(),
                occurrenceNumber,
                record.nextOccurrenceAt(),
                record.type(),
                record.name(),
                recipient.userId(),
                channel,
                record.payloadJson());
        tasks.add(new DeliveryTask(request, channelAdapter, startDeadlineNanos));
      }
    }
    final List<Future<?>> futures = new ArrayList<>(tasks.size());
    for (DeliveryTask task : tasks) {
      futures.add(deliveryExecutor.submit(task));
    }
    final List<DeliveryAttemptRecord> attempts = new ArrayList<>(tasks.size());
    for (int i = 0; i < tasks.size(); i++) {
      final DeliveryTask task = tasks.get(i);
      final DeliveryAttemptRecord attempt = awaitDelivery(futures.get(i), task);
      metrics.recordDelivery(task.request().channel(), attempt.status());
      attempts.add(attempt);
    }
    return attempts;
  }

  private DeliveryAttemptRecord awaitDelivery(Future<?> future, DeliveryTask task) {
    final DeliveryRequest request = task.request();
    try {
      final OptionalLong startedAt = task.awaitStart();
      if (startedAt.isEmpty()) {
        logger.warn(
            "scheduled notification delivery not attempted before window closed userId={} channel={}",
            request.userId(),
            request.channel());
        return attempt(request, DeliveryStatus.NOT_ATTEMPTED, "delivery window elapsed before send");
      }
      // タイムアウトは送信開始から数える
      final long remainingNanos =
          properties.deliveryTimeout().toNanos() - (System.nanoTime() - startedAt.getAsLong());
      future.get(Math.max(0, remainingNanos), TimeUnit.NANOSECONDS);
      return attempt(request, DeliveryStatus.SUCCEEDED, null);
    } catch (TimeoutException ex) {
      future.cancel(true);
      logger.warn(
          "scheduled notification delivery timed out userId={} channel={}",
          request.userId(),
          request.channel());
      return attempt(request, DeliveryStatus.TIMED_OUT, "delivery timed out");
    } catch (ExecutionException ex) {
      final Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      logger.warn(
          "scheduled notification delivery failed userId={} channel={}",
          request.userId(),
          request.channel(),
          cause);
      return attempt(request, DeliveryStatus.FAILED, truncateError(cause.getMessage()));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      return attempt(request, DeliveryStatus.FAILED, "delivery interrupted");
    }
  }

  private RecordDispatchResult fire(
      ScheduledNotificationRecord record, List<DeliveryAttemptRecord> attempts, String lockedBy) {
    final Instant firedAt = Instant.now(clock);
    final FireOutcome outcome = lifecycle.fire(record, firedAt);
    final List<DeliveryFailure> failures =
        attempts.stream()
            .filter(attempt -> attempt.status() != DeliveryStatus.SUCCEEDED)
            .map(
                attempt ->
                    new DeliveryFailure(
                        attempt.notificationId(),
                        attempt.occurrenceNumber(),
                        attempt.userId(),
                        attempt.channel(),
                        attempt.status(),
                        attempt.errorMessage()))
            .toList();
    final boolean anySucceeded = attempts.size() > failures.size();
    final long notAttempted =
        failures.stream().filter(f -> f.status() == DeliveryStatus.NOT_ATTEMPTED).count();
    final String lastError =
        failures.isEmpty()
            ? null
            : failures.size()
                + " of "
                + attempts.size()
                + " deliveries failed"
                + (notAttempted > 0 ? " (" + notAttempted + " not attempted)" : "");
    // 配信結果と次状態を同一トランザクションで書き、lock 喪失時はどちらも残さない
    final Boolean advanced =
        transactionTemplate()
            .execute(
                status -> {
                  final int updated =
                      notificationRepository.advance(
                          record.notificationId(),
                          lockedBy,
                          outcome.status(),
                          outcome.nextOccurrenceAt(),
                          outcome.occurrenceCount(),
                          anySucceeded ? firedAt : null,
                          lastError,
                          firedAt);
                  if (updated == 0) {
                    status.setRollbackOnly();
                    return false;
                  }
                  deliveryAttemptRepository.insertAll(attempts);
                  return true;
                });
    if (!Boolean.TRUE.equals(advanced)) {
      metrics.recordLockLost();
      logger.warn(
          "scheduled notification fired but claim was lost id={} occurrence={} failedDeliveries={}",
          record.notificationId(),
          outcome.occurrenceCount(),
          failures.size());
      return new RecordDispatchResult(
          record.notificationId(),
          RecordDispatchResult.Outcome.LOCK_LOST,
          null,
          attempts.size(),
          failures);
    }
    metrics.recordDispatchLag(record.nextOccurrenceAt(), firedAt);
    logger.info(
        "scheduled notification fired id={} occurrence={} status={} next={} deliveries={} failed={}",
        record.notificationId(),
        outcome.occurrenceCount(),
        outcome.status(),
        outcome.nextOccurrenceAt(),
        attempts.size(),
        failures.size());
    return new RecordDispatchResult(
        record.notificationId(),
        RecordDispatchResult.Outcome.FIRED,
        outcome.status(),
        attempts.size(),
        failures);
  }

  @VisibleForTesting
  RecordDispatchResult release(
      ScheduledNotificationRecord record, RuntimeException ex, Instant now, String lockedBy) {
    final int nextAttempt = record.attemptCount() + 1;
    final Instant nextRetryAt = now.plus(computeBackoffDuration(nextAttempt));
    final int updated =
        notificationRepository.release(
            record.notificationId(),
            lockedBy,
            nextAttempt,
            nextRetryAt,
            truncateError(rootMessage(ex)),
            now);
    if (updated == 0) {
      logger.warn(
          "scheduled notification release skipped because claim was lost id={} attempt={}",
          record.notificationId(),
          nextAttempt);
      return RecordDispatchResult.withoutDelivery(
          record.notificationId(), RecordDispatchResult.Outcome.LOCK_LOST);
    }
    logger.warn(
        "scheduled notification released without delivery id={} attempt={} nextRetryAt={}",
        record.notificationId(),
        nextAttempt,
        nextRetryAt,
        ex);
    return new RecordDispatchResult(
        record.notificationId(),
        RecordDispatchResult.Outcome.RELEASED,
        ScheduledNotificationStatus.PENDING,
        0,
        List.of());
  }

  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(properties.backoffExponentBase(), (attempt - 1));
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = properties.backoffJitterMax();
    final double jitter =
        jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    final long backoffMillis = (long) Math.ceil(capped * jitter);
    final long minMillis = properties.backoffMin().toMillis();
    return Duration.ofMillis(Math.max(minMillis, backoffMillis));
  }

  TransactionTemplate transactionTemplate() {
    return new TransactionTemplate(transactionManager);
  }

  @VisibleForTesting
  String resolveLockedBy() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }

  private RecordDispatchResult await(
      Future<RecordDispatchResult> future, ScheduledNotificationRecord record) {
    try {
      return future.get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("dispatch tick interrupted", ex);
    } catch (ExecutionException ex) {
      logger.error(
          "scheduled notification dispatch crashed id={}", record.notificationId(), ex.getCause());
      return RecordDispatchResult.withoutDelivery(
          record.notificationId(), RecordDispatchResult.Outcome.ERRORED);
    }
  }

  private DeliveryAttemptRecord attempt(
      DeliveryRequest request, DeliveryStatus status, String errorMessage) {
    return new DeliveryAttemptRecord(
        UUID.randomUUID(),
        request.notificationId(),
        request.occurrenceNumber(),
        request.occurrenceAt(),
        request.userId(),
        request.channel(),
        status,
        errorMessage,
        Instant.now(clock));
  }

  private String rootMessage(Throwable ex) {
    Throwable current = ex;
    while (current.getCause() != null && current.getCause() != current) {
      current = current.getCause();
    }
    return ex == current ? ex.getMessage() : ex.getMessage() + ": " + current.getMessage();
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }
}
