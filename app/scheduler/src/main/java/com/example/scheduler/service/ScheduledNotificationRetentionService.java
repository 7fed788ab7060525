/*
 * Where: Scheduler service layer
 * What: Applies retention policy to finished scheduled notifications
 * Why: Keep the record table bounded while leaving active schedules untouched
 */
package com.example.scheduler.service;

import com.example.scheduler.config.SchedulerRetentionProperties;
import com.example.scheduler.repository.ScheduledNotificationRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ScheduledNotificationRetentionService {

  private static final Logger logger =
      LoggerFactory.getLogger(ScheduledNotificationRetentionService.class);

  private final ScheduledNotificationRepository notificationRepository;
  private final SchedulerRetentionProperties retentionProperties;
  private final Clock clock;

  public void cleanup() {
    final Instant now = Instant.now(clock);
    // lease 切れのまま再 claim されない PROCESSING は発火処理が止まっている兆候
    final Instant staleThreshold = now.minus(retentionProperties.staleProcessingAfter());
    final int staleProcessingCount = notificationRepository.countStaleProcessing(staleThreshold);
    if (staleProcessingCount > 0) {
      logger.error(
          "scheduled notification retention found stale processing records count={} threshold={}",
          staleProcessingCount,
          staleThreshold);
    }
    final Instant threshold = now.minus(Duration.ofDays(retentionProperties.retentionDays()));
    final int deleted = notificationRepository.deleteTerminalOlderThan(threshold);
    logger.info(
        "scheduled notification retention cleanup deleted={} threshold={}", deleted, threshold);
  }
}
