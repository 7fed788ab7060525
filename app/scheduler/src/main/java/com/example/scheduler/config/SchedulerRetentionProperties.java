/*
 * Where: Scheduler application configuration binding
 * What: Holds retention cleanup settings for finished scheduled notifications
 * Why: Keep the retention window and the stale-claim alert threshold tunable per environment
 */
package com.example.scheduler.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "scheduler.retention")
public record SchedulerRetentionProperties(
    boolean enabled, int retentionDays, Duration cleanupInterval, Duration staleProcessingAfter) {

  public SchedulerRetentionProperties {
    if (retentionDays < 1) {
      throw new IllegalArgumentException("scheduler.retention.retention-days must be >= 1");
    }
    staleProcessingAfter = staleProcessingAfter == null ? Duration.ofMinutes(30) : staleProcessingAfter;
  }
}
