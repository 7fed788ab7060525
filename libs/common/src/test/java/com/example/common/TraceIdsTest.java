package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class TraceIdsTest {

  private static final UUID NOTIFICATION_ID =
      UUID.fromString("0b8f6c1e-5d0a-4f7e-9a55-3c2f1d0e9b77");

  @Test
  void sameOccurrenceYieldsSameTraceId() {
    assertThat(TraceIds.forOccurrence(NOTIFICATION_ID, 3))
        .isEqualTo(TraceIds.forOccurrence(NOTIFICATION_ID, 3))
        .hasSize(36);
  }

  @Test
  void differentOccurrenceOrNotificationYieldsDifferentTraceId() {
    final String base = TraceIds.forOccurrence(NOTIFICATION_ID, 1);

    assertThat(TraceIds.forOccurrence(NOTIFICATION_ID, 2)).isNotEqualTo(base);
    assertThat(TraceIds.forOccurrence(UUID.randomUUID(), 1)).isNotEqualTo(base);
  }
}
