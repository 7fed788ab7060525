/*
 * どこで: Scheduler API
 * 何を: 予約通知の作成/更新/取消/参照/集計のエンドポイントを提供する
 * なぜ: 呼び出し元をヘッダから明示的に受け取り、サービスへ渡すため
 */
package com.example.scheduler.api;

import com.example.scheduler.model.ScheduledNotificationFilter;
import com.example.scheduler.model.ScheduledNotificationRecord;
import com.example.scheduler.model.ScheduledNotificationStatus;
import com.example.scheduler.service.CallerContext;
import com.example.scheduler.service.ScheduledNotificationService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/scheduled-notifications")
@RequiredArgsConstructor
@Validated
public class ScheduledNotificationController {

  private final ScheduledNotificationService notificationService;
  private final ObjectMapper objectMapper;

  @PostMapping
  public ResponseEntity<ScheduledNotificationResponse> create(
      @RequestHeader(CallerHeaders.USER_ID) String userId,
      @RequestHeader(value = CallerHeaders.ROLES, required = false) String roles,
      @Valid @RequestBody ScheduledNotificationRequest request) {
    final ScheduledNotificationRecord record =
        notificationService.create(caller(userId, roles), request);
    return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(record));
  }

  @PutMapping("/{id}")
  public ScheduledNotificationResponse update(
      @RequestHeader(CallerHeaders.USER_ID) String userId,
      @RequestHeader(value = CallerHeaders.ROLES, required = false) String roles,
      @PathVariable("id") UUID notificationId,
      @Valid @RequestBody ScheduledNotificationRequest request) {
    return toResponse(notificationService.update(caller(userId, roles), notificationId, request));
  }

  @PostMapping("/{id}/cancel")
  public ScheduledNotificationResponse cancel(
      @RequestHeader(CallerHeaders.USER_ID) String userId,
      @RequestHeader(value = CallerHeaders.ROLES, required = false) String roles,
      @PathVariable("id") UUID notificationId) {
    return toResponse(notificationService.cancel(caller(userId, roles), notificationId));
  }

  @GetMapping("/{id}")
  public ScheduledNotificationResponse get(
      @RequestHeader(CallerHeaders.USER_ID) String userId,
      @RequestHeader(value = CallerHeaders.ROLES, required = false) String roles,
      @PathVariable("id") UUID notificationId) {
    return toResponse(notificationService.get(caller(userId, roles), notificationId));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(
      @RequestHeader(CallerHeaders.USER_ID) String userId,
      @RequestHeader(value = CallerHeaders.ROLES, required = false) String roles,
      @PathVariable("id") UUID notificationId) {
    notificationService.delete(caller(userId, roles), notificationId);
    return ResponseEntity.noContent().build();
  }

  @GetMapping
  public ScheduledNotificationsResponse list(
      @RequestHeader(CallerHeaders.USER_ID) String userId,
      @RequestHeader(value = CallerHeaders.ROLES, required = false) String roles,
      @RequestParam(value = "status", required = false) String status,
      @RequestParam(value = "type", required = false) String type,
      @RequestParam(value = "start_date", required = false) String startDate,
      @RequestParam(value = "end_date", required = false) String endDate,
      @RequestParam(value = "created_by", required = false) String createdBy,
      @RequestParam(value = "limit", defaultValue = "15")
          @Min(value = 1, message = "limit must be >= 1")
          @Max(value = 100, message = "limit must be <= 100")
          int limit,
      @RequestParam(value = "offset", defaultValue = "0")
          @Min(value = 0, message = "offset must be >= 0")
          int offset) {
    final ScheduledNotificationFilter filter =
        new ScheduledNotificationFilter(
            parseStatus(status),
            blankToNull(type),
            parseBound(startDate, "start_date", false),
            parseBound(endDate, "end_date", true),
            blankToNull(createdBy),
            limit,
            offset);
    return new ScheduledNotificationsResponse(
        notificationService.list(caller(userId, roles), filter).stream()
            .map(this::toResponse)
            .toList(),
        limit,
        offset);
  }

  @GetMapping("/upcoming")
  public ScheduledNotificationsResponse upcoming(
      @RequestHeader(CallerHeaders.USER_ID) String userId,
      @RequestHeader(value = CallerHeaders.ROLES, required = false) String roles,
      @RequestParam(value = "limit", defaultValue = "10")
          @Min(value = 1, message = "limit must be >= 1")
          @Max(value = 100, message = "limit must be <= 100")
          int limit) {
    return new ScheduledNotificationsResponse(
        notificationService.upcoming(caller(userId, roles), limit).stream()
            .map(this::toResponse)
            .toList(),
        limit,
        0);
  }

  @GetMapping("/{id}/deliveries")
  public DeliveryAttemptsResponse deliveries(
      @RequestHeader(CallerHeaders.USER_ID) String userId,
      @RequestHeader(value = CallerHeaders.ROLES, required = false) String roles,
      @PathVariable("id") UUID notificationId,
      @RequestParam(value = "limit", defaultValue = "100")
          @Min(value = 1, message = "limit must be >= 1")
          @Max(value = 1000, message = "limit must be <= 1000")
          int limit) {
    return new DeliveryAttemptsResponse(
        notificationId,
        notificationService.deliveries(caller(userId, roles), notificationId, limit).stream()
            .map(DeliveryAttemptSummary::from)
            .toList());
  }

  @GetMapping("/stats")
  public ScheduledNotificationStatsResponse stats(
      @RequestHeader(CallerHeaders.USER_ID) String userId,
      @RequestHeader(value = CallerHeaders.ROLES, required = false) String roles) {
    return ScheduledNotificationStatsResponse.from(
        notificationService.stats(caller(userId, roles)));
  }

  private CallerContext caller(String userId, String roles) {
    final Set<String> roleSet =
        roles == null
            ? Set.of()
            : Arrays.stream(roles.split(","))
                .map(String::trim)
                .filter(role -> !role.isEmpty())
                .collect(Collectors.toSet());
    return new CallerContext(userId, roleSet);
  }

  private ScheduledNotificationResponse toResponse(ScheduledNotificationRecord record) {
    try {
      final JsonNode payload = objectMapper.readTree(record.payloadJson());
      return ScheduledNotificationResponse.from(record, payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException(
          "scheduled notification payload parse failure id=" + record.notificationId(), ex);
    }
  }

  private ScheduledNotificationStatus parseStatus(String status) {
    if (status == null || status.isBlank()) {
      return null;
    }
    try {
      return ScheduledNotificationStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("status is invalid: " + status, ex);
    }
  }

  // 日付だけの指定は UTC のその日の始まり/終わりとして扱う
  private Instant parseBound(String value, String name, boolean endOfDay) {
    if (value == null || value.isBlank()) {
      return null;
    }
    final String trimmed = value.trim();
    try {
      if (trimmed.length() == 10) {
        final LocalDate date = LocalDate.parse(trimmed);
        return endOfDay
            ? date.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().minusNanos(1)
            : date.atStartOfDay(ZoneOffset.UTC).toInstant();
      }
      return Instant.parse(trimmed);
    } catch (DateTimeException ex) {
      throw new IllegalArgumentException(name + " is invalid: " + value, ex);
    }
  }

  private String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
