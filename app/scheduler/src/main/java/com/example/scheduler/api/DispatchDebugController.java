/*
 * どこで: Scheduler 運用 API
 * 何を: 期限到来レコードの発火処理を 1 ティック分だけ手動で実行する
 * なぜ: ポーリングを待たずに発火を確認/再実行できるようにするため
 */
package com.example.scheduler.api;

import com.example.scheduler.config.SchedulerDispatchProperties;
import com.example.scheduler.dispatch.DispatchReport;
import com.example.scheduler.dispatch.DispatchService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/debug/scheduler")
@RequiredArgsConstructor
@Validated
public class DispatchDebugController {

  private final DispatchService dispatchService;
  private final SchedulerDispatchProperties properties;
  private final Clock clock;

  @PostMapping("/dispatch")
  public DispatchReport dispatch(
      @RequestParam(value = "limit", required = false)
          @Min(value = 1, message = "limit must be >= 1")
          @Max(value = 1000, message = "limit must be <= 1000")
          Integer limit) {
    final int batch = limit == null ? properties.batchSize() : limit;
    return dispatchService.processDue(Instant.now(clock), batch);
  }
}
