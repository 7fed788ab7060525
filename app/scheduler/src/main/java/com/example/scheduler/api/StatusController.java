/*
 * どこで: Scheduler API
 * 何を: ルートの簡易ヘルスレスポンスを返す
 * なぜ: 他サービスと同じ動作確認エンドポイントを揃えるため
 */
package com.example.scheduler.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  @GetMapping("/")
  public String home() {
    return "scheduler: ok";
  }
}
