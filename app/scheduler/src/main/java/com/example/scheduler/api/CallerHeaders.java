/*
 * どこで: Scheduler API
 * 何を: 呼び出し元ユーザ/ロールを運ぶヘッダ名
 * なぜ: コントローラと MDC で同じヘッダを参照するため
 */
package com.example.scheduler.api;

public final class CallerHeaders {

  public static final String USER_ID = "X-User-Id";
  public static final String ROLES = "X-User-Roles";

  private CallerHeaders() {}
}
