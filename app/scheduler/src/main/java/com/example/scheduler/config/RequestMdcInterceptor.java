/*
 * どこで: Scheduler Web 設定
 * 何を: リクエスト単位の運用キー (request_id/呼び出し元/パス) を MDC に積む
 * なぜ: 予約通知の作成/取消ログを呼び出し元ユーザまで辿れるようにするため
 */
package com.example.scheduler.config;

import com.example.scheduler.api.CallerHeaders;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";
  private static final String HEADER_REQUEST_ID = "X-Request-Id";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final List<String> keys = new ArrayList<>();
    put(
        keys,
        "request_id",
        firstNonBlank(request.getHeader(HEADER_REQUEST_ID), UUID.randomUUID().toString()));
    put(keys, "caller_user_id", request.getHeader(CallerHeaders.USER_ID));
    put(keys, "http_method", request.getMethod());
    put(keys, "http_path", request.getRequestURI());
    put(keys, "client_ip", request.getRemoteAddr());
    request.setAttribute(ATTRIBUTE_KEYS, keys);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    // 積んだキーだけを外し、スレッド再利用時に前のリクエストの値を残さない
    if (request.getAttribute(ATTRIBUTE_KEYS) instanceof List<?> rawKeys) {
      rawKeys.stream().filter(String.class::isInstance).map(String.class::cast).forEach(MDC::remove);
    }
  }

  private String firstNonBlank(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }

  private void put(List<String> keys, String key, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    MDC.put(key, value);
    keys.add(key);
  }
}
