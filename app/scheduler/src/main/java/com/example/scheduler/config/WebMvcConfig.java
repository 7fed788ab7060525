/*
 * どこで: Scheduler Web 設定
 * 何を: RequestMdcInterceptor を業務/運用 API に適用する
 * なぜ: 予約通知 API のログへ呼び出し元を埋め込み、actuator のスクレイプは対象外にするため
 */
package com.example.scheduler.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry
        .addInterceptor(requestMdcInterceptor)
        .addPathPatterns("/v1/**", "/debug/**")
        .excludePathPatterns("/actuator/**");
  }
}
