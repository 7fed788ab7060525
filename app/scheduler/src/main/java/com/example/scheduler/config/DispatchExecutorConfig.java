/*
 * どこで: Scheduler アプリの並列実行設定
 * 何を: レコード単位と配信単位の有界スレッドプールを定義する
 * なぜ: 遅いチャネル配信が他レコードの発火を止めないよう並列度を分けて制限するため
 */
package com.example.scheduler.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class DispatchExecutorConfig {

  public static final String RECORD_EXECUTOR = "dispatchRecordExecutor";
  public static final String DELIVERY_EXECUTOR = "dispatchDeliveryExecutor";

  @Bean(name = RECORD_EXECUTOR)
  @Qualifier(RECORD_EXECUTOR)
  public ThreadPoolTaskExecutor dispatchRecordExecutor(SchedulerDispatchProperties properties) {
    return boundedExecutor("dispatch-record-", properties.recordParallelism());
  }

  @Bean(name = DELIVERY_EXECUTOR)
  @Qualifier(DELIVERY_EXECUTOR)
  public ThreadPoolTaskExecutor dispatchDeliveryExecutor(SchedulerDispatchProperties properties) {
    return boundedExecutor("dispatch-delivery-", properties.deliveryParallelism());
  }

  private ThreadPoolTaskExecutor boundedExecutor(String threadNamePrefix, int parallelism) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    // 並列度はスレッド数で固定し、溢れた分はキューで待たせる
    executor.setCorePoolSize(Math.max(1, parallelism));
    executor.setMaxPoolSize(Math.max(1, parallelism));
    executor.setThreadNamePrefix(threadNamePrefix);
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }
}
