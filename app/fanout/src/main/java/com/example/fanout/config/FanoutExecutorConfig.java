/*
 * どこで: fan-out インフラ設定
 * 何を: リアルタイム配信と一覧時の状態 upsert 用スレッドプールを定義する
 * なぜ: 配信が永続化を妨げず、upsert の並列度を制限するため
 */
package com.example.fanout.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class FanoutExecutorConfig {

  public static final String PUBLISH_EXECUTOR = "publishExecutor";
  public static final String STATE_UPSERT_EXECUTOR = "stateUpsertExecutor";

  @Bean(name = PUBLISH_EXECUTOR)
  public ThreadPoolTaskExecutor publishExecutor(FanoutPublishProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("fanout-publish-");
    executor.setCorePoolSize(properties.poolSize());
    executor.setMaxPoolSize(properties.poolSize());
    executor.setQueueCapacity(properties.queueCapacity());
    executor.setTaskDecorator(new MdcTaskDecorator());
    // キューが満杯なら拒否し、呼び出し側でログを出して配信を破棄する
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(5);
    return executor;
  }

  @Bean(name = STATE_UPSERT_EXECUTOR)
  public ThreadPoolTaskExecutor stateUpsertExecutor(FanoutListProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("fanout-upsert-");
    executor.setCorePoolSize(properties.upsertParallelism());
    executor.setMaxPoolSize(properties.upsertParallelism());
    executor.setQueueCapacity(properties.maxLimit());
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    return executor;
  }
}
