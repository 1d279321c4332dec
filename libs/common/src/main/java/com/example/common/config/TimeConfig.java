/*
 * どこで: 共通設定
 * 何を: UTC の Clock Bean を提供する
 * なぜ: 現在時刻の取得元を差し替え可能な 1 箇所に揃えるため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
