/*
 * どこで: fan-out インフラ設定
 * 何を: リアルタイム配信で使う NATS 接続を管理する
 * なぜ: 配信処理が 1 本の接続を共有し、コンテキストと同じライフサイクルで閉じるため
 */
package com.example.fanout.config;

import io.nats.client.Connection;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsConfig {

  @Bean(destroyMethod = "close")
  public Connection natsConnection(
      NatsProperties properties, @Value("${spring.application.name}") String applicationName)
      throws IOException, InterruptedException {
    Options options =
        new Options.Builder()
            .server(properties.url())
            .connectionName(applicationName)
            .connectionTimeout(Duration.ofSeconds(properties.connectionTimeout()))
            // 配信は補助的なため、サービスを落とさず再接続を続ける
            .maxReconnects(-1)
            .build();
    return Nats.connect(options);
  }
}
