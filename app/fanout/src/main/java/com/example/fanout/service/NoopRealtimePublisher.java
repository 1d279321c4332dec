/*
 * どこで: fan-out サービス層
 * 何を: NATS 無効時に使う配信実装
 * なぜ: ローカル実行やテストでブローカーなしに通知を作成できるようにするため
 */
package com.example.fanout.service;

import com.example.fanout.model.NotificationRecord;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class NoopRealtimePublisher implements RealtimePublisher {

  private static final Logger logger = LoggerFactory.getLogger(NoopRealtimePublisher.class);

  @Override
  public void publish(Set<String> channels, NotificationRecord notification) {
    logger.debug(
        "realtime publish skipped nats disabled notificationId={} channels={}",
        notification.notificationId(),
        channels);
  }
}
