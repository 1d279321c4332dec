/*
 * どこで: fan-out サービス層
 * 何を: 期限切れ通知と、通知本体を失った配信状態を削除する
 * なぜ: 一覧経路では削除しないため、不要行をここでまとめて消すため
 */
package com.example.fanout.service;

import com.example.fanout.config.NotificationMaintenanceProperties;
import com.example.fanout.repository.DeliveryStateRepository;
import com.example.fanout.repository.NotificationRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationMaintenanceService {

  private static final Logger logger =
      LoggerFactory.getLogger(NotificationMaintenanceService.class);

  private final NotificationRepository notificationRepository;
  private final DeliveryStateRepository deliveryStateRepository;
  private final NotificationMaintenanceProperties properties;
  private final NotificationMetrics metrics;
  private final Clock clock;

  public int pruneOrphans() {
    final int deleted = deliveryStateRepository.pruneOrphans();
    metrics.recordDeleted(NotificationMetrics.DELETED_ORPHAN, deleted);
    logger.info("orphan delivery states pruned count={}", deleted);
    return deleted;
  }

  public int purgeExpired() {
    final Duration grace =
        properties.expiredGrace() == null ? Duration.ZERO : properties.expiredGrace();
    final Instant threshold = Instant.now(clock).minus(grace);
    final int deleted = notificationRepository.deleteExpiredBefore(threshold);
    metrics.recordDeleted(NotificationMetrics.DELETED_EXPIRED, deleted);
    logger.info("expired notifications purged count={} threshold={}", deleted, threshold);
    return deleted;
  }

  /** 先に期限切れ削除を行い、直後の孤児削除で関連する状態行も消す。 */
  public void runScheduledCleanup() {
    purgeExpired();
    pruneOrphans();
  }
}
