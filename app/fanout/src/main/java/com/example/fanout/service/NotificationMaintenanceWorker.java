/*
 * どこで: fan-out 掃除ワーカー
 * 何を: 期限切れ削除と孤児削除を定期実行する
 * なぜ: 手動操作なしに両テーブルの肥大化を防ぐため
 */
package com.example.fanout.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "fanout.maintenance.enabled", havingValue = "true")
public class NotificationMaintenanceWorker {

  private static final Logger logger = LoggerFactory.getLogger(NotificationMaintenanceWorker.class);

  private final NotificationMaintenanceService maintenanceService;

  @Scheduled(fixedDelayString = "${fanout.maintenance.cleanup-interval}")
  public void run() {
    try {
      maintenanceService.runScheduledCleanup();
    } catch (DataAccessException ex) {
      // 次回の実行で再試行する
      logger.error("notification maintenance failed", ex);
    }
  }
}
