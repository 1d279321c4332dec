/*
 * どこで: fan-out 設定バインド
 * 何を: 期限切れ削除と孤児削除の実行間隔と猶予期間を保持する
 * なぜ: 環境ごとに掃除の頻度を調整できるようにするため
 */
package com.example.fanout.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "fanout.maintenance")
public record NotificationMaintenanceProperties(
    boolean enabled, Duration cleanupInterval, Duration expiredGrace) {}
