/*
 * どこで: fan-out ドメインモデル
 * 何を: notifications テーブルの 1 行を表す
 * なぜ: 作成/一覧/配信の各経路で書き込み後不変の通知本体を共有するため
 */
package com.example.fanout.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

public record NotificationRecord(
    UUID notificationId,
    String title,
    String body,
    String type,
    Severity severity,
    Audience audience,
    Instant createdAt,
    Instant expiresAt,
    Map<String, Object> metadata,
    Set<DeliveryMedium> channels) {

  public NotificationRecord {
    // metadata の値は JSON null を含みうるため Map.copyOf は使えない
    metadata =
        metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    channels =
        channels == null || channels.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(channels));
  }
}
