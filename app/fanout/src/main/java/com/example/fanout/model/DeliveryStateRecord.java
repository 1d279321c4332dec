/*
 * どこで: fan-out ドメインモデル
 * 何を: delivery_states テーブルの 1 行を表す
 * なぜ: 受信者ごとの既読/アーカイブ状態を保持するため
 */
package com.example.fanout.model;

import java.time.Instant;
import java.util.UUID;

public record DeliveryStateRecord(
    String recipient,
    UUID notificationId,
    boolean read,
    boolean archived,
    Instant deliveredAt,
    Instant readAt) {}
