/*
 * どこで: fan-out ドメインモデル
 * 何を: 永続化前の通知作成入力を表す
 * なぜ: 未検証の入力と保存済みの通知本体を区別するため
 */
package com.example.fanout.model;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

public record NotificationDraft(
    String title,
    String body,
    String type,
    Severity severity,
    Audience audience,
    Instant expiresAt,
    Map<String, Object> metadata,
    Set<DeliveryMedium> channels) {}
