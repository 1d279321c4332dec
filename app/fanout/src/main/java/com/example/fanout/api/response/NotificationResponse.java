/*
 * どこで: fan-out API レスポンス DTO
 * 何を: 保存済み通知の応答形式を定義する
 * なぜ: JSON 形状をドメインレコードから切り離すため
 */
package com.example.fanout.api.response;

import com.example.fanout.model.DeliveryMedium;
import com.example.fanout.model.NotificationRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationResponse(
    String notificationId,
    String title,
    String body,
    String type,
    String severity,
    AudienceResponse audience,
    String createdAt,
    String expiresAt,
    Map<String, Object> metadata,
    List<String> channels) {

  public NotificationResponse {
    metadata =
        metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    channels = channels == null ? List.of() : List.copyOf(channels);
  }

  public static NotificationResponse from(NotificationRecord record) {
    return new NotificationResponse(
        record.notificationId().toString(),
        record.title(),
        record.body(),
        record.type(),
        record.severity().value(),
        AudienceResponse.from(record.audience()),
        record.createdAt().toString(),
        record.expiresAt() == null ? null : record.expiresAt().toString(),
        record.metadata(),
        record.channels().stream().map(DeliveryMedium::value).toList());
  }
}
