/*
 * どこで: fan-out リアルタイム配信
 * 何を: 各チャネルの subject に送る JSON 本文を定義する
 * なぜ: 宛先種別に関係なく購読側が同じ形式で解釈できるようにするため
 */
package com.example.fanout.nats;

import com.example.fanout.model.DeliveryMedium;
import com.example.fanout.model.NotificationRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationPushMessage(String event, String traceId, Data data) {

  public static NotificationPushMessage of(
      String event, String traceId, NotificationRecord notification) {
    return new NotificationPushMessage(event, traceId, Data.from(notification));
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Data(
      String notificationId,
      String title,
      String body,
      String type,
      String severity,
      String audienceMode,
      List<String> audienceMembers,
      String createdAt,
      String expiresAt,
      Map<String, Object> metadata,
      List<String> channels) {

    public Data {
      audienceMembers =
          audienceMembers == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(audienceMembers));
      metadata =
          metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
      channels = channels == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(channels));
    }

    static Data from(NotificationRecord notification) {
      return new Data(
          notification.notificationId().toString(),
          notification.title(),
          notification.body(),
          notification.type(),
          notification.severity().value(),
          notification.audience().mode().value(),
          new ArrayList<>(notification.audience().members()),
          notification.createdAt().toString(),
          notification.expiresAt() == null ? null : notification.expiresAt().toString(),
          notification.metadata(),
          notification.channels().stream().map(DeliveryMedium::value).toList());
    }
  }
}
