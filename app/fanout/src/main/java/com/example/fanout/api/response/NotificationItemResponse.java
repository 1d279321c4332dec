package com.example.fanout.api.response;

import com.example.fanout.model.MergedNotification;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** 通知の各フィールドを {@code user_state} と同じ階層に展開する。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationItemResponse(
    @JsonUnwrapped NotificationResponse notification, UserStateResponse userState) {

  public static NotificationItemResponse from(MergedNotification merged) {
    return new NotificationItemResponse(
        NotificationResponse.from(merged.notification()),
        UserStateResponse.from(merged.userState()));
  }
}
