package com.example.fanout.api.response;

import com.example.fanout.model.UserState;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserStateResponse(
    // boolean アクセサで is_ 接頭辞が落ちないよう名前を明示する
    @JsonProperty("is_read") boolean isRead,
    @JsonProperty("is_archived") boolean isArchived,
    String deliveredAt,
    String readAt) {

  public static UserStateResponse from(UserState state) {
    return new UserStateResponse(
        state.read(),
        state.archived(),
        state.deliveredAt() == null ? null : state.deliveredAt().toString(),
        state.readAt() == null ? null : state.readAt().toString());
  }
}
