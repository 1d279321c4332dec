package com.example.fanout.model;

import java.time.Instant;

public record UserState(boolean read, boolean archived, Instant deliveredAt, Instant readAt) {

  private static final UserState UNSEEN = new UserState(false, false, null, null);

  /** 状態行を読めなかった項目に返す既定状態。 */
  public static UserState unseen() {
    return UNSEEN;
  }

  public static UserState from(DeliveryStateRecord state) {
    return new UserState(state.read(), state.archived(), state.deliveredAt(), state.readAt());
  }
}
