/*
 * どこで: fan-out サービス層
 * 何を: 宛先をリアルタイム配信チャネル名へ変換し、宛先判定を行う
 * なぜ: 購読側が broadcast / user:<name> / role:<name> を購読するため
 */
package com.example.fanout.service;

import com.example.fanout.model.Audience;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class AudienceResolver {

  public static final String BROADCAST_CHANNEL = "broadcast";
  public static final String USER_CHANNEL_PREFIX = "user:";
  public static final String ROLE_CHANNEL_PREFIX = "role:";

  /** メンバー順のチャネル集合。メンバーが無ければ空集合。 */
  public Set<String> resolve(Audience audience) {
    Objects.requireNonNull(audience, "audience");
    if (audience instanceof Audience.Broadcast) {
      return Set.of(BROADCAST_CHANNEL);
    }
    if (audience instanceof Audience.Users users) {
      return prefixed(USER_CHANNEL_PREFIX, users.usernames());
    }
    if (audience instanceof Audience.Roles roles) {
      return prefixed(ROLE_CHANNEL_PREFIX, roles.roles());
    }
    throw new IllegalStateException("unhandled audience " + audience.getClass().getName());
  }

  /** リポジトリの可視性クエリと同じ判定規則。 */
  public boolean isVisibleTo(Audience audience, String recipient, String role) {
    Objects.requireNonNull(audience, "audience");
    if (audience instanceof Audience.Broadcast) {
      return true;
    }
    if (audience instanceof Audience.Users users) {
      return recipient != null && users.usernames().contains(recipient);
    }
    if (audience instanceof Audience.Roles roles) {
      return role != null && roles.roles().contains(role);
    }
    return false;
  }

  private Set<String> prefixed(String prefix, Set<String> members) {
    final Set<String> channels = new LinkedHashSet<>();
    for (String member : members) {
      channels.add(prefix + member);
    }
    return Collections.unmodifiableSet(channels);
  }
}
