/*
 * どこで: fan-out ドメインモデル
 * 何を: 通知の宛先種別を閉じた集合として定義する
 * なぜ: ユーザー宛先にロールが混入する（またはその逆の）状態を型で防ぐため
 */
package com.example.fanout.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public sealed interface Audience permits Audience.Broadcast, Audience.Users, Audience.Roles {

  AudienceMode mode();

  /** 宛先メンバー。broadcast では空。 */
  Set<String> members();

  static Audience broadcast() {
    return new Broadcast();
  }

  static Audience users(Collection<String> usernames) {
    return new Users(normalize(usernames));
  }

  static Audience roles(Collection<String> roles) {
    return new Roles(normalize(roles));
  }

  static Audience of(AudienceMode mode, Collection<String> members) {
    return switch (mode) {
      case BROADCAST -> broadcast();
      case USER -> users(members);
      case ROLE -> roles(members);
    };
  }

  record Broadcast() implements Audience {
    @Override
    public AudienceMode mode() {
      return AudienceMode.BROADCAST;
    }

    @Override
    public Set<String> members() {
      return Set.of();
    }
  }

  record Users(Set<String> usernames) implements Audience {
    public Users {
      usernames = normalize(usernames);
    }

    @Override
    public AudienceMode mode() {
      return AudienceMode.USER;
    }

    @Override
    public Set<String> members() {
      return usernames;
    }
  }

  record Roles(Set<String> roles) implements Audience {
    public Roles {
      roles = normalize(roles);
    }

    @Override
    public AudienceMode mode() {
      return AudienceMode.ROLE;
    }

    @Override
    public Set<String> members() {
      return roles;
    }
  }

  // 前後空白を除去し、空文字と重複を捨て、初出順を保つ
  private static Set<String> normalize(Collection<String> values) {
    if (values == null || values.isEmpty()) {
      return Set.of();
    }
    final Set<String> normalized = new LinkedHashSet<>();
    for (String value : values) {
      if (value == null) {
        continue;
      }
      final String trimmed = value.trim();
      if (!trimmed.isEmpty()) {
        normalized.add(trimmed);
      }
    }
    return Collections.unmodifiableSet(normalized);
  }
}
