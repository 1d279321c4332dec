/*
 * どこで: fan-out 設定バインド
 * 何を: API で通知を作成できるロールを保持する
 * なぜ: リリースなしで作成権限を調整できるようにするため
 */
package com.example.fanout.config;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "fanout.api")
public record FanoutApiProperties(Set<String> authorRoles) {

  public FanoutApiProperties {
    authorRoles =
        authorRoles == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(authorRoles));
  }

  public boolean canAuthor(String role) {
    return role != null && authorRoles.contains(role);
  }
}
