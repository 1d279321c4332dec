/*
 * どこで: fan-out API リクエスト DTO
 * 何を: 宛先の JSON 表現を定義する
 * なぜ: mode に合わないメンバー指定を拒否するため
 */
package com.example.fanout.api.request;

import com.example.fanout.model.Audience;
import com.example.fanout.model.AudienceMode;
import com.example.fanout.service.InvalidNotificationException;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.NotBlank;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "Request DTO is read once and never shared")
public record AudienceRequest(@NotBlank String mode, List<String> usernames, List<String> roles) {

  public Audience toAudience() {
    final AudienceMode audienceMode;
    try {
      audienceMode = AudienceMode.fromValue(mode);
    } catch (IllegalArgumentException ex) {
      throw new InvalidNotificationException(ex.getMessage(), ex);
    }
    return switch (audienceMode) {
      case BROADCAST -> {
        if (isPresent(usernames) || isPresent(roles)) {
          throw new InvalidNotificationException("broadcast audience takes no members");
        }
        yield Audience.broadcast();
      }
      case USER -> {
        if (isPresent(roles)) {
          throw new InvalidNotificationException("user audience cannot carry roles");
        }
        yield Audience.users(usernames);
      }
      case ROLE -> {
        if (isPresent(usernames)) {
          throw new InvalidNotificationException("role audience cannot carry usernames");
        }
        yield Audience.roles(roles);
      }
    };
  }

  private static boolean isPresent(List<String> values) {
    return values != null && !values.isEmpty();
  }
}
