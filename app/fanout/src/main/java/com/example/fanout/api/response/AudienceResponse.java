package com.example.fanout.api.response;

import com.example.fanout.model.Audience;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AudienceResponse(String mode, List<String> usernames, List<String> roles) {

  public AudienceResponse {
    usernames = usernames == null ? null : List.copyOf(usernames);
    roles = roles == null ? null : List.copyOf(roles);
  }

  public static AudienceResponse from(Audience audience) {
    final List<String> members = new ArrayList<>(audience.members());
    return switch (audience.mode()) {
      case BROADCAST -> new AudienceResponse(audience.mode().value(), null, null);
      case USER -> new AudienceResponse(audience.mode().value(), members, null);
      case ROLE -> new AudienceResponse(audience.mode().value(), null, members);
    };
  }
}
