package com.example.fanout.api.request;

import com.example.fanout.model.DeliveryMedium;
import com.example.fanout.model.NotificationDraft;
import com.example.fanout.model.Severity;
import com.example.fanout.service.InvalidNotificationException;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "Request DTO is read once and never shared")
public record CreateNotificationRequest(
    @NotBlank String title,
    @NotBlank String body,
    String type,
    String severity,
    @NotNull @Valid AudienceRequest audience,
    Instant expiresAt,
    Map<String, Object> metadata,
    List<String> channels) {

  public NotificationDraft toDraft() {
    try {
      return new NotificationDraft(
          title,
          body,
          type,
          severity == null ? null : Severity.fromValue(severity),
          audience.toAudience(),
          expiresAt,
          metadata,
          toMediums());
    } catch (IllegalArgumentException ex) {
      throw new InvalidNotificationException(ex.getMessage(), ex);
    }
  }

  private Set<DeliveryMedium> toMediums() {
    if (channels == null || channels.isEmpty()) {
      return null;
    }
    final Set<DeliveryMedium> mediums = EnumSet.noneOf(DeliveryMedium.class);
    channels.forEach(channel -> mediums.add(DeliveryMedium.fromValue(channel)));
    return mediums;
  }
}
