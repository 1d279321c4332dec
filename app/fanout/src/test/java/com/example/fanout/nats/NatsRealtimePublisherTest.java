package com.example.fanout.nats;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import com.example.fanout.config.FanoutRealtimeProperties;
import com.example.fanout.model.Audience;
import com.example.fanout.model.DeliveryMedium;
import com.example.fanout.model.NotificationRecord;
import com.example.fanout.model.Severity;
import com.example.fanout.service.RealtimePublishException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.Connection;
import io.nats.client.impl.Headers;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

class NatsRealtimePublisherTest {

  private final Connection connection = Mockito.mock(Connection.class);
  private final ObjectMapper objectMapper = new ObjectMapper();
  private final NatsRealtimePublisher publisher =
      new NatsRealtimePublisher(
          connection,
          new FanoutRealtimeProperties("fanout.realtime", "notification.new"),
          objectMapper);

  @Test
  void publishesOneMessagePerChannelWithEnvelope() throws Exception {
    final NotificationRecord record = record();

    publisher.publish(new LinkedHashSet<>(List.of("role:admin", "role:manager")), record);

    final ArgumentCaptor<Headers> headers = ArgumentCaptor.forClass(Headers.class);
    final ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
    verify(connection).publish(eq("fanout.realtime.role:admin"), headers.capture(), body.capture());
    verify(connection).publish(eq("fanout.realtime.role:manager"), any(Headers.class), any(byte[].class));

    assertThat(headers.getValue().getFirst("Nats-Msg-Id"))
        .isEqualTo(record.notificationId() + ":role:admin");
    assertThat(headers.getValue().getFirst("Fanout-Channel")).isEqualTo("role:admin");
    final JsonNode json = objectMapper.readTree(body.getValue());
    assertThat(json.get("event").asText()).isEqualTo("notification.new");
    assertThat(json.get("data").get("notification_id").asText())
        .isEqualTo(record.notificationId().toString());
    assertThat(json.get("data").get("audience_mode").asText()).isEqualTo("role");
    assertThat(json.get("data").get("severity").asText()).isEqualTo("warning");
  }

  @Test
  void subjectTokensAreSanitized() {
    assertThat(publisher.subjectFor("user:jane.doe")).isEqualTo("fanout.realtime.user:jane_doe");
    assertThat(publisher.subjectFor("role:a *>b")).isEqualTo("fanout.realtime.role:a___b");
    assertThat(publisher.subjectFor("broadcast")).isEqualTo("fanout.realtime.broadcast");
  }

  @Test
  void throwsAfterTryingEveryChannelWhenOneFails() {
    doThrow(new IllegalStateException("Connection is Closed"))
        .when(connection)
        .publish(eq("fanout.realtime.user:alice"), any(Headers.class), any(byte[].class));

    assertThatThrownBy(
            () -> publisher.publish(new LinkedHashSet<>(List.of("user:alice", "user:bob")), record()))
        .isInstanceOf(RealtimePublishException.class)
        .hasMessageContaining("1 of 2");
    verify(connection).publish(eq("fanout.realtime.user:bob"), any(Headers.class), any(byte[].class));
  }

  private static NotificationRecord record() {
    return new NotificationRecord(
        UUID.randomUUID(),
        "Inspection",
        "Tomorrow at 10",
        "maintenance",
        Severity.WARNING,
        Audience.roles(List.of("admin", "manager")),
        Instant.parse("2026-03-01T09:00:00Z"),
        null,
        Map.of("propertyId", "p-1"),
        Set.of(DeliveryMedium.INAPP));
  }
}
