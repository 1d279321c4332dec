/*
 * どこで: fan-out リアルタイム配信
 * 何を: 解決済みチャネルごとに core NATS メッセージを 1 件送る
 * なぜ: 接続中クライアントがユーザー/ロール/全体の subject を購読するため
 */
package com.example.fanout.nats;

import com.example.common.TraceIds;
import com.example.fanout.config.FanoutRealtimeProperties;
import com.example.fanout.model.NotificationRecord;
import com.example.fanout.service.RealtimePublishException;
import com.example.fanout.service.RealtimePublisher;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.Connection;
import io.nats.client.impl.Headers;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "The NATS connection is a shared Spring-managed bean")
public class NatsRealtimePublisher implements RealtimePublisher {

  private static final Logger logger = LoggerFactory.getLogger(NatsRealtimePublisher.class);

  static final String HEADER_MSG_ID = "Nats-Msg-Id";
  static final String HEADER_CHANNEL = "Fanout-Channel";

  // NATS のトークン区切りとワイルドカード
  private static final Pattern UNSAFE_SUBJECT_CHARS = Pattern.compile("[\\s.*>]");

  private final Connection connection;
  private final FanoutRealtimeProperties properties;
  private final ObjectMapper objectMapper;

  public NatsRealtimePublisher(
      Connection connection, FanoutRealtimeProperties properties, ObjectMapper objectMapper) {
    this.connection = connection;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public void publish(Set<String> channels, NotificationRecord notification) {
    final byte[] body = serialize(notification);
    final String msgIdPrefix = notification.notificationId().toString();
    final List<String> failed = new ArrayList<>();
    for (String channel : channels) {
      final String subject = subjectFor(channel);
      final Headers headers = new Headers();
      headers.add(HEADER_MSG_ID, msgIdPrefix + ":" + channel);
      headers.add(HEADER_CHANNEL, channel);
      try {
        connection.publish(subject, headers, body);
      } catch (IllegalStateException | IllegalArgumentException ex) {
        failed.add(channel);
        logger.warn(
            "realtime publish to channel failed notificationId={} subject={}",
            notification.notificationId(),
            subject,
            ex);
      }
    }
    if (!failed.isEmpty()) {
      throw new RealtimePublishException(
          "failed to publish notification "
              + notification.notificationId()
              + " to "
              + failed.size()
              + " of "
              + channels.size()
              + " channels");
    }
    logger.debug(
        "realtime publish done notificationId={} channels={}",
        notification.notificationId(),
        channels.size());
  }

  @VisibleForTesting
  String subjectFor(String channel) {
    final String token = UNSAFE_SUBJECT_CHARS.matcher(channel).replaceAll("_");
    return properties.subjectPrefix() + "." + token;
  }

  private byte[] serialize(NotificationRecord notification) {
    final NotificationPushMessage message =
        NotificationPushMessage.of(properties.eventName(), resolveTraceId(), notification);
    try {
      return objectMapper.writeValueAsBytes(message);
    } catch (JsonProcessingException ex) {
      throw new RealtimePublishException(
          "failed to serialize notification " + notification.notificationId(), ex);
    }
  }

  private String resolveTraceId() {
    final String traceId = MDC.get("trace_id");
    if (traceId != null && !traceId.isBlank()) {
      return traceId;
    }
    return TraceIds.orNew(MDC.get("request_id"));
  }
}
