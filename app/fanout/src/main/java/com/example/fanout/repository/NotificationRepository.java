/*
 * どこで: fan-out データアクセス
 * 何を: notifications テーブルへの登録と検索を行う
 * なぜ: 作成/宛先を考慮した一覧/期限切れ削除の各経路で使うため
 */
package com.example.fanout.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.fanout.model.Audience;
import com.example.fanout.model.AudienceMode;
import com.example.fanout.model.DeliveryMedium;
import com.example.fanout.model.NotificationDraft;
import com.example.fanout.model.NotificationRecord;
import com.example.fanout.model.Severity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
  private static final TypeReference<Map<String, Object>> METADATA_MAP = new TypeReference<>() {};

  private static final String SELECT_COLUMNS =
      """
      SELECT notification_id, title, body, type, severity, audience_mode,
             audience_members::text AS audience_members_text,
             created_at, expires_at,
             metadata_json::text AS metadata_json_text,
             delivery_channels::text AS delivery_channels_text
      FROM notifications
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  /** 検証済みの下書きに ID と作成時刻を付与して保存する。 */
  public NotificationRecord create(NotificationDraft draft, Instant createdAt) {
    final NotificationRecord record =
        new NotificationRecord(
            UUID.randomUUID(),
            draft.title(),
            draft.body(),
            draft.type(),
            draft.severity(),
            draft.audience(),
            createdAt,
            draft.expiresAt(),
            draft.metadata(),
            draft.channels());
    return insert(record);
  }

  public NotificationRecord insert(NotificationRecord record) {
    final String sql =
        """
        INSERT INTO notifications (
          notification_id,
          title,
          body,
          type,
          severity,
          audience_mode,
          audience_members,
          created_at,
          expires_at,
          metadata_json,
          delivery_channels
        ) VALUES (
          :notificationId,
          :title,
          :body,
          :type,
          :severity,
          :audienceMode,
          :audienceMembers::jsonb,
          :createdAt,
          :expiresAt,
          :metadataJson::jsonb,
          :deliveryChannels::jsonb
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", record.notificationId())
            .addValue("title", record.title())
            .addValue("body", record.body())
            .addValue("type", record.type())
            .addValue("severity", record.severity().name())
            .addValue("audienceMode", record.audience().mode().name())
            .addValue("audienceMembers", writeJson(new ArrayList<>(record.audience().members())))
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("expiresAt", toTimestamp(record.expiresAt()), Types.TIMESTAMP)
            .addValue("metadataJson", writeJson(record.metadata()))
            .addValue("deliveryChannels", writeJson(channelValues(record.channels())));
    jdbcTemplate.update(sql, params);
    return record;
  }

  public Optional<NotificationRecord> findById(UUID notificationId) {
    final String sql = SELECT_COLUMNS + "WHERE notification_id = :notificationId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("notificationId", notificationId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * 受信者またはロールを宛先に含む期限内の通知を新しい順に返す。
   * ページングは受信者状態をマージする前のここで適用する。
   */
  public List<NotificationRecord> findVisibleTo(
      String recipient, String role, Instant now, int limit, int skip) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE (
              audience_mode = 'BROADCAST'
              OR (audience_mode = 'USER'
                  AND audience_members @> jsonb_build_array(CAST(:recipient AS text)))
              OR (audience_mode = 'ROLE'
                  AND audience_members @> jsonb_build_array(CAST(:role AS text)))
            )
              AND (expires_at IS NULL OR expires_at > :now)
            ORDER BY created_at DESC, notification_id DESC
            LIMIT :limit OFFSET :skip
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipient", recipient, Types.VARCHAR)
            .addValue("role", role, Types.VARCHAR)
            .addValue("now", toTimestamp(now))
            .addValue("limit", limit)
            .addValue("skip", skip);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int deleteExpiredBefore(Instant threshold) {
    final String sql =
        """
        DELETE FROM notifications
        WHERE expires_at IS NOT NULL
          AND expires_at < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final AudienceMode mode = AudienceMode.valueOf(rs.getString("audience_mode"));
    final List<String> members = readJson(rs.getString("audience_members_text"), STRING_LIST);
    final Map<String, Object> metadata =
        readJson(rs.getString("metadata_json_text"), METADATA_MAP);
    final List<String> channels = readJson(rs.getString("delivery_channels_text"), STRING_LIST);
    return new NotificationRecord(
        UUID.fromString(rs.getString("notification_id")),
        rs.getString("title"),
        rs.getString("body"),
        rs.getString("type"),
        Severity.valueOf(rs.getString("severity")),
        Audience.of(mode, members),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("expires_at")),
        metadata,
        toMediums(channels));
  }

  private List<String> channelValues(Set<DeliveryMedium> channels) {
    return channels.stream().map(DeliveryMedium::value).toList();
  }

  private Set<DeliveryMedium> toMediums(List<String> values) {
    final Set<DeliveryMedium> mediums = EnumSet.noneOf(DeliveryMedium.class);
    if (values != null) {
      values.forEach(value -> mediums.add(DeliveryMedium.fromValue(value)));
    }
    return mediums;
  }

  private String writeJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new InvalidDataAccessApiUsageException("notification column serialization failure", ex);
    }
  }

  private <T> T readJson(String json, TypeReference<T> type) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException ex) {
      throw new DataRetrievalFailureException("notification column parse failure", ex);
    }
  }
}
