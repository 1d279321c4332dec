/*
 * どこで: fan-out データアクセス
 * 何を: delivery_states テーブルの受信者別 既読/アーカイブ 行を操作する
 * なぜ: 書き込みを ON CONFLICT の upsert か単一の一括文に限定し、
 *      並行実行でも read-modify-write を不要にするため
 */
package com.example.fanout.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.fanout.model.DeliveryStateRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DeliveryStateRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT recipient, notification_id, is_read, is_archived, delivered_at, read_at
      FROM delivery_states
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public boolean insertIfAbsent(String recipient, UUID notificationId, Instant deliveredAt) {
    final String sql =
        """
        INSERT INTO delivery_states (recipient, notification_id, is_read, is_archived, delivered_at, read_at)
        VALUES (:recipient, :notificationId, FALSE, FALSE, :deliveredAt, NULL)
        ON CONFLICT (recipient, notification_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        keyParams(recipient, notificationId).addValue("deliveredAt", toTimestamp(deliveredAt));
    return jdbcTemplate.update(sql, params) > 0;
  }

  /**
   * 行が無ければ作成し、保存済みの状態を返す。競合に負けた insert は
   * 勝者の delivered_at と既読フラグを変更しない。
   */
  public DeliveryStateRecord upsert(String recipient, UUID notificationId, Instant now) {
    insertIfAbsent(recipient, notificationId, now);
    // READ COMMITTED で並行した勝者のコミット済み行を読めるよう別文で取得する
    return find(recipient, notificationId)
        .orElseThrow(
            () ->
                new EmptyResultDataAccessException(
                    "delivery state removed right after upsert recipient="
                        + recipient
                        + " notificationId="
                        + notificationId,
                    1));
  }

  public Optional<DeliveryStateRecord> find(String recipient, UUID notificationId) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE recipient = :recipient
              AND notification_id = :notificationId
            """;
    return jdbcTemplate.query(sql, keyParams(recipient, notificationId), this::mapRow).stream()
        .findFirst();
  }

  /** 行が変化した場合に true。既読行の read_at は維持する。 */
  public boolean markRead(String recipient, UUID notificationId, Instant now) {
    final String sql =
        """
        INSERT INTO delivery_states (recipient, notification_id, is_read, is_archived, delivered_at, read_at)
        VALUES (:recipient, :notificationId, TRUE, FALSE, :now, :now)
        ON CONFLICT (recipient, notification_id) DO UPDATE
        SET is_read = TRUE,
            read_at = EXCLUDED.read_at
        WHERE delivery_states.is_read = FALSE
        """;
    final MapSqlParameterSource params =
        keyParams(recipient, notificationId).addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public boolean markArchived(String recipient, UUID notificationId, Instant now) {
    final String sql =
        """
        INSERT INTO delivery_states (recipient, notification_id, is_read, is_archived, delivered_at, read_at)
        VALUES (:recipient, :notificationId, FALSE, TRUE, :now, NULL)
        ON CONFLICT (recipient, notification_id) DO UPDATE
        SET is_archived = TRUE
        WHERE delivery_states.is_archived = FALSE
        """;
    final MapSqlParameterSource params =
        keyParams(recipient, notificationId).addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public int markAllRead(String recipient, Instant now) {
    final String sql =
        """
        UPDATE delivery_states
        SET is_read = TRUE,
            read_at = :now
        WHERE recipient = :recipient
          AND is_read = FALSE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipient", recipient)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int archiveAll(String recipient) {
    final String sql =
        """
        UPDATE delivery_states
        SET is_archived = TRUE
        WHERE recipient = :recipient
          AND is_archived = FALSE
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("recipient", recipient));
  }

  public List<DeliveryStateRecord> findForUser(
      String recipient, int limit, int skip, boolean onlyUnread) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE recipient = :recipient
              AND (:onlyUnread = FALSE OR is_read = FALSE)
            ORDER BY delivered_at DESC, notification_id DESC
            LIMIT :limit OFFSET :skip
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipient", recipient)
            .addValue("onlyUnread", onlyUnread)
            .addValue("limit", limit)
            .addValue("skip", skip);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<DeliveryStateRecord> findForUserByNotificationIds(
      String recipient, Collection<UUID> notificationIds) {
    if (notificationIds.isEmpty()) {
      return List.of();
    }
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE recipient = :recipient
              AND notification_id IN (:notificationIds)
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipient", recipient)
            .addValue("notificationIds", notificationIds);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public long countUnread(String recipient) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM delivery_states
        WHERE recipient = :recipient
          AND is_read = FALSE
        """;
    final Long count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("recipient", recipient), Long.class);
    return count == null ? 0L : count;
  }

  public int deleteAllForUser(String recipient) {
    final String sql =
        """
        DELETE FROM delivery_states
        WHERE recipient = :recipient
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("recipient", recipient));
  }

  public int deleteManyForUser(String recipient, Collection<UUID> notificationIds) {
    if (notificationIds.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        DELETE FROM delivery_states
        WHERE recipient = :recipient
          AND notification_id IN (:notificationIds)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipient", recipient)
            .addValue("notificationIds", notificationIds);
    return jdbcTemplate.update(sql, params);
  }

  /** 通知本体が存在しない行を削除する。 */
  public int pruneOrphans() {
    final String sql =
        """
        DELETE FROM delivery_states d
        WHERE NOT EXISTS (
          SELECT 1
          FROM notifications n
          WHERE n.notification_id = d.notification_id
        )
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource());
  }

  private MapSqlParameterSource keyParams(String recipient, UUID notificationId) {
    return new MapSqlParameterSource()
        .addValue("recipient", recipient)
        .addValue("notificationId", notificationId);
  }

  private DeliveryStateRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new DeliveryStateRecord(
        rs.getString("recipient"),
        UUID.fromString(rs.getString("notification_id")),
        rs.getBoolean("is_read"),
        rs.getBoolean("is_archived"),
        toInstant(rs.getTimestamp("delivered_at")),
        toInstant(rs.getTimestamp("read_at")));
  }
}
