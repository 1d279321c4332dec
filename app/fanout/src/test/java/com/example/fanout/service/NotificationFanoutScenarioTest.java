/*
 * どこで: fan-out サービスの結合テスト
 * 何を: 作成/一覧/既読化/孤児削除を実リポジトリ経由で検証する
 * なぜ: 通知本体と受信者状態のマージが実 DB 上で成り立つことを保証するため
 */
package com.example.fanout.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.fanout.AbstractPostgresContainerTest;
import com.example.fanout.model.Audience;
import com.example.fanout.model.ListOptions;
import com.example.fanout.model.MergedNotification;
import com.example.fanout.model.NotificationDraft;
import com.example.fanout.model.NotificationRecord;
import com.example.fanout.repository.DeliveryStateRepository;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationFanoutScenarioTest extends AbstractPostgresContainerTest {

  private static final ListOptions FIRST_PAGE = new ListOptions(50, 0, false);

  @Autowired private NotificationFanoutService fanoutService;
  @Autowired private NotificationMaintenanceService maintenanceService;
  @Autowired private DeliveryStateRepository deliveryStateRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM delivery_states", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM notifications", new MapSqlParameterSource());
  }

  @Test
  void roleAudienceIsListedUnreadThenReadAfterMarkRead() {
    final NotificationRecord created =
        fanoutService.createNotification(draft("A", Audience.roles(List.of("admin"))));

    final List<MergedNotification> before = fanoutService.listForUser("alice", "admin", FIRST_PAGE);
    assertThat(before).extracting(item -> item.notification().notificationId())
        .containsExactly(created.notificationId());
    assertThat(before.get(0).userState().read()).isFalse();
    assertThat(before.get(0).userState().deliveredAt()).isNotNull();

    assertThat(fanoutService.markRead("alice", created.notificationId())).isTrue();

    final List<MergedNotification> after = fanoutService.listForUser("alice", "admin", FIRST_PAGE);
    assertThat(after).hasSize(1);
    assertThat(after.get(0).userState().read()).isTrue();
    assertThat(after.get(0).userState().readAt()).isNotNull();
    assertThat(fanoutService.listForUser("alice", "admin", new ListOptions(50, 0, true))).isEmpty();
  }

  @Test
  void userAudienceIsHiddenFromOtherRecipients() {
    final NotificationRecord created =
        fanoutService.createNotification(draft("B", Audience.users(List.of("bob"))));

    assertThat(fanoutService.listForUser("alice", "tenant", FIRST_PAGE)).isEmpty();
    assertThat(fanoutService.listForUser("bob", "tenant", FIRST_PAGE))
        .extracting(item -> item.notification().notificationId())
        .containsExactly(created.notificationId());
  }

  @Test
  void expiredNotificationsAreNeverListed() {
    fanoutService.createNotification(
        new NotificationDraft(
            "gone", "body", null, null, Audience.broadcast(), Instant.now().minusSeconds(60), null, null));

    assertThat(fanoutService.listForUser("alice", null, FIRST_PAGE)).isEmpty();
  }

  @Test
  void listingCreatesStateRowsAndUnreadCountFollows() {
    fanoutService.createNotification(draft("one", Audience.broadcast()));
    fanoutService.createNotification(draft("two", Audience.broadcast()));

    assertThat(fanoutService.countUnread("carol")).isZero();
    fanoutService.listForUser("carol", null, FIRST_PAGE);
    assertThat(fanoutService.countUnread("carol")).isEqualTo(2L);

    assertThat(fanoutService.markAllRead("carol").modified()).isEqualTo(2L);
    assertThat(fanoutService.countUnread("carol")).isZero();
  }

  @Test
  void orphanStateRowIsPruned() {
    deliveryStateRepository.upsert("alice", UUID.randomUUID(), Instant.now());

    assertThat(maintenanceService.pruneOrphans()).isEqualTo(1);
  }

  @Test
  void deleteAllForUserWithoutRowsReturnsZeroRepeatedly() {
    assertThat(fanoutService.deleteAllForUser("nobody")).isZero();
    assertThat(fanoutService.deleteAllForUser("nobody")).isZero();
  }

  private static NotificationDraft draft(String title, Audience audience) {
    return new NotificationDraft(title, "body", null, null, audience, null, null, null);
  }
}
