/*
 * どこで: fan-out サービス層
 * 何を: 通知を作成してリアルタイム配信し、受信者ごとの一覧を組み立てる
 * なぜ: 読み取り時に展開することで作成時に受信者数分の書き込みを避けるため
 */
package com.example.fanout.service;

import com.example.fanout.config.FanoutExecutorConfig;
import com.example.fanout.config.FanoutListProperties;
import com.example.fanout.model.Audience;
import com.example.fanout.model.BulkUpdateResult;
import com.example.fanout.model.DeliveryMedium;
import com.example.fanout.model.DeliveryStateRecord;
import com.example.fanout.model.ListOptions;
import com.example.fanout.model.MergedNotification;
import com.example.fanout.model.NotificationDraft;
import com.example.fanout.model.NotificationRecord;
import com.example.fanout.model.Severity;
import com.example.fanout.model.UserState;
import com.example.fanout.repository.DeliveryStateRepository;
import com.example.fanout.repository.NotificationRepository;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "Collaborators are Spring-managed singletons shared by reference")
public class NotificationFanoutService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationFanoutService.class);

  static final String DEFAULT_TYPE = "general";
  static final int TYPE_MAX_LENGTH = 64;
  // delivery_states.recipient は VARCHAR(255)
  static final int RECIPIENT_MAX_LENGTH = 255;

  private final NotificationRepository notificationRepository;
  private final DeliveryStateRepository deliveryStateRepository;
  private final AudienceResolver audienceResolver;
  private final RealtimePublisher realtimePublisher;
  private final NotificationMetrics metrics;
  private final FanoutListProperties listProperties;
  private final Executor publishExecutor;
  private final Executor stateUpsertExecutor;
  private final Clock clock;

  public NotificationFanoutService(
      NotificationRepository notificationRepository,
      DeliveryStateRepository deliveryStateRepository,
      AudienceResolver audienceResolver,
      RealtimePublisher realtimePublisher,
      NotificationMetrics metrics,
      FanoutListProperties listProperties,
      @Qualifier(FanoutExecutorConfig.PUBLISH_EXECUTOR) Executor publishExecutor,
      @Qualifier(FanoutExecutorConfig.STATE_UPSERT_EXECUTOR) Executor stateUpsertExecutor,
      Clock clock) {
    this.notificationRepository = notificationRepository;
    this.deliveryStateRepository = deliveryStateRepository;
    this.audienceResolver = audienceResolver;
    this.realtimePublisher = realtimePublisher;
    this.metrics = metrics;
    this.listProperties = listProperties;
    this.publishExecutor = publishExecutor;
    this.stateUpsertExecutor = stateUpsertExecutor;
    this.clock = clock;
  }

  /**
   * 下書きを検証して保存し、リアルタイム配信を予約する。配信が後で失敗しても
   * 保存済みレコードを返す。
   */
  public NotificationRecord createNotification(NotificationDraft draft) {
    final NotificationDraft normalized = normalize(draft);
    final NotificationRecord saved = notificationRepository.create(normalized, Instant.now(clock));
    metrics.recordCreated(saved.audience().mode());
    logger.info(
        "notification created notificationId={} type={} audienceMode={} members={}",
        saved.notificationId(),
        saved.type(),
        saved.audience().mode().value(),
        saved.audience().members().size());

    final Set<String> channels = audienceResolver.resolve(saved.audience());
    if (channels.isEmpty()) {
      metrics.recordPublishResult(NotificationMetrics.PUBLISH_SKIPPED);
      logger.info("realtime publish skipped no channels notificationId={}", saved.notificationId());
      return saved;
    }
    schedulePublish(channels, saved);
    return saved;
  }

  /**
   * 受信者に見える通知 1 ページを受信者状態とマージして返す。状態行は
   * マージ前にページ内の全項目について作成する。
   */
  public List<MergedNotification> listForUser(String recipient, String role, ListOptions options) {
    requireRecipient(recipient);
    final ListOptions effective = options == null ? defaultOptions() : options;
    if (effective.skip() < 0) {
      throw new InvalidNotificationException("skip must not be negative");
    }
    final int limit = listProperties.clampLimit(effective.limit());
    final Instant startedAt = Instant.now(clock);

    final String effectiveRole = blankToNull(role);
    final List<NotificationRecord> page =
        visibleOnly(
            recipient,
            effectiveRole,
            notificationRepository.findVisibleTo(
                recipient, effectiveRole, startedAt, limit, effective.skip()));
    if (page.isEmpty()) {
      return List.of();
    }

    upsertStates(recipient, page, startedAt);

    final List<UUID> ids = page.stream().map(NotificationRecord::notificationId).toList();
    final Map<UUID, DeliveryStateRecord> states = new HashMap<>();
    for (DeliveryStateRecord state :
        deliveryStateRepository.findForUserByNotificationIds(recipient, ids)) {
      states.put(state.notificationId(), state);
    }

    final List<MergedNotification> merged = new ArrayList<>(page.size());
    for (NotificationRecord notification : page) {
      final DeliveryStateRecord state = states.get(notification.notificationId());
      final UserState userState = state == null ? UserState.unseen() : UserState.from(state);
      if (effective.onlyUnread() && userState.read()) {
        continue;
      }
      merged.add(new MergedNotification(notification, userState));
    }
    metrics.recordListDuration(Duration.between(startedAt, Instant.now(clock)));
    return merged;
  }

  public boolean markRead(String recipient, UUID notificationId) {
    requireRecipient(recipient);
    requireNotificationId(notificationId);
    return deliveryStateRepository.markRead(recipient, notificationId, Instant.now(clock));
  }

  public boolean markArchived(String recipient, UUID notificationId) {
    requireRecipient(recipient);
    requireNotificationId(notificationId);
    return deliveryStateRepository.markArchived(recipient, notificationId, Instant.now(clock));
  }

  public BulkUpdateResult markAllRead(String recipient) {
    requireRecipient(recipient);
    return BulkUpdateResult.ofModified(
        deliveryStateRepository.markAllRead(recipient, Instant.now(clock)));
  }

  public BulkUpdateResult archiveAll(String recipient) {
    requireRecipient(recipient);
    return BulkUpdateResult.ofModified(deliveryStateRepository.archiveAll(recipient));
  }

  public long countUnread(String recipient) {
    requireRecipient(recipient);
    return deliveryStateRepository.countUnread(recipient);
  }

  public int deleteAllForUser(String recipient) {
    requireRecipient(recipient);
    final int deleted = deliveryStateRepository.deleteAllForUser(recipient);
    logger.info("delivery states deleted for recipient={} count={}", recipient, deleted);
    return deleted;
  }

  public int deleteManyForUser(String recipient, Collection<UUID> notificationIds) {
    requireRecipient(recipient);
    if (notificationIds == null || notificationIds.isEmpty()) {
      return 0;
    }
    return deliveryStateRepository.deleteManyForUser(
        recipient, new ArrayList<>(new LinkedHashSet<>(notificationIds)));
  }

  @VisibleForTesting
  NotificationDraft normalize(NotificationDraft draft) {
    if (draft == null) {
      throw new InvalidNotificationException("notification is required");
    }
    if (isBlank(draft.title())) {
      throw new InvalidNotificationException("title is required");
    }
    if (isBlank(draft.body())) {
      throw new InvalidNotificationException("body is required");
    }
    final Audience audience = draft.audience();
    if (audience == null) {
      throw new InvalidNotificationException("audience is required");
    }
    final String type = isBlank(draft.type()) ? DEFAULT_TYPE : draft.type().trim();
    if (type.length() > TYPE_MAX_LENGTH) {
      throw new InvalidNotificationException(
          "type must be at most " + TYPE_MAX_LENGTH + " characters");
    }
    final Severity severity = draft.severity() == null ? Severity.INFO : draft.severity();
    final Map<String, Object> metadata = draft.metadata() == null ? Map.of() : draft.metadata();
    final Set<DeliveryMedium> channels =
        draft.channels() == null || draft.channels().isEmpty()
            ? EnumSet.of(DeliveryMedium.INAPP)
            : EnumSet.copyOf(draft.channels());
    return new NotificationDraft(
        draft.title(),
        draft.body(),
        type,
        severity,
        audience,
        draft.expiresAt(),
        metadata,
        channels);
  }

  private void schedulePublish(Set<String> channels, NotificationRecord saved) {
    try {
      publishExecutor.execute(() -> publish(channels, saved));
    } catch (RejectedExecutionException ex) {
      // TaskRejectedException は RejectedExecutionException のサブクラス
      metrics.recordPublishResult(NotificationMetrics.PUBLISH_REJECTED);
      logger.warn(
          "realtime publish rejected notificationId={} channels={}",
          saved.notificationId(),
          channels.size(),
          ex);
    }
  }

  private void publish(Set<String> channels, NotificationRecord saved) {
    try {
      realtimePublisher.publish(channels, saved);
      metrics.recordPublishResult(NotificationMetrics.PUBLISH_SENT);
    } catch (RuntimeException ex) {
      metrics.recordPublishResult(NotificationMetrics.PUBLISH_FAILED);
      logger.warn(
          "realtime publish failed notificationId={} channels={}",
          saved.notificationId(),
          channels.size(),
          ex);
    }
  }

  // SQL の宛先判定と同じ規則で再確認し、見えない通知には状態行を作らない
  private List<NotificationRecord> visibleOnly(
      String recipient, String role, List<NotificationRecord> fetched) {
    final List<NotificationRecord> visible = new ArrayList<>(fetched.size());
    for (NotificationRecord notification : fetched) {
      if (audienceResolver.isVisibleTo(notification.audience(), recipient, role)) {
        visible.add(notification);
      } else {
        logger.warn(
            "notification outside audience dropped from list recipient={} notificationId={}",
            recipient,
            notification.notificationId());
      }
    }
    return visible;
  }

  private void upsertStates(String recipient, List<NotificationRecord> page, Instant now) {
    final long timeoutMillis = listProperties.upsertTimeout().toMillis();
    final List<CompletableFuture<Void>> futures = new ArrayList<>(page.size());
    for (NotificationRecord notification : page) {
      final UUID notificationId = notification.notificationId();
      futures.add(
          CompletableFuture.runAsync(
                  () -> deliveryStateRepository.upsert(recipient, notificationId, now),
                  stateUpsertExecutor)
              .orTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
              .exceptionally(
                  ex -> {
                    metrics.recordStateUpsertFailure();
                    logger.warn(
                        "delivery state upsert failed recipient={} notificationId={}",
                        recipient,
                        notificationId,
                        ex);
                    return null;
                  }));
    }
    CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
  }

  private ListOptions defaultOptions() {
    return new ListOptions(listProperties.defaultLimit(), 0, false);
  }

  private void requireRecipient(String recipient) {
    if (isBlank(recipient)) {
      throw new InvalidNotificationException("recipient is required");
    }
    if (recipient.length() > RECIPIENT_MAX_LENGTH) {
      throw new InvalidNotificationException(
          "recipient must be at most " + RECIPIENT_MAX_LENGTH + " characters");
    }
  }

  private void requireNotificationId(UUID notificationId) {
    if (notificationId == null) {
      throw new InvalidNotificationException("notification id is required");
    }
  }

  private static String blankToNull(String value) {
    return isBlank(value) ? null : value;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
