/*
 * どこで: fan-out API
 * 何を: 作成/一覧/受信者状態のエンドポイントを公開する
 * なぜ: ゲートウェイのヘッダで渡る呼び出し元に各操作を限定するため
 */
package com.example.fanout.api;

import com.example.fanout.api.request.CreateNotificationRequest;
import com.example.fanout.api.request.DismissNotificationsRequest;
import com.example.fanout.api.response.BulkUpdateResponse;
import com.example.fanout.api.response.DeleteResponse;
import com.example.fanout.api.response.MarkResponse;
import com.example.fanout.api.response.NotificationInboxResponse;
import com.example.fanout.api.response.NotificationItemResponse;
import com.example.fanout.api.response.NotificationResponse;
import com.example.fanout.api.response.UnreadCountResponse;
import com.example.fanout.config.FanoutApiProperties;
import com.example.fanout.config.FanoutListProperties;
import com.example.fanout.model.ListOptions;
import com.example.fanout.model.NotificationRecord;
import com.example.fanout.service.NotificationFanoutService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/notifications")
@RequiredArgsConstructor
public class NotificationController {

  static final String HEADER_USER_NAME = "X-User-Name";
  static final String HEADER_USER_ROLE = "X-User-Role";

  private final NotificationFanoutService fanoutService;
  private final FanoutApiProperties apiProperties;
  private final FanoutListProperties listProperties;

  @PostMapping
  public ResponseEntity<NotificationResponse> create(
      @RequestHeader(value = HEADER_USER_ROLE, required = false) String role,
      @Valid @RequestBody CreateNotificationRequest request) {
    if (!apiProperties.canAuthor(role)) {
      throw new NotificationAccessDeniedException(role);
    }
    final NotificationRecord saved = fanoutService.createNotification(request.toDraft());
    return ResponseEntity.status(HttpStatus.CREATED).body(NotificationResponse.from(saved));
  }

  @GetMapping
  public ResponseEntity<NotificationInboxResponse> list(
      @RequestHeader(HEADER_USER_NAME) String userName,
      @RequestHeader(value = HEADER_USER_ROLE, required = false) String role,
      @RequestParam(value = "limit", required = false) Integer limit,
      @RequestParam(value = "skip", defaultValue = "0") int skip,
      @RequestParam(value = "unread", defaultValue = "false") boolean unread) {
    final int effectiveLimit = listProperties.clampLimit(limit == null ? listProperties.defaultLimit() : limit);
    final List<NotificationItemResponse> items =
        fanoutService.listForUser(userName, role, new ListOptions(effectiveLimit, skip, unread)).stream()
            .map(NotificationItemResponse::from)
            .toList();
    return ResponseEntity.ok(new NotificationInboxResponse(userName, effectiveLimit, skip, items));
  }

  @GetMapping("/unread-count")
  public ResponseEntity<UnreadCountResponse> unreadCount(
      @RequestHeader(HEADER_USER_NAME) String userName) {
    return ResponseEntity.ok(new UnreadCountResponse(userName, fanoutService.countUnread(userName)));
  }

  @PostMapping("/{notificationId}/read")
  public ResponseEntity<MarkResponse> markRead(
      @RequestHeader(HEADER_USER_NAME) String userName,
      @PathVariable("notificationId") UUID notificationId) {
    final boolean modified = fanoutService.markRead(userName, notificationId);
    return ResponseEntity.ok(new MarkResponse(notificationId.toString(), modified));
  }

  @PostMapping("/{notificationId}/archive")
  public ResponseEntity<MarkResponse> markArchived(
      @RequestHeader(HEADER_USER_NAME) String userName,
      @PathVariable("notificationId") UUID notificationId) {
    final boolean modified = fanoutService.markArchived(userName, notificationId);
    return ResponseEntity.ok(new MarkResponse(notificationId.toString(), modified));
  }

  @PostMapping("/read-all")
  public ResponseEntity<BulkUpdateResponse> markAllRead(
      @RequestHeader(HEADER_USER_NAME) String userName) {
    return ResponseEntity.ok(BulkUpdateResponse.from(fanoutService.markAllRead(userName)));
  }

  @PostMapping("/archive-all")
  public ResponseEntity<BulkUpdateResponse> archiveAll(
      @RequestHeader(HEADER_USER_NAME) String userName) {
    return ResponseEntity.ok(BulkUpdateResponse.from(fanoutService.archiveAll(userName)));
  }

  @DeleteMapping
  public ResponseEntity<DeleteResponse> dismiss(
      @RequestHeader(HEADER_USER_NAME) String userName,
      @Valid @RequestBody DismissNotificationsRequest request) {
    return ResponseEntity.ok(
        new DeleteResponse(fanoutService.deleteManyForUser(userName, request.notificationIds())));
  }
}
