/*
 * どこで: fan-out 内部 API
 * 何を: アカウント削除時の掃除と保守処理の手動実行を公開する
 * なぜ: 運用者やアカウントサービスが定期実行外で呼び出せるようにするため
 */
package com.example.fanout.api;

import com.example.fanout.api.response.DeleteResponse;
import com.example.fanout.service.NotificationFanoutService;
import com.example.fanout.service.NotificationMaintenanceService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal")
@RequiredArgsConstructor
public class NotificationAdminController {

  private final NotificationFanoutService fanoutService;
  private final NotificationMaintenanceService maintenanceService;

  @DeleteMapping("/users/{recipient}/notifications")
  public ResponseEntity<DeleteResponse> deleteAllForUser(
      @PathVariable("recipient") String recipient) {
    return ResponseEntity.ok(new DeleteResponse(fanoutService.deleteAllForUser(recipient)));
  }

  @PostMapping("/maintenance/prune-orphans")
  public ResponseEntity<DeleteResponse> pruneOrphans() {
    return ResponseEntity.ok(new DeleteResponse(maintenanceService.pruneOrphans()));
  }

  @PostMapping("/maintenance/purge-expired")
  public ResponseEntity<DeleteResponse> purgeExpired() {
    return ResponseEntity.ok(new DeleteResponse(maintenanceService.purgeExpired()));
  }
}
