/*
 * どこで: fan-out サービス層
 * 何を: 作成直後の通知を接続中の購読者へ送る口を定義する
 * なぜ: 通知作成処理を配信手段から独立させるため
 */
package com.example.fanout.service;

import com.example.fanout.model.NotificationRecord;
import java.util.Set;

public interface RealtimePublisher {

  /**
   * チャネルごとに 1 件送る。実装は {@link RealtimePublishException} を投げてよく、
   * 呼び出し側は失敗を補助的なものとして扱う。
   */
  void publish(Set<String> channels, NotificationRecord notification);
}
