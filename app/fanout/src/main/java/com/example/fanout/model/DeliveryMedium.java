/*
 * どこで: fan-out ドメインモデル
 * 何を: 作成者が通知に指定する配信媒体を定義する
 * なぜ: 後段の送信処理向けに記録するため（リアルタイム配信チャネルとは無関係）
 */
package com.example.fanout.model;

public enum DeliveryMedium {
  INAPP("inapp"),
  EMAIL("email"),
  SMS("sms"),
  PUSH("push");

  private final String value;

  DeliveryMedium(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static DeliveryMedium fromValue(String medium) {
    for (DeliveryMedium candidate : values()) {
      if (candidate.value.equalsIgnoreCase(medium)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("unsupported channel: " + medium);
  }
}
