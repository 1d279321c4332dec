/*
 * どこで: fan-out ドメインモデル
 * 何を: 3 種類の宛先種別の JSON 表現を定義する
 * なぜ: JSON の mode 値と DB の列値を一箇所で管理するため
 */
package com.example.fanout.model;

public enum AudienceMode {
  BROADCAST("broadcast"),
  USER("user"),
  ROLE("role");

  private final String value;

  AudienceMode(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static AudienceMode fromValue(String mode) {
    for (AudienceMode audienceMode : values()) {
      if (audienceMode.value.equalsIgnoreCase(mode)) {
        return audienceMode;
      }
    }
    throw new IllegalArgumentException("unsupported audience mode: " + mode);
  }
}
