/*
 * どこで: fan-out 設定バインド
 * 何を: 一覧取得のページ上限と状態 upsert の並列設定を保持する
 * なぜ: クエリコストと項目ごとの upsert 並列度を制限するため
 */
package com.example.fanout.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "fanout.list")
@Validated
public record FanoutListProperties(
    @NotNull @Positive Integer defaultLimit,
    @NotNull @Positive Integer maxLimit,
    @NotNull @Positive Integer upsertParallelism,
    @NotNull Duration upsertTimeout) {

  @AssertTrue(message = "fanout.list.default-limit must not exceed fanout.list.max-limit")
  public boolean isDefaultLimitWithinMax() {
    return defaultLimit == null || maxLimit == null || defaultLimit <= maxLimit;
  }

  @AssertTrue(message = "fanout.list.upsert-timeout must be positive")
  public boolean isUpsertTimeoutPositive() {
    // Duration には @Positive を付与できない
    return upsertTimeout != null && !upsertTimeout.isZero() && !upsertTimeout.isNegative();
  }

  public int clampLimit(int requested) {
    if (requested < 1) {
      return 1;
    }
    return Math.min(requested, maxLimit);
  }
}
