/*
 * どこで: fan-out 設定バインド
 * 何を: リアルタイム配信の subject 接頭辞とイベント名を保持する
 * なぜ: 購読側と配信側で subject 構成を一致させるため
 */
package com.example.fanout.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "fanout.realtime")
@Validated
public record FanoutRealtimeProperties(@NotBlank String subjectPrefix, @NotBlank String eventName) {}
