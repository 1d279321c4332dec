/*
 * どこで: fan-out 設定バインド
 * 何を: NATS 接続設定を保持する
 * なぜ: 環境ごとに接続先を切り替えるため
 */
package com.example.fanout.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(boolean enabled, String url, Integer connectionTimeout) {}
