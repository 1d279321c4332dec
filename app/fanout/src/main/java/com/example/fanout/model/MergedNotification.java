/*
 * どこで: fan-out ドメインモデル
 * 何を: 通知本体と呼び出し元の配信状態を結合する
 * なぜ: 一覧 API で両者を 1 項目として返すため
 */
package com.example.fanout.model;

public record MergedNotification(NotificationRecord notification, UserState userState) {}
