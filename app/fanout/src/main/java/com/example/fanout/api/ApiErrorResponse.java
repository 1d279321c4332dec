/*
 * どこで: fan-out API
 * 何を: エラー応答の標準フォーマットを定義する
 * なぜ: 例外ハンドリング時のレスポンス形状を統一するため
 */
package com.example.fanout.api;

public record ApiErrorResponse(String code, String message) {

  static ApiErrorResponse of(ApiErrorCode code, String message) {
    return new ApiErrorResponse(code.name(), message);
  }
}
