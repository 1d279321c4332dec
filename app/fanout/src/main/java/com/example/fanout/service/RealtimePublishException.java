package com.example.fanout.service;

/** 少なくとも 1 チャネルでリアルタイム配信が失敗した。 */
public class RealtimePublishException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public RealtimePublishException(String message) {
    super(message);
  }

  public RealtimePublishException(String message, Throwable cause) {
    super(message, cause);
  }
}
