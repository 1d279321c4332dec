package com.example.fanout.service;

/** ストレージに触れる前に拒否する不正入力を表す。 */
public class InvalidNotificationException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public InvalidNotificationException(String message) {
    super(message);
  }

  public InvalidNotificationException(String message, Throwable cause) {
    super(message, cause);
  }
}
