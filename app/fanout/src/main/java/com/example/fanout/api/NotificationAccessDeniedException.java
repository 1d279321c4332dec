package com.example.fanout.api;

public class NotificationAccessDeniedException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public NotificationAccessDeniedException(String role) {
    super("role may not author notifications: " + role);
  }
}
