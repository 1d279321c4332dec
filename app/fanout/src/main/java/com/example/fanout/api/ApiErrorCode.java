package com.example.fanout.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  VALIDATION_ERROR,
  FORBIDDEN,
  STORAGE_UNAVAILABLE,
  INTERNAL_ERROR
}
