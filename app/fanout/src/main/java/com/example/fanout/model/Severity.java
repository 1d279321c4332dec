package com.example.fanout.model;

public enum Severity {
  INFO("info"),
  SUCCESS("success"),
  WARNING("warning"),
  ERROR("error");

  private final String value;

  Severity(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static Severity fromValue(String severity) {
    for (Severity candidate : values()) {
      if (candidate.value.equalsIgnoreCase(severity)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("unsupported severity: " + severity);
  }
}
