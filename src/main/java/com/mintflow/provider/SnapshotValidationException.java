package com.mintflow.provider;

public class SnapshotValidationException extends RuntimeException {
  public SnapshotValidationException(String message) {
    super(message);
  }

  static String require(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new SnapshotValidationException("Provider payload is missing " + field);
    }
    return value;
  }
}
