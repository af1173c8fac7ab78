package com.mintflow.provider;

import com.mintflow.model.ConnectionErrorCode;

public class ProviderRateLimitedException extends ProviderException {
  public ProviderRateLimitedException(String message, Throwable cause) {
    super(message, cause);
  }

  public ProviderRateLimitedException(String message) {
    this(message, null);
  }

  @Override
  public ConnectionErrorCode errorCode() {
    return ConnectionErrorCode.RATE_LIMITED;
  }
}
