package com.mintflow.provider;

import com.mintflow.model.ConnectionErrorCode;

public class ProviderUnavailableException extends ProviderException {
  public ProviderUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

  public ProviderUnavailableException(String message) {
    this(message, null);
  }

  @Override
  public ConnectionErrorCode errorCode() {
    return ConnectionErrorCode.PROVIDER_UNAVAILABLE;
  }
}
