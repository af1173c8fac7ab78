package com.mintflow.provider;

import com.mintflow.model.ConnectionErrorCode;

public abstract class ProviderException extends RuntimeException {
  protected ProviderException(String message, Throwable cause) {
    super(message, cause);
  }

  public abstract ConnectionErrorCode errorCode();
}
