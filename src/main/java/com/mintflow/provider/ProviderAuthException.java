package com.mintflow.provider;

import com.mintflow.model.ConnectionErrorCode;

/** The stored credential was revoked or expired; the user has to re-link the institution. */
public class ProviderAuthException extends ProviderException {
  public ProviderAuthException(String message, Throwable cause) {
    super(message, cause);
  }

  public ProviderAuthException(String message) {
    this(message, null);
  }

  @Override
  public ConnectionErrorCode errorCode() {
    return ConnectionErrorCode.REAUTH_REQUIRED;
  }
}
