package com.mintflow.model;

public enum ConnectionErrorCode {
  PROVIDER_UNAVAILABLE(false),
  RATE_LIMITED(false),
  REAUTH_REQUIRED(true),
  SYNC_TIMEOUT(false),
  SYNC_ERROR(false);

  private final boolean blocking;

  ConnectionErrorCode(boolean blocking) {
    this.blocking = blocking;
  }

  /** Blocking codes stop automatic syncs until the user re-links the connection. */
  public boolean isBlocking() {
    return blocking;
  }

  public boolean isTransient() {
    return this == PROVIDER_UNAVAILABLE || this == RATE_LIMITED;
  }
}
