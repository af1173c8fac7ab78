package com.mintflow.model;

public enum SyncLogStatus {
  SUCCESS, PARTIAL, ERROR
}
