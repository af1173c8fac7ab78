package com.mintflow.model;

public enum SyncStatus {
  IDLE, RUNNING, ERROR
}
