package com.mintflow.model;

public enum SyncType {
  ACCOUNTS, TRANSACTIONS
}
