package com.mintflow.model;

public enum TransactionDirection {
  DEBIT, CREDIT
}
