package com.mintflow.model;

public enum BudgetAlertType {
  WARNING, EXCEEDED
}
