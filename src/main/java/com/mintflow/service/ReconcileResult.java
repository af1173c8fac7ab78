package com.mintflow.service;

public record ReconcileResult(int created, int updated, int skipped) {
  public static final ReconcileResult EMPTY = new ReconcileResult(0, 0, 0);

  public ReconcileResult plus(ReconcileResult other) {
    return new ReconcileResult(created + other.created, updated + other.updated, skipped + other.skipped);
  }
}
