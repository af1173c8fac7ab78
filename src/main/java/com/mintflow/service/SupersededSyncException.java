package com.mintflow.service;

import java.util.UUID;

/** Thrown when a sync worker tries to commit after a newer attempt took over its connection. */
public class SupersededSyncException extends RuntimeException {
  public SupersededSyncException(UUID connectionId, long sequence) {
    super("Sync #" + sequence + " of connection " + connectionId + " was superseded by a newer attempt");
  }
}
