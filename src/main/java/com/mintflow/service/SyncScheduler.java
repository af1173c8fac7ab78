package com.mintflow.service;

import com.mintflow.config.SyncProperties;
import com.mintflow.model.Connection;
import com.mintflow.model.SyncStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class SyncScheduler {
  private static final Logger log = LoggerFactory.getLogger(SyncScheduler.class);

  private final ConnectionRegistry registry;
  private final SyncTaskQueue queue;
  private final SyncProperties properties;

  public SyncScheduler(ConnectionRegistry registry, SyncTaskQueue queue, SyncProperties properties) {
    this.registry = registry;
    this.queue = queue;
    this.properties = properties;
  }

  @Scheduled(fixedDelayString = "${mintflow.sync.poll-ms:300000}")
  public void run() {
    if (!properties.enabled()) {
      return;
    }
    int queued = 0;
    for (Connection connection : registry.listAllActive()) {
      if (shouldQueue(connection)) {
        queue.submit(connection.getId(), false);
        queued++;
      }
    }
    log.debug("Queued {} connections for background sync", queued);
  }

  private boolean shouldQueue(Connection connection) {
    return connection.getSyncStatus() != SyncStatus.RUNNING && !connection.isReconnectRequired();
  }
}
