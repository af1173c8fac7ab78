package com.mintflow.config;

import jakarta.validation.constraints.Min;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "mintflow.sync")
public record SyncProperties(
    boolean enabled,
    Duration minInterval,
    Duration deadline,
    @Min(1) int lookbackDays,
    @Min(1) int maxAttempts,
    Duration retryBackoff,
    @Min(1) int workerThreads
) {
  public SyncProperties {
    if (minInterval == null) {
      minInterval = Duration.ofHours(1);
    }
    if (deadline == null) {
      deadline = Duration.ofMinutes(5);
    }
    if (lookbackDays <= 0) {
      lookbackDays = 30;
    }
    if (maxAttempts <= 0) {
      maxAttempts = 3;
    }
    if (retryBackoff == null) {
      retryBackoff = Duration.ofMinutes(5);
    }
    if (workerThreads <= 0) {
      workerThreads = 4;
    }
  }

  /** A RUNNING marker older than this is left over from a crashed worker. */
  public Duration staleRunAfter() {
    return deadline.multipliedBy(2);
  }
}
