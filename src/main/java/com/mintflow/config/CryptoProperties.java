package com.mintflow.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * {@code secret} seals new credentials. {@code retiredSecrets} only open credentials sealed before
 * a key rotation; those are re-sealed under {@code secret} on their next sync.
 */
@ConfigurationProperties(prefix = "mintflow.crypto")
public record CryptoProperties(String secret, List<String> retiredSecrets) {
  public CryptoProperties {
    if (retiredSecrets == null) {
      retiredSecrets = List.of();
    }
  }
}
