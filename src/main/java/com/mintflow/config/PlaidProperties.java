package com.mintflow.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "mintflow.providers.plaid")
public record PlaidProperties(
    String baseUrl,
    String clientId,
    String secret,
    String version,
    String clientName,
    Duration connectTimeout,
    Duration readTimeout
) {
  public PlaidProperties {
    if (baseUrl == null || baseUrl.isBlank()) {
      baseUrl = "https://sandbox.plaid.com";
    }
    if (version == null || version.isBlank()) {
      version = "2020-09-14";
    }
    if (clientName == null || clientName.isBlank()) {
      clientName = "MintFlow";
    }
    if (connectTimeout == null) {
      connectTimeout = Duration.ofSeconds(5);
    }
    if (readTimeout == null) {
      readTimeout = Duration.ofSeconds(30);
    }
  }
}
