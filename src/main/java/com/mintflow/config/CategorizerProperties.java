package com.mintflow.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "mintflow.categorizer")
public record CategorizerProperties(
    String mode,
    String baseUrl,
    String apiKey,
    String model
) {
  public boolean modelMode() {
    return "model".equalsIgnoreCase(mode);
  }
}
