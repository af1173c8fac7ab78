package com.mintflow.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mintflow.categorizer.Categorizer;
import com.mintflow.categorizer.ModelCategorizer;
import com.mintflow.categorizer.RuleBasedCategorizer;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
public class CategorizerConfig {
  private static final Logger log = LoggerFactory.getLogger(CategorizerConfig.class);

  @Bean
  public Categorizer categorizer(CategorizerProperties properties, ObjectMapper objectMapper, Clock clock) {
    RuleBasedCategorizer rules = new RuleBasedCategorizer();
    if (!properties.modelMode()) {
      log.info("Using rule-based transaction categorizer");
      return rules;
    }
    String baseUrl = properties.baseUrl() == null || properties.baseUrl().isBlank()
        ? "https://generativelanguage.googleapis.com"
        : properties.baseUrl();
    log.info("Using model-backed transaction categorizer at {}", baseUrl);
    RestClient restClient = RestClient.builder().baseUrl(baseUrl).build();
    return new ModelCategorizer(properties, restClient, objectMapper, rules, clock);
  }
}
