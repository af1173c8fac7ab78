package com.mintflow.categorizer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mintflow.config.CategorizerProperties;
import com.mintflow.model.CategorySource;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

/**
 * Categorizer backed by a hosted language model. Any failure falls back to the rule lookup and
 * pauses model calls for a cooldown period.
 */
public class ModelCategorizer implements Categorizer {
  private static final Logger log = LoggerFactory.getLogger(ModelCategorizer.class);
  private static final Duration FAILURE_COOLDOWN = Duration.ofMinutes(15);
  private static final String DEFAULT_MODEL = "gemini-2.0-flash";

  private final CategorizerProperties properties;
  private final RestClient restClient;
  private final ObjectMapper objectMapper;
  private final RuleBasedCategorizer fallback;
  private final Clock clock;
  private volatile long pausedUntilMs = 0L;

  public ModelCategorizer(CategorizerProperties properties,
                          RestClient restClient,
                          ObjectMapper objectMapper,
                          RuleBasedCategorizer fallback,
                          Clock clock) {
    this.properties = properties;
    this.restClient = restClient;
    this.objectMapper = objectMapper;
    this.fallback = fallback;
    this.clock = clock;
  }

  @Override
  public Classification classify(String text) {
    if (properties.apiKey() == null || properties.apiKey().isBlank()) {
      return fallback.classify(text);
    }
    if (clock.millis() < pausedUntilMs) {
      return fallback.classify(text);
    }
    try {
      JsonNode response = restClient.post()
          .uri(uriBuilder -> uriBuilder
              .path("/v1beta/models/{model}:generateContent")
              .queryParam("key", properties.apiKey())
              .build(model()))
          .contentType(MediaType.APPLICATION_JSON)
          .accept(MediaType.APPLICATION_JSON)
          .body(requestBody(text))
          .retrieve()
          .body(JsonNode.class);
      Classification classification = parse(response);
      if (classification == null) {
        return fallback.classify(text);
      }
      return classification;
    } catch (Exception ex) {
      pausedUntilMs = clock.millis() + FAILURE_COOLDOWN.toMillis();
      log.warn("Model categorization failed, using rules for {}: {}", FAILURE_COOLDOWN, ex.getMessage());
      return fallback.classify(text);
    }
  }

  private Map<String, Object> requestBody(String text) {
    String prompt = "Classify this bank transaction. Allowed categories: "
        + String.join(", ", fallback.categories()) + ", " + RuleBasedCategorizer.FALLBACK_CATEGORY + ".\n"
        + "Answer with JSON only: {\"category\": \"...\", \"subcategory\": \"...\", \"confidence\": 0.0}\n"
        + "Transaction: " + (text == null ? "" : text.trim());
    return Map.of(
        "contents", List.of(Map.of("parts", List.of(Map.of("text", prompt)))),
        "generationConfig", Map.of("temperature", 0.1, "maxOutputTokens", 80, "candidateCount", 1));
  }

  Classification parse(JsonNode response) throws Exception {
    if (response == null) {
      return null;
    }
    String content = response.path("candidates").path(0).path("content").path("parts").path(0).path("text").asText(null);
    if (content == null || content.isBlank()) {
      return null;
    }
    int start = content.indexOf('{');
    int end = content.lastIndexOf('}');
    if (start < 0 || end <= start) {
      return null;
    }
    JsonNode answer = objectMapper.readTree(content.substring(start, end + 1));
    String category = answer.path("category").asText(null);
    if (category == null || category.isBlank()) {
      return null;
    }
    String subcategory = answer.path("subcategory").asText(null);
    if (subcategory != null && subcategory.isBlank()) {
      subcategory = null;
    }
    return new Classification(category.trim(), subcategory, answer.path("confidence").asDouble(0.0), CategorySource.MODEL);
  }

  private String model() {
    return properties.model() == null || properties.model().isBlank() ? DEFAULT_MODEL : properties.model().trim();
  }
}
