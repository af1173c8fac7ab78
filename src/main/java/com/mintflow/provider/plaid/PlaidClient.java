package com.mintflow.provider.plaid;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mintflow.config.PlaidProperties;
import com.mintflow.provider.ProviderAuthException;
import com.mintflow.provider.ProviderException;
import com.mintflow.provider.ProviderRateLimitedException;
import com.mintflow.provider.ProviderUnavailableException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Component
public class PlaidClient {
  private static final Logger log = LoggerFactory.getLogger(PlaidClient.class);
  private static final Set<String> AUTH_ERROR_CODES = Set.of(
      "ITEM_LOGIN_REQUIRED",
      "INVALID_ACCESS_TOKEN",
      "ACCESS_NOT_GRANTED",
      "ITEM_NOT_FOUND",
      "USER_PERMISSION_REVOKED");

  private final PlaidProperties properties;
  private final RestClient restClient;
  private final ObjectMapper objectMapper;

  public PlaidClient(PlaidProperties properties,
                     @Qualifier("plaidRestClient") RestClient restClient,
                     ObjectMapper objectMapper) {
    this.properties = properties;
    this.restClient = restClient;
    this.objectMapper = objectMapper;
  }

  public JsonNode getAccounts(String accessToken) {
    Map<String, Object> body = baseBody();
    body.put("access_token", accessToken);
    return post("/accounts/get", body);
  }

  public JsonNode syncTransactions(String accessToken, String cursor, int count) {
    Map<String, Object> body = baseBody();
    body.put("access_token", accessToken);
    if (cursor != null && !cursor.isBlank()) {
      body.put("cursor", cursor);
    }
    body.put("count", count);
    return post("/transactions/sync", body);
  }

  public JsonNode createLinkToken(String clientUserId, int daysRequested) {
    Map<String, Object> body = baseBody();
    body.put("client_name", properties.clientName());
    body.put("language", "en");
    body.put("country_codes", new String[]{"US"});
    body.put("products", new String[]{"transactions"});
    body.put("user", Map.of("client_user_id", clientUserId));
    body.put("transactions", Map.of("days_requested", daysRequested));
    return post("/link/token/create", body);
  }

  public JsonNode exchangePublicToken(String publicToken) {
    Map<String, Object> body = baseBody();
    body.put("public_token", publicToken);
    return post("/item/public_token/exchange", body);
  }

  public JsonNode getItem(String accessToken) {
    Map<String, Object> body = baseBody();
    body.put("access_token", accessToken);
    return post("/item/get", body);
  }

  public JsonNode getInstitution(String institutionId) {
    Map<String, Object> body = baseBody();
    body.put("institution_id", institutionId);
    body.put("country_codes", new String[]{"US"});
    return post("/institutions/get_by_id", body);
  }

  private Map<String, Object> baseBody() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("client_id", properties.clientId());
    body.put("secret", properties.secret());
    return body;
  }

  private JsonNode post(String path, Map<String, Object> body) {
    try {
      return restClient.post()
          .uri(path)
          .contentType(MediaType.APPLICATION_JSON)
          .body(body)
          .retrieve()
          .body(JsonNode.class);
    } catch (RestClientResponseException ex) {
      throw translate(path, ex);
    } catch (ResourceAccessException ex) {
      log.warn("Plaid {} unreachable: {}", path, ex.getMessage());
      throw new ProviderUnavailableException("Plaid " + path + " unreachable: " + ex.getMessage(), ex);
    } catch (RestClientException ex) {
      throw new ProviderUnavailableException("Plaid " + path + " failed: " + ex.getMessage(), ex);
    }
  }

  ProviderException translate(String path, RestClientResponseException ex) {
    int status = ex.getStatusCode().value();
    String errorCode = errorCode(ex.getResponseBodyAsString());
    String message = "Plaid " + path + " returned " + status + (errorCode == null ? "" : " " + errorCode);
    log.warn(message);
    if (status == HttpStatus.TOO_MANY_REQUESTS.value() || "RATE_LIMIT_EXCEEDED".equals(errorCode)) {
      return new ProviderRateLimitedException(message, ex);
    }
    if (errorCode != null && AUTH_ERROR_CODES.contains(errorCode)) {
      return new ProviderAuthException(message, ex);
    }
    if (status == HttpStatus.UNAUTHORIZED.value() || status == HttpStatus.FORBIDDEN.value()) {
      return new ProviderAuthException(message, ex);
    }
    return new ProviderUnavailableException(message, ex);
  }

  private String errorCode(String responseBody) {
    if (responseBody == null || responseBody.isBlank()) {
      return null;
    }
    try {
      JsonNode node = objectMapper.readTree(responseBody);
      String code = node.path("error_code").asText(null);
      return code == null || code.isBlank() ? null : code;
    } catch (Exception ex) {
      log.debug("Unparseable Plaid error body: {}", responseBody);
      return null;
    }
  }
}
