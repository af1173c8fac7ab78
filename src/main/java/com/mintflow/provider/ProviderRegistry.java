package com.mintflow.provider;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

@Component
public class ProviderRegistry {
  private final Map<String, ProviderClient> providers;

  public ProviderRegistry(List<ProviderClient> providers) {
    this.providers = providers.stream()
        .collect(Collectors.toMap(ProviderClient::getProviderId, Function.identity()));
  }

  public ProviderClient require(String providerId) {
    ProviderClient provider = providers.get(providerId);
    if (provider == null) {
      throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown provider: " + providerId);
    }
    return provider;
  }
}
