package com.mintflow.categorizer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mintflow.config.CategorizerProperties;
import com.mintflow.model.CategorySource;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class ModelCategorizerTest {
  private static final String ENDPOINT =
      "https://models.test/v1beta/models/gemini-test:generateContent?key=secret-key";

  private final ObjectMapper objectMapper = new ObjectMapper();
  private MockRestServiceServer server;
  private ModelCategorizer categorizer;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder().baseUrl("https://models.test");
    server = MockRestServiceServer.bindTo(builder).build();
    categorizer = new ModelCategorizer(
        new CategorizerProperties("model", "https://models.test", "secret-key", "gemini-test"),
        builder.build(), objectMapper, new RuleBasedCategorizer(),
        Clock.fixed(Instant.parse("2026-03-18T12:00:00Z"), ZoneOffset.UTC));
  }

  @Test
  void usesModelAnswer() {
    server.expect(once(), requestTo(ENDPOINT))
        .andExpect(method(HttpMethod.POST))
        .andRespond(withSuccess(answer("{\\\"category\\\": \\\"Travel\\\", \\\"subcategory\\\": \\\"Air Travel\\\", "
            + "\\\"confidence\\\": 0.91}"), MediaType.APPLICATION_JSON));

    Classification result = categorizer.classify("KLM 0742 AMSTERDAM");

    assertThat(result.category()).isEqualTo("Travel");
    assertThat(result.subcategory()).isEqualTo("Air Travel");
    assertThat(result.confidence()).isEqualTo(0.91);
    assertThat(result.source()).isEqualTo(CategorySource.MODEL);
    server.verify();
  }

  @Test
  void failureFallsBackToRulesAndPausesModelCalls() {
    server.expect(once(), requestTo(ENDPOINT)).andRespond(withServerError());

    Classification first = categorizer.classify("Starbucks");
    Classification second = categorizer.classify("Netflix");

    assertThat(first.source()).isEqualTo(CategorySource.RULES);
    assertThat(first.category()).isEqualTo("Food & Dining");
    assertThat(second.category()).isEqualTo("Entertainment");
    server.verify();
  }

  @Test
  void unusableAnswerFallsBackToRules() throws Exception {
    assertThat(categorizer.parse(objectMapper.readTree(answer("no idea")))).isNull();
    assertThat(categorizer.parse(objectMapper.readTree("{}"))).isNull();
  }

  private static String answer(String text) {
    return "{\"candidates\": [{\"content\": {\"parts\": [{\"text\": \"" + text + "\"}]}}]}";
  }
}
