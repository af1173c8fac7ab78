package com.mintflow.provider.plaid;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mintflow.config.PlaidProperties;
import com.mintflow.config.SyncProperties;
import com.mintflow.provider.AccountSnapshot;
import com.mintflow.provider.DateRange;
import com.mintflow.provider.LinkToken;
import com.mintflow.provider.ProviderAuthException;
import com.mintflow.provider.ProviderRateLimitedException;
import com.mintflow.provider.ProviderUnavailableException;
import com.mintflow.provider.SnapshotValidationException;
import com.mintflow.provider.TokenExchange;
import com.mintflow.provider.TransactionPage;
import com.mintflow.provider.TransactionSnapshot;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class PlaidProviderClientTest {
  private static final String BASE = "https://plaid.test";
  private static final DateRange MARCH = new DateRange(LocalDate.of(2026, 2, 16), LocalDate.of(2026, 3, 18));

  private MockRestServiceServer server;
  private PlaidProviderClient client;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder().baseUrl(BASE);
    server = MockRestServiceServer.bindTo(builder).build();
    PlaidProperties properties = new PlaidProperties(BASE, "client-1", "secret-1", null, "Budget App", null, null);
    SyncProperties syncProperties = new SyncProperties(true, Duration.ofHours(1), Duration.ofMinutes(5), 45, 3,
        Duration.ofMinutes(5), 2);
    client = new PlaidProviderClient(new PlaidClient(properties, builder.build(), new ObjectMapper()),
        syncProperties);
  }

  @Test
  void mapsAccountsAndBalances() {
    server.expect(requestTo(BASE + "/accounts/get"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(jsonPath("$.client_id").value("client-1"))
        .andExpect(jsonPath("$.access_token").value("access-1"))
        .andRespond(withSuccess("""
            {"accounts": [{
              "account_id": "acc-1", "name": "Plaid Checking", "official_name": "Plaid Gold Standard",
              "type": "depository", "subtype": "checking", "mask": "0000",
              "balances": {"current": 110.25, "available": 100, "limit": null, "iso_currency_code": "USD"}
            }]}
            """, MediaType.APPLICATION_JSON));

    List<AccountSnapshot> accounts = client.fetchAccounts("access-1");

    assertThat(accounts).hasSize(1);
    AccountSnapshot account = accounts.get(0);
    assertThat(account.externalAccountId()).isEqualTo("acc-1");
    assertThat(account.currentBalance()).isEqualByComparingTo("110.25");
    assertThat(account.availableBalance()).isEqualByComparingTo("100");
    assertThat(account.creditLimit()).isNull();
    assertThat(account.currency()).isEqualTo("USD");
    server.verify();
  }

  @Test
  void initialFetchIsLimitedToTheRequestedRange() {
    server.expect(requestTo(BASE + "/transactions/sync"))
        .andExpect(jsonPath("$.cursor").doesNotExist())
        .andRespond(withSuccess("""
            {"added": [
              {"transaction_id": "tx-1", "account_id": "acc-1", "amount": 45.0, "date": "2026-03-10",
               "name": "STARBUCKS STORE 1234", "merchant_name": "Starbucks", "pending": false,
               "iso_currency_code": "USD"},
              {"transaction_id": "tx-old", "account_id": "acc-1", "amount": 9.0, "date": "2025-11-01",
               "name": "OLD", "pending": false}
             ],
             "modified": [], "removed": [{"transaction_id": "tx-gone"}],
             "next_cursor": "cursor-1", "has_more": true}
            """, MediaType.APPLICATION_JSON));

    TransactionPage page = client.fetchTransactions("access-1", null, MARCH);

    assertThat(page.transactions()).extracting(TransactionSnapshot::externalTransactionId).containsExactly("tx-1");
    TransactionSnapshot tx = page.transactions().get(0);
    assertThat(tx.amount()).isEqualByComparingTo("45.00");
    assertThat(tx.merchantName()).isEqualTo("Starbucks");
    assertThat(tx.rawPayload()).contains("\"transaction_id\":\"tx-1\"");
    assertThat(page.nextCursor()).isEqualTo("cursor-1");
    assertThat(page.hasMore()).isTrue();
  }

  @Test
  void incrementalFetchSendsCursorAndKeepsOldDates() {
    server.expect(requestTo(BASE + "/transactions/sync"))
        .andExpect(jsonPath("$.cursor").value("cursor-1"))
        .andRespond(withSuccess("""
            {"added": [], "modified": [
              {"transaction_id": "tx-old", "account_id": "acc-1", "amount": -9.0, "date": "2025-11-01",
               "name": "Refund", "pending": false}],
             "removed": [], "next_cursor": "cursor-2", "has_more": false}
            """, MediaType.APPLICATION_JSON));

    TransactionPage page = client.fetchTransactions("access-1", "cursor-1", null);

    assertThat(page.transactions()).hasSize(1);
    assertThat(page.hasMore()).isFalse();
  }

  @Test
  void laterPagesOfInitialFetchAreLimitedToo() {
    server.expect(requestTo(BASE + "/transactions/sync"))
        .andExpect(jsonPath("$.cursor").value("cursor-1"))
        .andRespond(withSuccess("""
            {"added": [
              {"transaction_id": "tx-2", "account_id": "acc-1", "amount": 12.0, "date": "2026-02-20",
               "name": "Bodega", "pending": false},
              {"transaction_id": "tx-older", "account_id": "acc-1", "amount": 7.5, "date": "2025-06-30",
               "name": "Older", "pending": false}
             ],
             "modified": [], "removed": [], "next_cursor": "cursor-2", "has_more": false}
            """, MediaType.APPLICATION_JSON));

    TransactionPage page = client.fetchTransactions("access-1", "cursor-1", MARCH);

    assertThat(page.transactions()).extracting(TransactionSnapshot::externalTransactionId).containsExactly("tx-2");
    assertThat(page.nextCursor()).isEqualTo("cursor-2");
  }

  @Test
  void missingRequiredFieldIsRejected() {
    server.expect(requestTo(BASE + "/transactions/sync"))
        .andRespond(withSuccess("""
            {"added": [{"transaction_id": "tx-1", "account_id": "acc-1", "date": "2026-03-10", "name": "X"}],
             "next_cursor": "cursor-1", "has_more": false}
            """, MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> client.fetchTransactions("access-1", "c", MARCH))
        .isInstanceOf(SnapshotValidationException.class)
        .hasMessageContaining("amount");
  }

  @Test
  void loginRequiredIsAnAuthFailure() {
    server.expect(requestTo(BASE + "/accounts/get"))
        .andRespond(withStatus(HttpStatus.BAD_REQUEST).contentType(MediaType.APPLICATION_JSON)
            .body("{\"error_type\": \"ITEM_ERROR\", \"error_code\": \"ITEM_LOGIN_REQUIRED\"}"));

    assertThatThrownBy(() -> client.fetchAccounts("access-1")).isInstanceOf(ProviderAuthException.class);
  }

  @Test
  void throttlingIsRateLimited() {
    server.expect(requestTo(BASE + "/accounts/get"))
        .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

    assertThatThrownBy(() -> client.fetchAccounts("access-1")).isInstanceOf(ProviderRateLimitedException.class);
  }

  @Test
  void serverErrorIsUnavailable() {
    server.expect(requestTo(BASE + "/accounts/get")).andRespond(withServerError());

    assertThatThrownBy(() -> client.fetchAccounts("access-1")).isInstanceOf(ProviderUnavailableException.class);
  }

  @Test
  void exchangeResolvesInstitution() {
    server.expect(requestTo(BASE + "/item/public_token/exchange"))
        .andExpect(jsonPath("$.public_token").value("public-sandbox-1"))
        .andRespond(withSuccess("{\"access_token\": \"access-1\", \"item_id\": \"item-1\"}",
            MediaType.APPLICATION_JSON));
    server.expect(requestTo(BASE + "/item/get"))
        .andRespond(withSuccess("{\"item\": {\"item_id\": \"item-1\", \"institution_id\": \"ins_109508\"}}",
            MediaType.APPLICATION_JSON));
    server.expect(requestTo(BASE + "/institutions/get_by_id"))
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
        .andRespond(withServerError());

    TokenExchange exchange = client.exchangeToken("public-sandbox-1");

    assertThat(exchange.credential()).isEqualTo("access-1");
    assertThat(exchange.institutionId()).isEqualTo("ins_109508");
    assertThat(exchange.institutionName()).isNull();
    assertThat(exchange.itemId()).isEqualTo("item-1");
    server.verify();
  }

  @Test
  void linkTokenRequestsTransactionsForTheLookbackWindow() {
    server.expect(requestTo(BASE + "/link/token/create"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(jsonPath("$.client_name").value("Budget App"))
        .andExpect(jsonPath("$.user.client_user_id").value("user-42"))
        .andExpect(jsonPath("$.products[0]").value("transactions"))
        .andExpect(jsonPath("$.transactions.days_requested").value(45))
        .andRespond(withSuccess("""
            {"link_token": "link-sandbox-af1a0311", "expiration": "2026-03-18T16:00:00Z",
             "request_id": "req-1"}
            """, MediaType.APPLICATION_JSON));

    LinkToken token = client.createLinkToken("user-42");

    assertThat(token.token()).isEqualTo("link-sandbox-af1a0311");
    assertThat(token.expiration()).isEqualTo(Instant.parse("2026-03-18T16:00:00Z"));
    server.verify();
  }

  @Test
  void linkTokenWithoutTokenIsRejected() {
    server.expect(requestTo(BASE + "/link/token/create"))
        .andRespond(withSuccess("{\"expiration\": \"2026-03-18T16:00:00Z\"}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> client.createLinkToken("user-42"))
        .isInstanceOf(SnapshotValidationException.class)
        .hasMessageContaining("link_token");
  }
}
