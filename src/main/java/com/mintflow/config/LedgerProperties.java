package com.mintflow.config;

import com.mintflow.model.AmountSignConvention;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "mintflow.ledger")
public record LedgerProperties(AmountSignConvention signConvention) {
  public LedgerProperties {
    if (signConvention == null) {
      signConvention = AmountSignConvention.POSITIVE_IS_DEBIT;
    }
  }
}
