package com.mintflow.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class AccountResponse {
  private UUID id;
  private UUID connectionId;
  private String name;
  private String officialName;
  private String type;
  private String subtype;
  private String mask;
  private BigDecimal currentBalance;
  private BigDecimal availableBalance;
  private BigDecimal creditLimit;
  private String currency;
  private Instant lastSyncedAt;
}
