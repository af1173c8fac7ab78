package com.mintflow.dto;

import com.mintflow.model.CategorySource;
import com.mintflow.model.TransactionDirection;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class TransactionResponse {
  private UUID id;
  private UUID accountId;
  private BigDecimal amount;
  private String currency;
  private TransactionDirection direction;
  private String description;
  private String merchantName;
  private LocalDate bookingDate;
  private boolean pending;
  private String category;
  private String subcategory;
  private CategorySource categorySource;
  private BigDecimal categoryConfidence;
}
