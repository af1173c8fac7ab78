package com.mintflow.service;

import com.mintflow.model.AccountTransaction;
import com.mintflow.model.CategorySource;
import com.mintflow.repository.AccountTransactionRepository;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

@Service
public class TransactionCategoryService {
  private final AccountTransactionRepository transactionRepository;

  public TransactionCategoryService(AccountTransactionRepository transactionRepository) {
    this.transactionRepository = transactionRepository;
  }

  public AccountTransaction correctCategory(UUID userId, UUID transactionId, String category, String subcategory) {
    if (category == null || category.isBlank()) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "category is required");
    }
    AccountTransaction tx = transactionRepository.findByIdAndUserId(transactionId, userId)
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Transaction not found"));
    tx.setCategory(category.trim());
    tx.setSubcategory(subcategory == null || subcategory.isBlank() ? null : subcategory.trim());
    tx.setCategorySource(CategorySource.USER);
    tx.setCategoryConfidence(null);
    return transactionRepository.save(tx);
  }
}
