package com.mintflow.categorizer;

import com.mintflow.model.CategorySource;

public record Classification(String category, String subcategory, double confidence, CategorySource source) {
  public Classification {
    if (category == null || category.isBlank()) {
      throw new IllegalArgumentException("category is required");
    }
    confidence = Math.max(0.0, Math.min(1.0, confidence));
  }
}
