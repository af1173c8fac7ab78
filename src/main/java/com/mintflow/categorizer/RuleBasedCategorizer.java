package com.mintflow.categorizer;

import com.mintflow.model.CategorySource;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Keyword lookup over the description and merchant text. First matching rule wins. */
public class RuleBasedCategorizer implements Categorizer {
  static final String FALLBACK_CATEGORY = "Other";
  private static final double MATCH_CONFIDENCE = 0.6;

  private final List<Rule> rules = new ArrayList<>();

  public RuleBasedCategorizer() {
    rule("Food & Dining", "Coffee Shops", "starbucks", "coffee", "dunkin", "blue bottle", "peet's");
    rule("Food & Dining", "Groceries", "whole foods", "trader joe", "safeway", "kroger", "grocery", "aldi");
    rule("Food & Dining", "Restaurants", "restaurant", "mcdonald", "chipotle", "doordash", "grubhub", "uber eats");
    rule("Transportation", "Rideshare", "uber", "lyft");
    rule("Transportation", "Gas", "shell", "chevron", "exxon", "gas station", "bp ");
    rule("Shopping", "Online", "amazon", "ebay", "etsy");
    rule("Entertainment", "Streaming", "netflix", "spotify", "hulu", "disney+", "hbo");
    rule("Bills & Utilities", "Rent", "rent payment", "landlord", "property mgmt");
    rule("Bills & Utilities", "Electric", "electric", "power co", "energy");
    rule("Bills & Utilities", "Phone", "verizon", "at&t", "t-mobile");
    rule("Cash & ATM", "ATM", "atm", "cash withdrawal");
    rule("Income", "Salary", "payroll", "paycheck", "salary", "direct dep");
    rule("Travel", "Air Travel", "airline", "delta", "united air", "american air");
    rule("Travel", "Lodging", "airbnb", "hotel", "marriott", "hilton");
    rule("Health & Fitness", "Pharmacy", "pharmacy", "cvs", "walgreens");
  }

  @Override
  public Classification classify(String text) {
    String normalized = text == null ? "" : text.toLowerCase(Locale.ROOT);
    for (Rule rule : rules) {
      for (String keyword : rule.keywords()) {
        if (normalized.contains(keyword)) {
          return new Classification(rule.category(), rule.subcategory(), MATCH_CONFIDENCE, CategorySource.RULES);
        }
      }
    }
    return new Classification(FALLBACK_CATEGORY, null, 0.0, CategorySource.RULES);
  }

  List<String> categories() {
    return rules.stream().map(Rule::category).distinct().toList();
  }

  private void rule(String category, String subcategory, String... keywords) {
    rules.add(new Rule(category, subcategory, List.of(keywords)));
  }

  private record Rule(String category, String subcategory, List<String> keywords) {}
}
