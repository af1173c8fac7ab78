package com.mintflow.categorizer;

public interface Categorizer {
  Classification classify(String text);
}
