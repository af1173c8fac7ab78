package com.mintflow.model;

public enum CategorySource {
  MODEL, RULES, USER
}
