package com.mintflow.provider;

public record TokenExchange(String credential, String institutionId, String institutionName, String itemId) {}
