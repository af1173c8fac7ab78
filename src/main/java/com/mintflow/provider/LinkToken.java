package com.mintflow.provider;

import java.time.Instant;

/** Short-lived token the client-side link flow is started with; it yields the public token. */
public record LinkToken(String token, Instant expiration) {}
