package com.scholary.inference.failover;

import java.time.Instant;

/** One attempt to serve a request with an alternate model. {@code error} is null on success. */
public record FailoverEvent(
    Instant timestamp,
    String originalModel,
    String alternativeModel,
    boolean success,
    String error) {}
