package com.scholary.inference.ratelimit;

/**
 * Result of evaluating all rate-limit buckets for one request.
 *
 * @param admitted whether the request may proceed
 * @param limiter the bucket that decided: the rejecting one, or the one whose budget is reported
 *     ("api_key" when the caller sent a key, else "ip")
 * @param limit the request budget of that bucket
 * @param remaining requests left in that bucket
 * @param resetEpochSeconds when the reported bucket's window resets
 * @param retryAfterSeconds retry hint for a rejected request; 0 when admitted
 */
public record AdmissionDecision(
    boolean admitted,
    String limiter,
    int limit,
    int remaining,
    long resetEpochSeconds,
    int retryAfterSeconds) {}
