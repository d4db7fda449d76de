package com.scholary.inference.ratelimit;

/**
 * Outcome of one admission check.
 *
 * @param limited whether the request must be rejected
 * @param remaining requests left in the current window after this one
 * @param waitSeconds seconds until a rejected caller may retry; 0 when admitted
 */
public record RateLimitResult(boolean limited, int remaining, int waitSeconds) {

  static RateLimitResult admitted(int remaining) {
    return new RateLimitResult(false, remaining, 0);
  }

  static RateLimitResult rejected(int waitSeconds) {
    return new RateLimitResult(true, 0, waitSeconds);
  }
}
