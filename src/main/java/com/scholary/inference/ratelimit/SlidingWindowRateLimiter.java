package com.scholary.inference.ratelimit;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sliding-window request counter keyed by an arbitrary identifier (IP, API key, "global").
 *
 * <p>Each identifier keeps its recent samples in arrival order. Checks for one identifier are
 * linearized through the map's per-key {@code compute}; different identifiers do not contend.
 */
public class SlidingWindowRateLimiter {

  private final String name;
  private final int maxRequests;
  private final long windowMillis;
  private final Clock clock;
  private final ConcurrentMap<String, Deque<Sample>> windows = new ConcurrentHashMap<>();

  public SlidingWindowRateLimiter(String name, int maxRequests, int windowSeconds, Clock clock) {
    if (maxRequests <= 0 || windowSeconds <= 0) {
      throw new IllegalArgumentException("maxRequests and windowSeconds must be positive");
    }
    this.name = name;
    this.maxRequests = maxRequests;
    this.windowMillis = windowSeconds * 1000L;
    this.clock = clock;
  }

  /**
   * Check whether the identifier is over its budget and, if not, count this request.
   *
   * <p>A rejected request is not counted.
   */
  public RateLimitResult isLimited(String identifier) {
    AtomicReference<RateLimitResult> result = new AtomicReference<>();
    windows.compute(
        identifier,
        (key, samples) -> {
          long now = clock.millis();
          Deque<Sample> window = samples != null ? samples : new ArrayDeque<>();
          dropExpired(window, now);

          int total = window.stream().mapToInt(Sample::count).sum();
          if (total >= maxRequests) {
            result.set(RateLimitResult.rejected(waitSeconds(window, now)));
          } else {
            window.addLast(new Sample(now, 1));
            result.set(RateLimitResult.admitted(maxRequests - total - 1));
          }
          return window;
        });
    return result.get();
  }

  /**
   * Drop identifiers whose windows have fully elapsed.
   *
   * @return number of identifiers removed
   */
  public int purgeIdle() {
    int before = windows.size();
    for (String identifier : windows.keySet()) {
      windows.computeIfPresent(
          identifier,
          (key, window) -> {
            dropExpired(window, clock.millis());
            return window.isEmpty() ? null : window;
          });
    }
    return Math.max(0, before - windows.size());
  }

  public String getName() {
    return name;
  }

  public int getMaxRequests() {
    return maxRequests;
  }

  public int getWindowSeconds() {
    return (int) (windowMillis / 1000);
  }

  int trackedIdentifiers() {
    return windows.size();
  }

  private void dropExpired(Deque<Sample> window, long now) {
    long cutoff = now - windowMillis;
    while (!window.isEmpty() && window.peekFirst().timestampMillis() <= cutoff) {
      window.removeFirst();
    }
  }

  /** Whole seconds until the oldest sample leaves the window, at least 1. */
  private int waitSeconds(Deque<Sample> window, long now) {
    if (window.isEmpty()) {
      return getWindowSeconds();
    }
    long untilFree = window.peekFirst().timestampMillis() + windowMillis - now;
    return (int) Math.max(1, (untilFree + 999) / 1000);
  }

  private record Sample(long timestampMillis, int count) {}
}
