package com.scholary.inference.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.inference.support.MutableClock;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryResponseCacheTest {

  private MutableClock clock;
  private InMemoryResponseCache cache;

  @BeforeEach
  void setUp() {
    clock = MutableClock.atEpochSeconds(1_700_000_000L);
    cache = new InMemoryResponseCache(2, 300, clock);
  }

  @Test
  void get_shouldReturnStoredResponse() {
    cache.put("k1", bytes("hello"), Map.of("Content-Type", "text/plain"), 200, null);

    CacheEntry entry = cache.get("k1").orElseThrow();
    assertThat(new String(entry.payload(), StandardCharsets.UTF_8)).isEqualTo("hello");
    assertThat(entry.headers()).containsEntry("Content-Type", "text/plain");
    assertThat(entry.statusCode()).isEqualTo(200);
    assertThat(entry.ttlSeconds()).isEqualTo(300);
  }

  @Test
  void get_shouldExpireEntryAfterTtl() {
    cache.put("k1", bytes("a"), Map.of(), 200, 5);

    clock.advanceSeconds(4);
    assertThat(cache.get("k1")).isPresent();

    clock.advanceSeconds(2);
    assertThat(cache.get("k1")).isEmpty();
    assertThat(cache.stats().size()).isZero();
  }

  @Test
  void put_shouldEvictOldestCreatedEntryAtCapacity() {
    cache.put("k1", bytes("1"), Map.of(), 200, null);
    cache.put("k2", bytes("2"), Map.of(), 200, null);
    // reading k1 does not protect it: eviction is by creation, not use
    cache.get("k1");

    cache.put("k3", bytes("3"), Map.of(), 200, null);

    assertThat(cache.get("k1")).isEmpty();
    assertThat(cache.get("k2")).isPresent();
    assertThat(cache.get("k3")).isPresent();
    assertThat(cache.stats().evictions()).isEqualTo(1);
  }

  @Test
  void put_shouldPurgeExpiredEntriesBeforeEvicting() {
    cache.put("short", bytes("1"), Map.of(), 200, 1);
    cache.put("long", bytes("2"), Map.of(), 200, 100);
    clock.advanceSeconds(2);

    cache.put("new", bytes("3"), Map.of(), 200, null);

    assertThat(cache.get("long")).isPresent();
    assertThat(cache.get("new")).isPresent();
    assertThat(cache.stats().evictions()).isZero();
  }

  @Test
  void put_overwriteShouldNotEvict() {
    cache.put("k1", bytes("1"), Map.of(), 200, null);
    cache.put("k2", bytes("2"), Map.of(), 200, null);

    cache.put("k1", bytes("updated"), Map.of(), 201, null);

    assertThat(cache.get("k2")).isPresent();
    assertThat(cache.get("k1").orElseThrow().statusCode()).isEqualTo(201);
    assertThat(cache.stats().evictions()).isZero();
  }

  @Test
  void invalidate_shouldRemoveKeysWithPrefix() {
    cache.put("abc1", bytes("1"), Map.of(), 200, null);
    cache.put("xyz", bytes("2"), Map.of(), 200, null);

    assertThat(cache.invalidate("abc")).isEqualTo(1);
    assertThat(cache.get("abc1")).isEmpty();
    assertThat(cache.get("xyz")).isPresent();
  }

  @Test
  void stats_shouldCountHitsAndMisses() {
    cache.put("k1", bytes("1"), Map.of(), 200, null);
    cache.get("k1");
    cache.get("k1");
    cache.get("nope");

    ResponseCache.CacheStats stats = cache.stats();
    assertThat(stats.hits()).isEqualTo(2);
    assertThat(stats.misses()).isEqualTo(1);
    assertThat(stats.hitRate()).isCloseTo(2.0 / 3, org.assertj.core.data.Offset.offset(0.001));
  }

  @Test
  void payload_shouldBeDefensivelyCopied() {
    byte[] payload = bytes("abc");
    cache.put("k1", payload, Map.of(), 200, null);
    payload[0] = 'z';

    byte[] read = cache.get("k1").orElseThrow().payload();
    read[1] = 'z';

    assertThat(cache.get("k1").orElseThrow().payload()).isEqualTo(bytes("abc"));
  }

  @Test
  void constructor_shouldRejectNonPositiveCapacity() {
    assertThatThrownBy(() -> new InMemoryResponseCache(0, 300, clock))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void generateKey_shouldDependOnEveryPart() {
    String base = ResponseCache.generateKey("GET", "/api/inference/models", null, null);

    assertThat(base).hasSize(32).matches("[0-9a-f]+");
    assertThat(ResponseCache.generateKey("GET", "/api/inference/models", null, null))
        .isEqualTo(base);
    assertThat(ResponseCache.generateKey("GET", "/api/inference/models", "a=1", null))
        .isNotEqualTo(base);
    assertThat(ResponseCache.generateKey("GET", "/api/inference/models", null, "key-1"))
        .isNotEqualTo(base);
  }

  private static byte[] bytes(String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }
}
