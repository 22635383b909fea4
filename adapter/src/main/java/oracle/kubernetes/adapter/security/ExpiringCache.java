// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.security;

import java.time.Duration;
import java.util.Optional;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

/**
 * A bounded cache whose entries each carry their own time to live. Expired entries are evicted,
 * and the least recently used entries give way once the maximum size is reached.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
class ExpiringCache<K, V> {

  static final long DEFAULT_MAXIMUM_SIZE = 10_000;

  private final Cache<K, Entry<V>> cache;

  ExpiringCache(long maximumSize, Ticker ticker) {
    this.cache = Caffeine.newBuilder()
          .expireAfter(new EntryExpiry<K, V>())
          .maximumSize(maximumSize)
          .ticker(ticker)
          .executor(Runnable::run)
          .build();
  }

  Optional<V> get(K key) {
    return Optional.ofNullable(cache.getIfPresent(key)).map(entry -> entry.value);
  }

  /**
   * Caches a value.
   * @param key the key
   * @param value the value
   * @param ttl how long the value may be used. A zero or negative duration disables caching.
   */
  void put(K key, V value, Duration ttl) {
    if (ttl.isZero() || ttl.isNegative()) {
      return;
    }
    cache.put(key, new Entry<>(value, ttl.toNanos()));
  }

  long size() {
    cache.cleanUp();
    return cache.estimatedSize();
  }

  private static class Entry<V> {
    private final V value;
    private final long ttlNanos;

    Entry(V value, long ttlNanos) {
      this.value = value;
      this.ttlNanos = ttlNanos;
    }
  }

  private static class EntryExpiry<K, V> implements Expiry<K, Entry<V>> {
    @Override
    public long expireAfterCreate(K key, Entry<V> entry, long currentTime) {
      return entry.ttlNanos;
    }

    @Override
    public long expireAfterUpdate(K key, Entry<V> entry, long currentTime, long currentDuration) {
      return entry.ttlNanos;
    }

    @Override
    public long expireAfterRead(K key, Entry<V> entry, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
