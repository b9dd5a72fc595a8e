package com.servicevault.identifier.app.client;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.Arrays;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Keyed store of read views. Entries are only ever replaced by a fresh fetch: after a mutation
 * the affected keys are invalidated, never patched in place.
 */
public class ClientViewCache {

  private static final long DEFAULT_MAX_ENTRIES = 256;

  private final Cache<String, Object> entries;

  public ClientViewCache() {
    this(DEFAULT_MAX_ENTRIES);
  }

  public ClientViewCache(long maxEntries) {
    this.entries = Caffeine.newBuilder().maximumSize(Math.max(1, maxEntries)).build();
  }

  /** Cached value for {@code key}, loading and storing it on a miss. */
  public <T> T get(String key, Class<T> type, Supplier<T> loader) {
    Object cached = entries.getIfPresent(key);
    if (type.isInstance(cached)) return type.cast(cached);

    // a null load is not cached, so the next read retries
    T loaded = loader.get();
    if (loaded != null) entries.put(key, loaded);
    return loaded;
  }

  public <T> Optional<T> peek(String key, Class<T> type) {
    Object cached = entries.getIfPresent(key);
    return type.isInstance(cached) ? Optional.of(type.cast(cached)) : Optional.empty();
  }

  public void put(String key, Object value) {
    if (value == null) {
      entries.invalidate(key);
    } else {
      entries.put(key, value);
    }
  }

  public void invalidate(String... keys) {
    entries.invalidateAll(Arrays.asList(keys));
  }

  public boolean contains(String key) {
    return entries.getIfPresent(key) != null;
  }
}
