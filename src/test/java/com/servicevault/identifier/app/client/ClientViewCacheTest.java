package com.servicevault.identifier.app.client;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ClientViewCacheTest {

  private final ClientViewCache cache = new ClientViewCache();

  @Test
  void loadsOnceUntilInvalidated() {
    AtomicInteger loads = new AtomicInteger();

    cache.get("k", String.class, () -> "v" + loads.incrementAndGet());
    String second = cache.get("k", String.class, () -> "v" + loads.incrementAndGet());
    assertEquals("v1", second);

    cache.invalidate("k", "unrelated");
    assertEquals("v2", cache.get("k", String.class, () -> "v" + loads.incrementAndGet()));
  }

  @Test
  void nullLoadIsNotCached() {
    assertNull(cache.get("k", String.class, () -> null));
    assertFalse(cache.contains("k"));
  }

  @Test
  void staleTypeIsReloaded() {
    cache.put("k", 7);

    assertEquals("fresh", cache.get("k", String.class, () -> "fresh"));
    assertEquals("fresh", cache.peek("k", String.class).orElseThrow());
  }

  @Test
  void loaderFailureLeavesNoEntry() {
    assertThrows(
        IllegalStateException.class,
        () ->
            cache.get(
                "k",
                String.class,
                () -> {
                  throw new IllegalStateException("offline");
                }));
    assertFalse(cache.contains("k"));
  }

  @Test
  void peekIsTypeChecked() {
    cache.put(CacheKeys.DASHBOARD, 42);

    assertTrue(cache.peek(CacheKeys.DASHBOARD, String.class).isEmpty());
    assertEquals(42, cache.peek(CacheKeys.DASHBOARD, Integer.class).orElseThrow());

    cache.put(CacheKeys.DASHBOARD, null);
    assertFalse(cache.contains(CacheKeys.DASHBOARD));
  }
}
