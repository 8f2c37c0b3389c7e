package io.intellixity.semgate.governance.handler;

import java.time.Duration;
import java.util.Objects;

/** Bounds of the handler cache. A zero {@code ttl} keeps handlers until evicted. */
public record HandlerCacheSettings(int maxEntries, Duration ttl) {
  public HandlerCacheSettings {
    if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
    Objects.requireNonNull(ttl, "ttl");
    if (ttl.isNegative()) throw new IllegalArgumentException("ttl must be >= 0");
  }

  public static HandlerCacheSettings defaults() {
    return new HandlerCacheSettings(100, Duration.ofMinutes(30));
  }
}
