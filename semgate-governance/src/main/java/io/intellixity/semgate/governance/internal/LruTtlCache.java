package io.intellixity.semgate.governance.internal;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Synchronized LRU cache with expire-after-write and optional expire-after-access.\n
 *
 * - LRU eviction: access-order LinkedHashMap\n
 * - TTL: expire-after-write (0 disables)\n
 * - Idle: expire-after-access (0 disables)\n
 *
 * {@link #putIfAbsent} and {@link #remove(Object, Object)} let callers park an in-flight value (a pending future)
 * under a key and retract exactly that value later.
 */
public final class LruTtlCache<K, V> {
  private final int maxEntries;
  private final long ttlMillis;
  private final long idleMillis;
  private final LongSupplier nowMillis;

  private final LinkedHashMap<K, Entry<V>> map = new LinkedHashMap<>(16, 0.75f, true);

  private static final class Entry<V> {
    final V value;
    final long writeAt;
    long accessAt;

    Entry(V value, long now) {
      this.value = value;
      this.writeAt = now;
      this.accessAt = now;
    }
  }

  public LruTtlCache(int maxEntries, long ttlMillis, long idleMillis) {
    this(maxEntries, ttlMillis, idleMillis, System::currentTimeMillis);
  }

  public LruTtlCache(int maxEntries, long ttlMillis, long idleMillis, LongSupplier nowMillis) {
    if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
    if (ttlMillis < 0) throw new IllegalArgumentException("ttlMillis must be >= 0");
    if (idleMillis < 0) throw new IllegalArgumentException("idleMillis must be >= 0");
    this.maxEntries = maxEntries;
    this.ttlMillis = ttlMillis;
    this.idleMillis = idleMillis;
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
  }

  public synchronized V get(K key) {
    Objects.requireNonNull(key, "key");
    long now = nowMillis.getAsLong();
    pruneExpired(now);
    Entry<V> e = map.get(key);
    if (e == null) return null;
    e.accessAt = now;
    return e.value;
  }

  public synchronized V put(K key, V value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    long now = nowMillis.getAsLong();
    pruneExpired(now);
    Entry<V> prev = map.put(key, new Entry<>(value, now));
    evictIfNeeded();
    return prev == null ? null : prev.value;
  }

  /** Stores {@code value} unless a live entry exists; returns that entry's value, or null if stored. */
  public synchronized V putIfAbsent(K key, V value) {
    V existing = get(key);
    if (existing != null) return existing;
    put(key, value);
    return null;
  }

  public synchronized V remove(K key) {
    Objects.requireNonNull(key, "key");
    Entry<V> e = map.remove(key);
    return e == null ? null : e.value;
  }

  /** Removes the entry only while it still holds {@code value} (identity). */
  public synchronized boolean remove(K key, V value) {
    Objects.requireNonNull(key, "key");
    Entry<V> e = map.get(key);
    if (e == null || e.value != value) return false;
    map.remove(key);
    return true;
  }

  public synchronized void clear() {
    map.clear();
  }

  public synchronized int size() {
    pruneExpired(nowMillis.getAsLong());
    return map.size();
  }

  private boolean isExpired(Entry<V> e, long now) {
    if (ttlMillis > 0 && (now - e.writeAt) >= ttlMillis) return true;
    return idleMillis > 0 && (now - e.accessAt) >= idleMillis;
  }

  private void pruneExpired(long now) {
    if (map.isEmpty()) return;
    Iterator<Map.Entry<K, Entry<V>>> it = map.entrySet().iterator();
    while (it.hasNext()) {
      if (isExpired(it.next().getValue(), now)) it.remove();
    }
  }

  private void evictIfNeeded() {
    while (map.size() > maxEntries) {
      Iterator<Map.Entry<K, Entry<V>>> it = map.entrySet().iterator();
      if (!it.hasNext()) return;
      it.next();
      it.remove();
    }
  }
}
