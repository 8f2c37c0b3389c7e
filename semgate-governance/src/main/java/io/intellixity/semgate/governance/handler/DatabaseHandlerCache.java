package io.intellixity.semgate.governance.handler;

import io.intellixity.semgate.error.NotReadyException;
import io.intellixity.semgate.error.ResourceNotFoundException;
import io.intellixity.semgate.governance.internal.LruTtlCache;
import io.intellixity.semgate.registry.DatabaseConfig;
import io.intellixity.semgate.registry.DatabaseRegistry;
import io.intellixity.semgate.registry.RegistryEvent;
import io.intellixity.semgate.registry.RegistryListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Process-wide cache of ready {@link DatabaseHandler}s, keyed by database id.\n
 *
 * - Single flight: the first caller parks a pending future under the key and builds; concurrent callers for the
 *   same key await that future instead of building their own.\n
 * - A failed build is retracted, so the next call builds again; a cached handler that is not ready is discarded
 *   and rebuilt.\n
 * - Registry writes that invalidate a database evict its handler; a hit also re-reads the row, so a database
 *   deactivated elsewhere is never served from the cache.\n
 * - LRU bound and expire-after-write from {@link HandlerCacheSettings}.\n
 */
public final class DatabaseHandlerCache implements RegistryListener {
  private static final Logger log = LoggerFactory.getLogger(DatabaseHandlerCache.class);

  private final DatabaseRegistry registry;
  private final DatabaseHandlerFactory factory;
  private final LruTtlCache<String, CompletableFuture<DatabaseHandler>> cache;

  public DatabaseHandlerCache(DatabaseRegistry registry,
                              DatabaseHandlerFactory factory,
                              HandlerCacheSettings settings,
                              Clock clock) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.factory = Objects.requireNonNull(factory, "factory");
    Objects.requireNonNull(settings, "settings");
    Objects.requireNonNull(clock, "clock");
    this.cache = new LruTtlCache<>(settings.maxEntries(), settings.ttl().toMillis(), 0, clock::millis);
  }

  /**
   * Ready handler for the database.
   *
   * @throws ResourceNotFoundException if the database does not exist or is not visible to {@code tenantId}
   * @throws NotReadyException if the database is not active
   */
  public DatabaseHandler getHandler(String databaseId, String tenantId) {
    Objects.requireNonNull(databaseId, "databaseId");
    while (true) {
      CompletableFuture<DatabaseHandler> cached = cache.get(databaseId);
      if (cached != null) {
        DatabaseHandler h = await(cached);
        DatabaseConfig current = registry.get(databaseId, tenantId).orElse(null);
        if (current == null) {
          // gone, or owned by another tenant
          if (h.database().visibleTo(tenantId)) cache.remove(databaseId, cached);
          throw ResourceNotFoundException.database(databaseId);
        }
        if (!current.isActive()) {
          log.info("Discarding handler for {}: database is {}", databaseId, current.status().wire());
          cache.remove(databaseId, cached);
          throw NotReadyException.inactive(databaseId);
        }
        if (h.isReady()) return h;
        log.info("Discarding handler for {}: not ready", databaseId);
        cache.remove(databaseId, cached);
        continue;
      }

      DatabaseConfig db = registry.get(databaseId, tenantId)
          .orElseThrow(() -> ResourceNotFoundException.database(databaseId));
      if (!db.isActive()) throw NotReadyException.inactive(databaseId);

      CompletableFuture<DatabaseHandler> pending = new CompletableFuture<>();
      if (cache.putIfAbsent(databaseId, pending) != null) continue;
      return build(db, pending);
    }
  }

  public void evict(String databaseId) {
    if (cache.remove(databaseId) != null) log.info("Evicted handler for {}", databaseId);
  }

  public void evictAll() {
    cache.clear();
  }

  public int size() {
    return cache.size();
  }

  @Override
  public void onEvent(RegistryEvent event) {
    if (event.invalidates()) evict(event.databaseId());
  }

  private DatabaseHandler build(DatabaseConfig db, CompletableFuture<DatabaseHandler> pending) {
    try {
      DatabaseHandler h = factory.create(db);
      h.initialize();
      pending.complete(h);
      log.info("Created handler for database {}", db.id());
      return h;
    } catch (RuntimeException | Error e) {
      cache.remove(db.id(), pending);
      pending.completeExceptionally(e);
      log.warn("Handler initialization failed for database {}", db.id(), e);
      throw e;
    }
  }

  private static DatabaseHandler await(CompletableFuture<DatabaseHandler> f) {
    try {
      return f.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException re) throw re;
      throw e;
    }
  }
}
