package io.intellixity.semgate.registry;

import io.intellixity.semgate.error.ConflictException;
import io.intellixity.semgate.error.ErrorCode;
import io.intellixity.semgate.error.InvalidRequestException;
import io.intellixity.semgate.error.ResourceNotFoundException;
import io.intellixity.semgate.governance.GovernanceDocument;
import io.intellixity.semgate.registry.store.DatabaseStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Tenant-isolated lifecycle of database configurations.
 * <p>
 * Every operation takes an optional {@code tenantId}. Null is single-tenant mode and sees every row; a non-null
 * value only sees the tenant's own rows, and a row of another tenant is reported exactly as a missing one.
 */
public final class DatabaseRegistry {
  private static final Logger log = LoggerFactory.getLogger(DatabaseRegistry.class);
  private static final Pattern ID = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_-]{0,63}$");
  private static final Set<String> HOST_DATABASE_TYPES = Set.of("postgres", "mysql", "redshift", "clickhouse");

  private final DatabaseStore store;
  private final RegistrySettings settings;
  private final Clock clock;
  private final List<RegistryListener> listeners = new CopyOnWriteArrayList<>();

  public DatabaseRegistry(DatabaseStore store, RegistrySettings settings, Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public RegistrySettings settings() { return settings; }
  public String storeKind() { return store.kind(); }

  public void addListener(RegistryListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public void removeListener(RegistryListener listener) {
    listeners.remove(listener);
  }

  /**
   * Registers a database as {@code inactive} with the initial governance document.
   * The storage id is {@code DatabaseIds.scope(request.id(), tenantId)}.
   */
  public DatabaseConfig create(NewDatabase request, String tenantId) {
    Objects.requireNonNull(request, "request");
    String userId = request.id();
    if (userId == null || !ID.matcher(userId).matches()) {
      throw new InvalidRequestException(ErrorCode.INVALID_ARGUMENT,
          "Database id must be 1-64 letters, digits, '-' or '_' and start with a letter or digit");
    }
    String slug = request.slug() == null || request.slug().isBlank() ? userId : request.slug();
    String id = DatabaseIds.scope(userId, tenantId);
    log.info("Creating database {} (slug {}, tenant {})", id, slug, tenantId);

    if (store.exists(id, null)) {
      throw new ConflictException(ErrorCode.DATABASE_EXISTS, "Database with ID '" + userId + "' already exists");
    }
    if (store.slugExists(slug, tenantId)) {
      throw new ConflictException(ErrorCode.SLUG_TAKEN, "Slug '" + slug + "' is already used");
    }
    warnOnCustomSecret(id, request.jwtSecret());

    Instant now = clock.instant();
    DatabaseConfig db = new DatabaseConfig(
        id, slug, tenantId,
        request.name() == null || request.name().isBlank() ? userId : request.name(),
        request.description(),
        DatabaseStatus.INACTIVE,
        request.connection() == null ? Map.of() : new LinkedHashMap<>(request.connection()),
        apiUrlOverride(request.cubeApiUrl()),
        request.jwtSecret() == null || request.jwtSecret().isBlank() ? settings.globalJwtSecret() : request.jwtSecret(),
        request.maxLimit(),
        request.denyMembers(),
        request.defaultSegments(),
        Boolean.TRUE.equals(request.returnSql()),
        null, now, now);
    store.insert(db);
    store.saveGovernance(id, GovernanceDocument.initial(), now);
    publish(new RegistryEvent(RegistryEvent.Type.CREATED, id, tenantId, db));
    return db;
  }

  public Optional<DatabaseConfig> get(String id, String tenantId) {
    if (id == null) return Optional.empty();
    return store.get(id, tenantId);
  }

  /** Like {@link #get} but fails with {@code DATABASE_NOT_FOUND}. */
  public DatabaseConfig require(String id, String tenantId) {
    return get(id, tenantId).orElseThrow(() -> ResourceNotFoundException.database(id));
  }

  public List<DatabaseConfig> list(String tenantId) {
    return store.list(tenantId);
  }

  public List<DatabaseConfig> listActive(String tenantId) {
    return store.listByStatus(DatabaseStatus.ACTIVE, tenantId);
  }

  public boolean exists(String id, String tenantId) {
    return id != null && store.exists(id, tenantId);
  }

  /**
   * Applies a partial update. Empty if no row matched.
   *
   * @throws ConflictException {@code DATABASE_ACTIVE} when changing the connection of an active database
   */
  public Optional<DatabaseConfig> update(String id, DatabasePatch patch, String tenantId) {
    Objects.requireNonNull(patch, "patch");
    Optional<DatabaseConfig> existing = get(id, tenantId);
    if (existing.isEmpty()) return Optional.empty();
    DatabaseConfig cur = existing.get();
    if (cur.isActive() && patch.connection() != null) throw activeConnectionFrozen();
    if (patch.jwtSecret() != null) warnOnCustomSecret(id, patch.jwtSecret());

    String apiUrl = patch.cubeApiUrl() != null ? apiUrlOverride(patch.cubeApiUrl()) : cur.cubeApiUrl();
    DatabaseConfig next = cur.patched(patch, apiUrl, clock.instant());
    Optional<DatabaseConfig> stored = store.replace(next, patch.connection() != null, tenantId);
    if (stored.isEmpty()) {
      // activated after our read
      if (patch.connection() != null && store.exists(id, tenantId)) throw activeConnectionFrozen();
      return Optional.empty();
    }
    publish(new RegistryEvent(RegistryEvent.Type.UPDATED, id, cur.tenantId(), stored.get()));
    return stored;
  }

  /**
   * Deletes an inactive database with its governance document. False if no row matched.
   *
   * @throws ConflictException {@code DATABASE_ACTIVE} for an active database, {@code DEFAULT_DATABASE} for the
   *                           default one
   */
  public boolean delete(String id, String tenantId) {
    Optional<DatabaseConfig> existing = get(id, tenantId);
    if (existing.isEmpty()) return false;
    DatabaseConfig cur = existing.get();
    if (cur.isActive()) throw activeNotDeletable(id);
    if (DatabaseIds.DEFAULT_SLUG.equals(cur.slug())) {
      throw new ConflictException(ErrorCode.DEFAULT_DATABASE, "Cannot delete the default database");
    }
    if (!store.delete(id, tenantId)) {
      // the store refuses active rows; anything still there was activated after our read
      if (store.exists(id, tenantId)) throw activeNotDeletable(id);
      return false;
    }
    log.info("Deleted database {}", id);
    publish(new RegistryEvent(RegistryEvent.Type.DELETED, id, cur.tenantId(), null));
    return true;
  }

  public boolean updateStatus(String id, DatabaseStatus status, String error, String tenantId) {
    Objects.requireNonNull(status, "status");
    Optional<DatabaseConfig> existing = get(id, tenantId);
    if (existing.isEmpty()) return false;
    if (!store.updateStatus(id, status, error, clock.instant(), tenantId)) return false;
    publish(new RegistryEvent(RegistryEvent.Type.UPDATED, id, existing.get().tenantId(), null));
    return true;
  }

  /** Checks the connection configuration by engine type; never throws for a bad configuration. */
  public ConnectionTestResult testConnection(String id, String tenantId) {
    Optional<DatabaseConfig> existing = get(id, tenantId);
    if (existing.isEmpty()) return ConnectionTestResult.failed("Database '" + id + "' not found");

    long start = System.nanoTime();
    Map<String, Object> c = existing.get().connection();
    Object type = c.get("type");
    if (type != null) {
      String t = type.toString();
      if (HOST_DATABASE_TYPES.contains(t) && (blank(c.get("host")) || blank(c.get("database")))) {
        return ConnectionTestResult.failed("Missing host or database in connection config");
      }
      if ("bigquery".equals(t) && blank(c.get("projectId"))) {
        return ConnectionTestResult.failed("Missing projectId for BigQuery");
      }
      if ("snowflake".equals(t) && (blank(c.get("account")) || blank(c.get("warehouse")))) {
        return ConnectionTestResult.failed("Missing account or warehouse for Snowflake");
      }
    }
    long latencyMs = (System.nanoTime() - start) / 1_000_000L;
    return new ConnectionTestResult(true, "Connection configuration is valid", latencyMs);
  }

  /**
   * Makes a database available to the gateway. A failed connection check moves it to {@code error} with
   * {@code lastError} set and fails with {@code CONNECTION_INVALID}. No-op when already active.
   */
  public DatabaseConfig activate(String id, String tenantId) {
    DatabaseConfig cur = require(id, tenantId);
    if (cur.isActive()) return cur;
    log.info("Activating database {}", id);

    ConnectionTestResult test = testConnection(id, tenantId);
    Instant now = clock.instant();
    if (!test.success()) {
      store.updateStatus(id, DatabaseStatus.ERROR, test.message(), now, tenantId);
      publish(new RegistryEvent(RegistryEvent.Type.UPDATED, id, cur.tenantId(), null));
      throw new ConflictException(ErrorCode.CONNECTION_INVALID, "Connection test failed: " + test.message(),
          Map.of("databaseId", id));
    }
    store.updateStatus(id, DatabaseStatus.ACTIVE, null, now, tenantId);
    DatabaseConfig active = cur.withStatus(DatabaseStatus.ACTIVE, null, now);
    publish(new RegistryEvent(RegistryEvent.Type.ACTIVATED, id, cur.tenantId(), active));
    return active;
  }

  /** No-op when already inactive. */
  public DatabaseConfig deactivate(String id, String tenantId) {
    DatabaseConfig cur = require(id, tenantId);
    if (cur.status() == DatabaseStatus.INACTIVE) return cur;
    log.info("Deactivating database {}", id);
    Instant now = clock.instant();
    store.updateStatus(id, DatabaseStatus.INACTIVE, null, now, tenantId);
    DatabaseConfig inactive = cur.withStatus(DatabaseStatus.INACTIVE, null, now);
    publish(new RegistryEvent(RegistryEvent.Type.DEACTIVATED, id, cur.tenantId(), inactive));
    return inactive;
  }

  /** Creates (if absent) and activates the tenant's {@code default} database. Returns its id. */
  public String initializeDefaultDatabase(String tenantId) {
    String id = DatabaseIds.defaultDatabaseId(tenantId);
    if (store.exists(id, null)) {
      log.debug("Default database {} already exists", id);
      return id;
    }
    log.info("Creating default database {} for tenant {}", id, tenantId);
    NewDatabase request = new NewDatabase(DatabaseIds.DEFAULT_SLUG, null, "Sample Database",
        "Auto-created sample database to get you started", settings.defaultConnection(), null,
        settings.globalJwtSecret(), settings.maxLimit(), settings.denyMembers(), settings.defaultSegments(),
        settings.returnSql());
    try {
      create(request, tenantId);
    } catch (ConflictException e) {
      if (e.code() != ErrorCode.DATABASE_EXISTS) throw e;
      log.debug("Default database {} created concurrently", id);
    }
    activate(id, tenantId);
    return id;
  }

  /** Emits a governance change of {@code databaseId}; used by {@link GovernanceCatalog}. */
  void governanceUpdated(String databaseId, String tenantId) {
    publish(new RegistryEvent(RegistryEvent.Type.GOVERNANCE_UPDATED, databaseId, tenantId, null));
  }

  DatabaseStore store() { return store; }
  Clock clock() { return clock; }

  private void publish(RegistryEvent event) {
    for (RegistryListener l : listeners) {
      try {
        l.onEvent(event);
      } catch (RuntimeException e) {
        log.warn("Registry listener failed on {} for {}", event.type(), event.databaseId(), e);
      }
    }
  }

  private static ConflictException activeConnectionFrozen() {
    return new ConflictException(ErrorCode.DATABASE_ACTIVE,
        "Cannot update connection while database is active. Deactivate first.");
  }

  private static ConflictException activeNotDeletable(String id) {
    return new ConflictException(ErrorCode.DATABASE_ACTIVE, "Cannot delete an active database. Deactivate first.",
        Map.of("databaseId", id));
  }

  private String apiUrlOverride(String url) {
    if (url == null || url.isBlank()) return null;
    return url.equals(settings.globalApiUrl()) ? null : url;
  }

  private void warnOnCustomSecret(String id, String secret) {
    if (secret != null && !secret.isBlank() && !secret.equals(settings.globalJwtSecret())) {
      log.warn("Database {} uses a JWT secret that differs from the global one; the engine may reject its tokens", id);
    }
  }

  private static boolean blank(Object v) {
    return v == null || v.toString().isBlank();
  }
}
