package io.intellixity.semgate.registry.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.semgate.error.ConflictException;
import io.intellixity.semgate.governance.GovernanceDocument;
import io.intellixity.semgate.governance.MemberOverride;
import io.intellixity.semgate.registry.DatabaseConfig;
import io.intellixity.semgate.registry.DatabaseStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcDatabaseStoreTest {
  private JdbcDatabaseStore store;
  private final Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);

  @BeforeEach
  void setUp() {
    DriverManagerDataSource ds = new DriverManagerDataSource(
        "jdbc:h2:mem:registry-" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1", "sa", "");
    RegistrySchema.apply(ds);
    store = new JdbcDatabaseStore(new JdbcTemplate(ds), new ObjectMapper());
  }

  private DatabaseConfig row(String id, String tenant, DatabaseStatus status) {
    return new DatabaseConfig(id, id, tenant, "Name " + id, null, status,
        Map.of("type", "postgres", "host", "db", "port", 5432), null, "secret", 500,
        List.of("users.ssn"), List.of("orders.completed"), true, null, now, now);
  }

  @Test
  void roundTripsEveryColumn() {
    store.insert(row("db1", "tenant-a", DatabaseStatus.INACTIVE));
    DatabaseConfig got = store.get("db1", null).orElseThrow();
    assertEquals("tenant-a", got.tenantId());
    assertEquals(5432, got.connection().get("port"));
    assertEquals(500, got.maxLimit());
    assertEquals(List.of("users.ssn"), got.denyMembers());
    assertTrue(got.returnSql());
    assertEquals(now, got.createdAt());
  }

  @Test
  void tenantPredicateFiltersEveryOperation() {
    store.insert(row("db1", "tenant-a", DatabaseStatus.INACTIVE));
    store.insert(row("db2", "tenant-b", DatabaseStatus.ACTIVE));

    assertTrue(store.get("db1", "tenant-b").isEmpty());
    assertEquals(List.of("db1"), store.list("tenant-a").stream().map(DatabaseConfig::id).toList());
    assertEquals(2, store.list(null).size());
    assertEquals(List.of("db2"), store.listByStatus(DatabaseStatus.ACTIVE, null).stream().map(DatabaseConfig::id).toList());
    assertFalse(store.updateStatus("db1", DatabaseStatus.ERROR, "x", now, "tenant-b"));
    assertFalse(store.delete("db1", "tenant-b"));
    assertTrue(store.replace(row("db1", "tenant-a", DatabaseStatus.INACTIVE), false, "tenant-b").isEmpty());
    assertEquals(DatabaseStatus.INACTIVE, store.get("db1", null).orElseThrow().status());
  }

  @Test
  void duplicateIdIsAConflict() {
    store.insert(row("db1", null, DatabaseStatus.INACTIVE));
    assertThrows(ConflictException.class, () -> store.insert(row("db1", null, DatabaseStatus.INACTIVE)));
  }

  @Test
  void slugIsPerTenant() {
    store.insert(row("db1", "tenant-a", DatabaseStatus.INACTIVE));
    assertTrue(store.slugExists("db1", "tenant-a"));
    assertFalse(store.slugExists("db1", "tenant-b"));
    assertFalse(store.slugExists("db1", null));
  }

  @Test
  void governanceIsUpsertedAndDeletedWithRow() {
    store.insert(row("db1", null, DatabaseStatus.INACTIVE));
    store.saveGovernance("db1", GovernanceDocument.initial(), now);
    store.saveGovernance("db1", GovernanceDocument.initial()
        .withMemberOverride("users.email", MemberOverride.none().withPii(true)), now);

    assertTrue(store.findGovernance("db1").orElseThrow().resolve("users.email").pii());
    assertTrue(store.delete("db1", null));
    assertTrue(store.findGovernance("db1").isEmpty());
  }

  @Test
  void statusUpdateKeepsLastError() {
    store.insert(row("db1", null, DatabaseStatus.INACTIVE));
    assertTrue(store.updateStatus("db1", DatabaseStatus.ERROR, "Missing host", now, null));
    DatabaseConfig got = store.get("db1", null).orElseThrow();
    assertEquals(DatabaseStatus.ERROR, got.status());
    assertEquals("Missing host", got.lastError());
  }

  @Test
  void deleteLeavesActiveRowInPlace() {
    store.insert(row("db1", null, DatabaseStatus.ACTIVE));
    assertFalse(store.delete("db1", null));
    assertTrue(store.exists("db1", null));
  }

  @Test
  void replaceKeepsStoredStatusAndError() {
    store.insert(row("db1", null, DatabaseStatus.INACTIVE));
    store.updateStatus("db1", DatabaseStatus.ACTIVE, null, now, null);

    DatabaseConfig renamed = new DatabaseConfig("db1", "db1", null, "Renamed", null, DatabaseStatus.INACTIVE,
        Map.of("type", "postgres"), null, "secret", 500, List.of(), List.of(), false, "stale", now, now);
    DatabaseConfig stored = store.replace(renamed, false, null).orElseThrow();
    assertEquals("Renamed", stored.name());
    assertEquals(DatabaseStatus.ACTIVE, stored.status());
    assertNull(stored.lastError());

    assertTrue(store.replace(renamed, true, null).isEmpty());
    assertEquals("Renamed", store.get("db1", null).orElseThrow().name());
  }
}
