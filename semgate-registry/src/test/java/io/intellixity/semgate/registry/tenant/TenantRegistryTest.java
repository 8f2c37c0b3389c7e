package io.intellixity.semgate.registry.tenant;

import io.intellixity.semgate.error.ConflictException;
import io.intellixity.semgate.error.ErrorCode;
import io.intellixity.semgate.error.InvalidRequestException;
import io.intellixity.semgate.error.ResourceNotFoundException;
import io.intellixity.semgate.registry.store.RegistrySchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.time.Clock;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class TenantRegistryTest {
  private TenantRegistry tenants;

  @BeforeEach
  void setUp() {
    DriverManagerDataSource ds = new DriverManagerDataSource(
        "jdbc:h2:mem:tenants-" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1", "sa", "");
    RegistrySchema.apply(ds);
    tenants = new TenantRegistry(new JdbcTenantStore(new JdbcTemplate(ds)), Clock.systemUTC());
  }

  @Test
  void ensureTenantIsIdempotent() {
    Tenant first = tenants.ensureTenant("org_Acme", "Acme");
    Tenant again = tenants.ensureTenant("org_Acme", "Other name");
    assertEquals("org-acme", first.slug());
    assertEquals(first.slug(), again.slug());
    assertEquals("Acme", again.name());
  }

  @Test
  void derivedSlugsAreDeduplicated() {
    tenants.ensureTenant("org_acme", null);
    Tenant second = tenants.ensureTenant("org-acme", null);
    assertEquals("org-acme-2", second.slug());
  }

  @Test
  void slugUpdateRules() {
    Tenant a = tenants.ensureTenant("org_a", null);
    Tenant b = tenants.ensureTenant("org_b", null);

    InvalidRequestException bad = assertThrows(InvalidRequestException.class, () -> tenants.updateSlug(a.id(), "No"));
    assertEquals(ErrorCode.INVALID_SLUG, bad.code());

    ConflictException taken = assertThrows(ConflictException.class, () -> tenants.updateSlug(a.id(), b.slug()));
    assertEquals(ErrorCode.SLUG_TAKEN, taken.code());

    assertEquals(a.slug(), tenants.updateSlug(a.id(), a.slug()).slug());
    assertEquals("acme-analytics", tenants.updateSlug(a.id(), "acme-analytics").slug());
    assertEquals(a.id(), tenants.findBySlug("acme-analytics").orElseThrow().id());
  }

  @Test
  void unknownTenant() {
    ResourceNotFoundException e = assertThrows(ResourceNotFoundException.class, () -> tenants.getById("nobody"));
    assertEquals(ErrorCode.TENANT_NOT_FOUND, e.code());
    assertThrows(ResourceNotFoundException.class, () -> tenants.updateSlug("nobody", "valid-slug"));
  }
}
