package io.intellixity.semgate.registry.tenant;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class TenantSlugsTest {
  @Test
  void validation() {
    assertTrue(TenantSlugs.isValid("acme"));
    assertTrue(TenantSlugs.isValid("acme-co-2"));
    assertFalse(TenantSlugs.isValid("ac"));
    assertFalse(TenantSlugs.isValid("2acme"));
    assertFalse(TenantSlugs.isValid("Acme"));
    assertFalse(TenantSlugs.isValid("a".repeat(49)));
    assertFalse(TenantSlugs.isValid(null));
  }

  @Test
  void generatesFromExternalId() {
    assertEquals("org-abc123", TenantSlugs.generate("org_ABC123"));
    assertEquals("org-42", TenantSlugs.generate("42"));
    assertEquals("a-b", TenantSlugs.generate("__a__b__"));
    assertEquals(48, TenantSlugs.generate("x".repeat(80)).length());
  }

  @Test
  void suffixesOnCollision() {
    Set<String> taken = Set.of("org-acme", "org-acme-2");
    assertEquals("org-acme-3", TenantSlugs.generateUnique("org_acme", taken::contains));
  }

  @Test
  void suffixBaseIsTruncated() {
    String base = TenantSlugs.generate("y".repeat(60));
    String unique = TenantSlugs.generateUnique("y".repeat(60), s -> s.equals(base));
    assertEquals("y".repeat(44) + "-2", unique);
  }
}
