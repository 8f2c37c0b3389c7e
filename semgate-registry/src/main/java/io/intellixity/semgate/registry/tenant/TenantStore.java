package io.intellixity.semgate.registry.tenant;

import java.time.Instant;
import java.util.Optional;

public interface TenantStore {
  Optional<Tenant> findById(String id);

  Optional<Tenant> findBySlug(String slug);

  /** @throws io.intellixity.semgate.error.ConflictException if the id or the slug is taken */
  void insert(Tenant tenant);

  /**
   * False if the tenant does not exist.
   *
   * @throws io.intellixity.semgate.error.ConflictException {@code SLUG_TAKEN} if another tenant owns the slug
   */
  boolean updateSlug(String id, String slug, Instant at);
}
