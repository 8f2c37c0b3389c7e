package io.intellixity.semgate.registry.tenant;

import io.intellixity.semgate.error.ConflictException;
import io.intellixity.semgate.error.ErrorCode;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public final class InMemoryTenantStore implements TenantStore {
  private final Map<String, Tenant> byId = new HashMap<>();

  @Override
  public synchronized Optional<Tenant> findById(String id) {
    return Optional.ofNullable(byId.get(id));
  }

  @Override
  public synchronized Optional<Tenant> findBySlug(String slug) {
    return byId.values().stream().filter(t -> t.slug().equals(slug)).findFirst();
  }

  @Override
  public synchronized void insert(Tenant tenant) {
    if (byId.containsKey(tenant.id())) {
      throw new ConflictException(ErrorCode.TENANT_EXISTS, "Tenant '" + tenant.id() + "' already exists");
    }
    if (findBySlug(tenant.slug()).isPresent()) {
      throw new ConflictException(ErrorCode.SLUG_TAKEN, "Slug '" + tenant.slug() + "' is already taken");
    }
    byId.put(tenant.id(), tenant);
  }

  @Override
  public synchronized boolean updateSlug(String id, String slug, Instant at) {
    Tenant cur = byId.get(id);
    if (cur == null) return false;
    Optional<Tenant> owner = findBySlug(slug);
    if (owner.isPresent() && !owner.get().id().equals(id)) {
      throw new ConflictException(ErrorCode.SLUG_TAKEN, "Slug '" + slug + "' is already taken");
    }
    byId.put(id, cur.withSlug(slug, at));
    return true;
  }
}
