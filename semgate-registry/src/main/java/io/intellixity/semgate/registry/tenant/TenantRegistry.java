package io.intellixity.semgate.registry.tenant;

import io.intellixity.semgate.error.ConflictException;
import io.intellixity.semgate.error.ErrorCode;
import io.intellixity.semgate.error.InvalidRequestException;
import io.intellixity.semgate.error.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

public final class TenantRegistry {
  private static final Logger log = LoggerFactory.getLogger(TenantRegistry.class);

  private final TenantStore store;
  private final Clock clock;

  public TenantRegistry(TenantStore store, Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** Returns the tenant with this external id, creating it with a derived unique slug on first sight. */
  public Tenant ensureTenant(String externalId, String name) {
    Objects.requireNonNull(externalId, "externalId");
    Optional<Tenant> existing = store.findById(externalId);
    if (existing.isPresent()) return existing.get();

    String slug = TenantSlugs.generateUnique(externalId, s -> store.findBySlug(s).isPresent());
    Instant now = clock.instant();
    Tenant tenant = new Tenant(externalId, slug, name, now, now);
    try {
      store.insert(tenant);
    } catch (ConflictException e) {
      // another request registered the same tenant first
      return store.findById(externalId).orElseThrow(() -> e);
    }
    log.info("Registered tenant {} as {}", externalId, slug);
    return tenant;
  }

  public Tenant getById(String id) {
    return store.findById(id).orElseThrow(() -> ResourceNotFoundException.tenant(id));
  }

  public Optional<Tenant> findBySlug(String slug) {
    return store.findBySlug(slug);
  }

  /**
   * Changes a tenant's slug. Setting the current slug is a no-op.
   *
   * @throws InvalidRequestException {@code INVALID_SLUG} for a malformed slug
   * @throws ConflictException       {@code SLUG_TAKEN} if another tenant owns it
   */
  public Tenant updateSlug(String id, String slug) {
    if (!TenantSlugs.isValid(slug)) {
      throw new InvalidRequestException(ErrorCode.INVALID_SLUG,
          "Slug must be 3-48 characters, lowercase, start with a letter, and contain only letters, digits or '-'");
    }
    Tenant cur = getById(id);
    if (cur.slug().equals(slug)) return cur;
    Optional<Tenant> owner = store.findBySlug(slug);
    if (owner.isPresent() && !owner.get().id().equals(id)) {
      throw new ConflictException(ErrorCode.SLUG_TAKEN, "Slug '" + slug + "' is already taken");
    }
    Instant now = clock.instant();
    if (!store.updateSlug(id, slug, now)) throw ResourceNotFoundException.tenant(id);
    return cur.withSlug(slug, now);
  }
}
