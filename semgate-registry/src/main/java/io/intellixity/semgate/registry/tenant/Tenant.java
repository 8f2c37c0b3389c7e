package io.intellixity.semgate.registry.tenant;

import java.time.Instant;
import java.util.Objects;

/** A tenant; {@code id} is the external identity's organization id, {@code slug} is globally unique. */
public record Tenant(String id, String slug, String name, Instant createdAt, Instant updatedAt) {
  public Tenant {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(slug, "slug");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(updatedAt, "updatedAt");
  }

  public Tenant withSlug(String s, Instant at) {
    return new Tenant(id, s, name, createdAt, at);
  }
}
