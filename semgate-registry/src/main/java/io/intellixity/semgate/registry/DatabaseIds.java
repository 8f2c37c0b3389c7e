package io.intellixity.semgate.registry;

import io.intellixity.semgate.util.Digests;

import java.util.Objects;

/**
 * Storage identifiers for databases.
 * <p>
 * In multi-tenant mode the storage id is {@code slug-hash8} where {@code hash8} is the first 8 hex characters of
 * SHA-256 over {@code slug + '\0' + tenantId}. Without a tenant the slug is the id.
 */
public final class DatabaseIds {
  public static final String DEFAULT_SLUG = "default";

  private DatabaseIds() {}

  public static String scope(String slug, String tenantId) {
    Objects.requireNonNull(slug, "slug");
    if (tenantId == null || tenantId.isEmpty()) return slug;
    return slug + "-" + hash8(slug, tenantId);
  }

  public static String hash8(String slug, String tenantId) {
    return Digests.sha256Prefix(slug + '\u0000' + tenantId, 8);
  }

  public static String defaultDatabaseId(String tenantId) {
    return scope(DEFAULT_SLUG, tenantId);
  }
}
