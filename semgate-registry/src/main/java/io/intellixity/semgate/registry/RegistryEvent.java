package io.intellixity.semgate.registry;

import java.util.Objects;

/** A registry write. {@code database} is the row after the write, or null for deletions and governance edits. */
public record RegistryEvent(Type type, String databaseId, String tenantId, DatabaseConfig database) {
  public enum Type { CREATED, UPDATED, DELETED, ACTIVATED, DEACTIVATED, GOVERNANCE_UPDATED }

  public RegistryEvent {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(databaseId, "databaseId");
  }

  /** True if a component built from the previous state of this database must be discarded. */
  public boolean invalidates() {
    return type == Type.UPDATED || type == Type.DELETED || type == Type.DEACTIVATED || type == Type.GOVERNANCE_UPDATED;
  }
}
