package io.intellixity.semgate.governance.handler;

import io.intellixity.semgate.registry.DatabaseConfig;

/** Builds an uninitialized handler for a database. */
@FunctionalInterface
public interface DatabaseHandlerFactory {
  DatabaseHandler create(DatabaseConfig database);
}
