package io.intellixity.semgate.error;

/** A component is not initialized (or a database not active) yet. Retryable. */
public final class NotReadyException extends GatewayException {
  public NotReadyException(ErrorCode code, String message) {
    super(code, message);
  }

  public static NotReadyException catalog(String databaseId) {
    return new NotReadyException(ErrorCode.CATALOG_NOT_INITIALIZED,
        databaseId == null ? "Catalog not initialized" : "Catalog not initialized for database '" + databaseId + "'");
  }

  public static NotReadyException inactive(String databaseId) {
    return new NotReadyException(ErrorCode.DATABASE_NOT_ACTIVE, "Database '" + databaseId + "' is not active");
  }
}
