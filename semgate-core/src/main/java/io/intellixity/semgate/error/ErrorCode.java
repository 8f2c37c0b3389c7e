package io.intellixity.semgate.error;

/** Stable, discriminated error codes surfaced to callers and audit records. */
public enum ErrorCode {
  MISSING_LIMIT(ErrorCategory.VALIDATION),
  LIMIT_EXCEEDED(ErrorCategory.VALIDATION),
  INVALID_LIMIT(ErrorCategory.VALIDATION),
  INVALID_OFFSET(ErrorCategory.VALIDATION),
  EMPTY_QUERY(ErrorCategory.VALIDATION),
  QUERY_KEY_NOT_ALLOWED(ErrorCategory.VALIDATION),
  GROUP_BY_NOT_ALLOWED(ErrorCategory.VALIDATION),
  GROUP_BY_DENIED(ErrorCategory.VALIDATION),
  TIME_DIMENSION_REQUIRED(ErrorCategory.VALIDATION),
  INVALID_TIME_DIMENSION(ErrorCategory.VALIDATION),
  INVALID_ARGUMENT(ErrorCategory.VALIDATION),
  INVALID_SLUG(ErrorCategory.VALIDATION),
  MANY_DIMENSIONS(ErrorCategory.VALIDATION),

  MEMBER_NOT_EXPOSED(ErrorCategory.GOVERNANCE),
  PII_MEMBER_BLOCKED(ErrorCategory.GOVERNANCE),
  MEMBER_DENIED(ErrorCategory.GOVERNANCE),

  UNKNOWN_MEMBER(ErrorCategory.NOT_FOUND),
  DATABASE_NOT_FOUND(ErrorCategory.NOT_FOUND),
  TENANT_NOT_FOUND(ErrorCategory.NOT_FOUND),

  DATABASE_EXISTS(ErrorCategory.CONFLICT),
  DATABASE_ACTIVE(ErrorCategory.CONFLICT),
  DEFAULT_DATABASE(ErrorCategory.CONFLICT),
  SLUG_TAKEN(ErrorCategory.CONFLICT),
  TENANT_EXISTS(ErrorCategory.CONFLICT),
  CONNECTION_INVALID(ErrorCategory.CONFLICT),

  CUBE_ERROR(ErrorCategory.UPSTREAM),
  UPSTREAM_TIMEOUT(ErrorCategory.UPSTREAM),

  CONFIG_ERROR(ErrorCategory.CONFIGURATION),

  CATALOG_NOT_INITIALIZED(ErrorCategory.NOT_READY),
  DATABASE_NOT_ACTIVE(ErrorCategory.NOT_READY),

  INTERNAL_ERROR(ErrorCategory.INTERNAL);

  private final ErrorCategory category;

  ErrorCode(ErrorCategory category) {
    this.category = category;
  }

  public ErrorCategory category() { return category; }
}
