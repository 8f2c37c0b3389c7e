package io.intellixity.semgate.error;

public final class ResourceNotFoundException extends GatewayException {
  public ResourceNotFoundException(ErrorCode code, String message) {
    super(code, message);
  }

  public static ResourceNotFoundException database(String id) {
    return new ResourceNotFoundException(ErrorCode.DATABASE_NOT_FOUND, "Database '" + id + "' not found");
  }

  public static ResourceNotFoundException tenant(String id) {
    return new ResourceNotFoundException(ErrorCode.TENANT_NOT_FOUND, "Tenant '" + id + "' not found");
  }
}
