package io.intellixity.semgate.error;

import java.util.Map;

/** The request is well-formed but conflicts with the current state (e.g. deleting an active database). */
public final class ConflictException extends GatewayException {
  public ConflictException(ErrorCode code, String message) {
    super(code, message);
  }

  public ConflictException(ErrorCode code, String message, Map<String, ?> details) {
    super(code, message, null, details, null);
  }
}
