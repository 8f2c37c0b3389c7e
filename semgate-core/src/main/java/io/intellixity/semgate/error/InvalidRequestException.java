package io.intellixity.semgate.error;

import java.util.List;

public final class InvalidRequestException extends GatewayException {
  public InvalidRequestException(ErrorCode code, String message) {
    super(code, message);
  }

  public InvalidRequestException(ErrorCode code, String message, List<String> suggestions) {
    super(code, message, suggestions, null, null);
  }
}
