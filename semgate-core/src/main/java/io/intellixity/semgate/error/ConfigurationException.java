package io.intellixity.semgate.error;

/** Malformed environment settings or governance document. */
public final class ConfigurationException extends GatewayException {
  public ConfigurationException(String message) {
    super(ErrorCode.CONFIG_ERROR, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(ErrorCode.CONFIG_ERROR, message, null, null, cause);
  }
}
