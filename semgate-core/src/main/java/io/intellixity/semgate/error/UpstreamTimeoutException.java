package io.intellixity.semgate.error;

import java.time.Duration;

public final class UpstreamTimeoutException extends UpstreamException {
  public UpstreamTimeoutException(String operation, Duration timeout, Throwable cause) {
    super(ErrorCode.UPSTREAM_TIMEOUT, "Semantic engine " + operation + " timed out after " + timeout.toMillis() + "ms", 0, null, cause);
  }
}
