package io.intellixity.semgate.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The remote semantic engine failed.
 * <p>
 * {@link #upstreamBody()} is the engine's error body as received, never rewritten.
 */
public class UpstreamException extends GatewayException {
  private final int status;
  private final String upstreamBody;

  public UpstreamException(String message, int status, String upstreamBody, Throwable cause) {
    this(ErrorCode.CUBE_ERROR, message, status, upstreamBody, cause);
  }

  protected UpstreamException(ErrorCode code, String message, int status, String upstreamBody, Throwable cause) {
    super(code, message, null, details(status, upstreamBody), cause);
    this.status = status;
    this.upstreamBody = upstreamBody;
  }

  /** HTTP status of the failed call, or 0 when no response was received. */
  public int status() { return status; }
  public String upstreamBody() { return upstreamBody; }

  private static Map<String, Object> details(int status, String body) {
    Map<String, Object> m = new LinkedHashMap<>();
    if (status > 0) m.put("status", status);
    if (body != null && !body.isBlank()) m.put("upstream", body);
    return m;
  }
}
