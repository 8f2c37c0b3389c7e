package io.intellixity.semgate.spi;

import java.util.Objects;

/**
 * Where and how to reach the engine for one database.
 * {@code jwtSecret} signs the per-request token; {@code databaseId} is carried in it for engine-side routing.
 */
public record EngineEndpoint(String databaseId, String apiUrl, String jwtSecret) {
  public EngineEndpoint {
    Objects.requireNonNull(databaseId, "databaseId");
    Objects.requireNonNull(apiUrl, "apiUrl");
    Objects.requireNonNull(jwtSecret, "jwtSecret");
    if (apiUrl.endsWith("/")) apiUrl = apiUrl.substring(0, apiUrl.length() - 1);
  }

  @Override
  public String toString() {
    return "EngineEndpoint[databaseId=" + databaseId + ", apiUrl=" + apiUrl + "]";
  }
}
