package io.intellixity.semgate.registry;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Global defaults the registry applies on create, and the template of the auto-created default database.
 */
public record RegistrySettings(String globalApiUrl,
                               String globalJwtSecret,
                               int maxLimit,
                               List<String> denyMembers,
                               List<String> defaultSegments,
                               boolean returnSql,
                               Map<String, Object> defaultConnection) {
  public RegistrySettings {
    Objects.requireNonNull(globalApiUrl, "globalApiUrl");
    Objects.requireNonNull(globalJwtSecret, "globalJwtSecret");
    denyMembers = denyMembers == null ? List.of() : List.copyOf(denyMembers);
    defaultSegments = defaultSegments == null ? List.of() : List.copyOf(defaultSegments);
    defaultConnection = defaultConnection == null ? Map.of() : Map.copyOf(defaultConnection);
  }

  @Override
  public String toString() {
    return "RegistrySettings[globalApiUrl=" + globalApiUrl + ", maxLimit=" + maxLimit + "]";
  }
}
