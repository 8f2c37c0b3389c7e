package io.intellixity.semgate.registry;

import java.util.List;
import java.util.Map;

/** Partial update; null fields are left unchanged. A {@code cubeApiUrl} equal to the global URL clears the override. */
public record DatabasePatch(String name,
                            String description,
                            Map<String, Object> connection,
                            String cubeApiUrl,
                            String jwtSecret,
                            Integer maxLimit,
                            List<String> denyMembers,
                            List<String> defaultSegments,
                            Boolean returnSql) {

  public static DatabasePatch empty() {
    return new DatabasePatch(null, null, null, null, null, null, null, null, null);
  }

  public DatabasePatch withName(String v) { return new DatabasePatch(v, description, connection, cubeApiUrl, jwtSecret, maxLimit, denyMembers, defaultSegments, returnSql); }
  public DatabasePatch withDescription(String v) { return new DatabasePatch(name, v, connection, cubeApiUrl, jwtSecret, maxLimit, denyMembers, defaultSegments, returnSql); }
  public DatabasePatch withConnection(Map<String, Object> v) { return new DatabasePatch(name, description, v, cubeApiUrl, jwtSecret, maxLimit, denyMembers, defaultSegments, returnSql); }
  public DatabasePatch withCubeApiUrl(String v) { return new DatabasePatch(name, description, connection, v, jwtSecret, maxLimit, denyMembers, defaultSegments, returnSql); }
  public DatabasePatch withMaxLimit(Integer v) { return new DatabasePatch(name, description, connection, cubeApiUrl, jwtSecret, v, denyMembers, defaultSegments, returnSql); }
  public DatabasePatch withDenyMembers(List<String> v) { return new DatabasePatch(name, description, connection, cubeApiUrl, jwtSecret, maxLimit, v, defaultSegments, returnSql); }
  public DatabasePatch withReturnSql(Boolean v) { return new DatabasePatch(name, description, connection, cubeApiUrl, jwtSecret, maxLimit, denyMembers, defaultSegments, v); }
}
