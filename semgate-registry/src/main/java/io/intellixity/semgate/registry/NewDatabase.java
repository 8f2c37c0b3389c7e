package io.intellixity.semgate.registry;

import java.util.List;
import java.util.Map;

/**
 * Creation request. {@code id} is the caller's identifier before tenant scoping; {@code slug} defaults to it.
 * Null optional fields take registry defaults.
 */
public record NewDatabase(String id,
                          String slug,
                          String name,
                          String description,
                          Map<String, Object> connection,
                          String cubeApiUrl,
                          String jwtSecret,
                          Integer maxLimit,
                          List<String> denyMembers,
                          List<String> defaultSegments,
                          Boolean returnSql) {

  public static NewDatabase of(String id, String name, Map<String, Object> connection) {
    return new NewDatabase(id, null, name, null, connection, null, null, null, null, null, null);
  }

  public NewDatabase withJwtSecret(String v) {
    return new NewDatabase(id, slug, name, description, connection, cubeApiUrl, v, maxLimit, denyMembers, defaultSegments, returnSql);
  }

  public NewDatabase withCubeApiUrl(String v) {
    return new NewDatabase(id, slug, name, description, connection, v, jwtSecret, maxLimit, denyMembers, defaultSegments, returnSql);
  }

  public NewDatabase withSlug(String v) {
    return new NewDatabase(id, v, name, description, connection, cubeApiUrl, jwtSecret, maxLimit, denyMembers, defaultSegments, returnSql);
  }

  public NewDatabase withPolicy(Integer maxLimit, List<String> denyMembers, List<String> defaultSegments, Boolean returnSql) {
    return new NewDatabase(id, slug, name, description, connection, cubeApiUrl, jwtSecret, maxLimit, denyMembers, defaultSegments, returnSql);
  }
}
