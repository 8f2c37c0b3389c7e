package io.intellixity.semgate.member;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Engine-side attributes of a member, as published by the semantic engine's metadata.
 * Carries no governance.
 */
public record MemberDefinition(String name,
                               MemberKind kind,
                               String cubeName,
                               String title,
                               String shortTitle,
                               String description,
                               String memberType,
                               boolean visible,
                               boolean isPublic,
                               String aggType,
                               String format,
                               boolean primaryKey,
                               List<String> drillMembers,
                               List<Granularity> granularities,
                               Map<String, Object> meta) {
  public MemberDefinition {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(cubeName, "cubeName");
    drillMembers = drillMembers == null ? List.of() : List.copyOf(drillMembers);
    granularities = granularities == null ? List.of() : List.copyOf(granularities);
    meta = meta == null ? Map.of() : meta;
  }

  /** Minimal definition, mostly for tests and synthetic members. */
  public static MemberDefinition of(String name, MemberKind kind, String memberType) {
    int dot = name.indexOf('.');
    String cube = dot < 0 ? name : name.substring(0, dot);
    return new MemberDefinition(name, kind, cube, null, null, null, memberType, true, true,
        null, null, false, List.of(), List.of(), Map.of());
  }
}
