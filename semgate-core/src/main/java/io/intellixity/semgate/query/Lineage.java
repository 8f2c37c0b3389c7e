package io.intellixity.semgate.query;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Which cubes and members a query touched, first-occurrence order, no duplicates. */
public record Lineage(List<String> cubes, List<String> members) {
  public Lineage {
    cubes = List.copyOf(cubes);
    members = List.copyOf(members);
  }

  public static Lineage of(SemanticQuery query) {
    Set<String> members = query.referencedMembers();
    Set<String> cubes = new LinkedHashSet<>();
    for (String m : members) cubes.add(cubeOf(m));
    return new Lineage(List.copyOf(cubes), List.copyOf(members));
  }

  /** Cube name of a qualified member: the text before the first dot. */
  public static String cubeOf(String member) {
    int dot = member.indexOf('.');
    return dot < 0 ? member : member.substring(0, dot);
  }
}
