package io.intellixity.semgate.error;

import java.util.List;
import java.util.Map;

/** A member name that the catalog does not know. Suggestions are close fuzzy matches. */
public final class UnknownMemberException extends GatewayException {
  private final String member;

  public UnknownMemberException(String member, List<String> suggestions) {
    super(ErrorCode.UNKNOWN_MEMBER, "Unknown member: " + member, suggestions, Map.of("member", member), null);
    this.member = member;
  }

  public String member() { return member; }
}
