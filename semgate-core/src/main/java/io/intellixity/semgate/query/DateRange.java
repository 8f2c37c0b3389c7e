package io.intellixity.semgate.query;

/**
 * Either a relative expression ("last 7 days") or an absolute [from, to] pair.
 * Exactly one form is set.
 */
public record DateRange(String expression, String from, String to) {
  public DateRange {
    boolean relative = expression != null;
    boolean absolute = from != null || to != null;
    if (relative == absolute) throw new IllegalArgumentException("DateRange needs either an expression or a from/to pair");
    if (absolute && (from == null || to == null)) throw new IllegalArgumentException("DateRange needs both from and to");
  }

  public static DateRange relative(String expression) {
    return new DateRange(expression, null, null);
  }

  public static DateRange between(String from, String to) {
    return new DateRange(null, from, to);
  }

  public boolean isRelative() { return expression != null; }
}
