package io.intellixity.semgate.query;

import java.util.Objects;

/** A time dimension reference with optional bucketing granularity and date range. */
public record TimeDimension(String dimension, String granularity, DateRange dateRange) {
  public TimeDimension {
    Objects.requireNonNull(dimension, "dimension");
    granularity = (granularity == null || granularity.isBlank()) ? null : granularity;
  }

  public static TimeDimension of(String dimension) {
    return new TimeDimension(dimension, null, null);
  }

  public static TimeDimension of(String dimension, String granularity) {
    return new TimeDimension(dimension, granularity, null);
  }
}
