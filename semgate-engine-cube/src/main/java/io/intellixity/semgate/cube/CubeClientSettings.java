package io.intellixity.semgate.cube;

import java.time.Duration;
import java.util.Objects;

/**
 * Transport settings shared by every Cube client.
 * <p>
 * Query read timeout grows with the query's row limit: {@code base + perRow * limit}, capped at {@code max}.
 * A query without a limit is sized for {@code maxLimit}.
 * A zero {@code continueWaitInterval} re-polls immediately.
 */
public record CubeClientSettings(Duration jwtTtl,
                                 Duration metaTimeout,
                                 Duration queryTimeoutBase,
                                 Duration queryTimeoutPerRow,
                                 Duration queryTimeoutMax,
                                 int maxLimit,
                                 Duration continueWaitInterval) {
  public CubeClientSettings {
    Objects.requireNonNull(jwtTtl, "jwtTtl");
    Objects.requireNonNull(metaTimeout, "metaTimeout");
    Objects.requireNonNull(queryTimeoutBase, "queryTimeoutBase");
    Objects.requireNonNull(queryTimeoutPerRow, "queryTimeoutPerRow");
    Objects.requireNonNull(queryTimeoutMax, "queryTimeoutMax");
    Objects.requireNonNull(continueWaitInterval, "continueWaitInterval");
    if (jwtTtl.isNegative() || jwtTtl.isZero()) throw new IllegalArgumentException("jwtTtl must be positive");
    if (maxLimit <= 0) throw new IllegalArgumentException("maxLimit must be positive");
  }

  public static CubeClientSettings defaults() {
    return new CubeClientSettings(Duration.ofHours(1), Duration.ofSeconds(10), Duration.ofSeconds(10),
        Duration.ofMillis(5), Duration.ofSeconds(120), 1000, Duration.ofMillis(500));
  }

  public CubeClientSettings withMaxLimit(int v) {
    return new CubeClientSettings(jwtTtl, metaTimeout, queryTimeoutBase, queryTimeoutPerRow, queryTimeoutMax, v, continueWaitInterval);
  }

  public CubeClientSettings withContinueWaitInterval(Duration v) {
    return new CubeClientSettings(jwtTtl, metaTimeout, queryTimeoutBase, queryTimeoutPerRow, queryTimeoutMax, maxLimit, v);
  }

  public CubeClientSettings withQueryTimeoutMax(Duration v) {
    return new CubeClientSettings(jwtTtl, metaTimeout, queryTimeoutBase, queryTimeoutPerRow, v, maxLimit, continueWaitInterval);
  }

  public Duration queryTimeout(Integer limit) {
    long rows = limit == null || limit <= 0 ? maxLimit : limit;
    Duration proportional = queryTimeoutBase.plus(queryTimeoutPerRow.multipliedBy(rows));
    return proportional.compareTo(queryTimeoutMax) > 0 ? queryTimeoutMax : proportional;
  }
}
