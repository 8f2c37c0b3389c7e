package io.intellixity.semgate.spi;

import io.intellixity.semgate.error.GatewayException;
import io.intellixity.semgate.query.SemanticQuery;
import io.intellixity.semgate.spi.meta.EngineMeta;

/**
 * Client of one semantic engine deployment, bound to one database.
 * <p>
 * Implementations translate transport failures into {@link io.intellixity.semgate.error.UpstreamException}
 * (engine error body preserved) or {@link io.intellixity.semgate.error.UpstreamTimeoutException}.
 */
public interface SemanticEngineClient {
  /** Cube/member metadata. */
  EngineMeta meta();

  /** Executes the query and returns rows plus column annotation. */
  LoadResponse load(SemanticQuery query);

  /** SQL the engine would run for the query. */
  SqlPreview sql(SemanticQuery query);

  /** True if metadata can be fetched. */
  default boolean healthCheck() {
    try {
      meta();
      return true;
    } catch (GatewayException e) {
      return false;
    }
  }
}
