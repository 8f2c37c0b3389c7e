package io.intellixity.semgate.spi;

/** Builds an engine client for a database endpoint. */
@FunctionalInterface
public interface SemanticEngineClientFactory {
  SemanticEngineClient create(EngineEndpoint endpoint);
}
