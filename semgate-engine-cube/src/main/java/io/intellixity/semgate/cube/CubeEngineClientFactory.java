package io.intellixity.semgate.cube;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.semgate.spi.EngineEndpoint;
import io.intellixity.semgate.spi.SemanticEngineClient;
import io.intellixity.semgate.spi.SemanticEngineClientFactory;

import java.time.Clock;
import java.util.Objects;

public final class CubeEngineClientFactory implements SemanticEngineClientFactory {
  private final CubeClientSettings settings;
  private final ObjectMapper json;
  private final Clock clock;

  public CubeEngineClientFactory(CubeClientSettings settings, ObjectMapper json, Clock clock) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.json = Objects.requireNonNull(json, "json");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public SemanticEngineClient create(EngineEndpoint endpoint) {
    return new CubeEngineClient(endpoint, settings, json, clock);
  }
}
