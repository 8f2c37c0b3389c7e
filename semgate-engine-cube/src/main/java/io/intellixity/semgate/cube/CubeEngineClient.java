package io.intellixity.semgate.cube;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.semgate.error.UpstreamException;
import io.intellixity.semgate.error.UpstreamTimeoutException;
import io.intellixity.semgate.query.SemanticQuery;
import io.intellixity.semgate.spi.EngineEndpoint;
import io.intellixity.semgate.spi.LoadResponse;
import io.intellixity.semgate.spi.SemanticEngineClient;
import io.intellixity.semgate.spi.SqlPreview;
import io.intellixity.semgate.spi.meta.EngineMeta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * HTTP client of a Cube-compatible REST API for one database.
 * <p>
 * Every request carries a freshly signed bearer token. Metadata and SQL preview use the metadata timeout; load
 * uses the query timeout and re-polls while the engine answers "Continue wait".
 */
public final class CubeEngineClient implements SemanticEngineClient {
  private static final Logger log = LoggerFactory.getLogger(CubeEngineClient.class);

  private final EngineEndpoint endpoint;
  private final CubeClientSettings settings;
  private final CubeTokens tokens;
  private final ObjectMapper json;
  private final RestTemplate metaRest;
  private final Function<Duration, RestTemplate> queryRest;
  private final Clock clock;

  public CubeEngineClient(EngineEndpoint endpoint, CubeClientSettings settings, ObjectMapper json, Clock clock) {
    this(endpoint, settings, json, clock, restTemplate(settings.metaTimeout()), perTimeout());
  }

  CubeEngineClient(EngineEndpoint endpoint,
                   CubeClientSettings settings,
                   ObjectMapper json,
                   Clock clock,
                   RestTemplate metaRest,
                   RestTemplate queryRest) {
    this(endpoint, settings, json, clock, metaRest, fixed(queryRest));
  }

  private CubeEngineClient(EngineEndpoint endpoint,
                           CubeClientSettings settings,
                           ObjectMapper json,
                           Clock clock,
                           RestTemplate metaRest,
                           Function<Duration, RestTemplate> queryRest) {
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.json = Objects.requireNonNull(json, "json");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metaRest = Objects.requireNonNull(metaRest, "metaRest");
    this.queryRest = Objects.requireNonNull(queryRest, "queryRest");
    this.tokens = new CubeTokens(endpoint.jwtSecret(), settings.jwtTtl(), clock);
  }

  public EngineEndpoint endpoint() { return endpoint; }

  @Override
  public EngineMeta meta() {
    log.debug("Fetching engine metadata for {}", endpoint.databaseId());
    String body = get(metaRest, uri("/meta", null), "meta", settings.metaTimeout());
    return read(body, EngineMeta.class);
  }

  @Override
  public LoadResponse load(SemanticQuery query) {
    URI uri = uri("/load", query);
    Duration timeout = settings.queryTimeout(query.limit());
    RestTemplate rest = queryRest.apply(timeout);
    Instant deadline = clock.instant().plus(timeout);
    log.debug("Executing engine query for {} (timeout {})", endpoint.databaseId(), timeout);
    while (true) {
      LoadResponse r = read(get(rest, uri, "load", timeout), LoadResponse.class);
      if (!r.isContinueWait()) return r;
      if (!clock.instant().isBefore(deadline)) throw new UpstreamTimeoutException("load", timeout, null);
      pause(timeout);
    }
  }

  @Override
  public SqlPreview sql(SemanticQuery query) {
    String body = get(metaRest, uri("/sql", query), "sql", settings.metaTimeout());
    JsonNode root = read(body, JsonNode.class);
    JsonNode sql = root.path("sql");
    JsonNode text = sql.path("sql");

    List<Object> params = new ArrayList<>();
    String rendered;
    if (text.isTextual()) {
      rendered = text.asText();
    } else if (text.isArray() && text.size() == 2 && text.get(0).isTextual() && text.get(1).isArray()) {
      // [statement, params]
      rendered = text.get(0).asText();
      text.get(1).forEach(p -> params.add(json.convertValue(p, Object.class)));
    } else if (text.isArray()) {
      List<String> lines = new ArrayList<>();
      text.forEach(x -> lines.add(x.asText()));
      rendered = String.join("\n", lines);
    } else {
      throw new UpstreamException("Engine SQL response has no sql text", 200, body, null);
    }
    sql.path("params").forEach(p -> params.add(json.convertValue(p, Object.class)));
    return new SqlPreview(rendered, params);
  }

  private URI uri(String path, SemanticQuery query) {
    UriComponentsBuilder b = UriComponentsBuilder.fromUriString(endpoint.apiUrl() + path);
    if (query == null) return b.build().toUri();
    return b.queryParam("query", "{query}").encode().buildAndExpand(write(query)).toUri();
  }

  private String get(RestTemplate rest, URI uri, String operation, Duration timeout) {
    HttpHeaders headers = new HttpHeaders();
    headers.setBearerAuth(tokens.issue(endpoint.databaseId()));
    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
    try {
      ResponseEntity<String> r = rest.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), String.class);
      return r.getBody() == null ? "{}" : r.getBody();
    } catch (HttpStatusCodeException e) {
      String body = e.getResponseBodyAsString();
      int status = e.getStatusCode().value();
      log.error("Engine {} failed for {}: HTTP {} {}", operation, endpoint.databaseId(), status, body);
      throw new UpstreamException(errorMessage(body, status), status, body, e);
    } catch (ResourceAccessException e) {
      if (e.getCause() instanceof SocketTimeoutException) {
        throw new UpstreamTimeoutException(operation, timeout, e);
      }
      throw new UpstreamException("Semantic engine unreachable: " + e.getMessage(), 0, null, e);
    }
  }

  private String errorMessage(String body, int status) {
    if (body != null && !body.isBlank()) {
      try {
        JsonNode n = json.readTree(body);
        if (n.hasNonNull("error")) return n.get("error").asText();
      } catch (JsonProcessingException e) {
        log.debug("Engine error body is not JSON", e);
      }
    }
    return "HTTP " + status;
  }

  private <T> T read(String body, Class<T> type) {
    try {
      return json.readValue(body, type);
    } catch (JsonProcessingException e) {
      throw new UpstreamException("Invalid response from semantic engine: " + e.getOriginalMessage(), 200, body, e);
    }
  }

  private String write(SemanticQuery query) {
    try {
      return json.writeValueAsString(query);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize query", e);
    }
  }

  private void pause(Duration timeout) {
    long millis = settings.continueWaitInterval().toMillis();
    if (millis <= 0) return;
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new UpstreamTimeoutException("load", timeout, e);
    }
  }

  private static Function<Duration, RestTemplate> fixed(RestTemplate rest) {
    Objects.requireNonNull(rest, "queryRest");
    return timeout -> rest;
  }

  /** One template per whole-second timeout, shared by the client's queries. */
  private static Function<Duration, RestTemplate> perTimeout() {
    ConcurrentMap<Long, RestTemplate> templates = new ConcurrentHashMap<>();
    return timeout -> {
      long seconds = (timeout.toMillis() + 999) / 1000;
      return templates.computeIfAbsent(seconds, s -> restTemplate(Duration.ofSeconds(s)));
    };
  }

  static RestTemplate restTemplate(Duration readTimeout) {
    SimpleClientHttpRequestFactory f = new SimpleClientHttpRequestFactory();
    f.setConnectTimeout((int) Math.min(readTimeout.toMillis(), Integer.MAX_VALUE));
    f.setReadTimeout((int) Math.min(readTimeout.toMillis(), Integer.MAX_VALUE));
    return new RestTemplate(f);
  }
}
