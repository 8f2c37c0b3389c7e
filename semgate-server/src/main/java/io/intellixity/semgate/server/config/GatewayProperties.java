package io.intellixity.semgate.server.config;

import io.intellixity.semgate.cube.CubeClientSettings;
import io.intellixity.semgate.error.ConfigurationException;
import io.intellixity.semgate.governance.handler.HandlerCacheSettings;
import io.intellixity.semgate.registry.RegistrySettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "semgate")
public class GatewayProperties {
  static final int MIN_SECRET_LENGTH = 32;

  private final Cube cube = new Cube();
  private final Policy policy = new Policy();
  private final Registry registry = new Registry();
  private final Cache cache = new Cache();

  public Cube getCube() { return cube; }
  public Policy getPolicy() { return policy; }
  public Registry getRegistry() { return registry; }
  public Cache getCache() { return cache; }

  /**
   * Global registry defaults.
   *
   * @throws ConfigurationException for a missing or short JWT secret, a malformed API URL or a non-positive max limit
   */
  public RegistrySettings toRegistrySettings() {
    String secret = cube.getJwtSecret();
    if (secret == null || secret.isBlank()) {
      throw new ConfigurationException("semgate.cube.jwt-secret is required");
    }
    if (secret.length() < MIN_SECRET_LENGTH) {
      throw new ConfigurationException("semgate.cube.jwt-secret must be at least " + MIN_SECRET_LENGTH + " characters");
    }
    requireHttpUrl(cube.getApiUrl());
    if (policy.getMaxLimit() <= 0) {
      throw new ConfigurationException("semgate.policy.max-limit must be positive, got " + policy.getMaxLimit());
    }
    return new RegistrySettings(cube.getApiUrl(), secret, policy.getMaxLimit(), policy.getDenyMembers(),
        policy.getDefaultSegments(), policy.isReturnSql(), registry.getDefaultConnection());
  }

  public CubeClientSettings toCubeClientSettings() {
    return new CubeClientSettings(cube.getJwtTtl(), cube.getMetaTimeout(), cube.getQueryTimeoutBase(),
        cube.getQueryTimeoutPerRow(), cube.getQueryTimeoutMax(), policy.getMaxLimit(), cube.getContinueWaitInterval());
  }

  public HandlerCacheSettings toHandlerCacheSettings() {
    return new HandlerCacheSettings(cache.getMaxEntries(), cache.getTtl());
  }

  private static void requireHttpUrl(String url) {
    if (url == null || url.isBlank()) throw new ConfigurationException("semgate.cube.api-url is required");
    try {
      URI uri = new URI(url);
      String scheme = uri.getScheme();
      if (uri.getHost() == null || !("http".equals(scheme) || "https".equals(scheme))) {
        throw new ConfigurationException("semgate.cube.api-url must be an http(s) URL: " + url);
      }
    } catch (URISyntaxException e) {
      throw new ConfigurationException("semgate.cube.api-url is malformed: " + url, e);
    }
  }

  public static class Cube {
    private String apiUrl = "http://localhost:4000/cubejs-api/v1";
    private String jwtSecret;
    private Duration jwtTtl = Duration.ofHours(1);
    private Duration metaTimeout = Duration.ofSeconds(10);
    private Duration queryTimeoutBase = Duration.ofSeconds(10);
    private Duration queryTimeoutPerRow = Duration.ofMillis(5);
    private Duration queryTimeoutMax = Duration.ofSeconds(120);
    private Duration continueWaitInterval = Duration.ofMillis(500);

    public String getApiUrl() { return apiUrl; }
    public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }
    public String getJwtSecret() { return jwtSecret; }
    public void setJwtSecret(String jwtSecret) { this.jwtSecret = jwtSecret; }
    public Duration getJwtTtl() { return jwtTtl; }
    public void setJwtTtl(Duration jwtTtl) { this.jwtTtl = jwtTtl; }
    public Duration getMetaTimeout() { return metaTimeout; }
    public void setMetaTimeout(Duration metaTimeout) { this.metaTimeout = metaTimeout; }
    public Duration getQueryTimeoutBase() { return queryTimeoutBase; }
    public void setQueryTimeoutBase(Duration queryTimeoutBase) { this.queryTimeoutBase = queryTimeoutBase; }
    public Duration getQueryTimeoutPerRow() { return queryTimeoutPerRow; }
    public void setQueryTimeoutPerRow(Duration queryTimeoutPerRow) { this.queryTimeoutPerRow = queryTimeoutPerRow; }
    public Duration getQueryTimeoutMax() { return queryTimeoutMax; }
    public void setQueryTimeoutMax(Duration queryTimeoutMax) { this.queryTimeoutMax = queryTimeoutMax; }
    public Duration getContinueWaitInterval() { return continueWaitInterval; }
    public void setContinueWaitInterval(Duration continueWaitInterval) { this.continueWaitInterval = continueWaitInterval; }
  }

  public static class Policy {
    private int maxLimit = 1000;
    private List<String> defaultSegments = new ArrayList<>();
    private List<String> denyMembers = new ArrayList<>();
    private boolean returnSql;

    public int getMaxLimit() { return maxLimit; }
    public void setMaxLimit(int maxLimit) { this.maxLimit = maxLimit; }
    public List<String> getDefaultSegments() { return defaultSegments; }
    public void setDefaultSegments(List<String> defaultSegments) { this.defaultSegments = defaultSegments; }
    public List<String> getDenyMembers() { return denyMembers; }
    public void setDenyMembers(List<String> denyMembers) { this.denyMembers = denyMembers; }
    public boolean isReturnSql() { return returnSql; }
    public void setReturnSql(boolean returnSql) { this.returnSql = returnSql; }
  }

  public static class Registry {
    /** {@code memory} or {@code jdbc}. */
    private String store = "memory";
    private String jdbcUrl;
    private String username;
    private String password;
    private String schema;
    private int poolSize = 10;
    private boolean bootstrapDefault = true;

    /** Connection template of the auto-created default database. */
    private Map<String, Object> defaultConnection = new LinkedHashMap<>(Map.of(
        "type", "postgres",
        "host", "localhost",
        "port", 5432,
        "database", "postgres"));

    public String getStore() { return store; }
    public void setStore(String store) { this.store = store; }
    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }
    public int getPoolSize() { return poolSize; }
    public void setPoolSize(int poolSize) { this.poolSize = poolSize; }
    public boolean isBootstrapDefault() { return bootstrapDefault; }
    public void setBootstrapDefault(boolean bootstrapDefault) { this.bootstrapDefault = bootstrapDefault; }
    public Map<String, Object> getDefaultConnection() { return defaultConnection; }
    public void setDefaultConnection(Map<String, Object> defaultConnection) { this.defaultConnection = defaultConnection; }
  }

  public static class Cache {
    private int maxEntries = 100;
    private Duration ttl = Duration.ofMinutes(30);

    public int getMaxEntries() { return maxEntries; }
    public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }
    public Duration getTtl() { return ttl; }
    public void setTtl(Duration ttl) { this.ttl = ttl; }
  }
}
