package io.intellixity.semgate.registry.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.semgate.error.ConfigurationException;
import io.intellixity.semgate.error.ConflictException;
import io.intellixity.semgate.error.ErrorCode;
import io.intellixity.semgate.governance.GovernanceDocument;
import io.intellixity.semgate.registry.DatabaseConfig;
import io.intellixity.semgate.registry.DatabaseStatus;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link DatabaseStore} over JDBC. JSON-valued columns hold Jackson-rendered text so the same schema runs on
 * PostgreSQL and H2.
 */
public final class JdbcDatabaseStore implements DatabaseStore {
  private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};
  private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {};

  private static final String COLUMNS = "id, slug, tenant_id, name, description, status, connection_json, cube_api_url, "
      + "jwt_secret, max_limit, deny_members, default_segments, return_sql, last_error, created_at, updated_at";

  private final JdbcTemplate jdbc;
  private final ObjectMapper json;
  private final RowMapper<DatabaseConfig> rowMapper = this::mapRow;

  public JdbcDatabaseStore(JdbcTemplate jdbc, ObjectMapper json) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    this.json = Objects.requireNonNull(json, "json");
  }

  @Override
  public Optional<DatabaseConfig> get(String id, String tenantId) {
    Where w = new Where("id = ?", id).tenant(tenantId);
    List<DatabaseConfig> rows = jdbc.query("SELECT " + COLUMNS + " FROM semgate_databases WHERE " + w.sql, rowMapper, w.args());
    return rows.stream().findFirst();
  }

  @Override
  public List<DatabaseConfig> list(String tenantId) {
    Where w = new Where("1 = 1").tenant(tenantId);
    return jdbc.query("SELECT " + COLUMNS + " FROM semgate_databases WHERE " + w.sql + " ORDER BY created_at, id",
        rowMapper, w.args());
  }

  @Override
  public List<DatabaseConfig> listByStatus(DatabaseStatus status, String tenantId) {
    Where w = new Where("status = ?", status.wire()).tenant(tenantId);
    return jdbc.query("SELECT " + COLUMNS + " FROM semgate_databases WHERE " + w.sql + " ORDER BY created_at, id",
        rowMapper, w.args());
  }

  @Override
  public boolean exists(String id, String tenantId) {
    Where w = new Where("id = ?", id).tenant(tenantId);
    Integer n = jdbc.queryForObject("SELECT COUNT(*) FROM semgate_databases WHERE " + w.sql, Integer.class, w.args());
    return n != null && n > 0;
  }

  @Override
  public boolean slugExists(String slug, String tenantId) {
    Integer n = tenantId == null
        ? jdbc.queryForObject("SELECT COUNT(*) FROM semgate_databases WHERE slug = ? AND tenant_id IS NULL", Integer.class, slug)
        : jdbc.queryForObject("SELECT COUNT(*) FROM semgate_databases WHERE slug = ? AND tenant_id = ?", Integer.class, slug, tenantId);
    return n != null && n > 0;
  }

  @Override
  public void insert(DatabaseConfig d) {
    try {
      jdbc.update("INSERT INTO semgate_databases (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
          d.id(), d.slug(), d.tenantId(), d.name(), d.description(), d.status().wire(), write(d.connection()),
          d.cubeApiUrl(), d.jwtSecret(), d.maxLimit(), write(d.denyMembers()), write(d.defaultSegments()),
          d.returnSql(), d.lastError(), Timestamp.from(d.createdAt()), Timestamp.from(d.updatedAt()));
    } catch (DuplicateKeyException e) {
      throw new ConflictException(ErrorCode.DATABASE_EXISTS, "Database '" + d.id() + "' already exists");
    }
  }

  @Override
  public Optional<DatabaseConfig> replace(DatabaseConfig d, boolean onlyIfInactive, String tenantId) {
    Where w = new Where("id = ?", d.id()).tenant(tenantId);
    if (onlyIfInactive) w.inactive();
    List<Object> args = new ArrayList<>();
    args.add(d.name());
    args.add(d.description());
    args.add(write(d.connection()));
    args.add(d.cubeApiUrl());
    args.add(d.jwtSecret());
    args.add(d.maxLimit());
    args.add(write(d.denyMembers()));
    args.add(write(d.defaultSegments()));
    args.add(d.returnSql());
    args.add(Timestamp.from(d.updatedAt()));
    args.addAll(w.argList);
    int n = jdbc.update("UPDATE semgate_databases SET name = ?, description = ?, connection_json = ?, cube_api_url = ?, "
            + "jwt_secret = ?, max_limit = ?, deny_members = ?, default_segments = ?, return_sql = ?, "
            + "updated_at = ? WHERE " + w.sql,
        args.toArray());
    return n > 0 ? get(d.id(), tenantId) : Optional.empty();
  }

  @Override
  public boolean updateStatus(String id, DatabaseStatus status, String lastError, Instant at, String tenantId) {
    Where w = new Where("id = ?", id).tenant(tenantId);
    List<Object> args = new ArrayList<>();
    args.add(status.wire());
    args.add(lastError);
    args.add(Timestamp.from(at));
    args.addAll(w.argList);
    return jdbc.update("UPDATE semgate_databases SET status = ?, last_error = ?, updated_at = ? WHERE " + w.sql,
        args.toArray()) > 0;
  }

  @Override
  public boolean delete(String id, String tenantId) {
    Where w = new Where("id = ?", id).tenant(tenantId).inactive();
    // governance document goes with the row (ON DELETE CASCADE)
    return jdbc.update("DELETE FROM semgate_databases WHERE " + w.sql, w.args()) > 0;
  }

  @Override
  public Optional<GovernanceDocument> findGovernance(String databaseId) {
    List<String> docs = jdbc.queryForList("SELECT config FROM semgate_catalog_configs WHERE database_id = ?",
        String.class, databaseId);
    if (docs.isEmpty()) return Optional.empty();
    try {
      return Optional.of(json.readValue(docs.get(0), GovernanceDocument.class));
    } catch (JsonProcessingException e) {
      throw new ConfigurationException("Stored governance document of '" + databaseId + "' is not valid JSON", e);
    }
  }

  @Override
  public void saveGovernance(String databaseId, GovernanceDocument document, Instant at) {
    String text = write(document);
    Timestamp ts = Timestamp.from(at);
    int n = jdbc.update("UPDATE semgate_catalog_configs SET config = ?, updated_at = ? WHERE database_id = ?",
        text, ts, databaseId);
    if (n > 0) return;
    try {
      jdbc.update("INSERT INTO semgate_catalog_configs (database_id, config, updated_at) VALUES (?, ?, ?)",
          databaseId, text, ts);
    } catch (DuplicateKeyException e) {
      // inserted concurrently; last writer wins
      jdbc.update("UPDATE semgate_catalog_configs SET config = ?, updated_at = ? WHERE database_id = ?",
          text, ts, databaseId);
    }
  }

  @Override
  public String kind() { return "jdbc"; }

  private DatabaseConfig mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new DatabaseConfig(
        rs.getString("id"),
        rs.getString("slug"),
        rs.getString("tenant_id"),
        rs.getString("name"),
        rs.getString("description"),
        DatabaseStatus.fromWire(rs.getString("status")),
        read(rs.getString("connection_json"), MAP),
        rs.getString("cube_api_url"),
        rs.getString("jwt_secret"),
        rs.getObject("max_limit", Integer.class),
        read(rs.getString("deny_members"), STRINGS),
        read(rs.getString("default_segments"), STRINGS),
        rs.getBoolean("return_sql"),
        rs.getString("last_error"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant());
  }

  private String write(Object value) {
    try {
      return json.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to render registry column", e);
    }
  }

  private <T> T read(String text, TypeReference<T> type) {
    if (text == null || text.isBlank()) return null;
    try {
      return json.readValue(text, type);
    } catch (JsonProcessingException e) {
      throw new ConfigurationException("Registry column is not valid JSON: " + e.getOriginalMessage(), e);
    }
  }

  /** WHERE clause with the optional tenant predicate appended. */
  private static final class Where {
    private String sql;
    private final List<Object> argList = new ArrayList<>();

    Where(String sql, Object... args) {
      this.sql = sql;
      argList.addAll(List.of(args));
    }

    Where tenant(String tenantId) {
      if (tenantId != null) {
        sql = sql + " AND tenant_id = ?";
        argList.add(tenantId);
      }
      return this;
    }

    Where inactive() {
      sql = sql + " AND status <> ?";
      argList.add(DatabaseStatus.ACTIVE.wire());
      return this;
    }

    Object[] args() { return argList.toArray(); }
  }
}
