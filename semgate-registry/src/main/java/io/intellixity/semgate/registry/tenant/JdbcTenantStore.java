package io.intellixity.semgate.registry.tenant;

import io.intellixity.semgate.error.ConflictException;
import io.intellixity.semgate.error.ErrorCode;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

public final class JdbcTenantStore implements TenantStore {
  private static final RowMapper<Tenant> ROW = (rs, n) -> new Tenant(
      rs.getString("id"),
      rs.getString("slug"),
      rs.getString("name"),
      rs.getTimestamp("created_at").toInstant(),
      rs.getTimestamp("updated_at").toInstant());

  private final JdbcTemplate jdbc;

  public JdbcTenantStore(JdbcTemplate jdbc) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
  }

  @Override
  public Optional<Tenant> findById(String id) {
    return jdbc.query("SELECT id, slug, name, created_at, updated_at FROM semgate_tenants WHERE id = ?", ROW, id)
        .stream().findFirst();
  }

  @Override
  public Optional<Tenant> findBySlug(String slug) {
    return jdbc.query("SELECT id, slug, name, created_at, updated_at FROM semgate_tenants WHERE slug = ?", ROW, slug)
        .stream().findFirst();
  }

  @Override
  public void insert(Tenant t) {
    try {
      jdbc.update("INSERT INTO semgate_tenants (id, slug, name, created_at, updated_at) VALUES (?, ?, ?, ?, ?)",
          t.id(), t.slug(), t.name(), Timestamp.from(t.createdAt()), Timestamp.from(t.updatedAt()));
    } catch (DuplicateKeyException e) {
      if (findById(t.id()).isPresent()) {
        throw new ConflictException(ErrorCode.TENANT_EXISTS, "Tenant '" + t.id() + "' already exists");
      }
      throw new ConflictException(ErrorCode.SLUG_TAKEN, "Slug '" + t.slug() + "' is already taken");
    }
  }

  @Override
  public boolean updateSlug(String id, String slug, Instant at) {
    try {
      return jdbc.update("UPDATE semgate_tenants SET slug = ?, updated_at = ? WHERE id = ?",
          slug, Timestamp.from(at), id) > 0;
    } catch (DuplicateKeyException e) {
      throw new ConflictException(ErrorCode.SLUG_TAKEN, "Slug '" + slug + "' is already taken");
    }
  }
}
