package com.tessera.tenancy.infrastructure.persistence;

import com.tessera.tenancy.domain.Tenant;
import com.tessera.tenancy.domain.TenantStore;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

/**
 * {@link TenantStore} backed by the {@code tenants} table.
 */
@Repository
public class JdbcTenantStore implements TenantStore {

    private static final String COLUMNS = "id, identifier, name, description, created_at, active";

    static final RowMapper<Tenant> TENANT_ROW = JdbcTenantStore::mapRow;

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcTenantStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Tenant insert(UUID identifier, String name, String description, boolean active) {
        OffsetDateTime createdAt = OffsetDateTime.now(ZoneOffset.UTC);
        KeyHolder keys = new GeneratedKeyHolder();
        jdbc.update("""
                INSERT INTO tenants (identifier, name, description, created_at, active)
                VALUES (:identifier, :name, :description, :createdAt, :active)
                """,
                new MapSqlParameterSource()
                        .addValue("identifier", identifier)
                        .addValue("name", name)
                        .addValue("description", description)
                        .addValue("createdAt", createdAt)
                        .addValue("active", active),
                keys,
                new String[] {"id"});
        long key = keys.getKey().longValue();
        return new Tenant(key, identifier, name, description, createdAt.toInstant(), active);
    }

    @Override
    public Optional<Tenant> findByIdentifier(UUID identifier) {
        return single(jdbc.query(
                "SELECT " + COLUMNS + " FROM tenants WHERE identifier = :identifier",
                new MapSqlParameterSource("identifier", identifier),
                TENANT_ROW));
    }

    @Override
    public Optional<Tenant> findByKey(long key) {
        return single(jdbc.query(
                "SELECT " + COLUMNS + " FROM tenants WHERE id = :key",
                new MapSqlParameterSource("key", key),
                TENANT_ROW));
    }

    @Override
    public boolean lockForUpdate(long key) {
        List<Long> locked = jdbc.queryForList(
                "SELECT id FROM tenants WHERE id = :key FOR UPDATE",
                new MapSqlParameterSource("key", key),
                Long.class);
        return !locked.isEmpty();
    }

    @Override
    public boolean update(long key, String name, String description, boolean active) {
        return jdbc.update(
                "UPDATE tenants SET name = :name, description = :description, active = :active WHERE id = :key",
                new MapSqlParameterSource()
                        .addValue("key", key)
                        .addValue("name", name)
                        .addValue("description", description)
                        .addValue("active", active)) > 0;
    }

    @Override
    public boolean delete(long key) {
        return jdbc.update("DELETE FROM tenants WHERE id = :key", new MapSqlParameterSource("key", key)) > 0;
    }

    static Tenant mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new Tenant(
                rs.getLong("id"),
                rs.getObject("identifier", UUID.class),
                rs.getString("name"),
                rs.getString("description"),
                rs.getObject("created_at", OffsetDateTime.class).toInstant(),
                rs.getBoolean("active"));
    }

    private static <T> Optional<T> single(List<T> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }
}
