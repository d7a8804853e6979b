package com.tessera.tenancy.infrastructure.persistence;

import com.tessera.security.TenantRole;
import com.tessera.tenancy.domain.Membership;
import com.tessera.tenancy.domain.MembershipStore;
import com.tessera.tenancy.domain.UserTenantMembership;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * {@link MembershipStore} backed by the {@code tenant_memberships} table. Roles are stored by
 * their claim name.
 */
@Repository
public class JdbcMembershipStore implements MembershipStore {

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcMembershipStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<TenantRole> findRole(String userId, long tenantKey) {
        List<String> roles = jdbc.queryForList(
                "SELECT role_name FROM tenant_memberships WHERE user_id = :userId AND tenant_id = :tenantKey",
                pair(userId, tenantKey),
                String.class);
        return roles.isEmpty() ? Optional.empty() : Optional.of(toRole(roles.get(0)));
    }

    @Override
    public void insert(Membership membership) {
        jdbc.update(
                "INSERT INTO tenant_memberships (user_id, tenant_id, role_name) VALUES (:userId, :tenantKey, :role)",
                pair(membership.userId(), membership.tenantKey()).addValue("role", membership.role().claimName()));
    }

    @Override
    public boolean updateRole(String userId, long tenantKey, TenantRole role) {
        return jdbc.update(
                "UPDATE tenant_memberships SET role_name = :role WHERE user_id = :userId AND tenant_id = :tenantKey",
                pair(userId, tenantKey).addValue("role", role.claimName())) > 0;
    }

    @Override
    public boolean delete(String userId, long tenantKey) {
        return jdbc.update(
                "DELETE FROM tenant_memberships WHERE user_id = :userId AND tenant_id = :tenantKey",
                pair(userId, tenantKey)) > 0;
    }

    @Override
    public int countOwners(long tenantKey) {
        Integer count = jdbc.queryForObject(
                "SELECT COUNT(*) FROM tenant_memberships WHERE tenant_id = :tenantKey AND role_name = :role",
                new MapSqlParameterSource("tenantKey", tenantKey).addValue("role", TenantRole.OWNER.claimName()),
                Integer.class);
        return count == null ? 0 : count;
    }

    @Override
    public List<Membership> findByTenant(long tenantKey) {
        return jdbc.query(
                "SELECT user_id, tenant_id, role_name FROM tenant_memberships WHERE tenant_id = :tenantKey ORDER BY user_id",
                new MapSqlParameterSource("tenantKey", tenantKey),
                (rs, i) -> new Membership(rs.getString("user_id"), rs.getLong("tenant_id"), toRole(rs.getString("role_name"))));
    }

    @Override
    public List<UserTenantMembership> findByUser(String userId) {
        return jdbc.query("""
                SELECT t.id, t.identifier, t.name, t.description, t.created_at, t.active, m.role_name
                FROM tenant_memberships m
                JOIN tenants t ON t.id = m.tenant_id
                WHERE m.user_id = :userId
                ORDER BY t.name, t.id
                """,
                new MapSqlParameterSource("userId", userId),
                (rs, i) -> new UserTenantMembership(JdbcTenantStore.mapRow(rs, i), toRole(rs.getString("role_name"))));
    }

    private static MapSqlParameterSource pair(String userId, long tenantKey) {
        return new MapSqlParameterSource("userId", userId).addValue("tenantKey", tenantKey);
    }

    private static TenantRole toRole(String stored) {
        return TenantRole.fromClaimName(stored)
                .orElseThrow(() -> new IllegalStateException("Unknown role stored: " + stored));
    }
}
