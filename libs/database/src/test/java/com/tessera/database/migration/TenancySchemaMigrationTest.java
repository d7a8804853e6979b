package com.tessera.database.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Applies the tenancy migrations to an in-memory H2 database in PostgreSQL mode and checks the
 * storage-level guarantees the service relies on.
 */
@DisplayName("Tenancy schema migrations")
class TenancySchemaMigrationTest {

    private String url;
    private Connection connection;

    @BeforeEach
    void migrate() throws SQLException {
        url = "jdbc:h2:mem:schema-" + UUID.randomUUID() + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1";
        var result = Flyway.configure()
                .dataSource(url, "sa", "")
                .locations("classpath:db/migration/tessera")
                .load()
                .migrate();
        assertThat(result.migrationsExecuted).isEqualTo(1);
        connection = DriverManager.getConnection(url, "sa", "");
    }

    @AfterEach
    void close() throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("SHUTDOWN");
        }
        connection.close();
    }

    @Test
    @DisplayName("migration file is on the classpath")
    void onClasspath() {
        assertThat(getClass().getClassLoader().getResource("db/migration/tessera/V1__tenancy_schema.sql")).isNotNull();
    }

    @Nested
    @DisplayName("memberships")
    class Memberships {

        @Test
        @DisplayName("at most one membership per user and tenant")
        void uniquePerUserAndTenant() throws SQLException {
            long tenant = insertTenant();
            insertMembership("alice", tenant, "Owner");

            assertThatThrownBy(() -> insertMembership("alice", tenant, "Viewer"))
                    .isInstanceOf(SQLException.class)
                    .satisfies(e -> assertThat(((SQLException) e).getSQLState()).isEqualTo("23505"));
        }

        @Test
        @DisplayName("only the three role names are accepted")
        void roleCheck() throws SQLException {
            long tenant = insertTenant();
            assertThatThrownBy(() -> insertMembership("bob", tenant, "Admin")).isInstanceOf(SQLException.class);
            assertThatThrownBy(() -> insertMembership("bob", tenant, "owner")).isInstanceOf(SQLException.class);
        }
    }

    @Test
    @DisplayName("deleting a tenant cascades to memberships and transactions")
    void cascade() throws SQLException {
        long tenant = insertTenant();
        long other = insertTenant();
        insertMembership("alice", tenant, "Owner");
        insertMembership("alice", other, "Owner");
        try (PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO ledger_transactions (transaction_key, tenant_id, posted_on, payee, amount) "
                        + "VALUES (?, ?, DATE '2024-01-31', 'Grocer', 12.5000)")) {
            ps.setObject(1, UUID.randomUUID());
            ps.setLong(2, tenant);
            ps.executeUpdate();
        }

        try (Statement st = connection.createStatement()) {
            st.executeUpdate("DELETE FROM tenants WHERE id = " + tenant);
        }

        assertThat(count("SELECT COUNT(*) FROM tenant_memberships WHERE tenant_id = " + tenant)).isZero();
        assertThat(count("SELECT COUNT(*) FROM ledger_transactions WHERE tenant_id = " + tenant)).isZero();
        assertThat(count("SELECT COUNT(*) FROM tenant_memberships WHERE tenant_id = " + other)).isEqualTo(1);
    }

    private long insertTenant() throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO tenants (identifier, name, description, created_at) VALUES (?, 'T', 'D', CURRENT_TIMESTAMP)",
                new String[] {"id"})) {
            ps.setObject(1, UUID.randomUUID());
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                keys.next();
                return keys.getLong(1);
            }
        }
    }

    private void insertMembership(String user, long tenant, String role) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO tenant_memberships (user_id, tenant_id, role_name) VALUES (?, ?, ?)")) {
            ps.setString(1, user);
            ps.setLong(2, tenant);
            ps.setString(3, role);
            ps.executeUpdate();
        }
    }

    private long count(String sql) throws SQLException {
        try (Statement st = connection.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            rs.next();
            return rs.getLong(1);
        }
    }
}
