package com.tessera.tenancy.infrastructure.persistence;

import com.tessera.tenancy.domain.LedgerTransaction;
import com.tessera.tenancy.domain.TenantScopedStore;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Tenant-scoped storage for ledger transactions. Every statement filters on {@code tenant_id}.
 */
@Repository
public class JdbcLedgerTransactionStore implements TenantScopedStore<LedgerTransaction, UUID> {

    private static final String COLUMNS = "transaction_key, tenant_id, posted_on, payee, amount, memo";

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcLedgerTransactionStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public List<LedgerTransaction> findAll(long tenantKey) {
        return jdbc.query(
                "SELECT " + COLUMNS + " FROM ledger_transactions WHERE tenant_id = :tenantKey ORDER BY posted_on, id",
                new MapSqlParameterSource("tenantKey", tenantKey),
                JdbcLedgerTransactionStore::mapRow);
    }

    @Override
    public Optional<LedgerTransaction> find(long tenantKey, UUID key) {
        List<LedgerTransaction> rows = jdbc.query(
                "SELECT " + COLUMNS + " FROM ledger_transactions WHERE tenant_id = :tenantKey AND transaction_key = :key",
                scoped(tenantKey, key),
                JdbcLedgerTransactionStore::mapRow);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public LedgerTransaction insert(long tenantKey, LedgerTransaction record) {
        jdbc.update("""
                INSERT INTO ledger_transactions (transaction_key, tenant_id, posted_on, payee, amount, memo)
                VALUES (:key, :tenantKey, :postedOn, :payee, :amount, :memo)
                """,
                details(scoped(tenantKey, record.key()), record));
        return record;
    }

    @Override
    public boolean update(long tenantKey, LedgerTransaction record) {
        return jdbc.update("""
                UPDATE ledger_transactions
                SET posted_on = :postedOn, payee = :payee, amount = :amount, memo = :memo
                WHERE tenant_id = :tenantKey AND transaction_key = :key
                """,
                details(scoped(tenantKey, record.key()), record)) > 0;
    }

    @Override
    public boolean delete(long tenantKey, UUID key) {
        return jdbc.update(
                "DELETE FROM ledger_transactions WHERE tenant_id = :tenantKey AND transaction_key = :key",
                scoped(tenantKey, key)) > 0;
    }

    private static MapSqlParameterSource scoped(long tenantKey, UUID key) {
        return new MapSqlParameterSource("tenantKey", tenantKey).addValue("key", key);
    }

    private static MapSqlParameterSource details(MapSqlParameterSource params, LedgerTransaction record) {
        return params
                .addValue("postedOn", record.postedOn())
                .addValue("payee", record.payee())
                .addValue("amount", record.amount())
                .addValue("memo", record.memo());
    }

    private static LedgerTransaction mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new LedgerTransaction(
                rs.getObject("transaction_key", UUID.class),
                rs.getLong("tenant_id"),
                rs.getDate("posted_on").toLocalDate(),
                rs.getString("payee"),
                rs.getBigDecimal("amount"),
                rs.getString("memo"));
    }
}
