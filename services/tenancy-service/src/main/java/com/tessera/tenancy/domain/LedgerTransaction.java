package com.tessera.tenancy.domain;

import com.tessera.security.TenantScoped;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A financial transaction recorded in a tenant's ledger.
 *
 * @param key external key of the transaction
 * @param tenantKey owning tenant, null until first stored through a gateway
 * @param postedOn booking date
 * @param payee counterparty
 * @param amount signed amount
 * @param memo optional note
 */
public record LedgerTransaction(
        UUID key, Long tenantKey, LocalDate postedOn, String payee, BigDecimal amount, String memo)
        implements TenantScoped<LedgerTransaction> {

    /** A new, untagged transaction with a fresh key. */
    public static LedgerTransaction draft(LocalDate postedOn, String payee, BigDecimal amount, String memo) {
        return new LedgerTransaction(UUID.randomUUID(), null, postedOn, payee, amount, memo);
    }

    @Override
    public LedgerTransaction withTenantKey(long tenantKey) {
        return new LedgerTransaction(key, tenantKey, postedOn, payee, amount, memo);
    }

    /** Copy with the editable fields replaced; key and tenant are kept. */
    public LedgerTransaction withDetails(LocalDate postedOn, String payee, BigDecimal amount, String memo) {
        return new LedgerTransaction(key, tenantKey, postedOn, payee, amount, memo);
    }
}
