package com.tessera.tenancy.service;

import com.tessera.security.ResolvedTenantContext;
import com.tessera.tenancy.domain.LedgerTransaction;
import com.tessera.tenancy.domain.TenantScopedStore;
import com.tessera.tenancy.domain.exception.TenantResourceNotFoundException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Ledger transactions of the resolved tenant. All access goes through a
 * {@link TenantScopedGateway} built for the request's context.
 */
@Service
public class LedgerTransactionService {

    static final String RESOURCE_TYPE = "Transaction";

    private final TenantScopedGatewayFactory gateways;
    private final TenantScopedStore<LedgerTransaction, UUID> store;

    public LedgerTransactionService(
            TenantScopedGatewayFactory gateways, TenantScopedStore<LedgerTransaction, UUID> store) {
        this.gateways = gateways;
        this.store = store;
    }

    public List<LedgerTransaction> list(ResolvedTenantContext context) {
        return gateway(context).readAll();
    }

    /** @throws TenantResourceNotFoundException if the key is unknown in this tenant */
    public LedgerTransaction get(ResolvedTenantContext context, UUID key) {
        return gateway(context).read(key)
                .orElseThrow(() -> new TenantResourceNotFoundException(RESOURCE_TYPE, key));
    }

    public LedgerTransaction create(
            ResolvedTenantContext context, LocalDate postedOn, String payee, BigDecimal amount, String memo) {
        return gateway(context).insert(LedgerTransaction.draft(postedOn, payee, amount, memo));
    }

    public LedgerTransaction update(
            ResolvedTenantContext context, UUID key, LocalDate postedOn, String payee, BigDecimal amount, String memo) {
        var gateway = gateway(context);
        LedgerTransaction changed = get(context, key).withDetails(postedOn, payee, amount, memo);
        if (!gateway.update(changed)) {
            throw new TenantResourceNotFoundException(RESOURCE_TYPE, key);
        }
        return changed;
    }

    public void delete(ResolvedTenantContext context, UUID key) {
        if (!gateway(context).delete(key)) {
            throw new TenantResourceNotFoundException(RESOURCE_TYPE, key);
        }
    }

    private TenantScopedGateway<LedgerTransaction, UUID> gateway(ResolvedTenantContext context) {
        return gateways.forContext(context, store);
    }
}
