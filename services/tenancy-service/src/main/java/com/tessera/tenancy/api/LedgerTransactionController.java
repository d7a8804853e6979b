package com.tessera.tenancy.api;

import com.tessera.security.ResolvedTenantContext;
import com.tessera.security.TenantRole;
import com.tessera.tenancy.api.dto.TransactionRequest;
import com.tessera.tenancy.api.dto.TransactionResponse;
import com.tessera.tenancy.domain.LedgerTransaction;
import com.tessera.tenancy.infrastructure.web.RequireTenantRole;
import com.tessera.tenancy.service.LedgerTransactionService;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Ledger transactions of one tenant: Viewers read, Editors write.
 */
@RestController
@RequestMapping("/api/tenant/{tenantIdentifier}/transactions")
public class LedgerTransactionController {

    private final LedgerTransactionService transactions;

    public LedgerTransactionController(LedgerTransactionService transactions) {
        this.transactions = transactions;
    }

    @GetMapping
    @RequireTenantRole(TenantRole.VIEWER)
    public List<TransactionResponse> list(ResolvedTenantContext context) {
        return transactions.list(context).stream().map(TransactionResponse::from).toList();
    }

    @GetMapping("/{key}")
    @RequireTenantRole(TenantRole.VIEWER)
    public TransactionResponse get(ResolvedTenantContext context, @PathVariable UUID key) {
        return TransactionResponse.from(transactions.get(context, key));
    }

    @PostMapping
    @RequireTenantRole(TenantRole.EDITOR)
    public ResponseEntity<TransactionResponse> create(
            ResolvedTenantContext context,
            @PathVariable String tenantIdentifier,
            @Valid @RequestBody TransactionRequest request) {
        LedgerTransaction created = transactions.create(
                context, request.date(), request.payee(), request.amount(), request.memo());
        return ResponseEntity.created(
                        URI.create("/api/tenant/" + tenantIdentifier + "/transactions/" + created.key()))
                .body(TransactionResponse.from(created));
    }

    @PutMapping("/{key}")
    @RequireTenantRole(TenantRole.EDITOR)
    public TransactionResponse update(
            ResolvedTenantContext context, @PathVariable UUID key, @Valid @RequestBody TransactionRequest request) {
        return TransactionResponse.from(transactions.update(
                context, key, request.date(), request.payee(), request.amount(), request.memo()));
    }

    @DeleteMapping("/{key}")
    @RequireTenantRole(TenantRole.EDITOR)
    public ResponseEntity<Void> delete(ResolvedTenantContext context, @PathVariable UUID key) {
        transactions.delete(context, key);
        return ResponseEntity.noContent().build();
    }
}
