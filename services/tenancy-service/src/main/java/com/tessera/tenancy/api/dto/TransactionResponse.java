package com.tessera.tenancy.api.dto;

import com.tessera.tenancy.domain.LedgerTransaction;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

public record TransactionResponse(UUID key, LocalDate date, String payee, BigDecimal amount, String memo) {

    public static TransactionResponse from(LedgerTransaction tx) {
        return new TransactionResponse(tx.key(), tx.postedOn(), tx.payee(), tx.amount(), tx.memo());
    }
}
