package com.tessera.tenancy.api.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;

public record TransactionRequest(
        @NotNull LocalDate date,
        @NotBlank @Size(max = 200) String payee,
        @NotNull @Digits(integer = 15, fraction = 4) BigDecimal amount,
        @Size(max = 500) String memo) {}
