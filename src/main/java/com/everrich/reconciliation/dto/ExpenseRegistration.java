package com.everrich.reconciliation.dto;

import java.time.LocalDate;

public record ExpenseRegistration(
        String companyId,
        String description,
        long amount,
        String currency,
        LocalDate expenseDate) {
}
