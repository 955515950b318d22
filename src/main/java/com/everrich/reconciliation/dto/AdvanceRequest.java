package com.everrich.reconciliation.dto;

import java.time.LocalDate;

/**
 * Registers an expense as paid out of pocket by an employee.
 * When {@code advanceAmount} is null the full expense amount is owed back.
 */
public record AdvanceRequest(
        Long expenseId,
        String employeeId,
        String employeeName,
        Long advanceAmount,
        LocalDate advanceDate,
        String paymentMethod,
        String notes) {
}
