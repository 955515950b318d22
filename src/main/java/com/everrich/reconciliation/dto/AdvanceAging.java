package com.everrich.reconciliation.dto;

import java.time.LocalDate;

import com.everrich.reconciliation.entities.AdvanceStatus;
import com.everrich.reconciliation.entities.EmployeeAdvance;

/**
 * An open advance with how long it has been waiting for repayment.
 */
public record AdvanceAging(
        Long advanceId,
        String employeeId,
        String employeeName,
        Long expenseId,
        long advanceAmount,
        long pendingAmount,
        AdvanceStatus status,
        LocalDate advanceDate,
        long daysPending,
        Priority priority) {

    public enum Priority {
        NORMAL,
        WARNING,
        URGENT
    }

    public static AdvanceAging of(EmployeeAdvance advance, long daysPending, Priority priority) {
        return new AdvanceAging(advance.getId(), advance.getEmployeeId(), advance.getEmployeeName(),
                advance.getExpenseId(), advance.getAdvanceAmount(), advance.getPendingAmount(),
                advance.getStatus(), advance.getAdvanceDate(), daysPending, priority);
    }
}
