package com.everrich.reconciliation.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * Totals over employee advances, overall and per employee.
 */
public class AdvanceSummary {

    private long totalAdvances;
    private long openAdvances;
    private long completedAdvances;
    private long cancelledAdvances;
    private long totalAdvanced;
    private long totalReimbursed;
    private long totalPending;
    private List<EmployeeTotals> employees = new ArrayList<>();

    public AdvanceSummary() {
    }

    public long getTotalAdvances() {
        return totalAdvances;
    }

    public void setTotalAdvances(long totalAdvances) {
        this.totalAdvances = totalAdvances;
    }

    public long getOpenAdvances() {
        return openAdvances;
    }

    public void setOpenAdvances(long openAdvances) {
        this.openAdvances = openAdvances;
    }

    public long getCompletedAdvances() {
        return completedAdvances;
    }

    public void setCompletedAdvances(long completedAdvances) {
        this.completedAdvances = completedAdvances;
    }

    public long getCancelledAdvances() {
        return cancelledAdvances;
    }

    public void setCancelledAdvances(long cancelledAdvances) {
        this.cancelledAdvances = cancelledAdvances;
    }

    public long getTotalAdvanced() {
        return totalAdvanced;
    }

    public void setTotalAdvanced(long totalAdvanced) {
        this.totalAdvanced = totalAdvanced;
    }

    public long getTotalReimbursed() {
        return totalReimbursed;
    }

    public void setTotalReimbursed(long totalReimbursed) {
        this.totalReimbursed = totalReimbursed;
    }

    public long getTotalPending() {
        return totalPending;
    }

    public void setTotalPending(long totalPending) {
        this.totalPending = totalPending;
    }

    public List<EmployeeTotals> getEmployees() {
        return employees;
    }

    public void setEmployees(List<EmployeeTotals> employees) {
        this.employees = employees;
    }

    public record EmployeeTotals(String employeeId, String employeeName, long advanceCount,
                                 long totalAdvanced, long totalReimbursed, long totalPending) {
    }
}
