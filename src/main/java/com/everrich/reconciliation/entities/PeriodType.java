package com.everrich.reconciliation.entities;

public enum PeriodType {
    DAILY,
    WEEKLY,
    MONTHLY
}
