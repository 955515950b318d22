package com.everrich.reconciliation.entities;

/**
 * Catalog of reasons an expense or movement could not be reconciled automatically.
 * Each code belongs to exactly one {@link ReasonCategory}.
 */
public enum ReasonCode {

    MISSING_VENDOR("Missing Vendor Information", ReasonCategory.MISSING_DATA, 14, false),
    MISSING_RECEIPT("Missing Receipt/Invoice", ReasonCategory.MISSING_DATA, 21, false),
    MISSING_CATEGORY("Missing Category Assignment", ReasonCategory.MISSING_DATA, 7, true),
    MISSING_PROJECT("Missing Project Code", ReasonCategory.MISSING_DATA, 10, false),

    INVALID_FORMAT("Invalid Data Format", ReasonCategory.FORMAT_MISMATCH, 5, true),
    ENCODING_ERROR("Character Encoding Issues", ReasonCategory.FORMAT_MISMATCH, 3, true),
    CURRENCY_MISMATCH("Currency Format Mismatch", ReasonCategory.FORMAT_MISMATCH, 7, false),

    AMOUNT_ZERO("Zero or Negative Amount", ReasonCategory.AMOUNT_DISCREPANCY, 5, true),
    AMOUNT_EXCESSIVE("Amount Exceeds Limits", ReasonCategory.AMOUNT_DISCREPANCY, 14, false),
    AMOUNT_PRECISION("Decimal Precision Issues", ReasonCategory.AMOUNT_DISCREPANCY, 3, true),

    DATE_FUTURE("Future Date Detected", ReasonCategory.DATE_INCONSISTENCY, 7, true),
    DATE_TOO_OLD("Date Too Far in Past", ReasonCategory.DATE_INCONSISTENCY, 14, false),
    DATE_FORMAT("Invalid Date Format", ReasonCategory.DATE_INCONSISTENCY, 3, true),

    VENDOR_NOT_FOUND("Vendor Not in System", ReasonCategory.VENDOR_MISMATCH, 21, false),
    VENDOR_INACTIVE("Inactive Vendor Account", ReasonCategory.VENDOR_MISMATCH, 14, false),

    DUPLICATE_SUSPECTED("Potential Duplicate Entry", ReasonCategory.DUPLICATE_SUSPECTED, 10, false),
    CONFLICT_DETECTED("Data Conflict Detected", ReasonCategory.DUPLICATE_SUSPECTED, 14, false),

    SYSTEM_ERROR("System Processing Error", ReasonCategory.SYSTEM_ERROR, 7, true),
    API_TIMEOUT("External API Timeout", ReasonCategory.SYSTEM_ERROR, 5, true),
    DATABASE_CONSTRAINT("Database Constraint Violation", ReasonCategory.SYSTEM_ERROR, 3, true),

    POLICY_VIOLATION("Policy Compliance Issue", ReasonCategory.MANUAL_REVIEW_REQUIRED, 21, false),
    HIGH_RISK_VENDOR("High Risk Vendor Flag", ReasonCategory.MANUAL_REVIEW_REQUIRED, 30, false),
    UNUSUAL_PATTERN("Unusual Spending Pattern", ReasonCategory.MANUAL_REVIEW_REQUIRED, 14, false),

    BANK_RECONCILIATION("Bank Reconciliation Pending", ReasonCategory.EXTERNAL_DEPENDENCY, 30, false),
    APPROVAL_PENDING("Approval Workflow Pending", ReasonCategory.EXTERNAL_DEPENDENCY, 21, false),
    DOCUMENT_VERIFICATION("Document Verification Pending", ReasonCategory.EXTERNAL_DEPENDENCY, 14, false);

    private final String displayName;
    private final ReasonCategory category;
    private final int typicalResolutionDays;
    private final boolean autoResolutionPossible;

    ReasonCode(String displayName, ReasonCategory category, int typicalResolutionDays, boolean autoResolutionPossible) {
        this.displayName = displayName;
        this.category = category;
        this.typicalResolutionDays = typicalResolutionDays;
        this.autoResolutionPossible = autoResolutionPossible;
    }

    public String getDisplayName() {
        return displayName;
    }

    public ReasonCategory getCategory() {
        return category;
    }

    public int getTypicalResolutionDays() {
        return typicalResolutionDays;
    }

    public boolean isAutoResolutionPossible() {
        return autoResolutionPossible;
    }
}
