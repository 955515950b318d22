package com.everrich.reconciliation.dto;

import com.everrich.reconciliation.entities.ReasonCategory;
import com.everrich.reconciliation.entities.ReasonCode;

public record ReasonCodeInfo(ReasonCode code, String name, ReasonCategory category, int typicalResolutionDays,
                             boolean autoResolutionPossible) {

    public static ReasonCodeInfo of(ReasonCode code) {
        return new ReasonCodeInfo(code, code.getDisplayName(), code.getCategory(), code.getTypicalResolutionDays(),
                code.isAutoResolutionPossible());
    }
}
