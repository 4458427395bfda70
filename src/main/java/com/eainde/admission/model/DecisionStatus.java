package com.eainde.admission.model;

public enum DecisionStatus {
    APPROVED,
    REJECTED,
    REVIEW_REQUIRED,
    MISSING_DOCS
}
