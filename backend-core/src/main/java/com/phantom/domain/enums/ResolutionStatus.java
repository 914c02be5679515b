package com.phantom.domain.enums;

public enum ResolutionStatus {
    KEPT,
    RESCHEDULED,
    UNRESOLVED
}
