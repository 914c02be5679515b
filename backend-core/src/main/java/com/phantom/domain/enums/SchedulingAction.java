package com.phantom.domain.enums;

public enum SchedulingAction {
    CREATE,
    UPDATE,
    DELETE,
    OPTIMIZE,
    BULK_UPDATE,
    BULK_DELETE
}
