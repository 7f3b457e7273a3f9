package dev.blueprint.domain.enums;

import java.util.Locale;

/**
 * Why a unit slot did not complete. Stored in result metadata under {@code failure_kind}
 * so consumers can tell "never ran" from "ran and failed".
 */
public enum FailureKind {
    REGISTRATION, NOT_IMPLEMENTED, EXECUTION, TIMEOUT, CANCELLED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
