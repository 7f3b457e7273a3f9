package dev.blueprint.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Externally visible outcome of a pipeline run. Failed units inside a run do not make it FAILED.
 */
public enum RunStatus {
    COMPLETED, FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public int exitCode() {
        return this == COMPLETED ? 0 : 1;
    }
}
