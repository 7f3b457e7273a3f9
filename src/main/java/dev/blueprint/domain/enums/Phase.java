package dev.blueprint.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The three sequential pipeline stages. Phase N+1 never starts before phase N has returned.
 */
public enum Phase {
    ANALYSIS(1), SYNTHESIS(2), VALIDATION(3);

    private final int number;
    Phase(int number) { this.number = number; }

    public int number() {
        return number;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
