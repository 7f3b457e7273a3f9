package dev.blueprint.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum OutputFormat {
    MARKDOWN("md"), JSON("json"), HTML("html");

    private final String extension;
    OutputFormat(String extension) { this.extension = extension; }

    public String extension() {
        return extension;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a user-supplied selector. Null or blank means markdown.
     *
     * @throws IllegalArgumentException for anything other than markdown, json or html
     */
    public static OutputFormat parse(String value) {
        if (value == null || value.isBlank()) return MARKDOWN;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unsupported output format: " + value + " (expected markdown, json or html)");
        }
    }
}
