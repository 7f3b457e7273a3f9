package dev.blueprint.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Language-model narration. Disabled, or no {@code ChatModel} bean, means units fall back
 * to their deterministic text.
 */
@ConfigurationProperties(prefix = "blueprint.ai")
public record AiProperties(boolean enabled, String model, double temperature, int maxOutputTokens) {
    public AiProperties {
        if (temperature <= 0) temperature = 0.1;
        if (maxOutputTokens <= 0) maxOutputTokens = 2048;
    }
}
