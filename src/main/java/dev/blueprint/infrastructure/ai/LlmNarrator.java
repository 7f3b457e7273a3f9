package dev.blueprint.infrastructure.ai;

import dev.blueprint.config.AiProperties;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Optional language-model narration for generated prose.
 *
 * <p>Returns empty when narration is disabled, when no {@link ChatModel} bean exists, when the
 * circuit is open, or when the call fails. Callers keep their deterministic text in that case.
 */
@Component
public class LlmNarrator {

    private static final Logger log = LoggerFactory.getLogger(LlmNarrator.class);

    private final AiProperties aiProperties;
    private final ChatModel chatModel;
    private final CircuitBreaker circuitBreaker = CircuitBreaker.ofDefaults("llm-narrator");

    @Autowired
    public LlmNarrator(AiProperties aiProperties, ObjectProvider<ChatModel> chatModel) {
        this(aiProperties, chatModel.getIfAvailable());
    }

    public LlmNarrator(AiProperties aiProperties, ChatModel chatModel) {
        this.aiProperties = aiProperties;
        this.chatModel = chatModel;
    }

    public boolean isAvailable() {
        return aiProperties.enabled() && chatModel != null;
    }

    public Optional<String> narrate(String prompt) {
        if (!isAvailable()) return Optional.empty();
        try {
            String text = circuitBreaker.executeSupplier(() -> call(prompt));
            return text == null || text.isBlank() ? Optional.empty() : Optional.of(text.strip());
        } catch (CallNotPermittedException e) {
            log.debug("Narration skipped: circuit {} is open", circuitBreaker.getName());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Narration failed, keeping deterministic text: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private String call(String prompt) {
        ChatOptions.Builder options = ChatOptions.builder()
                .temperature(aiProperties.temperature())
                .maxTokens(aiProperties.maxOutputTokens());
        if (aiProperties.model() != null && !aiProperties.model().isBlank()) {
            options.model(aiProperties.model());
        }
        ChatResponse response = chatModel.call(new Prompt(prompt, options.build()));
        if (response == null || response.getResult() == null) return null;
        return response.getResult().getOutput().getText();
    }
}
