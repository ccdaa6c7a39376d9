package dev.sitedigest.synthesis;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link GenerationClient} backed by a LangChain4j Anthropic chat model.
 *
 * <p>Only the model for the most recently used {@link GenerationParams} is kept. Every call of a
 * synthesis run shares its params, so a run builds at most one model, and params supplied per
 * request never accumulate. The model's own retries are disabled; a failed call surfaces as a
 * {@link GenerationException}.
 */
public class LangChain4jGenerationClient implements GenerationClient {

    private static final Logger log = LoggerFactory.getLogger(LangChain4jGenerationClient.class);

    private final Function<GenerationParams, ChatModel> modelFactory;
    private final AtomicReference<CachedModel> current = new AtomicReference<>();

    public LangChain4jGenerationClient(String apiKey, Duration timeout) {
        this(params -> AnthropicChatModel.builder()
                .apiKey(apiKey)
                .modelName(params.model())
                .maxTokens(params.maxOutputTokens())
                .temperature(params.temperature())
                .timeout(timeout)
                .maxRetries(0)
                .build());
    }

    LangChain4jGenerationClient(Function<GenerationParams, ChatModel> modelFactory) {
        this.modelFactory = modelFactory;
    }

    @Override
    public String generate(String prompt, GenerationParams params) {
        ChatModel model = modelFor(params);
        String text;
        try {
            text = model.chat(prompt);
        } catch (RuntimeException e) {
            log.debug("Generation call to {} failed: {}", params.model(), e.getMessage());
            throw new GenerationException(describe(e), e);
        }
        if (text == null || text.isBlank()) {
            throw new GenerationException("Empty response from model " + params.model());
        }
        return text;
    }

    private ChatModel modelFor(GenerationParams params) {
        CachedModel cached = current.get();
        if (cached != null && cached.params().equals(params)) {
            return cached.model();
        }
        ChatModel model = modelFactory.apply(params);
        current.set(new CachedModel(params, model));
        log.debug("Built chat model for {} (maxTokens={}, temperature={})",
                params.model(), params.maxOutputTokens(), params.temperature());
        return model;
    }

    private static String describe(RuntimeException e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private record CachedModel(GenerationParams params, ChatModel model) {
    }
}
