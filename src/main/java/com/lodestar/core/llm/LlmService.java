package com.lodestar.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lodestar.core.error.GenerationFailureException;
import com.lodestar.core.error.SchemaValidationException;
import com.lodestar.core.state.StateJson;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link GenerationService} backed by Spring AI's {@link ChatClient}.
 * <p>
 * Uses {@link BeanOutputConverter} to derive a JSON schema from the target record,
 * appends the format instructions to the user message and deserializes the reply.
 * Replies the converter rejects get one lenient Jackson pass (markdown fences stripped)
 * before a {@link SchemaValidationException} is raised. Each call runs under
 * {@link LlmProperties#getTimeout()}.
 */
@Service
public class LlmService implements GenerationService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final Duration timeout;
    private final ExecutorService callExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "llm-call");
        t.setDaemon(true);
        return t;
    });

    public LlmService(ChatClient.Builder builder, LlmProperties properties) {
        this.chatClient = builder.build();
        this.timeout = properties.getTimeout();
        log.info("LlmService initialized - provider: {}, model: {}, timeout: {}s",
                properties.getProvider(), properties.getModel(), timeout.toSeconds());
    }

    @Override
    public <T> T generate(String instructions, String context, Class<T> schema) {
        log.info("Generation started -> {}", schema.getSimpleName());
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(schema);
        String response = callWithTimeout(instructions, context + "\n\n" + converter.getFormat(), schema);
        log.info("Generation complete -> {} ({}s)", schema.getSimpleName(),
                String.format("%.1f", (System.currentTimeMillis() - start) / 1000.0));
        if (response == null || response.isBlank()) {
            throw new GenerationFailureException("Model returned empty content for " + schema.getSimpleName());
        }
        try {
            return converter.convert(response);
        } catch (RuntimeException e) {
            log.warn("Converter rejected response for {}: {}", schema.getSimpleName(), e.getMessage());
            log.debug("Raw response: {}", response);
            return parseLeniently(response, schema);
        }
    }

    private String callWithTimeout(String system, String user, Class<?> schema) {
        CompletableFuture<String> call = CompletableFuture.supplyAsync(
                () -> chatClient.prompt().system(system).user(user).call().content(), callExecutor);
        try {
            return call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new GenerationFailureException("Generation of " + schema.getSimpleName()
                    + " timed out after " + timeout.toSeconds() + "s", e);
        } catch (ExecutionException e) {
            throw new GenerationFailureException("Generation of " + schema.getSimpleName()
                    + " failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationFailureException("Interrupted while generating " + schema.getSimpleName(), e);
        }
    }

    private <T> T parseLeniently(String raw, Class<T> schema) {
        ObjectMapper mapper = StateJson.mapper().copy()
                .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
        String cleaned = stripFences(raw);
        try {
            T result = mapper.readValue(cleaned, schema);
            log.info("Lenient parse succeeded for {}", schema.getSimpleName());
            return result;
        } catch (Exception e) {
            log.error("Lenient parse failed for {}: {}", schema.getSimpleName(), e.getMessage());
            throw new SchemaValidationException("Response is not a valid " + schema.getSimpleName()
                    + ": " + e.getMessage(), raw, e);
        }
    }

    static String stripFences(String raw) {
        String cleaned = raw.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }

    @PreDestroy
    void shutdown() {
        callExecutor.shutdownNow();
    }
}
