package com.catalog.harvester.ai;

import com.catalog.harvester.config.OpenAIProperties;
import com.catalog.harvester.config.Resilience4jConfig;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.decorators.Decorators;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * {@link Translator} backed by an OpenAI-compatible chat-completion endpoint.
 * <p>
 * Each call is decorated with the {@code translation} retry and circuit breaker; any failure
 * ends in a fallback that logs and returns {@code null}, so a product is stored untranslated
 * rather than lost.
 * </p>
 */
@Slf4j
@Component
public class LlmTranslator implements Translator {

    /**
     * Endpoint for completions.
     */
    private static final String CHAT_COMPLETION_ENDPOINT = "/chat/completions";

    private static final String SYSTEM_PROMPT_TEMPLATE = """
            You are a professional %1$s translator producing fluent, natural product copy.
            Keep the original meaning, tone and style, and adapt idioms for %1$s-speaking shoppers.
            Reply with the translated text only: no explanations, notes or formatting.
            """;

    private static final Pattern LABEL_PREFIX = Pattern.compile("^(?i)(translation|translated text)\\s*:\\s*");

    private final OpenAIProperties props;

    private final Retry retry;

    private final CircuitBreaker circuitBreaker;

    private final WebClient openAiClientWeb;

    @Autowired
    public LlmTranslator(final OpenAIProperties props,
                         @Qualifier(Resilience4jConfig.TRANSLATION) final Retry retry,
                         @Qualifier(Resilience4jConfig.TRANSLATION) final CircuitBreaker circuitBreaker,
                         final WebClient.Builder builder) {
        this(props, retry, circuitBreaker, builder.clone()
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.getKey())
                .build());
    }

    public LlmTranslator(final OpenAIProperties props,
                         final Retry retry,
                         final CircuitBreaker circuitBreaker,
                         final WebClient openAiClientWeb) {
        this.props = Objects.requireNonNull(props);
        this.retry = Objects.requireNonNull(retry);
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker);
        this.openAiClientWeb = Objects.requireNonNull(openAiClientWeb);
    }

    @Override
    public boolean isEnabled() {
        return StringUtils.isNotBlank(props.getKey());
    }

    @Override
    public String translate(final String text) {
        if (StringUtils.isBlank(text)) {
            return "";
        }
        if (!isEnabled()) {
            return null;
        }
        Supplier<String> decorated = Decorators
                .ofSupplier(() -> askModel(text))
                .withRetry(retry)
                .withCircuitBreaker(circuitBreaker)
                .withFallback(
                        List.of(Exception.class),
                        ex -> {
                            log.warn("Translation of {} chars failed: {}", text.length(), ex.toString());
                            return null;
                        })
                .decorate();
        return decorated.get();
    }

    private String askModel(final String text) {
        Map<String, Object> system = Map.of(
                "role", "system",
                "content", String.format(SYSTEM_PROMPT_TEMPLATE, props.getTargetLanguage()));
        Map<String, Object> user = Map.of(
                "role", "user",
                "content", "Translate the following text into " + props.getTargetLanguage()
                        + " without changing its meaning or tone:\n\n" + text);
        Map<String, Object> payload = Map.of(
                "model", props.getDefaultModel(),
                "temperature", 0,
                "messages", List.of(system, user));

        JsonNode response = openAiClientWeb.post()
                .uri(URI.create(StringUtils.removeEnd(props.getBaseUrl(), "/") + CHAT_COMPLETION_ENDPOINT))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(props.getTimeout())
                .block();

        if (response == null) {
            throw new IllegalStateException("Null response from LLM");
        }
        String result = response.at("/choices/0/message/content").asText("").trim();
        result = LABEL_PREFIX.matcher(result).replaceFirst("").trim();
        if (result.isEmpty()) {
            throw new IllegalStateException("Empty translation from LLM");
        }
        log.debug("Translated {} chars into {} chars", text.length(), result.length());
        return result;
    }
}
