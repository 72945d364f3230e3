package com.catalog.harvester.ai;

import com.catalog.harvester.config.OpenAIProperties;
import com.catalog.harvester.support.StubExchange;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class LlmTranslatorTest {

    private static OpenAIProperties props(final String key) {
        OpenAIProperties props = new OpenAIProperties();
        props.setKey(key);
        props.setBaseUrl("https://llm.test/v1/");
        props.setTargetLanguage("French");
        props.setTimeout(Duration.ofSeconds(5));
        return props;
    }

    private static LlmTranslator translator(final OpenAIProperties props, final StubExchange stub) {
        Retry retry = Retry.of("translation-test", RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(1))
                .build());
        return new LlmTranslator(props, retry, CircuitBreaker.ofDefaults("translation-test"), stub.webClient());
    }

    @Test
    void returnsTheFirstChoiceWithoutLabel() {
        StubExchange stub = StubExchange.of(req -> StubExchange.json(200,
                "{\"choices\":[{\"message\":{\"content\":\"Translation:  Débardeur doux \"}}]}"));

        String out = translator(props("sk-test"), stub).translate("Soft tank top");

        assertThat(out).isEqualTo("Débardeur doux");
        assertThat(stub.requests()).hasSize(1);
        assertThat(stub.requests().get(0).url().toString()).isEqualTo("https://llm.test/v1/chat/completions");
    }

    @Test
    void failuresAreRetriedThenFallBackToNull() {
        AtomicInteger calls = new AtomicInteger();
        StubExchange stub = StubExchange.of(req -> {
            calls.incrementAndGet();
            return StubExchange.json(503, "{\"error\":\"overloaded\"}");
        });

        assertThat(translator(props("sk-test"), stub).translate("Soft tank top")).isNull();
        assertThat(calls).hasValue(2);
    }

    @Test
    void emptyAnswerCountsAsFailure() {
        StubExchange stub = StubExchange.of(req -> StubExchange.json(200, "{\"choices\":[]}"));

        assertThat(translator(props("sk-test"), stub).translate("Soft tank top")).isNull();
    }

    @Test
    void withoutKeyNothingIsSent() {
        StubExchange stub = StubExchange.of(req -> StubExchange.json(200, "{}"));
        LlmTranslator translator = translator(props(" "), stub);

        assertThat(translator.isEnabled()).isFalse();
        assertThat(translator.translate("Soft tank top")).isNull();
        assertThat(translator.translate("  ")).isEmpty();
        assertThat(stub.requests()).isEmpty();
    }
}
