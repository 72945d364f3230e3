package com.catalog.harvester.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings of the chat-completion model used to translate product descriptions.
 *
 * <p>Example application.yml snippet:
 * <pre>
 * openai:
 *   api:
 *     key: ${OPENAI_API_KEY:}
 *     base-url: https://api.openai.com/v1
 *     default-model: gpt-4o-mini
 *     target-language: Persian
 * </pre>
 * A blank key disables translation.</p>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "openai.api")
public class OpenAIProperties {

    private String key;

    @NotBlank
    private String baseUrl = "https://api.openai.com/v1";

    @NotBlank
    private String defaultModel = "gpt-4o-mini";

    @NotBlank
    private String targetLanguage = "English";

    private Duration timeout = Duration.ofSeconds(30);

}
