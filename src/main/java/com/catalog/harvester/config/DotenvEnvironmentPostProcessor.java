package com.catalog.harvester.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.HashMap;
import java.util.Map;

/**
 * Loads a {@code .env} file and exposes its entries as a high-priority property
 * source, so that {@code ${WOOCOMMERCE_CONSUMER_KEY}}, {@code ${OPENAI_API_KEY}}
 * and friends resolve without exporting them in the shell.
 * <p>
 * The directory is taken from {@code HARVESTER_DOTENV_DIR} (default: working directory).
 * </p>
 */
public class DotenvEnvironmentPostProcessor
        implements EnvironmentPostProcessor, Ordered {

    private static final String DIRECTORY_VARIABLE = "HARVESTER_DOTENV_DIR";

    private static final String SOURCE_NAME = "harvesterDotenv";

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE;
    }

    @Override
    public void postProcessEnvironment(final ConfigurableEnvironment env,
                                       final SpringApplication application) {
        Dotenv dotenv = Dotenv.configure()
                .directory(env.getProperty(DIRECTORY_VARIABLE, "."))
                .filename(".env")
                .ignoreIfMissing()
                .ignoreIfMalformed()
                .load();

        Map<String, Object> map = new HashMap<>();
        dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)
                .forEach(e -> map.put(e.getKey(), e.getValue()));

        if (!map.isEmpty()) {
            env.getPropertySources().addFirst(new MapPropertySource(SOURCE_NAME, map));
        }
    }
}
