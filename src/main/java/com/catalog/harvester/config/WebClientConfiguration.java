package com.catalog.harvester.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import io.netty.handler.logging.LogLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.HttpProtocol;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.transport.logging.AdvancedByteBufFormat;

import java.time.Duration;

@Configuration
@Slf4j
public class WebClientConfiguration {

    private static final Duration POOL_ACQUIRE_TIMEOUT = Duration.ofSeconds(30);

    /**
     * Shared builder: JSON codecs bound to the harvester mapper, large in-memory buffer
     * for full HTML pages, request/response logging. Consumers {@code clone()} it before
     * adding their own connector or defaults.
     */
    @Bean
    public WebClient.Builder webClientBuilder(@Qualifier("harvesterObjectMapper") final ObjectMapper mapper,
                                              final HarvestProperties props) {

        int maxBody = props.getFetch().getMaxBodyBytes();

        /* --- JSON codecs wired to the custom ObjectMapper ------------------ */
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(cfg -> {
                    cfg.defaultCodecs()
                            .jackson2JsonEncoder(new Jackson2JsonEncoder(mapper, MediaType.APPLICATION_JSON));
                    cfg.defaultCodecs()
                            .jackson2JsonDecoder(new Jackson2JsonDecoder(mapper, MediaType.APPLICATION_JSON));
                    cfg.defaultCodecs().maxInMemorySize(maxBody);
                })
                .build();

        return WebClient.builder()
                .filter(logRequest())
                .filter(logResponse())
                .exchangeStrategies(strategies);
    }

    /**
     * Client of the fetch engine. Redirects are not followed here: the engine follows
     * them itself so that it knows the final URL.
     */
    @Bean
    @Qualifier("fetchWebClient")
    public WebClient fetchWebClient(final WebClient.Builder builder, final HarvestProperties props) {
        HarvestProperties.Fetch fetch = props.getFetch();

        ConnectionProvider pool = ConnectionProvider.builder("fetch-pool")
                .maxConnections(fetch.getMaxConnections())
                .pendingAcquireTimeout(POOL_ACQUIRE_TIMEOUT)
                .build();

        HttpClient tcpClient = HttpClient.create(pool)
                .protocol(HttpProtocol.H2, HttpProtocol.HTTP11)
                .followRedirect(false)
                .compress(true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) fetch.getConnectTimeout().toMillis())
                .responseTimeout(fetch.getRequestTimeout())
                .wiretap("reactor.netty.http.client.HttpClient",
                        LogLevel.DEBUG, AdvancedByteBufFormat.TEXTUAL);

        return builder.clone()
                .clientConnector(new ReactorClientHttpConnector(tcpClient))
                .build();
    }

    private static ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(req -> {
            log.debug("--> {} {}", req.method(), req.url());
            return Mono.just(req);
        });
    }

    private static ExchangeFilterFunction logResponse() {
        return ExchangeFilterFunction.ofResponseProcessor(res -> {
            log.debug("<-- {}  {}", res.statusCode().value(), res.headers().asHttpHeaders().getContentType());
            return Mono.just(res);
        });
    }
}
