package com.catalog.harvester.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonHarvesterConfig {

    /**
     * The {@link ObjectMapper} used for scraped JSON, side-channel blobs and catalog payloads.
     * <p>
     * Lenient on unknown properties because retailer state blobs change shape without notice;
     * dates are written as ISO strings so job records read well over REST.
     *
     * @return ObjectMapper for the harvesting pipeline
     */
    @Bean
    @Qualifier("harvesterObjectMapper")
    public ObjectMapper harvesterObjectMapper() {

        ObjectMapper mapper = new ObjectMapper();

        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        return mapper;
    }

}
